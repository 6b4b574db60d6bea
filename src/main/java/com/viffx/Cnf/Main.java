package com.viffx.Cnf;

import com.viffx.Cnf.Grammar.Grammar;
import com.viffx.Cnf.Grammar.InvalidGrammarException;
import com.viffx.Cnf.Transform.ChomskyNormalizer;
import com.viffx.Cnf.Transform.NormalizerConfig;
import com.viffx.Cnf.Utils.Logging;

import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.logging.Level;

public class Main {

    public static void main(String[] args) {
        Logging.initFormat();
        if (Arrays.asList(args).contains("-v")) Logging.setLevel(Level.FINE);
        int status = run(System.in, System.out, System.err);
        if (status != 0) System.exit(status);
    }

    /**
     * Reads a grammar interactively, normalizes it and prints the result.
     * <p>
     * The variables and the terminals are read as whitespace separated lists. Each variable then gets one line of
     * whitespace separated alternatives where every character is a symbol ({@code aSb ε}), and the last line names
     * the start variable.
     *
     * @return the exit status, {@code 0} on success and {@code 1} if the grammar was rejected
     */
    public static int run(InputStream in, PrintStream out, PrintStream err) {
        Scanner scanner = new Scanner(in, StandardCharsets.UTF_8);

        List<String> variables = words(prompt(scanner, out, "Enter the variables: "));
        List<String> terminals = words(prompt(scanner, out, "Enter the terminals: "));
        Map<String, List<List<String>>> rules = new LinkedHashMap<>();
        for (String variable : variables) {
            rules.put(variable, Grammar.splitProductions(prompt(scanner, out, "Enter the products of " + variable + ": ")));
        }
        String start = prompt(scanner, out, "Enter the start variable: ").trim();

        try {
            Grammar grammar = new Grammar(variables, terminals, rules, start);
            out.println(new ChomskyNormalizer(NormalizerConfig.load()).normalize(grammar));
            return 0;
        } catch (InvalidGrammarException e) {
            err.println("ERROR: " + e.getMessage());
            return 1;
        }
    }

    private static String prompt(Scanner scanner, PrintStream out, String message) {
        out.print(message);
        out.flush();
        return scanner.hasNextLine() ? scanner.nextLine() : "";
    }

    private static List<String> words(String line) {
        List<String> words = new ArrayList<>();
        for (String word : line.trim().split("\\s+")) {
            if (!word.isEmpty()) words.add(word);
        }
        return words;
    }
}
