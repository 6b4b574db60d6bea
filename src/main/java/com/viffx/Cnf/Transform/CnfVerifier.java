package com.viffx.Cnf.Transform;

import com.viffx.Cnf.Grammar.Grammar;
import com.viffx.Cnf.Grammar.Production;
import com.viffx.Cnf.Symbols.NonTerminal;
import com.viffx.Cnf.Symbols.Symbol;
import com.viffx.Cnf.Symbols.Terminal;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks the shape of a grammar against Chomsky normal form: every production is {@code A → BC} with two variables
 * other than the start variable, or {@code A → a} with one terminal, and {@code ε} only appears as the start
 * variable's own production.
 */
public final class CnfVerifier {
    private CnfVerifier() {}

    /**
     * Returns a description of every production that breaks the normal form, empty if there is none.
     */
    @NotNull
    public static List<String> violations(Grammar grammar) {
        NonTerminal start = grammar.start();
        List<String> violations = new ArrayList<>();
        for (int id = 0; id < grammar.numRules(); id++) {
            NonTerminal head = grammar.head(id);
            for (Production production : grammar.productions(id)) {
                String rule = head + " → " + production;
                if (production.isEpsilon()) {
                    if (!head.equals(start)) violations.add(rule + ": ε outside the start variable");
                } else if (production.size() == 1) {
                    if (!(production.first() instanceof Terminal)) violations.add(rule + ": unit production");
                } else if (production.size() == 2) {
                    for (Symbol symbol : production.symbols()) {
                        if (symbol instanceof Terminal) violations.add(rule + ": terminal " + symbol + " in a pair");
                        else if (symbol.equals(start)) violations.add(rule + ": start variable on a right hand side");
                    }
                } else {
                    violations.add(rule + ": length " + production.size());
                }
            }
        }
        return violations;
    }

    public static boolean isValid(Grammar grammar) {
        return violations(grammar).isEmpty();
    }

    /**
     * @throws IllegalStateException listing the violations if the grammar is not in normal form
     */
    public static void verify(Grammar grammar) {
        List<String> violations = violations(grammar);
        if (violations.isEmpty()) return;
        throw new IllegalStateException("grammar is not in Chomsky normal form:\n\t" + String.join("\n\t", violations));
    }
}
