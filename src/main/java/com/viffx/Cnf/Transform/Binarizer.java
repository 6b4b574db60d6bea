package com.viffx.Cnf.Transform;

import com.viffx.Cnf.Grammar.Grammar;
import com.viffx.Cnf.Grammar.Production;
import com.viffx.Cnf.Symbols.NonTerminal;
import com.viffx.Cnf.Symbols.Symbol;
import com.viffx.Cnf.Symbols.Terminal;
import com.viffx.Cnf.Utils.FreshVariables;
import org.jetbrains.annotations.NotNull;

import java.util.*;
import java.util.logging.Logger;

/**
 * Brings a unit free, epsilon free grammar into its final binary shape in two passes.
 * <ol>
 *   <li>Every production {@code A → X Y Z...} of length three or more becomes {@code A → X T} with
 *       {@code T → Y Z...}. Minted variables are queued so their own long tails get split as well.</li>
 *   <li>Every terminal in a production of length two is replaced by a variable whose only production is that
 *       terminal.</li>
 * </ol>
 * Both passes reuse a variable whose only production already is the needed tail or terminal before minting one.
 */
public class Binarizer implements Transformation {
    private static final Logger LOGGER = Logger.getLogger(Binarizer.class.getName());

    private final FreshVariables names;

    public Binarizer(FreshVariables names) {
        this.names = names;
    }

    @Override
    public void apply(Grammar grammar) {
        int tails = shorten(grammar);
        int isolated = isolateTerminals(grammar);
        LOGGER.fine(() -> "minted " + tails + " tail variable(s) and " + isolated + " terminal variable(s)");
    }

    //[PASS_A]
    private int shorten(Grammar grammar) {
        int minted = 0;
        Deque<Integer> worklist = new ArrayDeque<>();
        for (int id = 0; id < grammar.numRules(); id++) worklist.add(id);

        while (!worklist.isEmpty()) {
            int id = worklist.poll();
            List<Production> productions = List.copyOf(grammar.productions(id));
            if (productions.stream().noneMatch(production -> production.size() >= 3)) continue;

            List<Production> shortened = new ArrayList<>(productions.size());
            for (Production production : productions) {
                if (production.size() < 3) {
                    shortened.add(production);
                    continue;
                }
                Production tail = production.tail();
                Optional<NonTerminal> existing = grammar.findSoleProducer(tail);
                NonTerminal variable;
                if (existing.isPresent()) {
                    variable = existing.get();
                } else {
                    variable = names.next(grammar);
                    grammar.addRule(variable, List.of(tail));
                    worklist.add(grammar.id(variable));
                    minted++;
                }
                shortened.add(Production.of(production.first(), variable));
            }
            grammar.replaceProductions(grammar.head(id), shortened);
        }
        return minted;
    }

    //[PASS_B]
    private int isolateTerminals(Grammar grammar) {
        int before = grammar.numRules();
        // variables minted here only produce a single terminal, so walking the growing arena visits them harmlessly
        for (int id = 0; id < grammar.numRules(); id++) {
            List<Production> productions = List.copyOf(grammar.productions(id));
            if (productions.stream().noneMatch(Binarizer::hasTerminalPair)) continue;

            List<Production> isolated = new ArrayList<>(productions.size());
            for (Production production : productions) {
                if (hasTerminalPair(production)) {
                    for (int i = 0; i < 2; i++) {
                        if (production.get(i) instanceof Terminal terminal) {
                            production = production.with(i, producerOf(terminal, grammar));
                        }
                    }
                }
                isolated.add(production);
            }
            grammar.replaceProductions(grammar.head(id), isolated);
        }
        return grammar.numRules() - before;
    }

    private static boolean hasTerminalPair(Production production) {
        if (production.size() != 2) return false;
        for (Symbol symbol : production.symbols()) {
            if (symbol instanceof Terminal) return true;
        }
        return false;
    }

    @NotNull
    private NonTerminal producerOf(Terminal terminal, Grammar grammar) {
        Production production = Production.of(terminal);
        Optional<NonTerminal> existing = grammar.findSoleProducer(production);
        if (existing.isPresent()) return existing.get();
        NonTerminal variable = names.next(grammar);
        grammar.addRule(variable, List.of(production));
        return variable;
    }
}
