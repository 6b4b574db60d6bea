package com.viffx.Cnf.Transform;

import com.viffx.Cnf.Grammar.Grammar;
import com.viffx.Cnf.Grammar.Production;
import com.viffx.Cnf.Symbols.NonTerminal;
import com.viffx.Cnf.Utils.Combinations;

import java.util.*;
import java.util.logging.Logger;

/**
 * Removes every {@code A → ε} production except the one of the start variable.
 * <p>
 * Nullable variables are processed from a worklist. Processing {@code V} removes {@code V → ε} and replaces every
 * production that mentions {@code V} by all the ways of keeping or dropping each occurrence of {@code V}. A production
 * that loses all its symbols becomes {@code ε}, which makes its variable nullable in turn, so it is queued unless it
 * was processed already. A processed variable that gets {@code ε} back has it removed again: every production
 * mentioning it already comes with its dropped variants.
 * <p>
 * The start variable is never processed. It keeps {@code S → ε} so the empty string stays in the language, which is
 * sound because start isolation ran first and no production refers to it.
 */
public class EpsilonEliminator implements Transformation {
    private static final Logger LOGGER = Logger.getLogger(EpsilonEliminator.class.getName());

    @Override
    public void apply(Grammar grammar) {
        NonTerminal start = grammar.start();
        Set<NonTerminal> visited = new HashSet<>();
        Deque<NonTerminal> nullable = new ArrayDeque<>();
        for (int id = 0; id < grammar.numRules(); id++) {
            NonTerminal head = grammar.head(id);
            if (!head.equals(start) && grammar.productions(id).contains(Production.EPSILON)) nullable.add(head);
        }

        while (!nullable.isEmpty()) {
            NonTerminal variable = nullable.poll();
            grammar.removeProduction(variable, Production.EPSILON);
            visited.add(variable);

            for (int id = 0; id < grammar.numRules(); id++) {
                NonTerminal head = grammar.head(id);
                List<Production> expanded = new ArrayList<>();
                boolean changed = false;
                for (Production production : grammar.productions(id)) {
                    if (production.contains(variable)) {
                        expanded.addAll(Combinations.of(production, variable));
                        changed = true;
                    } else {
                        expanded.add(production);
                    }
                }
                if (changed) grammar.replaceProductions(head, expanded);

                if (head.equals(start) || !grammar.productions(id).contains(Production.EPSILON)) continue;
                if (visited.contains(head)) {
                    grammar.removeProduction(head, Production.EPSILON);
                } else if (!nullable.contains(head)) {
                    nullable.add(head);
                }
            }
        }
        LOGGER.fine(() -> "removed epsilon productions of " + visited.size() + " nullable variable(s): " + visited);
    }
}
