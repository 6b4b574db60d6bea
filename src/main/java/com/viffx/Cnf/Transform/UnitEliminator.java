package com.viffx.Cnf.Transform;

import com.viffx.Cnf.Grammar.Grammar;
import com.viffx.Cnf.Grammar.Production;
import com.viffx.Cnf.Symbols.NonTerminal;

import java.util.*;
import java.util.logging.Logger;

/**
 * Removes every unit production {@code A → B}.
 * <p>
 * The unit pairs and the non unit productions are read once, before anything changes. The pairs are then closed
 * transitively with a worklist, each pair being queued at most once so unit cycles of any length terminate. Finally
 * each variable that had a unit production gets its own non unit productions plus the non unit productions of every
 * variable it reaches through unit chains. Only non unit productions are ever copied, so no new pair can appear.
 * Self loops {@code A → A} derive nothing new and are dropped.
 */
public class UnitEliminator implements Transformation {
    private static final Logger LOGGER = Logger.getLogger(UnitEliminator.class.getName());

    private record UnitPair(NonTerminal from, NonTerminal to) {}

    @Override
    public void apply(Grammar grammar) {
        List<NonTerminal> heads = grammar.ruleHeads();
        Map<NonTerminal, List<Production>> nonUnit = new HashMap<>();
        Map<NonTerminal, Set<NonTerminal>> units = new HashMap<>();
        Deque<UnitPair> pairs = new ArrayDeque<>();
        for (NonTerminal head : heads) {
            List<Production> kept = new ArrayList<>();
            for (Production production : grammar.productions(head)) {
                if (!production.isUnit()) {
                    kept.add(production);
                    continue;
                }
                NonTerminal target = (NonTerminal) production.first();
                if (units.computeIfAbsent(head, k -> new LinkedHashSet<>()).add(target)) {
                    pairs.add(new UnitPair(head, target));
                }
            }
            nonUnit.put(head, kept);
        }
        if (pairs.isEmpty()) {
            LOGGER.fine("no unit productions");
            return;
        }

        Set<UnitPair> seen = new HashSet<>(pairs);
        Map<NonTerminal, Set<NonTerminal>> reachable = new HashMap<>();
        while (!pairs.isEmpty()) {
            UnitPair pair = pairs.poll();
            if (pair.from().equals(pair.to())) continue;
            reachable.computeIfAbsent(pair.from(), k -> new LinkedHashSet<>()).add(pair.to());
            for (NonTerminal next : units.getOrDefault(pair.to(), Set.of())) {
                UnitPair derived = new UnitPair(pair.from(), next);
                if (seen.add(derived)) pairs.add(derived);
            }
        }

        for (NonTerminal head : heads) {
            if (!units.containsKey(head)) continue;
            List<Production> productions = new ArrayList<>(nonUnit.get(head));
            for (NonTerminal target : reachable.getOrDefault(head, Set.of())) {
                productions.addAll(nonUnit.getOrDefault(target, List.of()));
            }
            grammar.replaceProductions(head, productions);
        }
        LOGGER.fine(() -> "inlined " + seen.size() + " unit pair(s) into " + units.size() + " variable(s)");
    }
}
