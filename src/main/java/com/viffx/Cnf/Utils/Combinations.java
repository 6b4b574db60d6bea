package com.viffx.Cnf.Utils;

import com.viffx.Cnf.Grammar.Production;
import com.viffx.Cnf.Symbols.Symbol;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public final class Combinations {
    private Combinations() {}

    /**
     * Returns every production obtained from {@code production} by independently keeping or dropping each
     * occurrence of {@code symbol}.
     * <p>
     * For k occurrences there are 2^k choices, enumerated as a binary counter where bit i set means occurrence i is
     * kept, so the first result drops every occurrence and the last keeps them all. Dropping every symbol yields
     * {@link Production#EPSILON}. Equal results are reported once. A production without {@code symbol} is returned
     * alone.
     *
     * @param production the production to expand
     * @param symbol     the symbol whose occurrences may be dropped
     * @return the distinct expansions in enumeration order
     */
    @NotNull
    public static List<Production> of(Production production, Symbol symbol) {
        List<Integer> indices = new ArrayList<>();
        for (int i = 0; i < production.size(); i++) {
            if (production.get(i).equals(symbol)) indices.add(i);
        }
        if (indices.size() >= Integer.SIZE - 1)
            throw new IllegalArgumentException(production + " has too many occurrences of " + symbol);

        Set<Production> results = new LinkedHashSet<>();
        for (int mask = 0; mask < 1 << indices.size(); mask++) {
            List<Symbol> kept = new ArrayList<>(production.size());
            int occurrence = 0;
            for (int i = 0; i < production.size(); i++) {
                if (occurrence < indices.size() && indices.get(occurrence) == i) {
                    if ((mask & 1 << occurrence) != 0) kept.add(production.get(i));
                    occurrence++;
                    continue;
                }
                kept.add(production.get(i));
            }
            results.add(new Production(kept));
        }
        return new ArrayList<>(results);
    }
}
