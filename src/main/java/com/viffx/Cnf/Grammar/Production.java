package com.viffx.Cnf.Grammar;

import com.viffx.Cnf.Symbols.NonTerminal;
import com.viffx.Cnf.Symbols.Symbol;
import com.viffx.Cnf.Symbols.Terminal;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * One alternative of a rule: an ordered sequence of symbols.
 * <p>
 * Productions are immutable and always canonical. A production with no symbols is stored as {@code [ε]},
 * and {@code ε} is dropped from any production that holds other symbols, so {@code aεb} and {@code ab}
 * are the same production.
 */
public record Production(List<Symbol> symbols) {
    public static final Production EPSILON = new Production(List.of(Terminal.EPSILON));

    public Production {
        List<Symbol> canonical = new ArrayList<>(symbols.size());
        for (Symbol symbol : symbols) {
            if (!Terminal.EPSILON.equals(symbol)) canonical.add(symbol);
        }
        // add epsilon to truly empty productions
        if (canonical.isEmpty()) canonical.add(Terminal.EPSILON);
        symbols = List.copyOf(canonical);
    }

    @NotNull
    @Contract("_ -> new")
    public static Production of(Symbol... symbols) {
        return new Production(Arrays.asList(symbols));
    }

    public int size() {
        return symbols.size();
    }

    public Symbol get(int index) {
        return symbols.get(index);
    }

    public Symbol first() {
        return symbols.get(0);
    }

    public boolean isEpsilon() {
        return symbols.size() == 1 && Terminal.EPSILON.equals(symbols.get(0));
    }

    /**
     * Returns if this production is a unit production, i.e. exactly one variable.
     */
    public boolean isUnit() {
        return symbols.size() == 1 && symbols.get(0) instanceof NonTerminal;
    }

    public boolean contains(Symbol symbol) {
        return symbols.contains(symbol);
    }

    /**
     * Returns the production made of every symbol after the first one.
     *
     * @throws IndexOutOfBoundsException if the production has fewer than two symbols
     */
    @NotNull
    public Production tail() {
        if (symbols.size() < 2) throw new IndexOutOfBoundsException("tail of a production of length " + symbols.size());
        return new Production(symbols.subList(1, symbols.size()));
    }

    /**
     * Returns a copy of this production with the symbol at {@code index} replaced by {@code symbol}.
     */
    @NotNull
    @Contract("_, _ -> new")
    public Production with(int index, Symbol symbol) {
        List<Symbol> copy = new ArrayList<>(symbols);
        copy.set(index, symbol);
        return new Production(copy);
    }

    @Override
    public String toString() {
        return symbols.stream().map(Symbol::value).collect(Collectors.joining());
    }
}
