package com.viffx.Cnf.Symbols;

import java.util.Objects;

public record NonTerminal(String value) implements Symbol {
    public NonTerminal {
        Objects.requireNonNull(value, "value cannot be null");
    }

    @Override
    public SymbolType type() {
        return SymbolType.NON_TERMINAL;
    }

    @Override
    public String toString() {
        return value;
    }
}
