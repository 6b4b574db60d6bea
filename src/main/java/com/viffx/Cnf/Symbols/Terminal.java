package com.viffx.Cnf.Symbols;

import java.util.Objects;

public record Terminal(SymbolType type, String value) implements Symbol {
    public static final String EPSILON_MARK = "ε";
    public static final Terminal EPSILON = new Terminal(SymbolType.EPSILON, EPSILON_MARK);

    public Terminal {
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        if (type == SymbolType.NON_TERMINAL) throw new IllegalArgumentException("a Terminal cannot have type " + type);
    }

    public Terminal(String value) {
        this(EPSILON_MARK.equals(value) ? SymbolType.EPSILON : SymbolType.TERMINAL, value);
    }

    public boolean isEpsilon() {
        return type == SymbolType.EPSILON;
    }

    @Override
    public String toString() {
        return value;
    }
}
