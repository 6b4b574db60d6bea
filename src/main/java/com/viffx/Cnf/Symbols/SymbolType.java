package com.viffx.Cnf.Symbols;

public enum SymbolType {
    NON_TERMINAL,
    TERMINAL,
    EPSILON, // the empty production marker, never matched against input
}
