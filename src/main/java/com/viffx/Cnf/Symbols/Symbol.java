package com.viffx.Cnf.Symbols;

public sealed interface Symbol permits Terminal, NonTerminal {
    SymbolType type();
    String value();

    /**
     * Returns if {@code token} reads as a variable name under the casing heuristic: it contains at least one
     * upper case letter and no lower case letter (so {@code "S"}, {@code "U12"} and {@code "AB"} qualify).
     *
     * @param token the raw symbol text
     * @return if the token should be promoted to a variable when it has not been declared
     */
    static boolean looksLikeVariable(String token) {
        return token.chars().anyMatch(Character::isUpperCase) && token.chars().noneMatch(Character::isLowerCase);
    }

    /**
     * Returns if {@code name} is a well-formed rule head: one upper case letter optionally followed by digits.
     */
    static boolean isVariableName(String name) {
        return name != null && name.matches("[A-Z]\\d*");
    }
}
