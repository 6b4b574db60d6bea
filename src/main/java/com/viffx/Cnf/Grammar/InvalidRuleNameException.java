package com.viffx.Cnf.Grammar;

/**
 * Thrown when a rule is added under a left-hand side that is not a variable name
 * (an upper case letter optionally followed by digits).
 */
public class InvalidRuleNameException extends InvalidGrammarException {
    private final String name;

    public InvalidRuleNameException(String name) {
        super("invalid rule name: '" + name + "', expected an upper case letter optionally followed by digits");
        this.name = name;
    }

    public String name() {
        return name;
    }
}
