package com.viffx.Cnf.Grammar;

/**
 * Thrown when a grammar cannot be built from the declarations it was given.
 */
public class InvalidGrammarException extends IllegalArgumentException {

    public InvalidGrammarException() {
        super();
    }
    public InvalidGrammarException(String message) {
        super(message);
    }
    public InvalidGrammarException(String message, Throwable cause) {
        super(message, cause);
    }

}
