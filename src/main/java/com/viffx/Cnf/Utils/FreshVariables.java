package com.viffx.Cnf.Utils;

import com.viffx.Cnf.Grammar.Grammar;
import com.viffx.Cnf.Grammar.InvalidGrammarException;
import com.viffx.Cnf.Symbols.NonTerminal;
import com.viffx.Cnf.Symbols.Symbol;
import org.jetbrains.annotations.NotNull;

/**
 * Mints variable names that are not yet used by a grammar.
 * <p>
 * Names are a single upper case prefix followed by a counter that only ever increases, so a name handed out once is
 * never handed out again by the same instance even if the grammar forgets it.
 */
public class FreshVariables {
    private final String prefix;
    private int counter = 1;

    public FreshVariables(String prefix) {
        if (prefix == null || !prefix.matches("[A-Z]"))
            throw new InvalidGrammarException("fresh variable prefix must be a single upper case letter, got: " + prefix);
        this.prefix = prefix;
    }

    /**
     * Returns the next {@code prefix + n} that is neither a variable nor a terminal of {@code grammar}.
     */
    @NotNull
    public NonTerminal next(Grammar grammar) {
        while (true) {
            String name = prefix + counter++;
            if (!grammar.isSymbol(name)) return new NonTerminal(name);
        }
    }

    /**
     * Returns {@code preferred} if it is a variable name not yet used by any symbol of {@code grammar}, otherwise the
     * next fresh name.
     */
    @NotNull
    public NonTerminal preferring(String preferred, Grammar grammar) {
        if (Symbol.isVariableName(preferred) && !grammar.isSymbol(preferred)) return new NonTerminal(preferred);
        return next(grammar);
    }

    public int issued() {
        return counter - 1;
    }
}
