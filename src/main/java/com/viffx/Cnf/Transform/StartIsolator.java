package com.viffx.Cnf.Transform;

import com.viffx.Cnf.Grammar.Grammar;
import com.viffx.Cnf.Grammar.Production;
import com.viffx.Cnf.Symbols.NonTerminal;
import com.viffx.Cnf.Utils.FreshVariables;

import java.util.List;
import java.util.logging.Logger;

/**
 * Makes sure the start variable never appears on a right hand side.
 * <p>
 * If the current start variable {@code S} is used anywhere in a production, a fresh variable {@code S0 → S} is added
 * and becomes the start variable. Otherwise the grammar is left as it is.
 */
public class StartIsolator implements Transformation {
    private static final Logger LOGGER = Logger.getLogger(StartIsolator.class.getName());

    private final FreshVariables names;
    private final String preferredName;

    public StartIsolator(FreshVariables names, String preferredName) {
        this.names = names;
        this.preferredName = preferredName;
    }

    @Override
    public void apply(Grammar grammar) {
        NonTerminal start = grammar.start();
        if (!grammar.occursOnRightHandSide(start)) {
            LOGGER.fine(() -> "start variable " + start + " is not referenced, nothing to isolate");
            return;
        }
        NonTerminal isolated = names.preferring(preferredName, grammar);
        grammar.addRule(isolated, List.of(Production.of(start)));
        grammar.setStart(isolated);
        LOGGER.fine(() -> "isolated start variable " + start + " behind " + isolated);
    }
}
