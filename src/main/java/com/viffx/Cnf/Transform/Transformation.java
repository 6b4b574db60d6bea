package com.viffx.Cnf.Transform;

import com.viffx.Cnf.Grammar.Grammar;

/**
 * One stage of the normalization pipeline. A stage rewrites the grammar it is given in place and keeps the language
 * it generates unchanged.
 */
public interface Transformation {
    void apply(Grammar grammar);

    default String name() {
        return getClass().getSimpleName();
    }
}
