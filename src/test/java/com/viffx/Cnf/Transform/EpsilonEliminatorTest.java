package com.viffx.Cnf.Transform;

import com.viffx.Cnf.Grammar.Grammar;
import com.viffx.Cnf.Grammar.Production;
import com.viffx.Cnf.Symbols.NonTerminal;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import static com.viffx.Cnf.Grammars.*;
import static org.assertj.core.api.Assertions.assertThat;

class EpsilonEliminatorTest {

    private static void assertEpsilonFree(Grammar grammar) {
        for (NonTerminal head : grammar.ruleHeads()) {
            if (head.equals(grammar.start())) continue;
            assertThat(grammar.productions(head)).as(head.value()).doesNotContain(Production.EPSILON);
        }
    }

    @Test
    void nullableOccurrencesAreExpanded() {
        Grammar grammar = grammar("S -> AB", "A -> aA ε", "B -> b ε");
        new EpsilonEliminator().apply(grammar);

        assertThat(grammar.productions(var("A"))).containsExactlyInAnyOrder(prod("a"), prod("aA"));
        assertThat(grammar.productions(var("B"))).containsExactly(prod("b"));
        assertThat(grammar.productions(var("S")))
                .containsExactlyInAnyOrder(prod("AB"), prod("A"), prod("B"), Production.EPSILON);
    }

    @Test
    void nullabilityPropagatesThroughIndirectVariables() {
        Grammar grammar = grammar("S -> aX", "X -> YZ", "Y -> y ε", "Z -> z ε");
        new EpsilonEliminator().apply(grammar);

        assertThat(grammar.productions(var("X")))
                .containsExactlyInAnyOrder(prod("YZ"), prod("Y"), prod("Z"));
        assertThat(grammar.productions(var("S"))).containsExactlyInAnyOrder(prod("aX"), prod("a"));
        assertEpsilonFree(grammar);
    }

    @Test
    void selfReferenceDoesNotBringEpsilonBack() {
        Grammar grammar = grammar("S -> aA", "A -> AA b ε");
        new EpsilonEliminator().apply(grammar);

        assertThat(grammar.productions(var("A"))).containsExactlyInAnyOrder(prod("AA"), prod("A"), prod("b"));
        assertEpsilonFree(grammar);
    }

    @Test
    void startVariableKeepsItsEpsilon() {
        Grammar grammar = grammar("S -> a ε");
        new EpsilonEliminator().apply(grammar);
        assertThat(grammar.productions(var("S"))).containsExactly(prod("a"), Production.EPSILON);
    }

    @Test
    void referencedStartIsNotExpanded() {
        Grammar grammar = grammar("S -> aS ε");
        Grammar before = grammar.copy();
        new EpsilonEliminator().apply(grammar);

        assertThat(grammar.productions(var("S"))).containsExactly(prod("aS"), Production.EPSILON);
        assertThat(language(grammar, 6)).isEqualTo(language(before, 6));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "S0 -> S|S -> aSb ε",
            "S0 -> S|S -> AB|A -> aA ε|B -> bB ε",
            "S0 -> S|S -> ABC|A -> ε a|B -> A ε|C -> AB c",
            "S0 -> S|S -> XaX|X -> XX ε b",
            "S0 -> S|S -> (S) SS ε",
    })
    void languageIsPreserved(String rules) {
        Grammar grammar = grammar(rules.split("\\|"));
        Grammar before = grammar.copy();
        new EpsilonEliminator().apply(grammar);

        assertThat(language(grammar, 7)).isEqualTo(language(before, 7));
        assertEpsilonFree(grammar);
    }
}
