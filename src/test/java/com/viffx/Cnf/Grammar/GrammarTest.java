package com.viffx.Cnf.Grammar;

import com.viffx.Cnf.Symbols.NonTerminal;
import com.viffx.Cnf.Symbols.Terminal;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.viffx.Cnf.Grammars.grammar;
import static com.viffx.Cnf.Grammars.prod;
import static com.viffx.Cnf.Grammars.var;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class GrammarTest {

    @Test
    void constructorAcceptsForwardReferences() {
        Map<String, List<List<String>>> rules = new LinkedHashMap<>();
        rules.put("S", List.of(List.of("A", "b")));
        rules.put("A", List.of(List.of("a")));
        Grammar grammar = new Grammar(List.of("S"), List.of("b"), rules, "S");

        assertThat(grammar.variables()).containsExactlyInAnyOrder(var("S"), var("A"));
        assertThat(grammar.terminals()).containsExactlyInAnyOrder(new Terminal("a"), new Terminal("b"));
        assertThat(grammar.start()).isEqualTo(var("S"));
        assertThat(grammar.productions(var("A"))).containsExactly(prod("a"));
    }

    @Test
    void declaredSymbolsWinOverCasing() {
        Map<String, List<List<String>>> rules = new LinkedHashMap<>();
        rules.put("S", List.of(List.of("X", "y")));
        Grammar grammar = new Grammar(List.of("S", "y"), List.of("X"), rules, "S");

        assertThat(grammar.productions(var("S")).get(0).symbols())
                .containsExactly(new Terminal("X"), new NonTerminal("y"));
    }

    @Test
    void startVariableMustHaveARule() {
        Map<String, List<List<String>>> rules = Map.of("S", List.of(List.of("a")));
        assertThatThrownBy(() -> new Grammar(List.of("S", "A"), List.of("a"), rules, "A"))
                .isInstanceOf(InvalidGrammarException.class)
                .hasMessageContaining("'A'");
    }

    @Test
    void symbolsCannotBeBothVariableAndTerminal() {
        Map<String, List<List<String>>> rules = Map.of("S", List.of(List.of("a")));
        assertThatThrownBy(() -> new Grammar(List.of("S"), List.of("S"), rules, "S"))
                .isInstanceOf(InvalidGrammarException.class);
    }

    @Test
    void addProductionIsIdempotent() {
        Grammar grammar = grammar("S -> a");
        assertThat(grammar.addProduction(var("S"), prod("b"))).isTrue();
        assertThat(grammar.addProduction(var("S"), prod("b"))).isFalse();
        assertThat(grammar.productions(var("S"))).containsExactly(prod("a"), prod("b"));
    }

    @Test
    void addProductionCreatesMissingRules() {
        Grammar grammar = grammar("S -> A");
        assertThat(grammar.hasRule(var("A"))).isFalse();
        grammar.addProduction(var("A"), prod("a"));
        assertThat(grammar.hasRule(var("A"))).isTrue();
        assertThat(grammar.head(grammar.id(var("A")))).isEqualTo(var("A"));
    }

    @Test
    void addRulePromotesUndeclaredSymbolsByCasing() {
        Grammar grammar = grammar("S -> a");
        grammar.addRule("B1", List.of(List.of("x", "C"), List.of("ε")));

        assertThat(grammar.variables()).contains(var("B1"), var("C"));
        assertThat(grammar.terminals()).contains(new Terminal("x"), Terminal.EPSILON);
        assertThat(grammar.productions(var("B1"))).containsExactly(prod("xC"), Production.EPSILON);
    }

    @Test
    void epsilonMarkerIsListedAmongTerminals() {
        Grammar grammar = grammar("S -> a ε");
        assertThat(grammar.terminals()).containsExactlyInAnyOrder(new Terminal("a"), Terminal.EPSILON);
        assertThat(grammar.terminals()).filteredOn(terminal -> !terminal.isEpsilon()).containsExactly(new Terminal("a"));
    }

    @Test
    void isSymbolCoversVariablesAndTerminals() {
        Grammar grammar = grammar("S -> aB");
        assertThat(grammar.isSymbol("S")).isTrue();
        assertThat(grammar.isSymbol("B")).isTrue();
        assertThat(grammar.isSymbol("a")).isTrue();
        assertThat(grammar.isSymbol("U1")).isFalse();
    }

    @Test
    void addRuleWithNoProductionsStillCreatesTheRule() {
        Grammar grammar = grammar("S -> a");
        grammar.addRule("A", List.of());
        assertThat(grammar.hasRule(var("A"))).isTrue();
        assertThat(grammar.productions(var("A"))).isEmpty();
    }

    @Test
    void lowercaseRuleNameIsRejectedWithoutChangingTheGrammar() {
        Grammar grammar = grammar("S -> a");
        String before = grammar.toString();

        InvalidRuleNameException e = catchThrowableOfType(
                () -> grammar.addRule("s", List.of(List.of("B", "c"))), InvalidRuleNameException.class);

        assertThat(e).isNotNull();
        assertThat(e.name()).isEqualTo("s");

        assertThat(grammar.toString()).isEqualTo(before);
        assertThat(grammar.variables()).containsExactly(var("S"));
    }

    @Test
    void ruleNamesFollowTheVariableConvention() {
        Grammar grammar = grammar("S -> a");
        for (String bad : List.of("", "AB", "A1b", "1A", "a1")) {
            assertThatThrownBy(() -> grammar.addRule(bad, List.of()))
                    .as(bad)
                    .isInstanceOf(InvalidRuleNameException.class);
        }
        grammar.addRule("Z42", List.of(List.of("z")));
        assertThat(grammar.hasRule(var("Z42"))).isTrue();
    }

    @Test
    void replaceProductionsDropsDuplicates() {
        Grammar grammar = grammar("S -> a b");
        grammar.replaceProductions(var("S"), List.of(prod("c"), prod("c"), prod("d")));
        assertThat(grammar.productions(var("S"))).containsExactly(prod("c"), prod("d"));
    }

    @Test
    void findSoleProducerSkipsTheStartVariable() {
        Grammar grammar = grammar("S -> a", "A -> a", "B -> a b");
        assertThat(grammar.findSoleProducer(prod("a"))).contains(var("A"));
        assertThat(grammar.findSoleProducer(prod("b"))).isEmpty();

        grammar.setStart(var("A"));
        assertThat(grammar.findSoleProducer(prod("a"))).contains(var("S"));
    }

    @Test
    void occursOnRightHandSideLooksInsideProductions() {
        Grammar grammar = grammar("S -> aAb", "A -> a");
        assertThat(grammar.occursOnRightHandSide(var("A"))).isTrue();
        assertThat(grammar.occursOnRightHandSide(var("S"))).isFalse();
    }

    @Test
    void rendersOneLinePerRuleWithStartFirst() {
        Grammar grammar = grammar("A -> a", "S -> aSb ε");
        grammar.setStart(var("S"));
        assertThat(grammar).hasToString("S → aSb|ε\nA → a");
        assertThat(grammar.displayOrder()).containsExactly(var("S"), var("A"));
        assertThat(grammar.id(var("A"))).isZero();
    }

    @Test
    void setStartRequiresARule() {
        Grammar grammar = grammar("S -> A");
        assertThatThrownBy(() -> grammar.setStart(var("A"))).isInstanceOf(InvalidGrammarException.class);
    }

    @Test
    void copyIsIndependent() {
        Grammar grammar = grammar("S -> aS ε");
        Grammar copy = grammar.copy();
        grammar.removeProduction(var("S"), Production.EPSILON);
        grammar.addRule("T", List.of(List.of("t")));

        assertThat(copy.productions(var("S"))).containsExactly(prod("aS"), Production.EPSILON);
        assertThat(copy.hasRule(var("T"))).isFalse();
        assertThat(copy.start()).isEqualTo(var("S"));
    }

    @Test
    void splitProductionsReadsOneSymbolPerCharacter() {
        assertThat(Grammar.splitProductions("  aSb   ε ")).containsExactly(List.of("a", "S", "b"), List.of("ε"));
        assertThat(Grammar.splitProductions("   ")).isEmpty();
    }
}
