package com.viffx.Cnf.Grammar;

import com.viffx.Cnf.Symbols.NonTerminal;
import com.viffx.Cnf.Symbols.Symbol;
import com.viffx.Cnf.Symbols.Terminal;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.*;
import java.util.stream.Collectors;

/**
 * A context free grammar that the normalization stages rewrite in place.
 * <p>
 * Rules live in an arena: every variable that heads a rule is given a stable id the first time a production is
 * added for it, and its production list is addressed by that id. Ids are never reused or reordered, so a stage can
 * walk {@code 0 .. numRules()} while new rules are appended behind it.
 */
public class Grammar {
    //[GRAMMAR_STRUCTURE]
    private final Set<NonTerminal>          variables   = new LinkedHashSet<>();
    private final Set<Terminal>             terminals   = new LinkedHashSet<>();
    private final List<NonTerminal>         heads       = new ArrayList<>();
    private final Map<NonTerminal,Integer>  ids         = new HashMap<>();
    private final List<List<Production>>    rules       = new ArrayList<>();
    private NonTerminal start;

    //[CONSTRUCTORS_AND_FACTORY_METHODS]

    /**
     * Builds a grammar from raw declarations.
     * <p>
     * Symbols used in a production that were not declared are promoted by their casing, see
     * {@link #addRule(String, List)}.
     *
     * @param variables     the declared variable names
     * @param terminals     the declared terminal tokens
     * @param rules         the productions of each variable, each production a sequence of symbol tokens
     * @param startVariable the start variable, which must be a key of {@code rules}
     * @throws InvalidRuleNameException if a key of {@code rules} is not a variable name
     * @throws InvalidGrammarException  if a token is declared as both a variable and a terminal, or if the start
     *                                  variable has no entry in {@code rules}
     */
    public Grammar(Collection<String> variables,
                   Collection<String> terminals,
                   Map<String, List<List<String>>> rules,
                   String startVariable) {
        Objects.requireNonNull(variables, "variables cannot be null");
        Objects.requireNonNull(terminals, "terminals cannot be null");
        Objects.requireNonNull(rules, "rules cannot be null");
        Objects.requireNonNull(startVariable, "startVariable cannot be null");

        for (String variable : variables) this.variables.add(new NonTerminal(variable));
        for (String terminal : terminals) {
            if (variables.contains(terminal))
                throw new InvalidGrammarException("'" + terminal + "' is declared as both a variable and a terminal");
            this.terminals.add(new Terminal(terminal));
        }
        for (Map.Entry<String, List<List<String>>> rule : rules.entrySet()) {
            addRule(rule.getKey(), rule.getValue());
        }
        if (!rules.containsKey(startVariable))
            throw new InvalidGrammarException("start variable '" + startVariable + "' has no rule");
        this.start = new NonTerminal(startVariable);
    }

    private Grammar(Grammar other) {
        variables.addAll(other.variables);
        terminals.addAll(other.terminals);
        heads.addAll(other.heads);
        ids.putAll(other.ids);
        for (List<Production> productions : other.rules) rules.add(new ArrayList<>(productions));
        start = other.start;
    }

    /**
     * Returns an independent copy of this grammar. The stages never copy, this exists for callers that need to keep
     * the grammar as it was before normalization.
     */
    @NotNull
    @Contract(" -> new")
    public Grammar copy() {
        return new Grammar(this);
    }

    /**
     * Splits a line of alternatives in the compact notation of the command line: alternatives are separated by
     * whitespace and every character of an alternative is one symbol, so {@code "aSb ε"} yields
     * {@code [[a, S, b], [ε]]}.
     */
    @NotNull
    public static List<List<String>> splitProductions(String line) {
        List<List<String>> productions = new ArrayList<>();
        for (String alternative : line.trim().split("\\s+")) {
            if (alternative.isEmpty()) continue;
            List<String> production = new ArrayList<>();
            alternative.codePoints().forEach(c -> production.add(new String(Character.toChars(c))));
            productions.add(production);
        }
        return productions;
    }

    //[RULE_OPERATIONS]

    /**
     * Registers {@code variable} and appends {@code production} to its rule unless an equal production is already
     * listed. The rule entry is created if {@code variable} has none yet.
     *
     * @return if the production was added
     */
    public boolean addProduction(NonTerminal variable, Production production) {
        Objects.requireNonNull(variable, "variable cannot be null");
        Objects.requireNonNull(production, "production cannot be null");
        register(production);
        List<Production> productions = rule(variable);
        if (productions.contains(production)) return false;
        productions.add(production);
        return true;
    }

    /**
     * Adds a rule given as raw tokens.
     * <p>
     * Tokens that were not declared are promoted: a token that looks like a variable (upper case letters and no
     * lower case ones) becomes a variable, anything else, the epsilon marker included, becomes a terminal.
     *
     * @param lhs the rule head
     * @param rhs the productions, each a sequence of tokens
     * @throws InvalidRuleNameException if {@code lhs} is not an upper case letter optionally followed by digits, in
     *                                  which case the grammar is left untouched
     */
    public void addRule(String lhs, List<List<String>> rhs) {
        if (!Symbol.isVariableName(lhs)) throw new InvalidRuleNameException(lhs);
        Objects.requireNonNull(rhs, "rhs cannot be null");
        List<Production> productions = new ArrayList<>(rhs.size());
        for (List<String> tokens : rhs) {
            List<Symbol> symbols = new ArrayList<>(tokens.size());
            for (String token : tokens) symbols.add(symbol(token));
            productions.add(new Production(symbols));
        }
        addRule(new NonTerminal(lhs), productions);
    }

    /**
     * Adds every production of {@code productions} to the rule of {@code lhs}, creating the rule even when
     * {@code productions} is empty.
     *
     * @throws InvalidRuleNameException if the name of {@code lhs} is not a variable name
     */
    public void addRule(NonTerminal lhs, Collection<Production> productions) {
        Objects.requireNonNull(lhs, "lhs cannot be null");
        if (!Symbol.isVariableName(lhs.value())) throw new InvalidRuleNameException(lhs.value());
        Objects.requireNonNull(productions, "productions cannot be null");
        variables.add(lhs);
        rule(lhs);
        for (Production production : productions) addProduction(lhs, production);
    }

    /**
     * Removes {@code production} from the rule of {@code variable}.
     *
     * @return if the production was present
     */
    public boolean removeProduction(NonTerminal variable, Production production) {
        Integer id = ids.get(variable);
        return id != null && rules.get(id).remove(production);
    }

    /**
     * Replaces the productions of {@code variable} by {@code productions}, dropping duplicates.
     */
    public void replaceProductions(NonTerminal variable, Collection<Production> productions) {
        List<Production> replacement = List.copyOf(productions);
        rule(variable).clear();
        for (Production production : replacement) addProduction(variable, production);
    }

    //[API]
    public NonTerminal start() {
        return start;
    }

    /**
     * Makes {@code variable} the start variable.
     *
     * @throws InvalidGrammarException if {@code variable} heads no rule
     */
    public void setStart(NonTerminal variable) {
        if (!ids.containsKey(variable)) throw new InvalidGrammarException("start variable '" + variable + "' has no rule");
        start = variable;
    }

    /**
     * Returns a read only view of the productions of {@code variable}, empty if it heads no rule.
     */
    @NotNull
    public List<Production> productions(NonTerminal variable) {
        Integer id = ids.get(variable);
        if (id == null) return List.of();
        return Collections.unmodifiableList(rules.get(id));
    }

    @NotNull
    public List<Production> productions(int id) {
        return Collections.unmodifiableList(rules.get(id));
    }

    public boolean hasRule(NonTerminal variable) {
        return ids.containsKey(variable);
    }

    public NonTerminal head(int id) {
        return heads.get(id);
    }

    public int id(NonTerminal variable) {
        Integer id = ids.get(variable);
        if (id == null) throw new NoSuchElementException("no rule for " + variable);
        return id;
    }

    public int numRules() {
        return heads.size();
    }

    /**
     * Returns a snapshot of every rule head in id order.
     */
    @NotNull
    public List<NonTerminal> ruleHeads() {
        return List.copyOf(heads);
    }

    public Set<NonTerminal> variables() {
        return Collections.unmodifiableSet(variables);
    }

    /**
     * Returns the terminals, including {@link Terminal#EPSILON} once any production or declaration has used the
     * epsilon marker. Callers that want the input alphabet should skip {@link Terminal#isEpsilon()} entries.
     */
    public Set<Terminal> terminals() {
        return Collections.unmodifiableSet(terminals);
    }

    public boolean isVariable(String name) {
        return variables.contains(new NonTerminal(name));
    }

    /**
     * Returns if {@code name} is already taken by a variable or a terminal.
     */
    public boolean isSymbol(String name) {
        return isVariable(name) || terminals.contains(new Terminal(name));
    }

    /**
     * Returns if {@code symbol} appears in any production of any rule.
     */
    public boolean occursOnRightHandSide(Symbol symbol) {
        for (List<Production> productions : rules) {
            for (Production production : productions) {
                if (production.contains(symbol)) return true;
            }
        }
        return false;
    }

    /**
     * Returns a variable other than the start variable whose only production is {@code production}.
     * <p>
     * Such a variable derives exactly what {@code production} derives, so it can stand in for it.
     */
    @NotNull
    public Optional<NonTerminal> findSoleProducer(Production production) {
        for (int id = 0; id < heads.size(); id++) {
            NonTerminal head = heads.get(id);
            if (head.equals(start)) continue;
            List<Production> productions = rules.get(id);
            if (productions.size() == 1 && productions.get(0).equals(production)) return Optional.of(head);
        }
        return Optional.empty();
    }

    /**
     * Returns the total number of productions over all rules.
     */
    public int size() {
        int size = 0;
        for (List<Production> productions : rules) size += productions.size();
        return size;
    }

    /**
     * Returns the rule heads with the start variable first. Ids stay as they are, only the listing changes.
     */
    @NotNull
    public List<NonTerminal> displayOrder() {
        List<NonTerminal> order = new ArrayList<>(heads.size());
        if (start != null && ids.containsKey(start)) order.add(start);
        for (NonTerminal head : heads) {
            if (!head.equals(start)) order.add(head);
        }
        return order;
    }

    //[SYMBOL_UTILITIES]
    private Symbol symbol(String token) {
        Objects.requireNonNull(token, "token cannot be null");
        if (Terminal.EPSILON_MARK.equals(token)) return Terminal.EPSILON;
        NonTerminal variable = new NonTerminal(token);
        if (variables.contains(variable)) return variable;
        Terminal terminal = new Terminal(token);
        if (terminals.contains(terminal)) return terminal;
        return Symbol.looksLikeVariable(token) ? variable : terminal;
    }

    private void register(Production production) {
        for (Symbol symbol : production.symbols()) {
            switch (symbol.type()) {
                case NON_TERMINAL -> variables.add((NonTerminal) symbol);
                case TERMINAL, EPSILON -> terminals.add((Terminal) symbol);
            }
        }
    }

    private List<Production> rule(NonTerminal variable) {
        variables.add(variable);
        Integer id = ids.get(variable);
        if (id != null) return rules.get(id);
        ids.put(variable, heads.size());
        heads.add(variable);
        List<Production> productions = new ArrayList<>();
        rules.add(productions);
        return productions;
    }

    @Override
    public String toString() {
        return displayOrder().stream()
                .map(head -> head + " → " + rules.get(ids.get(head)).stream()
                        .map(Production::toString)
                        .collect(Collectors.joining("|")))
                .collect(Collectors.joining("\n"));
    }
}
