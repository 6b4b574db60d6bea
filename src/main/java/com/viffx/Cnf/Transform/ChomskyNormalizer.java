package com.viffx.Cnf.Transform;

import com.viffx.Cnf.Grammar.Grammar;
import com.viffx.Cnf.Utils.FreshVariables;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Rewrites a grammar into Chomsky normal form.
 * <p>
 * The stages run in a fixed order since each one relies on what the previous ones established: start isolation,
 * epsilon elimination, unit elimination and finally binarization with terminal isolation. The grammar is mutated in
 * place and returned. Names of minted variables come from one {@link FreshVariables} per run.
 */
public class ChomskyNormalizer {
    private static final Logger LOGGER = Logger.getLogger(ChomskyNormalizer.class.getName());

    private final NormalizerConfig config;

    public ChomskyNormalizer() {
        this(NormalizerConfig.DEFAULT);
    }

    public ChomskyNormalizer(NormalizerConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
    }

    /**
     * Returns the stages of one run, in order, sharing {@code names}.
     */
    @NotNull
    public List<Transformation> stages(FreshVariables names) {
        return List.of(
                new StartIsolator(names, config.startName()),
                new EpsilonEliminator(),
                new UnitEliminator(),
                new Binarizer(names)
        );
    }

    /**
     * Normalizes {@code grammar} in place.
     *
     * @return {@code grammar} itself
     * @throws IllegalStateException if verification is enabled and the result is not in normal form
     */
    @Contract("_ -> param1")
    public Grammar normalize(Grammar grammar) {
        Objects.requireNonNull(grammar, "grammar cannot be null");
        FreshVariables names = new FreshVariables(config.freshPrefix());
        for (Transformation stage : stages(names)) {
            stage.apply(grammar);
            LOGGER.fine(() -> stage.name() + " done, " + grammar.numRules() + " rule(s), " + grammar.size() + " production(s)");
        }
        if (config.verify()) CnfVerifier.verify(grammar);
        LOGGER.info(() -> "normalized grammar has " + grammar.numRules() + " rule(s) and " + grammar.size()
                + " production(s), start variable " + grammar.start());
        return grammar;
    }
}
