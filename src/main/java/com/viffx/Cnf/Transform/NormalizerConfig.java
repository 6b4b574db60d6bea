package com.viffx.Cnf.Transform;

import com.viffx.Cnf.Grammar.InvalidGrammarException;
import com.viffx.Cnf.Symbols.Symbol;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Settings of a {@link ChomskyNormalizer} run.
 *
 * @param startName   preferred name of the variable introduced by start isolation
 * @param freshPrefix upper case letter that starts every other minted variable
 * @param verify      if the result is checked against the normal form before it is returned
 */
public record NormalizerConfig(String startName, String freshPrefix, boolean verify) {
    public static final String RESOURCE = "/cnf.properties";
    public static final String START_NAME = "cnf.start.name";
    public static final String FRESH_PREFIX = "cnf.fresh.prefix";
    public static final String VERIFY = "cnf.verify";

    public static final NormalizerConfig DEFAULT = new NormalizerConfig("S0", "U", true);

    public NormalizerConfig {
        if (!Symbol.isVariableName(startName))
            throw new InvalidGrammarException(START_NAME + " must be a variable name, got: " + startName);
        if (freshPrefix == null || !freshPrefix.matches("[A-Z]"))
            throw new InvalidGrammarException(FRESH_PREFIX + " must be a single upper case letter, got: " + freshPrefix);
    }

    /**
     * Reads the settings from {@code properties}, falling back to {@link #DEFAULT} for missing keys.
     */
    @NotNull
    public static NormalizerConfig from(Properties properties) {
        return new NormalizerConfig(
                properties.getProperty(START_NAME, DEFAULT.startName()).trim(),
                properties.getProperty(FRESH_PREFIX, DEFAULT.freshPrefix()).trim(),
                flag(VERIFY, properties.getProperty(VERIFY, String.valueOf(DEFAULT.verify())).trim())
        );
    }

    private static boolean flag(String key, String value) {
        if (value.equalsIgnoreCase("true")) return true;
        if (value.equalsIgnoreCase("false")) return false;
        throw new InvalidGrammarException(key + " must be true or false, got: " + value);
    }

    /**
     * Loads {@value #RESOURCE} from the classpath and lets system properties with the same keys override it.
     */
    @NotNull
    public static NormalizerConfig load() {
        Properties properties = new Properties();
        try (InputStream in = NormalizerConfig.class.getResourceAsStream(RESOURCE)) {
            if (in != null) properties.load(in);
        } catch (IOException exc) {
            throw new UncheckedIOException("could not read " + RESOURCE, exc);
        }
        for (String key : new String[]{START_NAME, FRESH_PREFIX, VERIFY}) {
            String value = System.getProperty(key);
            if (value != null) properties.setProperty(key, value);
        }
        return from(properties);
    }
}
