package org.anlang.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

/**
 * The tunable settings of the lexer, read from the {@code anlang.lexer} configuration block.
 *
 * @param maxNestingDepth The maximum number of nested token trees (groups, strings, splices).
 * @param blankLinesParticipate Whether whitespace-only lines open and close indentation blocks.
 * @param warnOnMixedIndentation Whether indentation mixing tabs and spaces is reported as a warning.
 */
public record LexerOptions(int maxNestingDepth, boolean blankLinesParticipate, boolean warnOnMixedIndentation) {

    /** The configuration path of the lexer block. */
    public static final String CONFIG_PATH = "anlang.lexer";

    public LexerOptions {
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be at least 1, was " + maxNestingDepth);
        }
    }

    /**
     * Reads the options from a configuration.
     * @param config A configuration containing the {@code anlang.lexer} block.
     * @return The options.
     * @throws ConfigException if a setting is missing or has an invalid value.
     */
    public static LexerOptions fromConfig(Config config) {
        Config lexer = config.getConfig(CONFIG_PATH);
        int maxNestingDepth = lexer.getInt("max-nesting-depth");
        if (maxNestingDepth < 1) {
            throw new ConfigException.BadValue(lexer.origin(), CONFIG_PATH + ".max-nesting-depth",
                    "must be at least 1, was " + maxNestingDepth);
        }
        return new LexerOptions(
                maxNestingDepth,
                lexer.getBoolean("blank-lines-participate"),
                lexer.getBoolean("warn-on-mixed-indentation"));
    }

    /**
     * @return The options from {@code reference.conf}, ignoring any overrides.
     */
    public static LexerOptions defaults() {
        return fromConfig(ConfigFactory.parseResources("reference.conf"));
    }
}
