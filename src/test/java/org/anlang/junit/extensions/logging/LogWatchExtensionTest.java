package org.anlang.junit.extensions.logging;

import ch.qos.logback.classic.Level;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the matching rules of the {@link LogWatchExtension}.
 */
@Tag("unit")
class LogWatchExtensionTest {

    /**
     * Verifies that a rule permits only events of its own level, so allowing a warning
     * does not also let errors from the same logger pass.
     */
    @Test
    void testRuleMatchesExactLevelOnly() {
        LogWatchExtension.Rule rule = new LogWatchExtension.Rule(LogLevel.WARN, ".*Lexer", ".*");

        assertThat(rule.matches(new LogWatchExtension.Event("org.anlang.Lexer", Level.WARN, "careful"))).isTrue();
        assertThat(rule.matches(new LogWatchExtension.Event("org.anlang.Lexer", Level.ERROR, "broken"))).isFalse();
        assertThat(rule.matches(new LogWatchExtension.Event("org.anlang.Lexer", Level.INFO, "fine"))).isFalse();
    }

    /**
     * Verifies that both the logger and the message pattern must match the whole text.
     */
    @Test
    void testRuleMatchesLoggerAndMessagePatterns() {
        LogWatchExtension.Rule rule = new LogWatchExtension.Rule(LogLevel.WARN, ".*ConfigLoader", "Configuration .* not found.*");

        assertThat(rule.matches(new LogWatchExtension.Event("a.ConfigLoader", Level.WARN, "Configuration 'x' not found"))).isTrue();
        assertThat(rule.matches(new LogWatchExtension.Event("a.Other", Level.WARN, "Configuration 'x' not found"))).isFalse();
        assertThat(rule.matches(new LogWatchExtension.Event("a.ConfigLoader", Level.WARN, "Loaded x"))).isFalse();
    }
}
