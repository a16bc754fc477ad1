package org.anlang.compiler.api;

import org.anlang.compiler.frontend.lexer.Delimiter;
import org.anlang.compiler.internal.i18n.Messages;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for {@link LexException} and its base {@link CompilationException}.
 */
@Tag("unit")
class LexExceptionTest {

    private static final SourceInfo LOCATION = new SourceInfo("main.an", 2, 7, "  f (a }");

    @BeforeEach
    void setUp() {
        Messages.setLocale(Locale.ENGLISH);
    }

    @AfterEach
    void tearDown() {
        Messages.setLocale(Locale.getDefault());
    }

    /**
     * Verifies that the message names the group and the alternatives in order, followed by the location.
     */
    @Test
    void testMessageIncludesExpectedAndLocation() {
        Set<String> expected = new LinkedHashSet<>(List.of("')'", "identifier"));

        LexException e = new LexException(LexErrorCode.UNTERMINATED_GROUP, 9, expected, Delimiter.PARENTHESIS, LOCATION);

        assertThat(e.getMessage()).isEqualTo("Unterminated '(' group, expected one of: ')', identifier at main.an:2:7");
        assertThat(e.getExpected()).containsExactly("')'", "identifier");
    }

    /**
     * Verifies that the location is available through the checked base type.
     */
    @Test
    void testSourceInfoIsKeptByBaseType() {
        CompilationException e = new LexException(LexErrorCode.NUMERIC_OVERFLOW, 9, Set.of(), null, LOCATION);

        assertThat(e.getSourceInfo()).isSameAs(LOCATION);
        assertThat(((LexException) e).getDelimiter()).isNull();
    }
}
