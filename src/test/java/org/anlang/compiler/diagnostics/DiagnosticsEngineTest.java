package org.anlang.compiler.diagnostics;

import org.anlang.compiler.api.SourceInfo;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link DiagnosticsEngine}.
 */
@Tag("unit")
class DiagnosticsEngineTest {

    private static final SourceInfo LOCATION = new SourceInfo("main.an", 3, 5, "    x");

    /**
     * Verifies that warnings alone do not mark a run as failed.
     */
    @Test
    void testWarningsDoNotCountAsErrors() {
        DiagnosticsEngine engine = new DiagnosticsEngine();
        engine.reportWarning("careful", LOCATION);

        assertThat(engine.hasErrors()).isFalse();
        assertThat(engine.getDiagnostics(Diagnostic.Type.WARNING)).hasSize(1);
    }

    /**
     * Verifies that diagnostics are kept in reporting order and can be filtered by type.
     */
    @Test
    void testErrorsAreCollectedInOrder() {
        // Arrange
        DiagnosticsEngine engine = new DiagnosticsEngine();

        // Act
        engine.reportWarning("first", LOCATION);
        engine.reportError("second", LOCATION);

        // Assert
        assertThat(engine.hasErrors()).isTrue();
        assertThat(engine.getDiagnostics()).extracting(Diagnostic::message).containsExactly("first", "second");
        assertThat(engine.getDiagnostics(Diagnostic.Type.ERROR)).extracting(Diagnostic::message).containsExactly("second");
    }

    /**
     * Verifies the line format of the diagnostics summary.
     */
    @Test
    void testSummaryFormat() {
        DiagnosticsEngine engine = new DiagnosticsEngine();
        engine.reportError("boom", LOCATION);
        engine.reportWarning("hmm", new SourceInfo("main.an", 4, 1, ""));

        assertThat(engine.summary()).isEqualTo("[ERROR] main.an:3:5: boom\n[WARNING] main.an:4:1: hmm");
    }

    /**
     * Verifies that the lexer knows exactly two kinds of diagnostics.
     */
    @Test
    void testOnlyErrorsAndWarningsExist() {
        assertThat(Diagnostic.Type.values()).containsExactly(Diagnostic.Type.ERROR, Diagnostic.Type.WARNING);
    }

    /**
     * Verifies that callers cannot modify the collected diagnostics.
     */
    @Test
    void testDiagnosticListIsReadOnly() {
        DiagnosticsEngine engine = new DiagnosticsEngine();

        assertThatThrownBy(() -> engine.getDiagnostics().add(new Diagnostic(Diagnostic.Type.WARNING, "x", "f", 1, 1)))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
