package org.anlang.compiler.diagnostics;

import org.anlang.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting diagnostic messages (errors, warnings)
 * that occur during lexing.
 * <p>
 * This decouples error reporting from the actual scanning logic.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param message The error message.
     * @param location Where the error occurred.
     */
    public void reportError(String message, SourceInfo location) {
        report(Diagnostic.Type.ERROR, message, location);
    }

    /**
     * Reports a warning.
     *
     * @param message The warning message.
     * @param location Where the issue occurred.
     */
    public void reportWarning(String message, SourceInfo location) {
        report(Diagnostic.Type.WARNING, message, location);
    }

    private void report(Diagnostic.Type type, String message, SourceInfo location) {
        diagnostics.add(new Diagnostic(type, message, location.fileName(), location.lineNumber(), location.columnNumber()));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * Returns the diagnostics of the given type.
     *
     * @param type The type to select.
     * @return The matching diagnostics, in reporting order.
     */
    public List<Diagnostic> getDiagnostics(Diagnostic.Type type) {
        return diagnostics.stream().filter(d -> d.type() == type).collect(Collectors.toList());
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
