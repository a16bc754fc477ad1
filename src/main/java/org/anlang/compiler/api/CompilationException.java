package org.anlang.compiler.api;

/**
 * The checked base of all failures reported by the compiler front end. Every failure
 * refers to a location in a compilation unit, which is appended to the message.
 */
public class CompilationException extends Exception {

    private final SourceInfo sourceInfo;

    /**
     * Constructs a new compilation exception.
     * @param message The detail message, without location.
     * @param sourceInfo Where in the source the failure occurred.
     */
    public CompilationException(String message, SourceInfo sourceInfo) {
        super(String.format("%s at %s", message, sourceInfo));
        this.sourceInfo = sourceInfo;
    }

    /**
     * @return The source location the failure refers to.
     */
    public SourceInfo getSourceInfo() {
        return sourceInfo;
    }
}
