package org.anlang.compiler.api;

/**
 * Defines unique, testable error codes for all errors that can occur while lexing.
 * This decouples the test logic from the translated error messages.
 */
public enum LexErrorCode {
    /** No token tree, terminator or end of input can start at the position. */
    UNEXPECTED_CHARACTER,
    /** A string literal reached the end of input before its closing quote. */
    UNTERMINATED_STRING,
    /** A block comment reached the end of input before its closing marker. */
    UNTERMINATED_COMMENT,
    /** A parenthesis group or interpolation splice was never closed. */
    UNTERMINATED_GROUP,
    /** A backslash in a string literal was followed by an unsupported character. */
    INVALID_ESCAPE,
    /** An integer literal does not fit into an unsigned 64-bit value. */
    NUMERIC_OVERFLOW,
    /** A dedent returned to an indentation level that was never opened. */
    INCONSISTENT_INDENTATION,
    /** Groups and strings were nested deeper than the configured limit. */
    NESTING_TOO_DEEP,
    /** The source buffer is not well-formed UTF-8. */
    MALFORMED_INPUT;

    /**
     * @return The key of this error's message in the lexer message bundle.
     */
    public String messageKey() {
        return "error." + name().toLowerCase();
    }
}
