package org.anlang.compiler.frontend.lexer;

/**
 * The kinds of bracketing construct a {@link TokenTree.Group} can represent.
 */
public enum Delimiter {
    /** A group derived from indentation; it has no characters of its own in the source. */
    BLOCK("block"),
    /** A {@code (...)} group. */
    PARENTHESIS("'('"),
    /** One {@code ${...}} splice inside a string. */
    CURLY("'${'"),
    /** An entire string literal, wrapping its literal fragments and splices. */
    INTERPOLATION("string");

    private final String displayName;

    Delimiter(String displayName) {
        this.displayName = displayName;
    }

    /**
     * @return A short human-readable name used in error messages.
     */
    public String displayName() {
        return displayName;
    }
}
