package org.anlang.compiler.frontend.lexer;

/**
 * The single-character operators of the language.
 */
public enum Operator {
    /** {@code +} */
    ADD('+'),
    /** {@code =} */
    EQUALS('='),
    /** {@code .} */
    MEMBER_ACCESS('.');

    private final char symbol;

    Operator(char symbol) {
        this.symbol = symbol;
    }

    /**
     * Maps a source character to its operator.
     * @param c The character.
     * @return The operator, or {@code null} if the character is not an operator.
     */
    public static Operator fromSymbol(int c) {
        for (Operator op : values()) {
            if (op.symbol == c) {
                return op;
            }
        }
        return null;
    }
}
