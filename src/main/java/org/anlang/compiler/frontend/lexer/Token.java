package org.anlang.compiler.frontend.lexer;

/**
 * A leaf lexical unit. Tokens are immutable values; where they came from is
 * recorded by the {@link org.anlang.compiler.api.Spanned} wrapping the tree node.
 */
public sealed interface Token permits Token.Identifier, Token.StringLiteral, Token.IntegerLiteral, Token.OperatorToken, Token.Comment {

    /**
     * An identifier. Keywords are not distinguished at this stage.
     * @param text The identifier text.
     */
    record Identifier(String text) implements Token {}

    /**
     * A run of literal string content with escapes already decoded.
     * @param value The decoded text.
     */
    record StringLiteral(String value) implements Token {}

    /**
     * A decimal integer literal.
     * @param value The value, interpreted as an unsigned 64-bit integer.
     * @param suffix The type suffix, or {@code null} if none was written.
     */
    record IntegerLiteral(long value, IntegerKind suffix) implements Token {

        public boolean hasSuffix() {
            return suffix != null;
        }

        @Override
        public String toString() {
            return "IntegerLiteral[value=" + Long.toUnsignedString(value)
                    + (suffix != null ? ", suffix=" + suffix : "") + "]";
        }
    }

    /**
     * A single-character operator.
     * @param operator The operator.
     */
    record OperatorToken(Operator operator) implements Token {}

    /**
     * A line or block comment. The content is discarded; the span is kept so that
     * indentation of comment-only lines is still measured.
     */
    record Comment() implements Token {}
}
