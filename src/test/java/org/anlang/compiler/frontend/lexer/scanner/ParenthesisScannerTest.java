package org.anlang.compiler.frontend.lexer.scanner;

import org.anlang.compiler.TokenTreeLexer;
import org.anlang.compiler.api.LexErrorCode;
import org.anlang.compiler.api.LexException;
import org.anlang.compiler.api.Spanned;
import org.anlang.compiler.config.LexerOptions;
import org.anlang.compiler.frontend.lexer.Delimiter;
import org.anlang.compiler.frontend.lexer.TokenTree;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.anlang.compiler.frontend.lexer.Adjacency.SEQUENTIAL;
import static org.anlang.compiler.frontend.lexer.Adjacency.TERMINAL;
import static org.anlang.test.utils.TokenTrees.children;
import static org.anlang.test.utils.TokenTrees.identifier;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Contains unit tests for the {@link ParenthesisScanner}.
 */
@Tag("unit")
class ParenthesisScannerTest {

    private final TokenTreeLexer lexer = new TokenTreeLexer(LexerOptions.defaults());

    private List<Spanned<TokenTree>> lex(String source) throws LexException {
        return children(lexer.lex(source), Delimiter.BLOCK);
    }

    /**
     * Verifies that an empty pair of parentheses is a group without children.
     */
    @Test
    void testEmptyGroup() throws LexException {
        List<Spanned<TokenTree>> top = lex("()");

        assertThat(top).hasSize(1);
        assertThat(children(top.get(0), Delimiter.PARENTHESIS)).isEmpty();
        assertThat(top.get(0).span().start()).isZero();
        assertThat(top.get(0).span().end()).isEqualTo(2);
    }

    /**
     * Verifies the children and spans of nested parenthesis groups.
     */
    @Test
    void testNestedGroups() throws LexException {
        // Arrange
        String source = "(a (b c) ())";

        // Act
        List<Spanned<TokenTree>> outer = children(lex(source).get(0), Delimiter.PARENTHESIS);

        // Assert
        assertThat(outer).hasSize(3);
        assertThat(outer.get(0)).isEqualTo(identifier("a", TERMINAL, 1, 2));
        assertThat(children(outer.get(1), Delimiter.PARENTHESIS)).containsExactly(
                identifier("b", SEQUENTIAL, 4, 5),
                identifier("c", TERMINAL, 6, 7));
        assertThat(outer.get(1).span().start()).isEqualTo(3);
        assertThat(outer.get(1).span().end()).isEqualTo(8);
        assertThat(children(outer.get(2), Delimiter.PARENTHESIS)).isEmpty();
    }

    /**
     * Verifies that line breaks inside parentheses are plain whitespace.
     */
    @Test
    void testLineBreaksInsideGroupAreWhitespace() throws LexException {
        List<Spanned<TokenTree>> top = lex("f (\n  a\nb\n   )");

        assertThat(top).hasSize(2);
        assertThat(children(top.get(1), Delimiter.PARENTHESIS)).containsExactly(
                identifier("a", TERMINAL, 6, 7),
                identifier("b", TERMINAL, 8, 9));
    }

    /**
     * Verifies that a wrong closing delimiter is reported against the open group, listing the
     * expected closer first.
     */
    @Test
    void testMismatchedCloser() {
        LexException e = catchThrowableOfType(() -> lexer.lex("(a }"), LexException.class);

        assertThat(e).isNotNull();
        assertThat(e.getCode()).isEqualTo(LexErrorCode.UNTERMINATED_GROUP);
        assertThat(e.getPosition()).isZero();
        assertThat(e.getDelimiter()).isEqualTo(Delimiter.PARENTHESIS);
        assertThat(e.getExpected()).first().isEqualTo("')'");
    }

    /**
     * Verifies that a group still open at the end of input is reported at its opening parenthesis.
     */
    @Test
    void testGroupOpenAtEndOfInput() {
        LexException e = catchThrowableOfType(() -> lexer.lex("x (a\n  b"), LexException.class);

        assertThat(e).isNotNull();
        assertThat(e.getCode()).isEqualTo(LexErrorCode.UNTERMINATED_GROUP);
        assertThat(e.getPosition()).isEqualTo(2);
    }

    /**
     * Verifies that a closing parenthesis without an open group is an unexpected character.
     */
    @Test
    void testStrayCloser() {
        LexException e = catchThrowableOfType(() -> lexer.lex("a)"), LexException.class);

        assertThat(e).isNotNull();
        assertThat(e.getCode()).isEqualTo(LexErrorCode.UNEXPECTED_CHARACTER);
        assertThat(e.getPosition()).isEqualTo(1);
        assertThat(e.getExpected()).contains("newline", "end of input", "'('");
    }
}
