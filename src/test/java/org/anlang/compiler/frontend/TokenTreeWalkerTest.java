package org.anlang.compiler.frontend;

import org.anlang.compiler.TokenTreeLexer;
import org.anlang.compiler.api.LexException;
import org.anlang.compiler.api.Spanned;
import org.anlang.compiler.config.LexerOptions;
import org.anlang.compiler.frontend.lexer.Delimiter;
import org.anlang.compiler.frontend.lexer.Token;
import org.anlang.compiler.frontend.lexer.TokenTree;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import static org.anlang.compiler.frontend.lexer.Adjacency.TERMINAL;
import static org.anlang.test.utils.TokenTrees.children;
import static org.anlang.test.utils.TokenTrees.identifier;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link TokenTreeWalker}.
 */
@Tag("unit")
class TokenTreeWalkerTest {

    private final TokenTreeLexer lexer = new TokenTreeLexer(LexerOptions.defaults());

    /**
     * Verifies that the walker calls the handler of each group before descending into its children.
     */
    @Test
    void testWalkVisitsNodesInPreOrder() throws LexException {
        // Arrange
        Spanned<TokenTree> root = lexer.lex("a (b \"c\")");
        List<String> visited = new ArrayList<>();
        Consumer<Spanned<TokenTree>> recordToken = n -> visited.add(((TokenTree.Leaf) n.value()).token().toString());
        Map<Delimiter, Consumer<Spanned<TokenTree>>> groupHandlers = new EnumMap<>(Delimiter.class);
        for (Delimiter delimiter : Delimiter.values()) {
            groupHandlers.put(delimiter, n -> visited.add(delimiter.name()));
        }

        // Act
        new TokenTreeWalker(Map.of(Token.Identifier.class, recordToken, Token.StringLiteral.class, recordToken),
                groupHandlers).walk(root);

        // Assert
        assertThat(visited).containsExactly(
                "BLOCK",
                "Identifier[text=a]",
                "PARENTHESIS",
                "Identifier[text=b]",
                "INTERPOLATION",
                "StringLiteral[value=c]");
    }

    /**
     * Verifies that groups without a registered handler are still traversed.
     */
    @Test
    void testNodesWithoutHandlerAreStillDescended() throws LexException {
        Spanned<TokenTree> root = lexer.lex("((x))");
        List<Spanned<TokenTree>> identifiers = new ArrayList<>();

        new TokenTreeWalker(Map.of(Token.Identifier.class, identifiers::add), Map.of()).walk(root);

        assertThat(identifiers).containsExactly(identifier("x", TERMINAL, 2, 3));
    }

    /**
     * Verifies that comments are removed from nested groups as well and that spans are kept.
     */
    @Test
    void testWithoutCommentsRemovesCommentsAtEveryLevel() throws LexException {
        Spanned<TokenTree> root = lexer.lex("a // one\n  (b /* two */)");

        Spanned<TokenTree> stripped = TokenTreeWalker.withoutComments(root);

        List<Spanned<TokenTree>> top = children(stripped, Delimiter.BLOCK);
        assertThat(top).hasSize(2);
        List<Spanned<TokenTree>> block = children(top.get(1), Delimiter.BLOCK);
        assertThat(children(block.get(0), Delimiter.PARENTHESIS)).containsExactly(identifier("b", TERMINAL, 12, 13));
        assertThat(stripped.span()).isEqualTo(root.span());
    }

    /**
     * Verifies that pruning a tree without matching nodes does not copy it.
     */
    @Test
    void testPruneReturnsSameInstanceWhenNothingIsRemoved() throws LexException {
        Spanned<TokenTree> root = lexer.lex("a (b c)\n  d");

        assertThat(TokenTreeWalker.withoutComments(root)).isSameAs(root);
    }

    /**
     * Verifies that a rejected group is removed together with its children.
     */
    @Test
    void testPruneDropsRejectedGroupsWithChildren() throws LexException {
        Spanned<TokenTree> root = lexer.lex("a (b c) \"s\"");

        Spanned<TokenTree> pruned = TokenTreeWalker.prune(root,
                n -> !(n.value() instanceof TokenTree.Group group && group.delimiter() == Delimiter.PARENTHESIS));

        List<Spanned<TokenTree>> top = children(pruned, Delimiter.BLOCK);
        assertThat(top).hasSize(2);
        assertThat(top.get(0)).isEqualTo(identifier("a", TERMINAL, 0, 1));
        assertThat(((TokenTree.Group) top.get(1).value()).delimiter()).isEqualTo(Delimiter.INTERPOLATION);
    }
}
