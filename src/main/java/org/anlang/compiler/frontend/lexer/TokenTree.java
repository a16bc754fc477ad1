package org.anlang.compiler.frontend.lexer;

import org.anlang.compiler.api.Spanned;

import java.util.List;

/**
 * A token, or a delimited sequence of spanned token trees.
 */
public sealed interface TokenTree permits TokenTree.Leaf, TokenTree.Group {

    /**
     * A single token.
     * @param token The token.
     * @param adjacency The juxtaposition tag; {@link Adjacency#NONE} for anything but identifiers and integers.
     */
    record Leaf(Token token, Adjacency adjacency) implements TokenTree {

        /**
         * Creates a leaf that does not take part in adjacency tagging.
         * @param token The token.
         * @return The leaf.
         */
        public static Leaf untagged(Token token) {
            return new Leaf(token, Adjacency.NONE);
        }
    }

    /**
     * A delimited group. The children are ordered by position and never overlap.
     * @param delimiter The kind of group.
     * @param children The child trees.
     */
    record Group(Delimiter delimiter, List<Spanned<TokenTree>> children) implements TokenTree {

        public Group {
            children = List.copyOf(children);
        }
    }
}
