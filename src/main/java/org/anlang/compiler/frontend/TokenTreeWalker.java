package org.anlang.compiler.frontend;

import org.anlang.compiler.api.Spanned;
import org.anlang.compiler.frontend.lexer.Delimiter;
import org.anlang.compiler.frontend.lexer.Token;
import org.anlang.compiler.frontend.lexer.TokenTree;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * A generic class for traversing a token tree.
 * Instead of the Visitor pattern, this walker uses a handler-based system:
 * leaves are dispatched on the class of their token, groups on their delimiter.
 */
public class TokenTreeWalker {

    private final Map<Class<? extends Token>, Consumer<Spanned<TokenTree>>> tokenHandlers;
    private final Map<Delimiter, Consumer<Spanned<TokenTree>>> groupHandlers;

    /**
     * Constructs a new TokenTreeWalker.
     * @param tokenHandlers A map from token classes to the handlers of leaves carrying them.
     * @param groupHandlers A map from delimiters to the handlers of groups of that kind.
     */
    public TokenTreeWalker(Map<Class<? extends Token>, Consumer<Spanned<TokenTree>>> tokenHandlers,
                           Map<Delimiter, Consumer<Spanned<TokenTree>>> groupHandlers) {
        this.tokenHandlers = tokenHandlers;
        this.groupHandlers = groupHandlers;
    }

    /**
     * Walks a list of trees.
     * @param nodes The trees to walk.
     */
    public void walk(List<Spanned<TokenTree>> nodes) {
        for (Spanned<TokenTree> node : nodes) {
            walk(node);
        }
    }

    /**
     * Walks a tree in pre-order, calling the handler of each node before descending into its children.
     * @param node The tree to walk.
     */
    public void walk(Spanned<TokenTree> node) {
        if (node == null) {
            return;
        }
        if (node.value() instanceof TokenTree.Leaf leaf) {
            tokenHandlers.getOrDefault(leaf.token().getClass(), n -> {}).accept(node);
        } else if (node.value() instanceof TokenTree.Group group) {
            groupHandlers.getOrDefault(group.delimiter(), n -> {}).accept(node);
            walk(group.children());
        }
    }

    /**
     * Builds a copy of a tree without the nodes rejected by a filter. Rejected groups are
     * dropped together with their children; the root is always kept. Spans are unchanged.
     *
     * @param node The root of the tree.
     * @param keep The filter deciding which descendants to keep.
     * @return The pruned tree, or the same instance if nothing was removed.
     */
    public static Spanned<TokenTree> prune(Spanned<TokenTree> node, Predicate<Spanned<TokenTree>> keep) {
        if (!(node.value() instanceof TokenTree.Group group)) {
            return node;
        }
        List<Spanned<TokenTree>> kept = new ArrayList<>();
        boolean changed = false;
        for (Spanned<TokenTree> child : group.children()) {
            if (!keep.test(child)) {
                changed = true;
                continue;
            }
            Spanned<TokenTree> pruned = prune(child, keep);
            changed |= pruned != child;
            kept.add(pruned);
        }
        if (!changed) {
            return node;
        }
        return new Spanned<>(new TokenTree.Group(group.delimiter(), kept), node.span());
    }

    /**
     * Removes all comments from a tree, as the parser expects.
     * @param node The root of the tree.
     * @return The tree without comment leaves.
     */
    public static Spanned<TokenTree> withoutComments(Spanned<TokenTree> node) {
        return prune(node, n -> !(n.value() instanceof TokenTree.Leaf leaf && leaf.token() instanceof Token.Comment));
    }
}
