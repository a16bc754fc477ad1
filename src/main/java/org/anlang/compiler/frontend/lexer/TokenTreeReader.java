package org.anlang.compiler.frontend.lexer;

import org.anlang.compiler.api.LexErrorCode;
import org.anlang.compiler.api.LexException;
import org.anlang.compiler.api.Spanned;
import org.anlang.compiler.frontend.lexer.scanner.ITokenTreeScanner;
import org.anlang.compiler.frontend.lexer.scanner.ScannerRegistry;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Recursive-descent driver for the token-tree grammar. Every nested tree goes through
 * {@link #scanTokenTree()}, which counts the nesting depth and fails once the configured
 * maximum is reached.
 */
public class TokenTreeReader implements LexerContext {

    private final SourceCursor cursor;
    private final ScannerRegistry registry;
    private final int maxNestingDepth;
    private final Set<String> lineExpected;
    private int depth = 0;

    /**
     * @param cursor The cursor over the source buffer.
     * @param registry The scanners to dispatch to.
     * @param maxNestingDepth The maximum number of nested token trees.
     */
    public TokenTreeReader(SourceCursor cursor, ScannerRegistry registry, int maxNestingDepth) {
        this.cursor = cursor;
        this.registry = registry;
        this.maxNestingDepth = maxNestingDepth;
        this.lineExpected = new LinkedHashSet<>(registry.expectedStarters());
        this.lineExpected.add("newline");
        this.lineExpected.add("end of input");
    }

    @Override
    public SourceCursor cursor() {
        return cursor;
    }

    @Override
    public Spanned<TokenTree> scanTokenTree() throws LexException {
        int start = cursor.position();
        Optional<ITokenTreeScanner> scanner = registry.get(cursor.peek());
        if (scanner.isEmpty()) {
            throw cursor.error(LexErrorCode.UNEXPECTED_CHARACTER, start, registry.expectedStarters());
        }
        if (depth >= maxNestingDepth) {
            throw cursor.error(LexErrorCode.NESTING_TOO_DEEP, start, Set.of());
        }
        depth++;
        try {
            return scanner.get().scan(this);
        } finally {
            depth--;
        }
    }

    @Override
    public List<Spanned<TokenTree>> scanGroupBody(char closer, Delimiter delimiter, int openStart) throws LexException {
        List<Spanned<TokenTree>> children = new ArrayList<>();
        while (true) {
            cursor.skipWhitespace();
            int c = cursor.peek();
            if (c == closer) {
                cursor.advance();
                return children;
            }
            if (!registry.canStart(c)) {
                Set<String> expected = new LinkedHashSet<>();
                expected.add("'" + closer + "'");
                expected.addAll(registry.expectedStarters());
                throw cursor.error(LexErrorCode.UNTERMINATED_GROUP, openStart, expected, delimiter);
            }
            children.add(scanTokenTree());
        }
    }

    /**
     * Scans the token trees of one logical line. Leading indentation must already be consumed;
     * the line terminator is left for the caller. Nested groups and strings may span several
     * physical lines.
     *
     * @return The token trees of the line; empty for a blank line.
     * @throws LexException if the line contains something that is not a token tree.
     */
    public List<Spanned<TokenTree>> scanLine() throws LexException {
        List<Spanned<TokenTree>> children = new ArrayList<>();
        while (true) {
            cursor.skipInlineWhitespace();
            if (cursor.isAtEnd() || cursor.isAtNewline()) {
                return children;
            }
            if (!registry.canStart(cursor.peek())) {
                throw cursor.error(LexErrorCode.UNEXPECTED_CHARACTER, cursor.position(), lineExpected);
            }
            children.add(scanTokenTree());
        }
    }
}
