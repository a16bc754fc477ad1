package org.anlang.compiler.frontend.lexer;

import org.anlang.compiler.api.LexErrorCode;
import org.anlang.compiler.api.LexException;
import org.anlang.compiler.api.Spanned;
import org.anlang.compiler.config.LexerOptions;
import org.anlang.compiler.diagnostics.DiagnosticsEngine;
import org.anlang.compiler.internal.i18n.Messages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * The outermost stage of the lexer. It splits the source into logical lines, lets the
 * {@link TokenTreeReader} scan each line and nests the lines into {@link Delimiter#BLOCK}
 * groups according to their leading whitespace.
 * <p>
 * Indentation is compared as text: a line whose indentation strictly extends the
 * current level opens a nested block; a line with less indentation closes levels until
 * one matches it exactly. Returning to a level that was never opened is an error.
 */
public class IndentationGrouper {

    private static final Logger LOG = LoggerFactory.getLogger(IndentationGrouper.class);

    private final SourceCursor cursor;
    private final TokenTreeReader reader;
    private final DiagnosticsEngine diagnostics;
    private final LexerOptions options;
    private final Deque<Level> levels = new ArrayDeque<>();

    /**
     * @param cursor The cursor over the source buffer, positioned at the start.
     * @param reader The reader scanning the content of each line.
     * @param diagnostics The engine for reporting warnings.
     * @param options The lexer options.
     */
    public IndentationGrouper(SourceCursor cursor, TokenTreeReader reader, DiagnosticsEngine diagnostics, LexerOptions options) {
        this.cursor = cursor;
        this.reader = reader;
        this.diagnostics = diagnostics;
        this.options = options;
    }

    /**
     * Groups the whole source.
     * @return The top-level block, spanning the entire buffer.
     * @throws LexException if a line is malformed or the indentation is inconsistent.
     */
    public Spanned<TokenTree> group() throws LexException {
        Level root = new Level("", 0);
        levels.push(root);

        while (true) {
            int lineStart = cursor.position();
            cursor.skipInlineWhitespace();
            int contentStart = cursor.position();
            String indentation = cursor.text(lineStart, contentStart);

            List<Spanned<TokenTree>> line = reader.scanLine();
            if (!line.isEmpty() || options.blankLinesParticipate()) {
                if (options.warnOnMixedIndentation() && !line.isEmpty() && indentation.indexOf(' ') >= 0 && indentation.indexOf('\t') >= 0) {
                    diagnostics.reportWarning(Messages.get("warning.mixed_indentation"), cursor.sourceInfoAt(lineStart));
                }
                place(indentation, contentStart, line);
            }

            if (cursor.isAtEnd()) break;
            cursor.consumeNewline();
        }

        while (levels.size() > 1) {
            close();
        }
        return Spanned.of(new TokenTree.Group(Delimiter.BLOCK, root.children), 0, cursor.length());
    }

    private void place(String indentation, int contentStart, List<Spanned<TokenTree>> line) throws LexException {
        Level top = levels.peek();
        if (indentation.equals(top.indentation)) {
            top.append(line);
            return;
        }
        if (indentation.startsWith(top.indentation)) {
            Level nested = new Level(indentation, contentStart);
            LOG.trace("Opening block at offset {} (depth {})", contentStart, levels.size());
            levels.push(nested);
            nested.append(line);
            return;
        }

        while (levels.size() > 1 && !indentation.startsWith(levels.peek().indentation)) {
            close();
        }
        top = levels.peek();
        if (!top.indentation.equals(indentation)) {
            throw cursor.error(LexErrorCode.INCONSISTENT_INDENTATION, contentStart, Set.of());
        }
        top.append(line);
    }

    private void close() {
        Level closed = levels.pop();
        Level parent = levels.peek();
        LOG.trace("Closing block {}..{} with {} children", closed.start, closed.end, closed.children.size());
        parent.children.add(Spanned.of(new TokenTree.Group(Delimiter.BLOCK, closed.children), closed.start, closed.end));
        parent.end = Math.max(parent.end, closed.end);
    }

    private static final class Level {
        final String indentation;
        final int start;
        final List<Spanned<TokenTree>> children = new ArrayList<>();
        int end;

        Level(String indentation, int start) {
            this.indentation = indentation;
            this.start = start;
            this.end = start;
        }

        void append(List<Spanned<TokenTree>> line) {
            children.addAll(line);
            if (!line.isEmpty()) {
                end = Math.max(end, line.get(line.size() - 1).span().end());
            }
        }
    }
}
