package org.anlang.compiler.frontend.lexer.scanner;

import org.anlang.compiler.api.LexErrorCode;
import org.anlang.compiler.api.LexException;
import org.anlang.compiler.api.Spanned;
import org.anlang.compiler.frontend.lexer.Adjacency;
import org.anlang.compiler.frontend.lexer.IntegerKind;
import org.anlang.compiler.frontend.lexer.LexerContext;
import org.anlang.compiler.frontend.lexer.SourceCursor;
import org.anlang.compiler.frontend.lexer.Token;
import org.anlang.compiler.frontend.lexer.TokenTree;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Scans identifiers and integer literals and tags each with its {@link Adjacency}.
 * <p>
 * A bare token is {@link Adjacency#SEQUENTIAL} if, after optional spaces and tabs,
 * another identifier or integer follows on the same line, and {@link Adjacency#TERMINAL}
 * otherwise. The check is a single-byte lookahead; nothing is scanned twice.
 */
public class BareTokenScanner implements ITokenTreeScanner {

    @Override
    public boolean canStart(int c) {
        return SourceCursor.isDigit(c) || SourceCursor.isIdentifierStart(c);
    }

    @Override
    public List<String> labels() {
        return List.of("identifier", "integer");
    }

    @Override
    public Spanned<TokenTree> scan(LexerContext context) throws LexException {
        SourceCursor cursor = context.cursor();
        int start = cursor.position();
        Token token = SourceCursor.isDigit(cursor.peek()) ? integer(cursor) : identifier(cursor);
        int end = cursor.position();

        int next = cursor.peekAt(cursor.skipInlineWhitespaceFrom(end));
        Adjacency adjacency = canStart(next) ? Adjacency.SEQUENTIAL : Adjacency.TERMINAL;
        return Spanned.of(new TokenTree.Leaf(token, adjacency), start, end);
    }

    private Token identifier(SourceCursor cursor) {
        int start = cursor.position();
        int end = cursor.identifierEndFrom(start);
        cursor.advanceTo(end);
        return new Token.Identifier(cursor.text(start, end));
    }

    private Token integer(SourceCursor cursor) throws LexException {
        int start = cursor.position();
        while (SourceCursor.isDigit(cursor.peek())) cursor.advance();
        String digits = cursor.text(start, cursor.position());

        long value;
        try {
            value = Long.parseUnsignedLong(digits);
        } catch (NumberFormatException e) {
            throw cursor.error(LexErrorCode.NUMERIC_OVERFLOW, start, Set.of());
        }

        // The suffix must be the whole following identifier: "1i8x" is 1 followed by "i8x".
        int suffixStart = cursor.position();
        int suffixEnd = cursor.identifierEndFrom(suffixStart);
        Optional<IntegerKind> suffix = IntegerKind.fromSuffix(cursor.text(suffixStart, suffixEnd));
        suffix.ifPresent(kind -> cursor.advanceTo(suffixEnd));
        return new Token.IntegerLiteral(value, suffix.orElse(null));
    }
}
