package org.anlang.compiler.frontend.lexer.scanner;

import org.anlang.compiler.api.LexErrorCode;
import org.anlang.compiler.api.LexException;
import org.anlang.compiler.api.Spanned;
import org.anlang.compiler.frontend.lexer.Delimiter;
import org.anlang.compiler.frontend.lexer.LexerContext;
import org.anlang.compiler.frontend.lexer.SourceCursor;
import org.anlang.compiler.frontend.lexer.Token;
import org.anlang.compiler.frontend.lexer.TokenTree;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Scans a string literal into an {@link Delimiter#INTERPOLATION} group.
 * <p>
 * The body alternates between literal runs and {@code ${...}} splices. A literal run
 * (escapes included) becomes one {@link Token.StringLiteral} with its escapes decoded,
 * so two literal fragments are never adjacent. A {@code $} that is not followed by
 * an opening brace is ordinary text. Each splice becomes a {@link Delimiter#CURLY} group whose
 * children are scanned by the full grammar.
 */
public class StringScanner implements ITokenTreeScanner {

    private static final Set<String> ESCAPES = new LinkedHashSet<>(
            List.of("\\\\", "\\$", "\\\"", "\\n", "\\r", "\\t", "\\0"));

    @Override
    public boolean canStart(int c) {
        return c == '"';
    }

    @Override
    public List<String> labels() {
        return List.of("string");
    }

    @Override
    public Spanned<TokenTree> scan(LexerContext context) throws LexException {
        SourceCursor cursor = context.cursor();
        int start = cursor.position();
        cursor.advance();

        List<Spanned<TokenTree>> fragments = new ArrayList<>();
        ByteArrayOutputStream literal = new ByteArrayOutputStream();
        int literalStart = -1;

        while (true) {
            if (cursor.isAtEnd()) {
                throw cursor.error(LexErrorCode.UNTERMINATED_STRING, start, Set.of("'\"'"));
            }
            int c = cursor.peek();
            if (c == '"' || (c == '$' && cursor.peekNext() == '{')) {
                if (literalStart >= 0) {
                    fragments.add(literalFragment(literal, literalStart, cursor.position()));
                    literal.reset();
                    literalStart = -1;
                }
                if (c == '"') {
                    cursor.advance();
                    break;
                }
                fragments.add(splice(context));
                continue;
            }

            if (literalStart < 0) literalStart = cursor.position();
            if (c == '\\') {
                cursor.advance();
                literal.write(escape(cursor, start));
            } else {
                literal.write(cursor.advance());
            }
        }
        return Spanned.of(new TokenTree.Group(Delimiter.INTERPOLATION, fragments), start, cursor.position());
    }

    private Spanned<TokenTree> literalFragment(ByteArrayOutputStream literal, int start, int end) {
        Token token = new Token.StringLiteral(literal.toString(StandardCharsets.UTF_8));
        return Spanned.of(TokenTree.Leaf.untagged(token), start, end);
    }

    private Spanned<TokenTree> splice(LexerContext context) throws LexException {
        SourceCursor cursor = context.cursor();
        int start = cursor.position();
        cursor.advanceTo(start + 2);
        List<Spanned<TokenTree>> children = context.scanGroupBody('}', Delimiter.CURLY, start);
        return Spanned.of(new TokenTree.Group(Delimiter.CURLY, children), start, cursor.position());
    }

    /**
     * Decodes the character after a backslash.
     * @param cursor The cursor, positioned after the backslash.
     * @param stringStart The offset of the opening quote, for the end-of-input error.
     * @return The decoded byte.
     */
    private int escape(SourceCursor cursor, int stringStart) throws LexException {
        if (cursor.isAtEnd()) {
            throw cursor.error(LexErrorCode.UNTERMINATED_STRING, stringStart, Set.of("'\"'"));
        }
        int position = cursor.position();
        int decoded = switch (cursor.peek()) {
            case '\\' -> '\\';
            case '$' -> '$';
            case '"' -> '"';
            case 'n' -> '\n';
            case 'r' -> '\r';
            case 't' -> '\t';
            case '0' -> 0;
            default -> -1;
        };
        if (decoded < 0) {
            throw cursor.error(LexErrorCode.INVALID_ESCAPE, position, ESCAPES);
        }
        cursor.advance();
        return decoded;
    }
}
