package org.anlang.compiler.frontend.lexer.scanner;

import org.anlang.compiler.api.LexErrorCode;
import org.anlang.compiler.api.LexException;
import org.anlang.compiler.api.Spanned;
import org.anlang.compiler.frontend.lexer.LexerContext;
import org.anlang.compiler.frontend.lexer.SourceCursor;
import org.anlang.compiler.frontend.lexer.Token;
import org.anlang.compiler.frontend.lexer.TokenTree;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Scans {@code // line} and {@code /* block *}{@code /} comments. Block comments do not nest.
 * The comment text is dropped, only its span is kept.
 */
public class CommentScanner implements ITokenTreeScanner {

    @Override
    public boolean canStart(int c) {
        return c == '/';
    }

    @Override
    public List<String> labels() {
        return List.of("comment");
    }

    @Override
    public Spanned<TokenTree> scan(LexerContext context) throws LexException {
        SourceCursor cursor = context.cursor();
        int start = cursor.position();
        cursor.advance();

        if (cursor.match('/')) {
            // The line terminator belongs to the indentation grouper.
            while (!cursor.isAtEnd() && !cursor.isAtNewline()) cursor.advance();
        } else if (cursor.match('*')) {
            while (!cursor.lookingAt("*/")) {
                if (cursor.isAtEnd()) {
                    throw cursor.error(LexErrorCode.UNTERMINATED_COMMENT, start, Set.of("'*/'"));
                }
                cursor.advance();
            }
            cursor.advanceTo(cursor.position() + 2);
        } else {
            Set<String> expected = new LinkedHashSet<>(List.of("'/'", "'*'"));
            throw cursor.error(LexErrorCode.UNEXPECTED_CHARACTER, cursor.position(), expected);
        }
        return Spanned.of(TokenTree.Leaf.untagged(new Token.Comment()), start, cursor.position());
    }
}
