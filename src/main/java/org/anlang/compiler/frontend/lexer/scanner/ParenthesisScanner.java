package org.anlang.compiler.frontend.lexer.scanner;

import org.anlang.compiler.api.LexException;
import org.anlang.compiler.api.Spanned;
import org.anlang.compiler.frontend.lexer.Delimiter;
import org.anlang.compiler.frontend.lexer.LexerContext;
import org.anlang.compiler.frontend.lexer.SourceCursor;
import org.anlang.compiler.frontend.lexer.TokenTree;

import java.util.List;

/**
 * Scans a {@code (...)} group. Inside the parentheses, line breaks are plain whitespace.
 */
public class ParenthesisScanner implements ITokenTreeScanner {

    @Override
    public boolean canStart(int c) {
        return c == '(';
    }

    @Override
    public List<String> labels() {
        return List.of("'('");
    }

    @Override
    public Spanned<TokenTree> scan(LexerContext context) throws LexException {
        SourceCursor cursor = context.cursor();
        int start = cursor.position();
        cursor.advance();
        List<Spanned<TokenTree>> children = context.scanGroupBody(')', Delimiter.PARENTHESIS, start);
        return Spanned.of(new TokenTree.Group(Delimiter.PARENTHESIS, children), start, cursor.position());
    }
}
