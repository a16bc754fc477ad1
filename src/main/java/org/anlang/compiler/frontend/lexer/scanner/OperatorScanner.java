package org.anlang.compiler.frontend.lexer.scanner;

import org.anlang.compiler.api.Spanned;
import org.anlang.compiler.frontend.lexer.LexerContext;
import org.anlang.compiler.frontend.lexer.Operator;
import org.anlang.compiler.frontend.lexer.SourceCursor;
import org.anlang.compiler.frontend.lexer.Token;
import org.anlang.compiler.frontend.lexer.TokenTree;

import java.util.List;

/**
 * Scans the single-character operators {@code + = .}.
 */
public class OperatorScanner implements ITokenTreeScanner {

    @Override
    public boolean canStart(int c) {
        return Operator.fromSymbol(c) != null;
    }

    @Override
    public List<String> labels() {
        return List.of("operator");
    }

    @Override
    public Spanned<TokenTree> scan(LexerContext context) {
        SourceCursor cursor = context.cursor();
        int start = cursor.position();
        Operator operator = Operator.fromSymbol(cursor.advance());
        return Spanned.of(TokenTree.Leaf.untagged(new Token.OperatorToken(operator)), start, cursor.position());
    }
}
