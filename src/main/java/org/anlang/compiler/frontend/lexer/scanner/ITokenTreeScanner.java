package org.anlang.compiler.frontend.lexer.scanner;

import org.anlang.compiler.api.LexException;
import org.anlang.compiler.api.Spanned;
import org.anlang.compiler.frontend.lexer.LexerContext;
import org.anlang.compiler.frontend.lexer.TokenTree;

import java.util.List;

/**
 * The base interface for all token-tree scanners.
 * Each scanner is responsible for one alternative of the grammar (e.g. strings).
 */
public interface ITokenTreeScanner {

    /**
     * Decides whether this scanner handles a token tree starting with the given byte.
     * The start bytes of all registered scanners must be disjoint.
     *
     * @param c An unsigned byte value, or {@link org.anlang.compiler.frontend.lexer.SourceCursor#EOF}.
     * @return true if a token tree of this kind starts with {@code c}.
     */
    boolean canStart(int c);

    /**
     * @return The names of the alternatives this scanner accepts, as reported in error messages.
     */
    List<String> labels();

    /**
     * Scans one token tree. The cursor is positioned on a byte for which {@link #canStart(int)} holds.
     *
     * @param context The context providing the cursor and re-entry into the grammar.
     * @return The spanned token tree.
     * @throws LexException if the token tree is malformed.
     */
    Spanned<TokenTree> scan(LexerContext context) throws LexException;
}
