package org.anlang.compiler.frontend.lexer;

import org.anlang.compiler.api.LexException;
import org.anlang.compiler.api.Spanned;

import java.util.List;

/**
 * The state shared by the scanners of one lexing run. Scanners that contain nested
 * token trees re-enter the grammar through this interface instead of calling each
 * other directly.
 */
public interface LexerContext {

    /**
     * @return The cursor over the source buffer.
     */
    SourceCursor cursor();

    /**
     * Scans exactly one token tree at the cursor, dispatching on its first byte.
     * @return The spanned token tree.
     * @throws LexException if no token tree starts at the cursor, or the one that does is malformed.
     */
    Spanned<TokenTree> scanTokenTree() throws LexException;

    /**
     * Scans the whitespace-padded children of a group up to and including its closing character.
     * The opening delimiter must already be consumed.
     *
     * @param closer The character that closes the group.
     * @param delimiter The kind of group, for error reporting.
     * @param openStart The offset of the opening delimiter.
     * @return The children, in source order.
     * @throws LexException if the group is not closed or a child is malformed.
     */
    List<Spanned<TokenTree>> scanGroupBody(char closer, Delimiter delimiter, int openStart) throws LexException;
}
