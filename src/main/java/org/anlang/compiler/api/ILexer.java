package org.anlang.compiler.api;

import org.anlang.compiler.frontend.lexer.TokenTree;

/**
 * The public interface for the lexical front end. It turns one compilation unit
 * into a single top-level block of spanned token trees.
 */
public interface ILexer {

    /**
     * Lexes a UTF-8 encoded source buffer.
     *
     * @param utf8Source The raw source bytes. The buffer is only read.
     * @param fileName The name of the compilation unit, used for diagnostics.
     * @return The top-level {@code Block} tree spanning the whole buffer.
     * @throws LexException if the source is not lexically well formed.
     */
    Spanned<TokenTree> lex(byte[] utf8Source, String fileName) throws LexException;

    /**
     * Lexes source text after encoding it as UTF-8.
     *
     * @param source The source text.
     * @param fileName The name of the compilation unit, used for diagnostics.
     * @return The top-level {@code Block} tree spanning the whole source.
     * @throws LexException if the source is not lexically well formed.
     */
    Spanned<TokenTree> lex(String source, String fileName) throws LexException;

    /**
     * Lexes source text held in memory.
     *
     * @param source The source text.
     * @return The top-level {@code Block} tree spanning the whole source.
     * @throws LexException if the source is not lexically well formed.
     */
    default Spanned<TokenTree> lex(String source) throws LexException {
        return lex(source, "<memory>");
    }
}
