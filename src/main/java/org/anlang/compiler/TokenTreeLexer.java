package org.anlang.compiler;

import org.anlang.compiler.api.ILexer;
import org.anlang.compiler.api.LexException;
import org.anlang.compiler.api.Spanned;
import org.anlang.compiler.config.ConfigLoader;
import org.anlang.compiler.config.LexerOptions;
import org.anlang.compiler.diagnostics.Diagnostic;
import org.anlang.compiler.diagnostics.DiagnosticsEngine;
import org.anlang.compiler.frontend.TokenTreeWalker;
import org.anlang.compiler.frontend.lexer.Delimiter;
import org.anlang.compiler.frontend.lexer.IndentationGrouper;
import org.anlang.compiler.frontend.lexer.SourceCursor;
import org.anlang.compiler.frontend.lexer.Token;
import org.anlang.compiler.frontend.lexer.TokenTree;
import org.anlang.compiler.frontend.lexer.TokenTreeReader;
import org.anlang.compiler.frontend.lexer.scanner.ScannerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * The lexer implementation. It runs the indentation grouper over one compilation unit
 * and collects the diagnostics of the run. It is not thread-safe; the diagnostics of
 * the most recent run are available through {@link #getDiagnostics()}.
 */
public class TokenTreeLexer implements ILexer {

    private static final Logger LOG = LoggerFactory.getLogger(TokenTreeLexer.class);

    private final LexerOptions options;
    private final ScannerRegistry registry;
    private DiagnosticsEngine diagnostics = new DiagnosticsEngine();

    /**
     * Creates a lexer configured from {@link ConfigLoader#load()}.
     */
    public TokenTreeLexer() {
        this(LexerOptions.fromConfig(ConfigLoader.load()));
    }

    /**
     * Creates a lexer with explicit options.
     * @param options The lexer options.
     */
    public TokenTreeLexer(LexerOptions options) {
        this.options = options;
        this.registry = ScannerRegistry.initialize();
    }

    @Override
    public Spanned<TokenTree> lex(byte[] utf8Source, String fileName) throws LexException {
        long startTime = System.nanoTime();
        diagnostics = new DiagnosticsEngine();

        SourceCursor cursor = new SourceCursor(utf8Source, fileName);
        TokenTreeReader reader = new TokenTreeReader(cursor, registry, options.maxNestingDepth());
        IndentationGrouper grouper = new IndentationGrouper(cursor, reader, diagnostics, options);

        Spanned<TokenTree> root;
        try {
            cursor.requireWellFormedUtf8();
            root = grouper.group();
        } catch (LexException e) {
            diagnostics.reportError(e.getMessage(), e.getSourceInfo());
            LOG.debug("Lexing {} failed with {} at offset {}", fileName, e.getCode(), e.getPosition());
            throw e;
        }

        for (Diagnostic warning : diagnostics.getDiagnostics(Diagnostic.Type.WARNING)) {
            LOG.warn("{}", warning);
        }
        if (LOG.isDebugEnabled()) {
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startTime);
            LOG.debug("Lexed {} ({} bytes) in {} ms: {}", fileName, utf8Source.length, elapsedMs, summarize(root));
        }
        return root;
    }

    @Override
    public Spanned<TokenTree> lex(String source, String fileName) throws LexException {
        return lex(source.getBytes(StandardCharsets.UTF_8), fileName);
    }

    /**
     * @return The diagnostics collected during the most recent run.
     */
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    /**
     * Counts the nodes of a tree by kind, e.g. {@code "12 tokens, 2 comments, {BLOCK=3, PARENTHESIS=1}"}.
     * @param root The tree.
     * @return A one-line summary.
     */
    static String summarize(Spanned<TokenTree> root) {
        int[] tokens = new int[1];
        int[] comments = new int[1];
        Map<Delimiter, Integer> groups = new EnumMap<>(Delimiter.class);

        Map<Class<? extends Token>, Consumer<Spanned<TokenTree>>> tokenHandlers = new HashMap<>();
        Consumer<Spanned<TokenTree>> countToken = n -> tokens[0]++;
        tokenHandlers.put(Token.Identifier.class, countToken);
        tokenHandlers.put(Token.IntegerLiteral.class, countToken);
        tokenHandlers.put(Token.StringLiteral.class, countToken);
        tokenHandlers.put(Token.OperatorToken.class, countToken);
        tokenHandlers.put(Token.Comment.class, n -> comments[0]++);

        Map<Delimiter, Consumer<Spanned<TokenTree>>> groupHandlers = new EnumMap<>(Delimiter.class);
        for (Delimiter delimiter : Delimiter.values()) {
            groupHandlers.put(delimiter, n -> groups.merge(delimiter, 1, Integer::sum));
        }

        new TokenTreeWalker(tokenHandlers, groupHandlers).walk(root);
        return tokens[0] + " tokens, " + comments[0] + " comments, " + groups;
    }
}
