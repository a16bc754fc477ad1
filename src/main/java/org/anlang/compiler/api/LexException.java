package org.anlang.compiler.api;

import org.anlang.compiler.frontend.lexer.Delimiter;
import org.anlang.compiler.internal.i18n.Messages;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The single fatal failure of a lexing run. It carries the furthest position reached
 * and the alternatives that would have been accepted there.
 */
public class LexException extends CompilationException {

    private final LexErrorCode code;
    private final int position;
    private final Set<String> expected;
    private final Delimiter delimiter;

    /**
     * Constructs a new lex exception.
     * @param code The error code.
     * @param position The byte offset the error refers to.
     * @param expected The alternatives accepted at the position, in the order they were tried.
     * @param delimiter The delimiter of the unterminated group, or {@code null}.
     * @param sourceInfo The source location of {@code position}.
     */
    public LexException(LexErrorCode code, int position, Set<String> expected, Delimiter delimiter, SourceInfo sourceInfo) {
        super(describe(code, expected, delimiter), sourceInfo);
        this.code = code;
        this.position = position;
        this.expected = Collections.unmodifiableSet(new LinkedHashSet<>(expected));
        this.delimiter = delimiter;
    }

    private static String describe(LexErrorCode code, Set<String> expected, Delimiter delimiter) {
        return Messages.get(code,
                String.join(", ", expected),
                delimiter == null ? "" : delimiter.displayName());
    }

    public LexErrorCode getCode() {
        return code;
    }

    public int getPosition() {
        return position;
    }

    public Set<String> getExpected() {
        return expected;
    }

    /**
     * @return The delimiter of the group an {@link LexErrorCode#UNTERMINATED_GROUP} refers to, otherwise {@code null}.
     */
    public Delimiter getDelimiter() {
        return delimiter;
    }
}
