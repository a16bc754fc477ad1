package org.anlang.compiler.frontend.lexer;

import java.util.Optional;

/**
 * The closed set of type suffixes an integer literal may carry, e.g. {@code 42u8}.
 */
public enum IntegerKind {
    I8("i8"),
    I16("i16"),
    I32("i32"),
    I64("i64"),
    /** Pointer-sized signed integer. */
    ISZ("isz"),
    U8("u8"),
    U16("u16"),
    U32("u32"),
    U64("u64"),
    /** Pointer-sized unsigned integer. */
    USZ("usz");

    private final String suffix;

    IntegerKind(String suffix) {
        this.suffix = suffix;
    }

    /**
     * @return The suffix as written in source.
     */
    public String suffix() {
        return suffix;
    }

    /**
     * Looks up the kind whose suffix is exactly the given word.
     * @param word A complete identifier.
     * @return The matching kind, or empty if the word is not a suffix.
     */
    public static Optional<IntegerKind> fromSuffix(String word) {
        for (IntegerKind kind : values()) {
            if (kind.suffix.equals(word)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
