package org.anlang.compiler.api;

/**
 * Pairs a value with the source range it was produced from.
 *
 * @param value The value.
 * @param span The byte range of the value in the source buffer.
 * @param <T> The type of the value.
 */
public record Spanned<T>(T value, Span span) {

    /**
     * Convenience factory.
     * @param value The value.
     * @param start The first byte offset.
     * @param end The offset one past the last byte.
     * @param <T> The type of the value.
     * @return The spanned value.
     */
    public static <T> Spanned<T> of(T value, int start, int end) {
        return new Spanned<>(value, new Span(start, end));
    }
}
