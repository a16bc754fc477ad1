package org.anlang.compiler.api;

import java.util.Arrays;

/**
 * A half-open byte range {@code [start, end)} into the UTF-8 source buffer.
 *
 * @param start The offset of the first byte covered by the span.
 * @param end The offset one past the last byte covered by the span.
 */
public record Span(int start, int end) {

    public Span {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    /**
     * Creates an empty span at the given offset.
     * @param offset The offset.
     * @return A span of length zero.
     */
    public static Span at(int offset) {
        return new Span(offset, offset);
    }

    /**
     * @return The number of bytes covered.
     */
    public int length() {
        return end - start;
    }

    /**
     * Checks whether another span lies completely within this one.
     * @param other The span to test.
     * @return true if {@code other} is enclosed by this span.
     */
    public boolean contains(Span other) {
        return other.start >= start && other.end <= end;
    }

    /**
     * Copies the covered bytes out of a buffer.
     * @param buffer The buffer this span refers to.
     * @return A new array with the covered bytes.
     */
    public byte[] slice(byte[] buffer) {
        return Arrays.copyOfRange(buffer, start, end);
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
