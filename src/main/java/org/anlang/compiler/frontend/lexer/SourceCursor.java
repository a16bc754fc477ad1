package org.anlang.compiler.frontend.lexer;

import org.anlang.compiler.api.LexErrorCode;
import org.anlang.compiler.api.LexException;
import org.anlang.compiler.api.SourceInfo;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Set;

/**
 * A read-only cursor over a UTF-8 source buffer. Positions are byte offsets and only
 * ever move forward; lookahead is done through the {@code peek*} and {@code *From}
 * methods, which do not consume anything.
 */
public final class SourceCursor {

    /** Returned by the peek methods when the position is past the end of the buffer. */
    public static final int EOF = -1;

    private final byte[] source;
    private final String fileName;
    private int current = 0;

    /**
     * Creates a cursor at the start of the buffer.
     * @param source The UTF-8 source bytes. The array is not copied and must not be modified.
     * @param fileName The logical file name, for error reporting.
     */
    public SourceCursor(byte[] source, String fileName) {
        this.source = source;
        this.fileName = fileName;
    }

    /**
     * Checks that the whole buffer is well-formed UTF-8. Scanners only ever look at ASCII
     * bytes, so this is the one place where multi-byte sequences are validated.
     *
     * @throws LexException with {@link LexErrorCode#MALFORMED_INPUT} at the first byte of the
     *         first malformed or truncated sequence.
     */
    public void requireWellFormedUtf8() throws LexException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        ByteBuffer in = ByteBuffer.wrap(source);
        CharBuffer out = CharBuffer.allocate(1024);
        while (true) {
            CoderResult result = decoder.decode(in, out, true);
            if (result.isError()) {
                throw error(LexErrorCode.MALFORMED_INPUT, in.position(), Set.of());
            }
            if (result.isUnderflow()) {
                return;
            }
            out.clear();
        }
    }

    public int position() {
        return current;
    }

    public int length() {
        return source.length;
    }

    public String fileName() {
        return fileName;
    }

    public boolean isAtEnd() {
        return current >= source.length;
    }

    /**
     * @return The byte at the cursor as an unsigned value, or {@link #EOF}.
     */
    public int peek() {
        return peekAt(current);
    }

    /**
     * @return The byte after the cursor as an unsigned value, or {@link #EOF}.
     */
    public int peekNext() {
        return peekAt(current + 1);
    }

    /**
     * @param offset An absolute byte offset.
     * @return The byte at {@code offset} as an unsigned value, or {@link #EOF}.
     */
    public int peekAt(int offset) {
        if (offset >= source.length) return EOF;
        return source[offset] & 0xFF;
    }

    /**
     * Consumes one byte.
     * @return The consumed byte as an unsigned value.
     */
    public int advance() {
        return source[current++] & 0xFF;
    }

    /**
     * Moves the cursor forward to an offset found by lookahead.
     * @param offset The new position; must not be behind the current one.
     */
    public void advanceTo(int offset) {
        if (offset < current || offset > source.length) {
            throw new IllegalArgumentException("Cannot move cursor from " + current + " to " + offset);
        }
        current = offset;
    }

    /**
     * Consumes the next byte if it is the expected character.
     * @param expected The character to match.
     * @return true if the byte was consumed.
     */
    public boolean match(char expected) {
        if (peek() != expected) return false;
        current++;
        return true;
    }

    /**
     * Checks whether the ASCII text starts at the cursor, without consuming it.
     * @param text ASCII text.
     * @return true if the buffer continues with {@code text}.
     */
    public boolean lookingAt(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (peekAt(current + i) != text.charAt(i)) return false;
        }
        return true;
    }

    public boolean isAtNewline() {
        int c = peek();
        return c == '\n' || c == '\r';
    }

    /**
     * Consumes one line terminator: {@code \n}, {@code \r\n} or a lone {@code \r}.
     */
    public void consumeNewline() {
        if (match('\r')) {
            match('\n');
        } else if (!match('\n')) {
            throw new IllegalStateException("No line terminator at offset " + current);
        }
    }

    public void skipInlineWhitespace() {
        current = skipInlineWhitespaceFrom(current);
    }

    /**
     * @param offset Where to start.
     * @return The first offset at or after {@code offset} that is not inline whitespace.
     */
    public int skipInlineWhitespaceFrom(int offset) {
        while (isInlineWhitespace(peekAt(offset))) offset++;
        return offset;
    }

    /**
     * Skips any whitespace, including line terminators.
     */
    public void skipWhitespace() {
        while (isWhitespace(peek())) current++;
    }

    /**
     * @param offset The offset of an identifier start.
     * @return The offset one past the identifier starting at {@code offset}.
     */
    public int identifierEndFrom(int offset) {
        if (!isIdentifierStart(peekAt(offset))) return offset;
        offset++;
        while (isIdentifierPart(peekAt(offset))) offset++;
        return offset;
    }

    /**
     * Decodes a range of the buffer.
     * @param start The first byte offset.
     * @param end The offset one past the last byte.
     * @return The decoded text.
     */
    public String text(int start, int end) {
        return new String(source, start, end - start, StandardCharsets.UTF_8);
    }

    /**
     * Computes the human-readable location of a byte offset.
     * @param offset The byte offset; may equal the buffer length.
     * @return The location, with 1-based line and column.
     */
    public SourceInfo sourceInfoAt(int offset) {
        int line = 1;
        int lineStart = 0;
        for (int i = 0; i < offset && i < source.length; i++) {
            if (source[i] == '\n' || (source[i] == '\r' && peekAt(i + 1) != '\n')) {
                line++;
                lineStart = i + 1;
            }
        }
        int lineEnd = lineStart;
        while (lineEnd < source.length && source[lineEnd] != '\n' && source[lineEnd] != '\r') lineEnd++;
        return new SourceInfo(fileName, line, offset - lineStart + 1, text(lineStart, lineEnd));
    }

    /**
     * Creates the exception for a failure at the given offset.
     * @param code The error code.
     * @param offset The byte offset of the failure.
     * @param expected The alternatives that would have been accepted.
     * @return The exception, ready to be thrown.
     */
    public LexException error(LexErrorCode code, int offset, Set<String> expected) {
        return error(code, offset, expected, null);
    }

    /**
     * Creates the exception for a failure concerning a delimited group.
     * @param code The error code.
     * @param offset The byte offset of the failure.
     * @param expected The alternatives that would have been accepted.
     * @param delimiter The group's delimiter.
     * @return The exception, ready to be thrown.
     */
    public LexException error(LexErrorCode code, int offset, Set<String> expected, Delimiter delimiter) {
        return new LexException(code, offset, expected, delimiter, sourceInfoAt(offset));
    }

    public static boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }

    public static boolean isIdentifierStart(int c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    public static boolean isIdentifierPart(int c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    public static boolean isInlineWhitespace(int c) {
        return c == ' ' || c == '\t';
    }

    public static boolean isWhitespace(int c) {
        return isInlineWhitespace(c) || c == '\n' || c == '\r' || c == '\f' || c == 0x0B;
    }
}
