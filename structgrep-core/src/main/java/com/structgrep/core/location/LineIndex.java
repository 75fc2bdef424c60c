package com.structgrep.core.location;

import java.util.Arrays;
import java.util.Objects;

/**
 * Line table for one source text.
 *
 * <p>Converts between character offsets and 1-based (line, column) positions, and from character
 * offsets to UTF-8 byte offsets. {@code \n}, {@code \r\n} and a lone {@code \r} each end a line,
 * the same convention JavaParser uses. Columns count UTF-16 code units; a tab is one column.
 */
public final class LineIndex {

    private final String source;
    private final int[] lineStarts;
    private final int[] lineByteStarts;

    public LineIndex(String source) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        int[] starts = new int[16];
        int count = 0;
        starts[count++] = 0;
        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);
            boolean lineEnd = c == '\n' || (c == '\r' && (i + 1 >= source.length() || source.charAt(i + 1) != '\n'));
            if (lineEnd) {
                if (count == starts.length) {
                    starts = Arrays.copyOf(starts, count * 2);
                }
                starts[count++] = i + 1;
            }
        }
        this.lineStarts = Arrays.copyOf(starts, count);
        this.lineByteStarts = new int[count];
        for (int line = 1; line < count; line++) {
            lineByteStarts[line] = lineByteStarts[line - 1] + utf8Length(lineStarts[line - 1], lineStarts[line]);
        }
    }

    public String source() {
        return source;
    }

    public int lineCount() {
        return lineStarts.length;
    }

    /**
     * Character offset of a 1-based position, clamped to the source bounds.
     *
     * @param line 1-based line
     * @param column 1-based column
     * @return character offset
     */
    public int offset(int line, int column) {
        if (line < 1) {
            return 0;
        }
        if (line > lineStarts.length) {
            return source.length();
        }
        return Math.min(lineStarts[line - 1] + Math.max(column, 1) - 1, source.length());
    }

    /**
     * 1-based line containing the character offset.
     */
    public int line(int offset) {
        int clamped = clamp(offset);
        int found = Arrays.binarySearch(lineStarts, clamped);
        return found >= 0 ? found + 1 : -found - 1;
    }

    /**
     * 1-based column of the character offset within its line.
     */
    public int column(int offset) {
        int clamped = clamp(offset);
        return clamped - lineStarts[line(clamped) - 1] + 1;
    }

    /**
     * UTF-8 byte offset corresponding to a character offset.
     */
    public int byteOffset(int offset) {
        int clamped = clamp(offset);
        int line = line(clamped);
        return lineByteStarts[line - 1] + utf8Length(lineStarts[line - 1], clamped);
    }

    private int clamp(int offset) {
        return Math.max(0, Math.min(offset, source.length()));
    }

    private int utf8Length(int from, int to) {
        int bytes = 0;
        for (int i = from; i < to; i++) {
            char c = source.charAt(i);
            if (c < 0x80) {
                bytes += 1;
            } else if (c < 0x800) {
                bytes += 2;
            } else if (Character.isHighSurrogate(c) && i + 1 < to && Character.isLowSurrogate(source.charAt(i + 1))) {
                bytes += 4;
                i++;
            } else {
                bytes += 3;
            }
        }
        return bytes;
    }
}
