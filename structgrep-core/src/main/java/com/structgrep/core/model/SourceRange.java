package com.structgrep.core.model;

/**
 * A resolved source location.
 *
 * <p>Lines and columns are 1-based; the end position is exclusive, so a zero-width range has
 * equal start and end. Offsets are 0-based character offsets, byte offsets count UTF-8 bytes.
 *
 * @param startLine 1-based start line
 * @param startColumn 1-based start column
 * @param endLine 1-based end line
 * @param endColumn 1-based column just past the last character
 * @param startOffset character offset of the first character
 * @param endOffset character offset just past the last character
 * @param startByte UTF-8 byte offset of the first character
 * @param endByte UTF-8 byte offset just past the last character
 */
public record SourceRange(
    int startLine,
    int startColumn,
    int endLine,
    int endColumn,
    int startOffset,
    int endOffset,
    int startByte,
    int endByte
) implements Comparable<SourceRange> {

    public SourceRange {
        if (startLine < 1 || endLine < startLine) {
            throw new IllegalArgumentException("Invalid line range: " + startLine + "-" + endLine);
        }
        if (startOffset < 0 || endOffset < startOffset) {
            throw new IllegalArgumentException("Invalid offset range: " + startOffset + "-" + endOffset);
        }
    }

    public boolean isEmpty() {
        return startOffset == endOffset;
    }

    @Override
    public int compareTo(SourceRange other) {
        int byStart = Integer.compare(startOffset, other.startOffset);
        return byStart != 0 ? byStart : Integer.compare(endOffset, other.endOffset);
    }

    @Override
    public String toString() {
        return startLine + ":" + startColumn + "-" + endLine + ":" + endColumn;
    }
}
