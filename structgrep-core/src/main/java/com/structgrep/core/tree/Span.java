package com.structgrep.core.tree;

/**
 * Half-open character range {@code [start, end)} into the source text a node was lowered from.
 *
 * @param start offset of the first character
 * @param end offset one past the last character
 */
public record Span(int start, int end) implements Comparable<Span> {

    public Span {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    /**
     * Creates a zero-width span at the given offset.
     *
     * @param offset position of the span
     * @return empty span
     */
    public static Span empty(int offset) {
        return new Span(offset, offset);
    }

    /**
     * Smallest span covering both arguments.
     */
    public static Span covering(Span first, Span last) {
        return new Span(Math.min(first.start, last.start), Math.max(first.end, last.end));
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    /**
     * Returns true if {@code other} lies entirely within this span (bounds inclusive).
     */
    public boolean contains(Span other) {
        return start <= other.start && other.end <= end;
    }

    /**
     * Returns true if the two spans share at least one character, or if one is a zero-width
     * span positioned inside the other.
     */
    public boolean overlaps(Span other) {
        if (isEmpty() || other.isEmpty()) {
            return contains(other) || other.contains(this);
        }
        return start < other.end && other.start < end;
    }

    @Override
    public int compareTo(Span other) {
        int byStart = Integer.compare(start, other.start);
        return byStart != 0 ? byStart : Integer.compare(end, other.end);
    }

    @Override
    public String toString() {
        return "[" + start + "," + end + ")";
    }
}
