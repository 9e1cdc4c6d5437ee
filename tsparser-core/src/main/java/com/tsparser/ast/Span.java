package com.tsparser.ast;

/**
 * Half-open range of source offsets.
 *
 * @param start first offset covered (inclusive)
 * @param end   offset after the last one covered (exclusive)
 */
public record Span(int start, int end) {

    public Span {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span " + start + ".." + end);
        }
    }

    public static Span at(int offset) {
        return new Span(offset, offset);
    }

    /** The smallest span covering both this span and {@code other}. */
    public Span union(Span other) {
        return new Span(Math.min(start, other.start), Math.max(end, other.end));
    }

    public int length() {
        return end - start;
    }

    public boolean contains(int offset) {
        return offset >= start && offset < end;
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
