package com.tsparser.ast;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SpanTest {

    @Test
    void testUnionCoversBoth() {
        Span union = new Span(4, 9).union(new Span(0, 3));
        assertEquals(new Span(0, 9), union);
        assertEquals(union, new Span(0, 3).union(new Span(4, 9)));
    }

    @Test
    void testUnionWithContainedSpan() {
        assertEquals(new Span(2, 10), new Span(2, 10).union(new Span(4, 5)));
    }

    @Test
    void testZeroWidthSpan() {
        Span span = Span.at(7);
        assertEquals(0, span.length());
        assertFalse(span.contains(7));
        assertEquals("7..7", span.toString());
    }

    @Test
    void testInvalidSpanRejected() {
        assertThrows(IllegalArgumentException.class, () -> new Span(5, 4));
        assertThrows(IllegalArgumentException.class, () -> new Span(-1, 2));
    }
}
