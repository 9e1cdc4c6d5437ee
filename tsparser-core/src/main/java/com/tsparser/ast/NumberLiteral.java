package com.tsparser.ast;

import com.tsparser.SourceWriter;
import com.tsparser.ToStringOptions;

/**
 * @param raw source text, printed back verbatim
 */
public record NumberLiteral(String raw, double value, Span span) implements Expression {

    /** A literal created by a rewriting pass rather than read from source. */
    public static NumberLiteral of(double value) {
        String raw = value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e21
            ? Long.toString((long) value)
            : Double.toString(value);
        return new NumberLiteral(raw, value, Span.at(0));
    }

    @Override
    public String type() {
        return "NumberLiteral";
    }

    @Override
    public Span getPosition() {
        return span;
    }

    @Override
    public void toStringFromBuffer(SourceWriter buf, ToStringOptions options, int depth) {
        buf.pushString(raw);
    }
}
