package com.tsparser.ast;

import com.tsparser.SourceWriter;
import com.tsparser.ToStringOptions;

public record ConditionalExpression(
    Expression test,
    Expression consequent,
    Expression alternate,
    Span span
) implements Expression {

    @Override
    public String type() {
        return "ConditionalExpression";
    }

    @Override
    public Span getPosition() {
        return span;
    }

    @Override
    public void toStringFromBuffer(SourceWriter buf, ToStringOptions options, int depth) {
        test.toStringFromBuffer(buf, options, depth);
        buf.pushString(options.spaced("?"));
        consequent.toStringFromBuffer(buf, options, depth);
        buf.pushString(options.spaced(":"));
        alternate.toStringFromBuffer(buf, options, depth);
    }
}
