package com.tsparser.ast;

import com.tsparser.SourceWriter;
import com.tsparser.ToStringOptions;

public record BinaryExpression(
    BinaryOperator operator,
    Expression left,
    Expression right,
    Span span
) implements Expression {

    @Override
    public String type() {
        return "BinaryExpression";
    }

    @Override
    public Span getPosition() {
        return span;
    }

    @Override
    public void toStringFromBuffer(SourceWriter buf, ToStringOptions options, int depth) {
        left.toStringFromBuffer(buf, options, depth);
        if (operator.isWord()) {
            buf.pushString(" " + operator.symbol() + " ");
        } else {
            buf.pushString(options.spaced(operator.symbol()));
        }
        right.toStringFromBuffer(buf, options, depth);
    }
}
