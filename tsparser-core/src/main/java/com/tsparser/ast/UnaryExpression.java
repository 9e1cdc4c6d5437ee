package com.tsparser.ast;

import com.tsparser.SourceWriter;
import com.tsparser.ToStringOptions;

public record UnaryExpression(UnaryOperator operator, Expression argument, Span span) implements Expression {

    @Override
    public String type() {
        return "UnaryExpression";
    }

    @Override
    public Span getPosition() {
        return span;
    }

    @Override
    public void toStringFromBuffer(SourceWriter buf, ToStringOptions options, int depth) {
        buf.pushString(operator.symbol());
        if (operator.isWord()) {
            buf.push(' ');
        }
        argument.toStringFromBuffer(buf, options, depth);
    }
}
