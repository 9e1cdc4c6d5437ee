package com.tsparser.ast;

import com.tsparser.SourceWriter;
import com.tsparser.ToStringOptions;

public record ParenthesizedExpression(Expression expression, Span span) implements Expression {

    @Override
    public String type() {
        return "ParenthesizedExpression";
    }

    @Override
    public Span getPosition() {
        return span;
    }

    @Override
    public void toStringFromBuffer(SourceWriter buf, ToStringOptions options, int depth) {
        buf.push('(');
        expression.toStringFromBuffer(buf, options, depth);
        buf.push(')');
    }
}
