package com.tsparser.ast;

import com.tsparser.SourceWriter;
import com.tsparser.ToStringOptions;

public record ExpressionStatement(Expression expression, Span span) implements Statement {

    @Override
    public String type() {
        return "ExpressionStatement";
    }

    @Override
    public Span getPosition() {
        return span;
    }

    @Override
    public void toStringFromBuffer(SourceWriter buf, ToStringOptions options, int depth) {
        expression.toStringFromBuffer(buf, options, depth);
    }
}
