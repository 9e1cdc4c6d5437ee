package com.tsparser.ast;

import com.tsparser.SourceWriter;
import com.tsparser.ToStringOptions;

public record BooleanLiteral(boolean value, Span span) implements Expression {

    @Override
    public String type() {
        return "BooleanLiteral";
    }

    @Override
    public Span getPosition() {
        return span;
    }

    @Override
    public void toStringFromBuffer(SourceWriter buf, ToStringOptions options, int depth) {
        buf.pushString(value ? "true" : "false");
    }
}
