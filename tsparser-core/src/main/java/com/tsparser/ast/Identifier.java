package com.tsparser.ast;

import com.tsparser.SourceWriter;
import com.tsparser.ToStringOptions;

/**
 * A name: a variable reference in expressions, a binding in patterns.
 */
public record Identifier(String name, Span span) implements Expression, VariableField {

    public Identifier(String name) {
        this(name, Span.at(0));
    }

    @Override
    public String type() {
        return "Identifier";
    }

    @Override
    public Span getPosition() {
        return span;
    }

    @Override
    public void toStringFromBuffer(SourceWriter buf, ToStringOptions options, int depth) {
        buf.pushString(name);
    }
}
