package com.tsparser.ast;

import com.tsparser.SourceWriter;
import com.tsparser.ToStringOptions;

/** A lone {@code ;}. */
public record EmptyStatement(Span span) implements Statement {

    @Override
    public String type() {
        return "EmptyStatement";
    }

    @Override
    public Span getPosition() {
        return span;
    }

    @Override
    public void toStringFromBuffer(SourceWriter buf, ToStringOptions options, int depth) {
    }
}
