package com.tsparser.ast;

import com.tsparser.SourceWriter;
import com.tsparser.ToStringOptions;

public record ParenthesizedType(TypeReference inner, Span span) implements TypeReference {

    @Override
    public String type() {
        return "ParenthesizedType";
    }

    @Override
    public Span getPosition() {
        return span;
    }

    @Override
    public void toStringFromBuffer(SourceWriter buf, ToStringOptions options, int depth) {
        buf.push('(');
        inner.toStringFromBuffer(buf, options, depth);
        buf.push(')');
    }
}
