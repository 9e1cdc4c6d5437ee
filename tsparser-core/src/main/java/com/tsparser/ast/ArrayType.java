package com.tsparser.ast;

import com.tsparser.SourceWriter;
import com.tsparser.ToStringOptions;

public record ArrayType(TypeReference elementType, Span span) implements TypeReference {

    @Override
    public String type() {
        return "ArrayType";
    }

    @Override
    public Span getPosition() {
        return span;
    }

    @Override
    public void toStringFromBuffer(SourceWriter buf, ToStringOptions options, int depth) {
        elementType.toStringFromBuffer(buf, options, depth);
        buf.pushString("[]");
    }
}
