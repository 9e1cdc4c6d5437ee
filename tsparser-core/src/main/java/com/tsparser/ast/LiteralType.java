package com.tsparser.ast;

import com.tsparser.SourceWriter;
import com.tsparser.ToStringOptions;

/**
 * A string, number, boolean or {@code null} literal used as a type.
 *
 * @param raw source text, printed back verbatim
 */
public record LiteralType(String raw, Span span) implements TypeReference {

    @Override
    public String type() {
        return "LiteralType";
    }

    @Override
    public Span getPosition() {
        return span;
    }

    @Override
    public void toStringFromBuffer(SourceWriter buf, ToStringOptions options, int depth) {
        buf.pushString(raw);
    }
}
