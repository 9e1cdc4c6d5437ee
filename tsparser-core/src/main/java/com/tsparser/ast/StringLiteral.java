package com.tsparser.ast;

import com.tsparser.SourceWriter;
import com.tsparser.ToStringOptions;

/**
 * @param value unescaped contents
 * @param raw   source text including quotes, printed back verbatim
 */
public record StringLiteral(String value, String raw, Span span) implements Expression {

    /** A double-quoted literal created by a rewriting pass rather than read from source. */
    public static StringLiteral of(String value) {
        StringBuilder raw = new StringBuilder("\"");
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> raw.append("\\\"");
                case '\\' -> raw.append("\\\\");
                case '\n' -> raw.append("\\n");
                case '\r' -> raw.append("\\r");
                case '\t' -> raw.append("\\t");
                default -> raw.append(c);
            }
        }
        raw.append('"');
        return new StringLiteral(value, raw.toString(), Span.at(0));
    }

    @Override
    public String type() {
        return "StringLiteral";
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
