package com.tsparser.ast;

import com.tsparser.SourceWriter;
import com.tsparser.ToStringOptions;

import java.util.List;

/**
 * A type name such as {@code number}, {@code ns.Item} or {@code Map<string, T>}.
 *
 * @param name          possibly dotted name
 * @param typeArguments generic arguments, empty when none were written
 */
public record NamedType(String name, List<TypeReference> typeArguments, Span span) implements TypeReference {

    public NamedType {
        typeArguments = List.copyOf(typeArguments);
    }

    @Override
    public String type() {
        return "NamedType";
    }

    @Override
    public Span getPosition() {
        return span;
    }

    @Override
    public void toStringFromBuffer(SourceWriter buf, ToStringOptions options, int depth) {
        buf.pushString(name);
        if (!typeArguments.isEmpty()) {
            buf.push('<');
            for (int i = 0; i < typeArguments.size(); i++) {
                if (i > 0) {
                    buf.push(',');
                    options.addGap(buf);
                }
                typeArguments.get(i).toStringFromBuffer(buf, options, depth);
            }
            buf.push('>');
        }
    }
}
