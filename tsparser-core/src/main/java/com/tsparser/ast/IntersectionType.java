package com.tsparser.ast;

import com.tsparser.SourceWriter;
import com.tsparser.ToStringOptions;

import java.util.List;

public record IntersectionType(List<TypeReference> members, Span span) implements TypeReference {

    public IntersectionType {
        members = List.copyOf(members);
    }

    @Override
    public String type() {
        return "IntersectionType";
    }

    @Override
    public Span getPosition() {
        return span;
    }

    @Override
    public void toStringFromBuffer(SourceWriter buf, ToStringOptions options, int depth) {
        for (int i = 0; i < members.size(); i++) {
            if (i > 0) {
                buf.pushString(options.spaced("&"));
            }
            members.get(i).toStringFromBuffer(buf, options, depth);
        }
    }
}
