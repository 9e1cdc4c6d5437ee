package com.tsparser.ast;

import com.tsparser.SourceWriter;
import com.tsparser.ToStringOptions;

import java.util.List;

public record ObjectDestructuring(List<ObjectDestructuringMember> members, Span span) implements VariableField {

    public ObjectDestructuring {
        members = List.copyOf(members);
    }

    @Override
    public String type() {
        return "ObjectDestructuring";
    }

    @Override
    public Span getPosition() {
        return span;
    }

    @Override
    public void toStringFromBuffer(SourceWriter buf, ToStringOptions options, int depth) {
        if (members.isEmpty()) {
            buf.pushString("{}");
            return;
        }
        buf.push('{');
        options.addGap(buf);
        for (int i = 0; i < members.size(); i++) {
            if (i > 0) {
                buf.push(',');
                options.addGap(buf);
            }
            members.get(i).toStringFromBuffer(buf, options, depth + 1);
        }
        options.addGap(buf);
        buf.push('}');
    }
}
