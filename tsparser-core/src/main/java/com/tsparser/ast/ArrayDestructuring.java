package com.tsparser.ast;

import com.tsparser.SourceWriter;
import com.tsparser.ToStringOptions;

import java.util.List;

public record ArrayDestructuring(List<ArrayDestructuringMember> members, Span span) implements VariableField {

    public ArrayDestructuring {
        members = List.copyOf(members);
    }

    @Override
    public String type() {
        return "ArrayDestructuring";
    }

    @Override
    public Span getPosition() {
        return span;
    }

    @Override
    public void toStringFromBuffer(SourceWriter buf, ToStringOptions options, int depth) {
        buf.push('[');
        for (int i = 0; i < members.size(); i++) {
            if (i > 0) {
                buf.push(',');
                if (!(members.get(i) instanceof ArrayDestructuringMember.Hole)) {
                    options.addGap(buf);
                }
            }
            members.get(i).toStringFromBuffer(buf, options, depth + 1);
        }
        // A trailing hole needs its own comma to survive a round trip
        if (!members.isEmpty() && members.get(members.size() - 1) instanceof ArrayDestructuringMember.Hole) {
            buf.push(',');
        }
        buf.push(']');
    }
}
