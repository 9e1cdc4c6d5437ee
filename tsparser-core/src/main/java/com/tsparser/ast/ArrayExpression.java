package com.tsparser.ast;

import com.tsparser.SourceWriter;
import com.tsparser.ToStringOptions;

import java.util.List;

public record ArrayExpression(List<Expression> elements, Span span) implements Expression {

    public ArrayExpression {
        elements = List.copyOf(elements);
    }

    @Override
    public String type() {
        return "ArrayExpression";
    }

    @Override
    public Span getPosition() {
        return span;
    }

    @Override
    public void toStringFromBuffer(SourceWriter buf, ToStringOptions options, int depth) {
        buf.push('[');
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) {
                buf.push(',');
                options.addGap(buf);
            }
            elements.get(i).toStringFromBuffer(buf, options, depth);
        }
        buf.push(']');
    }
}
