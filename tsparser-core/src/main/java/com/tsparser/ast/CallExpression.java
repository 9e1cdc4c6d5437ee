package com.tsparser.ast;

import com.tsparser.SourceWriter;
import com.tsparser.ToStringOptions;

import java.util.List;

public record CallExpression(Expression callee, List<Expression> arguments, Span span) implements Expression {

    public CallExpression {
        arguments = List.copyOf(arguments);
    }

    @Override
    public String type() {
        return "CallExpression";
    }

    @Override
    public Span getPosition() {
        return span;
    }

    @Override
    public void toStringFromBuffer(SourceWriter buf, ToStringOptions options, int depth) {
        callee.toStringFromBuffer(buf, options, depth);
        buf.push('(');
        for (int i = 0; i < arguments.size(); i++) {
            if (i > 0) {
                buf.push(',');
                options.addGap(buf);
            }
            arguments.get(i).toStringFromBuffer(buf, options, depth);
        }
        buf.push(')');
    }
}
