package com.tsparser.ast;

import com.tsparser.SourceWriter;
import com.tsparser.ToStringOptions;

/**
 * @param target an {@link Identifier} or {@link MemberExpression}
 */
public record AssignmentExpression(
    AssignmentOperator operator,
    Expression target,
    Expression value,
    Span span
) implements Expression {

    @Override
    public String type() {
        return "AssignmentExpression";
    }

    @Override
    public Span getPosition() {
        return span;
    }

    @Override
    public void toStringFromBuffer(SourceWriter buf, ToStringOptions options, int depth) {
        target.toStringFromBuffer(buf, options, depth);
        buf.pushString(options.spaced(operator.symbol()));
        value.toStringFromBuffer(buf, options, depth);
    }
}
