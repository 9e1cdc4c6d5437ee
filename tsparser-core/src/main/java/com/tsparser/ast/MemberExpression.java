package com.tsparser.ast;

import com.tsparser.SourceWriter;
import com.tsparser.ToStringOptions;

/**
 * {@code object.property}, or {@code object[property]} when computed.
 *
 * @param property an {@link Identifier} unless computed
 */
public record MemberExpression(
    Expression object,
    Expression property,
    boolean computed,
    Span span
) implements Expression {

    @Override
    public String type() {
        return "MemberExpression";
    }

    @Override
    public Span getPosition() {
        return span;
    }

    @Override
    public void toStringFromBuffer(SourceWriter buf, ToStringOptions options, int depth) {
        object.toStringFromBuffer(buf, options, depth);
        if (computed) {
            buf.push('[');
            property.toStringFromBuffer(buf, options, depth);
            buf.push(']');
        } else {
            buf.push('.');
            property.toStringFromBuffer(buf, options, depth);
        }
    }
}
