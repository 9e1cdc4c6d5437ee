package com.tsparser.ast;

import com.tsparser.SourceWriter;
import com.tsparser.ToStringOptions;

/**
 * One entry of an object pattern.
 */
public sealed interface ObjectDestructuringMember extends AstNode {

    /** {@code name} or {@code name = default}. */
    record Shorthand(Identifier name, Expression defaultValue, Span span) implements ObjectDestructuringMember {

        @Override
        public String type() {
            return "ObjectDestructuringShorthand";
        }

        @Override
        public Span getPosition() {
            return span;
        }

        @Override
        public void toStringFromBuffer(SourceWriter buf, ToStringOptions options, int depth) {
            name.toStringFromBuffer(buf, options, depth);
            if (defaultValue != null) {
                buf.pushString(options.spaced("="));
                defaultValue.toStringFromBuffer(buf, options, depth);
            }
        }
    }

    /** {@code key: target} with an optional default. */
    record Property(String key, VariableField value, Expression defaultValue, Span span)
        implements ObjectDestructuringMember {

        @Override
        public String type() {
            return "ObjectDestructuringProperty";
        }

        @Override
        public Span getPosition() {
            return span;
        }

        @Override
        public void toStringFromBuffer(SourceWriter buf, ToStringOptions options, int depth) {
            buf.pushString(key);
            buf.push(':');
            options.addGap(buf);
            value.toStringFromBuffer(buf, options, depth);
            if (defaultValue != null) {
                buf.pushString(options.spaced("="));
                defaultValue.toStringFromBuffer(buf, options, depth);
            }
        }
    }

    record Spread(Identifier target, Span span) implements ObjectDestructuringMember {

        @Override
        public String type() {
            return "ObjectDestructuringSpread";
        }

        @Override
        public Span getPosition() {
            return span;
        }

        @Override
        public void toStringFromBuffer(SourceWriter buf, ToStringOptions options, int depth) {
            buf.pushString("...");
            target.toStringFromBuffer(buf, options, depth);
        }
    }
}
