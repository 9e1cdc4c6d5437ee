package com.tsparser.ast;

import com.tsparser.SourceWriter;
import com.tsparser.ToStringOptions;

/**
 * One slot of an array pattern.
 */
public sealed interface ArrayDestructuringMember extends AstNode {

    /**
     * @param defaultValue value used when the slot is undefined, or null
     */
    record Element(VariableField field, Expression defaultValue, Span span) implements ArrayDestructuringMember {

        @Override
        public String type() {
            return "ArrayDestructuringElement";
        }

        @Override
        public Span getPosition() {
            return span;
        }

        @Override
        public void toStringFromBuffer(SourceWriter buf, ToStringOptions options, int depth) {
            field.toStringFromBuffer(buf, options, depth);
            if (defaultValue != null) {
                buf.pushString(options.spaced("="));
                defaultValue.toStringFromBuffer(buf, options, depth);
            }
        }
    }

    /** An elided slot, as in {@code [, b]}. */
    record Hole(Span span) implements ArrayDestructuringMember {

        @Override
        public String type() {
            return "ArrayDestructuringHole";
        }

        @Override
        public Span getPosition() {
            return span;
        }

        @Override
        public void toStringFromBuffer(SourceWriter buf, ToStringOptions options, int depth) {
        }
    }

    /** {@code ...rest}; only valid as the last member. */
    record Spread(VariableField target, Span span) implements ArrayDestructuringMember {

        @Override
        public String type() {
            return "ArrayDestructuringSpread";
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
