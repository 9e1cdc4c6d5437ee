package com.tsparser.ast;

import com.tsparser.SourceWriter;
import com.tsparser.StringSourceWriter;
import com.tsparser.ToStringOptions;

/**
 * Contract shared by every syntax tree node: a source position and a way back to source text.
 */
public interface AstNode {

    /** Node kind, used as the discriminator in JSON output. */
    String type();

    Span getPosition();

    /**
     * Appends the source form of this node.
     *
     * @param depth nesting depth, forwarded unchanged to children
     */
    void toStringFromBuffer(SourceWriter buf, ToStringOptions options, int depth);

    default int start() {
        return getPosition().start();
    }

    default int end() {
        return getPosition().end();
    }

    default String toSource(ToStringOptions options) {
        StringSourceWriter buf = new StringSourceWriter();
        toStringFromBuffer(buf, options, 0);
        return buf.toString();
    }

    default String toSource() {
        return toSource(ToStringOptions.PRETTY);
    }
}
