package com.tsparser.ast;

import com.tsparser.NodeReader;
import com.tsparser.ParseOptions;
import com.tsparser.ParsingState;
import com.tsparser.SourceWriter;
import com.tsparser.ToStringOptions;
import com.tsparser.Token;
import com.tsparser.TokenReader;

import java.util.Optional;

/**
 * A node with the block comment that preceded it, if any.
 *
 * @param comment body of the comment without delimiters, or null
 * @param span    covers the comment as well as the node
 */
public record WithComment<T extends AstNode>(String comment, T item, Span span) implements AstNode {

    public static <T extends AstNode> WithComment<T> none(T item) {
        return new WithComment<>(null, item, item.getPosition());
    }

    public static <T extends AstNode> WithComment<T> fromReader(
        TokenReader reader,
        ParsingState state,
        ParseOptions options,
        NodeReader<T> itemReader
    ) {
        Optional<Token> comment = reader.peekComment();
        if (comment.isPresent()) {
            T item = itemReader.read(reader, state, options);
            return new WithComment<>((String) comment.get().literal(), item,
                comment.get().span().union(item.getPosition()));
        }
        return none(itemReader.read(reader, state, options));
    }

    public boolean hasComment() {
        return comment != null;
    }

    @Override
    public String type() {
        return "WithComment";
    }

    @Override
    public Span getPosition() {
        return span;
    }

    @Override
    public void toStringFromBuffer(SourceWriter buf, ToStringOptions options, int depth) {
        if (comment != null && options.includeComments()) {
            buf.pushString("/*");
            buf.pushString(comment);
            buf.pushString("*/");
            options.addGap(buf);
        }
        item.toStringFromBuffer(buf, options, depth);
    }
}
