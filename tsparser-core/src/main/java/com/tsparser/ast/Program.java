package com.tsparser.ast;

import com.tsparser.ParseOptions;
import com.tsparser.ParsingState;
import com.tsparser.SourceWriter;
import com.tsparser.ToStringOptions;
import com.tsparser.Token;
import com.tsparser.TokenReader;
import com.tsparser.TokenType;
import com.tsparser.UnexpectedTokenException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A sequence of statements covering the whole source.
 */
public record Program(List<Statement> body, Span span) implements AstNode {

    public Program {
        body = List.copyOf(body);
    }

    public static Program fromReader(TokenReader reader, ParsingState state, ParseOptions options) {
        List<Statement> body = new ArrayList<>();
        while (true) {
            if (reader.isAtEnd()) {
                break;
            }
            Statement statement = Statement.fromReader(reader, state, options);
            body.add(statement);
            if (!(statement instanceof EmptyStatement)) {
                expectTerminator(reader);
            }
        }
        return new Program(body, new Span(0, state.getSourceLength()));
    }

    /** A statement ends at {@code ;}, at end of input, or before a line break. */
    private static void expectTerminator(TokenReader reader) {
        if (reader.match(TokenType.SEMICOLON)) {
            return;
        }
        Optional<Token> next = reader.peek();
        if (next.isEmpty()) {
            return;
        }
        Optional<Token> previous = reader.previous();
        if (previous.isPresent() && previous.get().endLine() < next.get().line()) {
            return;
        }
        throw new UnexpectedTokenException(next.get(), List.of(TokenType.SEMICOLON));
    }

    @Override
    public String type() {
        return "Program";
    }

    @Override
    public Span getPosition() {
        return span;
    }

    @Override
    public void toStringFromBuffer(SourceWriter buf, ToStringOptions options, int depth) {
        for (Statement statement : body) {
            statement.toStringFromBuffer(buf, options, depth);
            buf.push(';');
            if (options.pretty()) {
                buf.push('\n');
            }
        }
    }
}
