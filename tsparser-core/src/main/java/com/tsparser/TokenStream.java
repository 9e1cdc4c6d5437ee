package com.tsparser;

import com.tsparser.ast.Span;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link TokenReader} over a fully lexed token list. Comment tokens are set aside
 * when the stream is built, keyed by the start offset of the token they precede.
 */
public final class TokenStream implements TokenReader {

    private final List<Token> tokens = new ArrayList<>();
    private final Map<Integer, Token> commentsBefore = new HashMap<>();
    private int current = 0;

    public TokenStream(List<Token> tokens) {
        Token pendingComment = null;
        for (Token token : tokens) {
            if (token.type() == TokenType.MULTI_LINE_COMMENT) {
                // The closest comment wins
                pendingComment = token;
                continue;
            }
            if (pendingComment != null) {
                commentsBefore.put(token.start(), pendingComment);
                pendingComment = null;
            }
            this.tokens.add(token);
        }
    }

    @Override
    public Optional<Token> peek() {
        if (current >= tokens.size()) {
            return Optional.empty();
        }
        return Optional.of(tokens.get(current));
    }

    @Override
    public Optional<Token> next() {
        if (current >= tokens.size()) {
            return Optional.empty();
        }
        return Optional.of(tokens.get(current++));
    }

    @Override
    public Token expectNext(TokenType expected) {
        if (current >= tokens.size()) {
            throw UnexpectedEndException.at(this, List.of(expected), null);
        }
        Token token = tokens.get(current);
        if (token.type() != expected) {
            throw new UnexpectedTokenException(token, List.of(expected));
        }
        current++;
        return token;
    }

    @Override
    public Token splitNext(TokenType consumedType, int length, TokenType remainderType) {
        if (current >= tokens.size()) {
            throw UnexpectedEndException.at(this, List.of(consumedType), null);
        }
        Token head = tokens.get(current);
        String lexeme = head.lexeme();
        if (length <= 0 || length >= lexeme.length()) {
            throw new IllegalArgumentException("Cannot split '" + lexeme + "' at " + length);
        }
        int cut = head.start() + length;
        Token consumed = new Token(consumedType, lexeme.substring(0, length), null,
            new Span(head.start(), cut), head.line(), head.line());
        Token remainder = new Token(remainderType, lexeme.substring(length), null,
            new Span(cut, head.end()), head.line(), head.endLine());
        tokens.set(current, remainder);
        tokens.add(current, consumed);
        current++;
        return consumed;
    }

    @Override
    public Optional<Token> peekComment() {
        if (current >= tokens.size()) {
            return Optional.empty();
        }
        return Optional.ofNullable(commentsBefore.get(tokens.get(current).start()));
    }

    @Override
    public Optional<Token> previous() {
        if (current == 0) {
            return Optional.empty();
        }
        return Optional.of(tokens.get(current - 1));
    }

    @Override
    public int position() {
        return current;
    }

    /** Number of non-comment tokens, counting split halves separately. */
    public int size() {
        return tokens.size();
    }
}
