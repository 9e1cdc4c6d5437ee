package com.tsparser;

import java.util.Optional;

/**
 * Pull-based cursor over a token sequence. Parsers never look further ahead
 * than {@link #peek()}. Block comments are trivia: {@link #peek()} and
 * {@link #next()} step over them, and {@link #peekComment()} exposes the one
 * directly in front of the head token.
 */
public interface TokenReader {

    /** The next token without consuming it, or empty at end of input. */
    Optional<Token> peek();

    /** Consumes and returns the next token, or empty at end of input. */
    Optional<Token> next();

    /**
     * Consumes the next token if it has the given type. Otherwise throws without
     * moving the cursor.
     *
     * @throws UnexpectedTokenException if the head token has another type
     * @throws UnexpectedEndException   if the input is exhausted
     */
    Token expectNext(TokenType expected);

    /**
     * Splits the head token: its first {@code length} characters are consumed as a
     * token of {@code consumedType}, and the rest stays at the head as {@code remainderType}.
     * Used where the lexer's longest match is wrong for the grammar, such as the
     * {@code >>} closing two generic argument lists.
     *
     * @throws UnexpectedEndException if the input is exhausted
     */
    Token splitNext(TokenType consumedType, int length, TokenType remainderType);

    /** The block comment immediately before the head token, if any. Never consumes. */
    Optional<Token> peekComment();

    /** The most recently consumed token, or empty before the first one. */
    Optional<Token> previous();

    /** Number of tokens consumed so far. */
    int position();

    default boolean isAtEnd() {
        return peek().isEmpty();
    }

    default boolean check(TokenType type) {
        Optional<Token> head = peek();
        return head.isPresent() && head.get().type() == type;
    }

    default boolean match(TokenType type) {
        if (check(type)) {
            next();
            return true;
        }
        return false;
    }
}
