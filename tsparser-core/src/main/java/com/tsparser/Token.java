package com.tsparser;

import com.tsparser.ast.Span;

/**
 * A lexical unit.
 *
 * @param type    token kind
 * @param lexeme  source text of the token
 * @param literal cooked value: a {@link Double} for numbers, the unescaped text for strings,
 *                the comment body for comments, otherwise null
 * @param span    source range
 * @param line    1-based line the token starts on
 * @param endLine 1-based line the token ends on
 */
public record Token(
    TokenType type,
    String lexeme,
    Object literal,
    Span span,
    int line,
    int endLine
) {
    public int start() {
        return span.start();
    }

    public int end() {
        return span.end();
    }

    @Override
    public String toString() {
        return "'" + lexeme + "' (" + type + ") at " + span;
    }
}
