package com.tsparser;

import com.tsparser.ast.Span;

import java.util.List;

/**
 * A token was required but the stream was exhausted.
 */
public class UnexpectedEndException extends ParseException {

    private final List<TokenType> expectedTypes;

    public UnexpectedEndException(int offset, List<TokenType> expectedTypes, String context) {
        super("SyntaxError", null, new Span(offset, offset),
            expectedTypes.isEmpty() ? context : UnexpectedTokenException.describe(expectedTypes), context,
            expectedTypes.isEmpty()
                ? "Unexpected end of input"
                : "Unexpected end of input, expected " + UnexpectedTokenException.describe(expectedTypes));
        this.expectedTypes = List.copyOf(expectedTypes);
    }

    /** Builds the error at the end of the last token the reader handed out. */
    public static UnexpectedEndException at(TokenReader reader, List<TokenType> expectedTypes, String context) {
        int offset = reader.previous().map(Token::end).orElse(0);
        return new UnexpectedEndException(offset, expectedTypes, context);
    }

    public List<TokenType> getExpectedTypes() {
        return expectedTypes;
    }
}
