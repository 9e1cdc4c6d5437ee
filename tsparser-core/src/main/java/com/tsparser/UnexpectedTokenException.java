package com.tsparser;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The head token's kind does not fit the grammar position.
 */
public class UnexpectedTokenException extends ParseException {

    private final List<TokenType> expectedTypes;

    public UnexpectedTokenException(Token found, List<TokenType> expectedTypes) {
        super("SyntaxError", found, found.span(), describe(expectedTypes), null,
            "Unexpected token '" + found.lexeme() + "', expected " + describe(expectedTypes));
        this.expectedTypes = List.copyOf(expectedTypes);
    }

    public UnexpectedTokenException(Token found, String context) {
        super("SyntaxError", found, found.span(), context, context,
            "Unexpected token '" + found.lexeme() + "'");
        this.expectedTypes = List.of();
    }

    static String describe(List<TokenType> types) {
        if (types.size() == 1) {
            return "'" + types.get(0).display() + "'";
        }
        return types.stream()
            .map(type -> "'" + type.display() + "'")
            .collect(Collectors.joining(", ", "one of ", ""));
    }

    /** Token kinds that would have been accepted; empty when only a context was given. */
    public List<TokenType> getExpectedTypes() {
        return expectedTypes;
    }

    public Token getFound() {
        return getToken();
    }
}
