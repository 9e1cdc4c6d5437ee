package com.tsparser.ast;

import com.tsparser.TokenType;

public enum UnaryOperator {
    NOT("!"),
    NEGATE("-"),
    PLUS("+"),
    BITWISE_NOT("~"),
    TYPEOF("typeof"),
    VOID("void");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /** Word operators need a space before their operand in every mode. */
    public boolean isWord() {
        return this == TYPEOF || this == VOID;
    }

    public static UnaryOperator fromToken(TokenType type) {
        return switch (type) {
            case BANG -> NOT;
            case MINUS -> NEGATE;
            case PLUS -> PLUS;
            case TILDE -> BITWISE_NOT;
            case TYPEOF -> TYPEOF;
            case VOID -> VOID;
            default -> throw new IllegalArgumentException("Not a unary operator: " + type);
        };
    }
}
