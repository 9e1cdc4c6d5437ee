package com.tsparser.ast;

import com.tsparser.TokenType;

public enum AssignmentOperator {
    ASSIGN("="),
    ADD_ASSIGN("+="),
    SUBTRACT_ASSIGN("-="),
    MULTIPLY_ASSIGN("*="),
    DIVIDE_ASSIGN("/="),
    REMAINDER_ASSIGN("%="),
    EXPONENT_ASSIGN("**="),
    LEFT_SHIFT_ASSIGN("<<="),
    RIGHT_SHIFT_ASSIGN(">>="),
    UNSIGNED_RIGHT_SHIFT_ASSIGN(">>>="),
    BITWISE_AND_ASSIGN("&="),
    BITWISE_OR_ASSIGN("|="),
    BITWISE_XOR_ASSIGN("^="),
    LOGICAL_AND_ASSIGN("&&="),
    LOGICAL_OR_ASSIGN("||="),
    NULLISH_ASSIGN("??=");

    private final String symbol;

    AssignmentOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /** The operator for an assignment token, or null if the token does not assign. */
    public static AssignmentOperator fromToken(TokenType type) {
        return switch (type) {
            case ASSIGN -> ASSIGN;
            case PLUS_ASSIGN -> ADD_ASSIGN;
            case MINUS_ASSIGN -> SUBTRACT_ASSIGN;
            case STAR_ASSIGN -> MULTIPLY_ASSIGN;
            case SLASH_ASSIGN -> DIVIDE_ASSIGN;
            case PERCENT_ASSIGN -> REMAINDER_ASSIGN;
            case STAR_STAR_ASSIGN -> EXPONENT_ASSIGN;
            case LEFT_SHIFT_ASSIGN -> LEFT_SHIFT_ASSIGN;
            case RIGHT_SHIFT_ASSIGN -> RIGHT_SHIFT_ASSIGN;
            case UNSIGNED_RIGHT_SHIFT_ASSIGN -> UNSIGNED_RIGHT_SHIFT_ASSIGN;
            case BIT_AND_ASSIGN -> BITWISE_AND_ASSIGN;
            case BIT_OR_ASSIGN -> BITWISE_OR_ASSIGN;
            case BIT_XOR_ASSIGN -> BITWISE_XOR_ASSIGN;
            case AND_ASSIGN -> LOGICAL_AND_ASSIGN;
            case OR_ASSIGN -> LOGICAL_OR_ASSIGN;
            case QUESTION_QUESTION_ASSIGN -> NULLISH_ASSIGN;
            default -> null;
        };
    }
}
