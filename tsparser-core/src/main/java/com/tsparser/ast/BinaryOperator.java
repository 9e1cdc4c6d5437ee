package com.tsparser.ast;

import com.tsparser.TokenType;

public enum BinaryOperator {
    ADD("+"),
    SUBTRACT("-"),
    MULTIPLY("*"),
    DIVIDE("/"),
    REMAINDER("%"),
    EXPONENT("**"),
    LEFT_SHIFT("<<"),
    RIGHT_SHIFT(">>"),
    UNSIGNED_RIGHT_SHIFT(">>>"),
    LESS_THAN("<"),
    LESS_THAN_EQUAL("<="),
    GREATER_THAN(">"),
    GREATER_THAN_EQUAL(">="),
    EQUAL("=="),
    NOT_EQUAL("!="),
    STRICT_EQUAL("==="),
    STRICT_NOT_EQUAL("!=="),
    BITWISE_AND("&"),
    BITWISE_OR("|"),
    BITWISE_XOR("^"),
    LOGICAL_AND("&&"),
    LOGICAL_OR("||"),
    NULLISH_COALESCING("??"),
    IN("in"),
    INSTANCEOF("instanceof");

    private final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isWord() {
        return this == IN || this == INSTANCEOF;
    }

    public static BinaryOperator fromToken(TokenType type) {
        return switch (type) {
            case PLUS -> ADD;
            case MINUS -> SUBTRACT;
            case STAR -> MULTIPLY;
            case SLASH -> DIVIDE;
            case PERCENT -> REMAINDER;
            case STAR_STAR -> EXPONENT;
            case LEFT_SHIFT -> LEFT_SHIFT;
            case RIGHT_SHIFT -> RIGHT_SHIFT;
            case UNSIGNED_RIGHT_SHIFT -> UNSIGNED_RIGHT_SHIFT;
            case LT -> LESS_THAN;
            case LE -> LESS_THAN_EQUAL;
            case GT -> GREATER_THAN;
            case GE -> GREATER_THAN_EQUAL;
            case EQ -> EQUAL;
            case NE -> NOT_EQUAL;
            case EQ_STRICT -> STRICT_EQUAL;
            case NE_STRICT -> STRICT_NOT_EQUAL;
            case BIT_AND -> BITWISE_AND;
            case BIT_OR -> BITWISE_OR;
            case BIT_XOR -> BITWISE_XOR;
            case AND -> LOGICAL_AND;
            case OR -> LOGICAL_OR;
            case QUESTION_QUESTION -> NULLISH_COALESCING;
            case IN -> IN;
            case INSTANCEOF -> INSTANCEOF;
            default -> throw new IllegalArgumentException("Not a binary operator: " + type);
        };
    }
}
