package com.tsparser.ast;

import com.tsparser.ExpressionParser;
import com.tsparser.ParseOptions;
import com.tsparser.ParsingState;
import com.tsparser.TokenReader;

public sealed interface Expression extends AstNode permits
    NumberLiteral,
    StringLiteral,
    BooleanLiteral,
    NullLiteral,
    Identifier,
    ArrayExpression,
    ParenthesizedExpression,
    UnaryExpression,
    BinaryExpression,
    ConditionalExpression,
    AssignmentExpression,
    CallExpression,
    MemberExpression {

    /** Parses one assignment-level expression; a top-level comma ends it. */
    static Expression fromReader(TokenReader reader, ParsingState state, ParseOptions options) {
        return ExpressionParser.parse(reader, state, options);
    }
}
