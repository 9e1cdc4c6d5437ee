package com.tsparser.ast;

import com.tsparser.ParseOptions;
import com.tsparser.ParsingState;
import com.tsparser.Token;
import com.tsparser.TokenReader;
import com.tsparser.TokenType;
import com.tsparser.UnexpectedEndException;

import java.util.List;

public sealed interface Statement extends AstNode permits VariableStatement, ExpressionStatement, EmptyStatement {

    /**
     * Dispatches on the head token: declaration keywords start a variable statement,
     * a lone {@code ;} is an empty statement, anything else an expression statement.
     * The terminating {@code ;} of a non-empty statement is left to the caller.
     */
    static Statement fromReader(TokenReader reader, ParsingState state, ParseOptions options) {
        Token head = reader.peek().orElseThrow(() -> UnexpectedEndException.at(reader, List.of(), "statement"));
        if (VariableKeyword.isDeclarationKeyword(head)) {
            return VariableStatement.fromReader(reader, state, options);
        }
        if (head.type() == TokenType.SEMICOLON) {
            reader.next();
            return new EmptyStatement(head.span());
        }
        Expression expression = Expression.fromReader(reader, state, options);
        return new ExpressionStatement(expression, expression.getPosition());
    }
}
