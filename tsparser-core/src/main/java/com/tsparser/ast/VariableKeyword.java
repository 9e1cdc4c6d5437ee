package com.tsparser.ast;

import com.tsparser.SourceWriter;
import com.tsparser.ToStringOptions;
import com.tsparser.Token;
import com.tsparser.TokenType;
import com.tsparser.UnexpectedTokenException;

import java.util.List;

/**
 * The keyword that opens a variable statement, with its source span.
 */
public sealed interface VariableKeyword extends AstNode {

    List<TokenType> KEYWORDS = List.of(TokenType.CONST, TokenType.LET, TokenType.VAR);

    record Const(Span span) implements VariableKeyword {
        @Override
        public TokenType tokenType() {
            return TokenType.CONST;
        }
    }

    record Let(Span span) implements VariableKeyword {
        @Override
        public TokenType tokenType() {
            return TokenType.LET;
        }
    }

    record Var(Span span) implements VariableKeyword {
        @Override
        public TokenType tokenType() {
            return TokenType.VAR;
        }
    }

    Span span();

    TokenType tokenType();

    static boolean isDeclarationKeyword(Token token) {
        return isDeclarationKeyword(token.type());
    }

    static boolean isDeclarationKeyword(TokenType type) {
        return type == TokenType.CONST || type == TokenType.LET || type == TokenType.VAR;
    }

    /**
     * @throws UnexpectedTokenException if the token is not {@code const}, {@code let} or {@code var}
     */
    static VariableKeyword fromToken(Token token) {
        return switch (token.type()) {
            case CONST -> new Const(token.span());
            case LET -> new Let(token.span());
            case VAR -> new Var(token.span());
            default -> throw new UnexpectedTokenException(token, KEYWORDS);
        };
    }

    /** Keyword text including the separating space, e.g. {@code "const "}. */
    default String asKeywordText() {
        return tokenType().display() + " ";
    }

    @Override
    default String type() {
        return "VariableKeyword";
    }

    @Override
    default Span getPosition() {
        return span();
    }

    @Override
    default void toStringFromBuffer(SourceWriter buf, ToStringOptions options, int depth) {
        buf.pushString(asKeywordText());
    }
}
