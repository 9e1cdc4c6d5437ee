package com.tsparser.ast;

import com.tsparser.ParseOptions;
import com.tsparser.ParsingState;
import com.tsparser.SourceWriter;
import com.tsparser.ToStringOptions;
import com.tsparser.TokenReader;
import com.tsparser.TokenType;

import java.util.Objects;
import java.util.Optional;

/**
 * An initializer that must be present, as in every {@code const} declaration.
 */
public final class RequiredInitializer implements DeclarationExpression {

    private Expression expression;

    public RequiredInitializer(Expression expression) {
        this.expression = Objects.requireNonNull(expression, "expression");
    }

    /**
     * Parses {@code = expression}.
     *
     * @throws com.tsparser.UnexpectedTokenException if the head token is not {@code =}; the token is not consumed
     */
    public static RequiredInitializer fromReader(TokenReader reader, ParsingState state, ParseOptions options) {
        reader.expectNext(TokenType.ASSIGN);
        return new RequiredInitializer(Expression.fromReader(reader, state, options));
    }

    public Expression expression() {
        return expression;
    }

    @Override
    public void toStringFromBuffer(SourceWriter buf, ToStringOptions options, int depth) {
        buf.pushString(options.pretty() ? " = " : "=");
        expression.toStringFromBuffer(buf, options, depth);
    }

    @Override
    public Optional<Span> declPosition() {
        return Optional.of(expression.getPosition());
    }

    @Override
    public Optional<InitializerSlot> asMutableExpression() {
        return Optional.of(new InitializerSlot() {
            @Override
            public Expression get() {
                return expression;
            }

            @Override
            public void set(Expression replacement) {
                expression = Objects.requireNonNull(replacement, "expression");
            }
        });
    }

    @Override
    public Optional<Expression> initializer() {
        return Optional.of(expression);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RequiredInitializer other && expression.equals(other.expression);
    }

    @Override
    public int hashCode() {
        return expression.hashCode();
    }

    @Override
    public String toString() {
        return "RequiredInitializer[" + expression + "]";
    }
}
