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
 * An initializer that may be absent, as in {@code let} and {@code var} declarations.
 */
public final class OptionalInitializer implements DeclarationExpression {

    private Expression expression;

    /**
     * @param expression the initializer, or null when there is none
     */
    public OptionalInitializer(Expression expression) {
        this.expression = expression;
    }

    public static OptionalInitializer absent() {
        return new OptionalInitializer(null);
    }

    /** Parses {@code = expression} if the head token is {@code =}; otherwise consumes nothing. */
    public static OptionalInitializer fromReader(TokenReader reader, ParsingState state, ParseOptions options) {
        if (reader.match(TokenType.ASSIGN)) {
            return new OptionalInitializer(Expression.fromReader(reader, state, options));
        }
        return absent();
    }

    public boolean isPresent() {
        return expression != null;
    }

    @Override
    public void toStringFromBuffer(SourceWriter buf, ToStringOptions options, int depth) {
        if (expression != null) {
            buf.pushString(options.pretty() ? " = " : "=");
            expression.toStringFromBuffer(buf, options, depth);
        }
    }

    @Override
    public Optional<Span> declPosition() {
        return initializer().map(Expression::getPosition);
    }

    /** Empty when there is no initializer; an absent initializer cannot be filled in. */
    @Override
    public Optional<InitializerSlot> asMutableExpression() {
        if (expression == null) {
            return Optional.empty();
        }
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
        return Optional.ofNullable(expression);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof OptionalInitializer other && Objects.equals(expression, other.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(expression);
    }

    @Override
    public String toString() {
        return "OptionalInitializer[" + expression + "]";
    }
}
