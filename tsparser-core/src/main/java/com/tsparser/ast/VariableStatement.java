package com.tsparser.ast;

import com.tsparser.NodeReader;
import com.tsparser.ParseOptions;
import com.tsparser.ParsingState;
import com.tsparser.SourceWriter;
import com.tsparser.ToStringOptions;
import com.tsparser.Token;
import com.tsparser.TokenReader;
import com.tsparser.TokenType;
import com.tsparser.UnexpectedEndException;

import java.util.ArrayList;
import java.util.List;

/**
 * A {@code const}, {@code let} or {@code var} statement. Each variant pairs its keyword
 * with the initializer strategy it requires, so a {@code const} without an initializer
 * cannot be constructed.
 */
public sealed interface VariableStatement extends Statement {

    record ConstDeclaration(
        VariableKeyword.Const keyword,
        List<VariableDeclaration<RequiredInitializer>> declarations
    ) implements VariableStatement {
        public ConstDeclaration {
            declarations = requireNonEmpty(declarations);
        }
    }

    record LetDeclaration(
        VariableKeyword.Let keyword,
        List<VariableDeclaration<OptionalInitializer>> declarations
    ) implements VariableStatement {
        public LetDeclaration {
            declarations = requireNonEmpty(declarations);
        }
    }

    record VarDeclaration(
        VariableKeyword.Var keyword,
        List<VariableDeclaration<OptionalInitializer>> declarations
    ) implements VariableStatement {
        public VarDeclaration {
            declarations = requireNonEmpty(declarations);
        }
    }

    VariableKeyword keyword();

    List<? extends VariableDeclaration<?>> declarations();

    /**
     * Parses a keyword followed by one or more comma-separated declarations.
     * The declaration list ends at the first token after a declaration that is
     * not a comma, or at end of input.
     */
    static VariableStatement fromReader(TokenReader reader, ParsingState state, ParseOptions options) {
        Token token = reader.next().orElseThrow(() ->
            UnexpectedEndException.at(reader, VariableKeyword.KEYWORDS, "variable statement"));
        VariableKeyword keyword = VariableKeyword.fromToken(token);
        if (options.recordKeywordPositions()) {
            state.recordKeyword(keyword.tokenType(), keyword.span());
        }

        if (keyword instanceof VariableKeyword.Const constKeyword) {
            return new ConstDeclaration(constKeyword,
                parseDeclarations(reader, state, options, RequiredInitializer::fromReader));
        } else if (keyword instanceof VariableKeyword.Let letKeyword) {
            return new LetDeclaration(letKeyword,
                parseDeclarations(reader, state, options, OptionalInitializer::fromReader));
        } else {
            return new VarDeclaration((VariableKeyword.Var) keyword,
                parseDeclarations(reader, state, options, OptionalInitializer::fromReader));
        }
    }

    private static <T extends DeclarationExpression> List<VariableDeclaration<T>> parseDeclarations(
        TokenReader reader,
        ParsingState state,
        ParseOptions options,
        NodeReader<T> expressionReader
    ) {
        List<VariableDeclaration<T>> declarations = new ArrayList<>();
        do {
            declarations.add(VariableDeclaration.fromReader(reader, state, options, expressionReader));
        } while (reader.match(TokenType.COMMA));
        return declarations;
    }

    private static <D> List<D> requireNonEmpty(List<D> declarations) {
        if (declarations.isEmpty()) {
            throw new IllegalArgumentException("A variable statement needs at least one declaration");
        }
        return List.copyOf(declarations);
    }

    default boolean isConstant() {
        return this instanceof ConstDeclaration;
    }

    @Override
    default String type() {
        return "VariableStatement";
    }

    @Override
    default Span getPosition() {
        List<? extends VariableDeclaration<?>> declarations = declarations();
        return keyword().span().union(declarations.get(declarations.size() - 1).getPosition());
    }

    @Override
    default void toStringFromBuffer(SourceWriter buf, ToStringOptions options, int depth) {
        buf.pushString(keyword().asKeywordText());
        List<? extends VariableDeclaration<?>> declarations = declarations();
        for (int i = 0; i < declarations.size(); i++) {
            if (i > 0) {
                buf.push(',');
                options.addGap(buf);
            }
            declarations.get(i).toStringFromBuffer(buf, options, depth);
        }
    }
}
