package com.tsparser.ast;

import com.tsparser.NodeReader;
import com.tsparser.ParseOptions;
import com.tsparser.ParsingState;
import com.tsparser.SourceWriter;
import com.tsparser.StringSourceWriter;
import com.tsparser.ToStringOptions;
import com.tsparser.TokenReader;
import com.tsparser.TokenType;

import java.util.Optional;

/**
 * One {@code name[: Type][ = init]} entry of a variable statement.
 *
 * @param name          binding target with any leading comment
 * @param typeReference annotation, or null
 * @param expression    initializer strategy
 */
public record VariableDeclaration<T extends DeclarationExpression>(
    WithComment<VariableField> name,
    TypeReference typeReference,
    T expression
) implements AstNode {

    public static <T extends DeclarationExpression> VariableDeclaration<T> fromReader(
        TokenReader reader,
        ParsingState state,
        ParseOptions options,
        NodeReader<T> expressionReader
    ) {
        WithComment<VariableField> name = WithComment.fromReader(reader, state, options, VariableField::fromReader);
        TypeReference typeReference = null;
        if (reader.match(TokenType.COLON)) {
            typeReference = TypeReference.fromReader(reader, state, options);
        }
        T expression = expressionReader.read(reader, state, options);
        return new VariableDeclaration<>(name, typeReference, expression);
    }

    public Optional<TypeReference> typeAnnotation() {
        return Optional.ofNullable(typeReference);
    }

    /**
     * The initializer slot for in-place rewriting, when an initializer exists.
     * Setting it changes this declaration's {@code equals} and {@code hashCode}, so do not
     * hold declarations in hash-based collections across a rewrite.
     */
    public Optional<InitializerSlot> initializerSlot() {
        return expression.asMutableExpression();
    }

    @Override
    public String type() {
        return "VariableDeclaration";
    }

    @Override
    public Span getPosition() {
        Span namePosition = name.getPosition();
        Optional<Span> initPosition = expression.declPosition();
        if (initPosition.isPresent()) {
            return namePosition.union(initPosition.get());
        }
        if (typeReference != null) {
            return namePosition.union(typeReference.getPosition());
        }
        return namePosition;
    }

    @Override
    public void toStringFromBuffer(SourceWriter buf, ToStringOptions options, int depth) {
        name.toStringFromBuffer(buf, options, depth);
        if (options.includeTypeAnnotations() && typeReference != null) {
            StringSourceWriter typeText = new StringSourceWriter();
            typeReference.toStringFromBuffer(typeText, options, depth);
            buf.pushString(": ");
            buf.pushString(typeText.toString());
            // "T>=" would lex as '>='
            if (!options.pretty() && typeText.toString().endsWith(">") && expression.declPosition().isPresent()) {
                buf.push(' ');
            }
        }
        expression.toStringFromBuffer(buf, options, depth);
    }
}
