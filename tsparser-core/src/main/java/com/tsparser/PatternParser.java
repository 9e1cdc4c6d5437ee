package com.tsparser;

import com.tsparser.ast.ArrayDestructuring;
import com.tsparser.ast.ArrayDestructuringMember;
import com.tsparser.ast.Expression;
import com.tsparser.ast.Identifier;
import com.tsparser.ast.ObjectDestructuring;
import com.tsparser.ast.ObjectDestructuringMember;
import com.tsparser.ast.Span;
import com.tsparser.ast.VariableField;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses binding targets: identifiers and array/object destructuring patterns.
 */
public final class PatternParser {

    private static final List<TokenType> FIELD_START =
        List.of(TokenType.IDENTIFIER, TokenType.LBRACKET, TokenType.LBRACE);

    private PatternParser() {
    }

    public static VariableField parseField(TokenReader reader, ParsingState state, ParseOptions options) {
        Token head = reader.peek().orElseThrow(() -> UnexpectedEndException.at(reader, FIELD_START, "binding"));
        return switch (head.type()) {
            case IDENTIFIER -> {
                reader.next();
                yield new Identifier(head.lexeme(), head.span());
            }
            case LBRACKET -> parseArrayPattern(reader, state, options);
            case LBRACE -> parseObjectPattern(reader, state, options);
            default -> throw new UnexpectedTokenException(head, FIELD_START);
        };
    }

    private static ArrayDestructuring parseArrayPattern(TokenReader reader, ParsingState state, ParseOptions options) {
        Token open = reader.expectNext(TokenType.LBRACKET);
        List<ArrayDestructuringMember> members = new ArrayList<>();

        while (!reader.check(TokenType.RBRACKET)) {
            Token head = reader.peek().orElseThrow(() ->
                UnexpectedEndException.at(reader, List.of(TokenType.RBRACKET), "array pattern"));

            if (head.type() == TokenType.COMMA) {
                reader.next();
                members.add(new ArrayDestructuringMember.Hole(Span.at(head.start())));
                continue;
            }

            if (head.type() == TokenType.DOT_DOT_DOT) {
                reader.next();
                VariableField target = parseField(reader, state, options);
                members.add(new ArrayDestructuringMember.Spread(target, new Span(head.start(), target.end())));
                rejectTrailingMembers(reader, "Rest element must be last in array pattern");
                break;
            }

            VariableField field = parseField(reader, state, options);
            Expression defaultValue = parseDefault(reader, state, options);
            int end = defaultValue != null ? defaultValue.end() : field.end();
            members.add(new ArrayDestructuringMember.Element(field, defaultValue, new Span(field.start(), end)));

            if (!reader.match(TokenType.COMMA)) {
                break;
            }
        }

        Token close = reader.expectNext(TokenType.RBRACKET);
        return new ArrayDestructuring(members, new Span(open.start(), close.end()));
    }

    private static ObjectDestructuring parseObjectPattern(TokenReader reader, ParsingState state, ParseOptions options) {
        Token open = reader.expectNext(TokenType.LBRACE);
        List<ObjectDestructuringMember> members = new ArrayList<>();

        while (!reader.check(TokenType.RBRACE)) {
            Token key = reader.next().orElseThrow(() ->
                UnexpectedEndException.at(reader, List.of(TokenType.RBRACE), "object pattern"));

            if (key.type() == TokenType.DOT_DOT_DOT) {
                Token name = reader.expectNext(TokenType.IDENTIFIER);
                Identifier target = new Identifier(name.lexeme(), name.span());
                members.add(new ObjectDestructuringMember.Spread(target, new Span(key.start(), name.end())));
                rejectTrailingMembers(reader, "Rest element must be last in object pattern");
                break;
            }

            if (reader.match(TokenType.COLON)) {
                // Keywords and strings are valid property keys
                if (key.type() != TokenType.IDENTIFIER && key.type() != TokenType.STRING && !key.type().isKeyword()) {
                    throw new UnexpectedTokenException(key, List.of(TokenType.IDENTIFIER, TokenType.STRING));
                }
                VariableField value = parseField(reader, state, options);
                Expression defaultValue = parseDefault(reader, state, options);
                int end = defaultValue != null ? defaultValue.end() : value.end();
                members.add(new ObjectDestructuringMember.Property(key.lexeme(), value, defaultValue,
                    new Span(key.start(), end)));
            } else {
                if (key.type() != TokenType.IDENTIFIER) {
                    throw new UnexpectedTokenException(key, List.of(TokenType.IDENTIFIER));
                }
                Identifier name = new Identifier(key.lexeme(), key.span());
                Expression defaultValue = parseDefault(reader, state, options);
                int end = defaultValue != null ? defaultValue.end() : key.end();
                members.add(new ObjectDestructuringMember.Shorthand(name, defaultValue, new Span(key.start(), end)));
            }

            if (!reader.match(TokenType.COMMA)) {
                break;
            }
        }

        Token close = reader.expectNext(TokenType.RBRACE);
        return new ObjectDestructuring(members, new Span(open.start(), close.end()));
    }

    private static Expression parseDefault(TokenReader reader, ParsingState state, ParseOptions options) {
        if (reader.match(TokenType.ASSIGN)) {
            return ExpressionParser.parse(reader, state, options);
        }
        return null;
    }

    private static void rejectTrailingMembers(TokenReader reader, String message) {
        if (reader.check(TokenType.COMMA)) {
            throw new ExpectedTokenException(message, reader.peek().get());
        }
    }
}
