package com.tsparser;

import com.tsparser.ast.ArrayType;
import com.tsparser.ast.IntersectionType;
import com.tsparser.ast.LiteralType;
import com.tsparser.ast.NamedType;
import com.tsparser.ast.ParenthesizedType;
import com.tsparser.ast.Span;
import com.tsparser.ast.TupleType;
import com.tsparser.ast.TypeReference;
import com.tsparser.ast.UnionType;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for type annotations.
 *
 * <p>The lexer reads {@code >>}, {@code >=} and the like as single operators.
 * When one of them closes a generic argument list, only its leading {@code >}
 * is consumed and the rest goes back to the reader, so {@code Array<number>= []}
 * leaves an {@code =} and a stray {@code >} is left for the caller to reject.
 */
public class TypeReferenceParser {

    private final TokenReader reader;

    public TypeReferenceParser(TokenReader reader) {
        this.reader = reader;
    }

    public TypeReference parse() {
        return parseUnion();
    }

    private TypeReference parseUnion() {
        TypeReference first = parseIntersection();
        if (!reader.check(TokenType.BIT_OR)) {
            return first;
        }
        List<TypeReference> members = new ArrayList<>();
        members.add(first);
        while (reader.check(TokenType.BIT_OR)) {
            reader.next();
            members.add(parseIntersection());
        }
        return new UnionType(members, new Span(first.start(), members.get(members.size() - 1).end()));
    }

    private TypeReference parseIntersection() {
        TypeReference first = parsePostfix();
        if (!reader.check(TokenType.BIT_AND)) {
            return first;
        }
        List<TypeReference> members = new ArrayList<>();
        members.add(first);
        while (reader.check(TokenType.BIT_AND)) {
            reader.next();
            members.add(parsePostfix());
        }
        return new IntersectionType(members, new Span(first.start(), members.get(members.size() - 1).end()));
    }

    private TypeReference parsePostfix() {
        TypeReference type = parsePrimary();
        while (reader.check(TokenType.LBRACKET)) {
            reader.next();
            Token close = reader.expectNext(TokenType.RBRACKET);
            type = new ArrayType(type, new Span(type.start(), close.end()));
        }
        return type;
    }

    private TypeReference parsePrimary() {
        Token token = reader.next().orElseThrow(() -> UnexpectedEndException.at(reader, List.of(), "type"));
        return switch (token.type()) {
            case IDENTIFIER -> parseNamed(token);
            case VOID -> new NamedType(token.lexeme(), List.of(), token.span());
            case STRING, NUMBER, TRUE, FALSE, NULL -> new LiteralType(token.lexeme(), token.span());
            case MINUS -> {
                Token number = reader.expectNext(TokenType.NUMBER);
                yield new LiteralType("-" + number.lexeme(), new Span(token.start(), number.end()));
            }
            case LBRACKET -> parseTuple(token);
            case LPAREN -> {
                TypeReference inner = parseUnion();
                Token close = reader.expectNext(TokenType.RPAREN);
                yield new ParenthesizedType(inner, new Span(token.start(), close.end()));
            }
            default -> throw new UnexpectedTokenException(token, "type");
        };
    }

    private TypeReference parseNamed(Token first) {
        StringBuilder name = new StringBuilder(first.lexeme());
        int end = first.end();
        while (reader.match(TokenType.DOT)) {
            Token part = reader.expectNext(TokenType.IDENTIFIER);
            name.append('.').append(part.lexeme());
            end = part.end();
        }

        List<TypeReference> arguments = new ArrayList<>();
        if (reader.match(TokenType.LT)) {
            arguments.add(parseUnion());
            while (reader.check(TokenType.COMMA)) {
                reader.next();
                arguments.add(parseUnion());
            }
            end = closeAngle();
        }
        return new NamedType(name.toString(), arguments, new Span(first.start(), end));
    }

    private TypeReference parseTuple(Token open) {
        List<TypeReference> elements = new ArrayList<>();
        while (!reader.check(TokenType.RBRACKET)) {
            elements.add(parseUnion());
            if (!reader.match(TokenType.COMMA)) {
                break;
            }
        }
        Token close = reader.expectNext(TokenType.RBRACKET);
        return new TupleType(elements, new Span(open.start(), close.end()));
    }

    /** Consumes one {@code >} and returns the offset just after it. */
    private int closeAngle() {
        Token token = reader.peek().orElseThrow(() ->
            UnexpectedEndException.at(reader, List.of(TokenType.GT), "type arguments"));
        TokenType remainder = switch (token.type()) {
            case GT -> null;
            case RIGHT_SHIFT -> TokenType.GT;
            case UNSIGNED_RIGHT_SHIFT -> TokenType.RIGHT_SHIFT;
            case GE -> TokenType.ASSIGN;
            case RIGHT_SHIFT_ASSIGN -> TokenType.GE;
            case UNSIGNED_RIGHT_SHIFT_ASSIGN -> TokenType.RIGHT_SHIFT_ASSIGN;
            default -> throw new UnexpectedTokenException(token, List.of(TokenType.GT));
        };
        if (remainder == null) {
            return reader.next().get().end();
        }
        return reader.splitNext(TokenType.GT, 1, remainder).end();
    }
}
