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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TypeReferenceParserTest {

    private static TypeReference parse(String source) {
        return new TypeReferenceParser(new TokenStream(Parser.tokenize(source))).parse();
    }

    @Test
    void testNamedType() {
        NamedType type = assertInstanceOf(NamedType.class, parse("number"));
        assertEquals("number", type.name());
        assertTrue(type.typeArguments().isEmpty());
    }

    @Test
    void testDottedName() {
        NamedType type = assertInstanceOf(NamedType.class, parse("ns.Item"));
        assertEquals("ns.Item", type.name());
        assertEquals(new Span(0, 7), type.getPosition());
    }

    @Test
    void testUnion() {
        UnionType union = assertInstanceOf(UnionType.class, parse("string | number"));
        assertEquals(2, union.members().size());
        assertEquals("string | number", union.toSource());
        assertEquals("string|number", union.toSource(ToStringOptions.COMPACT));
    }

    @Test
    void testIntersectionBindsTighterThanUnion() {
        UnionType union = assertInstanceOf(UnionType.class, parse("A & B | C"));
        assertInstanceOf(IntersectionType.class, union.members().get(0));
    }

    @Test
    @DisplayName("'>>' closes two generic argument lists")
    void testNestedGenericsWithShiftToken() {
        NamedType map = assertInstanceOf(NamedType.class, parse("Map<string, Array<number>>"));
        assertEquals(2, map.typeArguments().size());
        NamedType array = assertInstanceOf(NamedType.class, map.typeArguments().get(1));
        assertEquals("Array", array.name());
        assertEquals(new Span(12, 25), array.getPosition());
        assertEquals(new Span(0, 26), map.getPosition());
        assertEquals("Map<string, Array<number>>", map.toSource());
    }

    @Test
    @DisplayName("'>>>' closes three generic argument lists")
    void testNestedGenericsWithUnsignedShiftToken() {
        NamedType a = assertInstanceOf(NamedType.class, parse("A<B<C<D>>>"));
        NamedType b = assertInstanceOf(NamedType.class, a.typeArguments().get(0));
        NamedType c = assertInstanceOf(NamedType.class, b.typeArguments().get(0));
        assertEquals(new Span(4, 8), c.getPosition());
        assertEquals(new Span(2, 9), b.getPosition());
        assertEquals(new Span(0, 10), a.getPosition());
        assertEquals("A<B<C<D>>>", a.toSource());
    }

    @Test
    void testArraySuffixes() {
        ArrayType outer = assertInstanceOf(ArrayType.class, parse("string[][]"));
        assertInstanceOf(ArrayType.class, outer.elementType());
        assertInstanceOf(ArrayType.class, parse("Array<number>[]"));
    }

    @Test
    void testParenthesizedUnionArray() {
        ArrayType array = assertInstanceOf(ArrayType.class, parse("(A | B)[]"));
        assertInstanceOf(ParenthesizedType.class, array.elementType());
        assertEquals("(A | B)[]", array.toSource());
    }

    @Test
    void testTuple() {
        TupleType tuple = assertInstanceOf(TupleType.class, parse("[number, string]"));
        assertEquals(2, tuple.elements().size());
        assertEquals("[number,string]", tuple.toSource(ToStringOptions.COMPACT));
    }

    @Test
    void testLiteralTypes() {
        UnionType union = assertInstanceOf(UnionType.class, parse("'a' | 42 | -1 | true | null"));
        assertEquals(5, union.members().size());
        LiteralType negative = assertInstanceOf(LiteralType.class, union.members().get(2));
        assertEquals("-1", negative.raw());
        assertEquals("'a' | 42 | -1 | true | null", union.toSource());
    }

    @Test
    void testVoid() {
        assertEquals("void", assertInstanceOf(NamedType.class, parse("void")).name());
    }

    @Test
    void testUnclosedTypeArguments() {
        UnexpectedEndException end = assertThrows(UnexpectedEndException.class, () -> parse("Map<string"));
        assertEquals(List.of(TokenType.GT), end.getExpectedTypes());

        UnexpectedTokenException wrong = assertThrows(UnexpectedTokenException.class, () -> parse("Map<string;"));
        assertEquals(List.of(TokenType.GT), wrong.getExpectedTypes());
        assertEquals(";", wrong.getFound().lexeme());
    }

    @Test
    void testMissingType() {
        assertThrows(UnexpectedTokenException.class, () -> parse("= 1"));
        assertThrows(UnexpectedEndException.class, () -> parse(""));
    }

    @Test
    @DisplayName("'>=' after type arguments leaves '=' for the caller")
    void testGreaterEqualClosesTypeArguments() {
        TokenStream tokens = new TokenStream(Parser.tokenize("Array<number>= []"));
        NamedType array = assertInstanceOf(NamedType.class, new TypeReferenceParser(tokens).parse());
        assertEquals(new Span(0, 13), array.getPosition());
        Token rest = tokens.next().orElseThrow();
        assertEquals(TokenType.ASSIGN, rest.type());
        assertEquals(new Span(13, 14), rest.span());
    }

    @Test
    void testShiftAssignClosesTypeArguments() {
        TokenStream tokens = new TokenStream(Parser.tokenize("A<B<C>>= x"));
        assertEquals("A<B<C>>", new TypeReferenceParser(tokens).parse().toSource());
        assertEquals(TokenType.ASSIGN, tokens.next().orElseThrow().type());
    }

    @Test
    @DisplayName("A '>' beyond the open argument lists stays in the stream")
    void testExtraCloserIsNotConsumed() {
        TokenStream tokens = new TokenStream(Parser.tokenize("Array<number>> = 1"));
        assertEquals("Array<number>", new TypeReferenceParser(tokens).parse().toSource());
        Token stray = tokens.peek().orElseThrow();
        assertEquals(TokenType.GT, stray.type());
        assertEquals(new Span(13, 14), stray.span());

        tokens = new TokenStream(Parser.tokenize("Array<Array<number>>>"));
        assertEquals("Array<Array<number>>", new TypeReferenceParser(tokens).parse().toSource());
        assertEquals(TokenType.GT, tokens.next().orElseThrow().type());
        assertTrue(tokens.isAtEnd());
    }
}
