package com.tsparser;

import com.tsparser.ast.ArrayDestructuring;
import com.tsparser.ast.ArrayDestructuringMember;
import com.tsparser.ast.Identifier;
import com.tsparser.ast.ObjectDestructuring;
import com.tsparser.ast.ObjectDestructuringMember;
import com.tsparser.ast.Span;
import com.tsparser.ast.VariableField;
import com.tsparser.ast.VariableStatement;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PatternParserTest {

    private static VariableField parseField(String source) {
        TokenStream tokens = new TokenStream(Parser.tokenize(source));
        return PatternParser.parseField(tokens, new ParsingState(source.length()), ParseOptions.DEFAULT);
    }

    @Test
    void testIdentifier() {
        Identifier id = assertInstanceOf(Identifier.class, parseField("count"));
        assertEquals("count", id.name());
        assertEquals(new Span(0, 5), id.getPosition());
    }

    @Test
    void testArrayPatternMembers() {
        ArrayDestructuring pattern = assertInstanceOf(ArrayDestructuring.class, parseField("[a, , b = 2, ...rest]"));
        List<ArrayDestructuringMember> members = pattern.members();
        assertEquals(4, members.size());
        assertInstanceOf(ArrayDestructuringMember.Element.class, members.get(0));
        ArrayDestructuringMember.Hole hole = assertInstanceOf(ArrayDestructuringMember.Hole.class, members.get(1));
        assertEquals(Span.at(4), hole.getPosition());
        ArrayDestructuringMember.Element withDefault =
            assertInstanceOf(ArrayDestructuringMember.Element.class, members.get(2));
        assertNotNull(withDefault.defaultValue());
        assertEquals(new Span(6, 11), withDefault.getPosition());
        assertInstanceOf(ArrayDestructuringMember.Spread.class, members.get(3));
        assertEquals(new Span(0, 21), pattern.getPosition());
    }

    @Test
    void testArrayPatternPrinting() {
        assertEquals("[a,, b = 2, ...rest]", parseField("[a, , b = 2, ...rest]").toSource());
        assertEquals("[, b]", parseField("[, b]").toSource());
        assertEquals("[a,b=2]", parseField("[a, b = 2]").toSource(ToStringOptions.COMPACT));
        assertEquals("[a,,]", parseField("[a, ,]").toSource(ToStringOptions.COMPACT));
    }

    @Test
    void testNestedPatterns() {
        ArrayDestructuring pattern = assertInstanceOf(ArrayDestructuring.class, parseField("[[x, y], { z }]"));
        ArrayDestructuringMember.Element first =
            assertInstanceOf(ArrayDestructuringMember.Element.class, pattern.members().get(0));
        assertInstanceOf(ArrayDestructuring.class, first.field());
        ArrayDestructuringMember.Element second =
            assertInstanceOf(ArrayDestructuringMember.Element.class, pattern.members().get(1));
        assertInstanceOf(ObjectDestructuring.class, second.field());
    }

    @Test
    void testRestMustBeLastInArray() {
        ExpectedTokenException e = assertThrows(ExpectedTokenException.class, () -> parseField("[...rest, a]"));
        assertTrue(e.getMessage().contains("Rest element must be last in array pattern"));
        assertEquals(TokenType.COMMA, e.getToken().type());
    }

    @Test
    void testObjectPatternMembers() {
        ObjectDestructuring pattern =
            assertInstanceOf(ObjectDestructuring.class, parseField("{ a, b: [c], d = 1, ...others }"));
        List<ObjectDestructuringMember> members = pattern.members();
        assertEquals(4, members.size());
        assertInstanceOf(ObjectDestructuringMember.Shorthand.class, members.get(0));
        ObjectDestructuringMember.Property renamed =
            assertInstanceOf(ObjectDestructuringMember.Property.class, members.get(1));
        assertEquals("b", renamed.key());
        assertInstanceOf(ArrayDestructuring.class, renamed.value());
        ObjectDestructuringMember.Shorthand withDefault =
            assertInstanceOf(ObjectDestructuringMember.Shorthand.class, members.get(2));
        assertNotNull(withDefault.defaultValue());
        assertInstanceOf(ObjectDestructuringMember.Spread.class, members.get(3));
    }

    @Test
    void testObjectPatternPrinting() {
        String source = "{ a, b: [c], d = 1, ...others }";
        assertEquals(source, parseField(source).toSource());
        assertEquals("{a,b:[c],d=1,...others}", parseField(source).toSource(ToStringOptions.COMPACT));
        assertEquals("{}", parseField("{}").toSource());
    }

    @Test
    void testKeywordAndStringKeys() {
        ObjectDestructuring pattern =
            assertInstanceOf(ObjectDestructuring.class, parseField("{ default: d, 'x-y': xy }"));
        assertEquals("default", ((ObjectDestructuringMember.Property) pattern.members().get(0)).key());
        assertEquals("'x-y'", ((ObjectDestructuringMember.Property) pattern.members().get(1)).key());
    }

    @Test
    void testRestMustBeLastInObject() {
        ExpectedTokenException e = assertThrows(ExpectedTokenException.class, () -> parseField("{ ...rest, a }"));
        assertTrue(e.getMessage().contains("Rest element must be last in object pattern"));
    }

    @Test
    void testInvalidBindingStart() {
        UnexpectedTokenException e = assertThrows(UnexpectedTokenException.class, () -> parseField("5"));
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.LBRACKET, TokenType.LBRACE), e.getExpectedTypes());
        assertThrows(UnexpectedTokenException.class, () -> parseField("const"));
    }

    @Test
    void testDestructuringDeclarationRoundTrip() {
        String source = "const { a, b: [c], d = 1, ...others } = obj";
        VariableStatement statement = Parser.parseVariableStatement(source);
        assertEquals(source, statement.toSource());
        assertEquals("const {a,b:[c],d=1,...others}=obj", statement.toSource(ToStringOptions.COMPACT));
    }
}
