package com.tsparser;

import com.tsparser.ast.AssignmentExpression;
import com.tsparser.ast.BinaryExpression;
import com.tsparser.ast.BinaryOperator;
import com.tsparser.ast.CallExpression;
import com.tsparser.ast.Expression;
import com.tsparser.ast.MemberExpression;
import com.tsparser.ast.NumberLiteral;
import com.tsparser.ast.Span;
import com.tsparser.ast.StringLiteral;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ExpressionParserTest {

    private static Expression parse(String source) {
        TokenStream tokens = new TokenStream(Parser.tokenize(source));
        return ExpressionParser.parse(tokens, new ParsingState(source.length()), ParseOptions.DEFAULT);
    }

    private static void assertRoundTrip(String source) {
        assertEquals(source, parse(source).toSource());
    }

    @Test
    void testMultiplicationBindsTighter() {
        BinaryExpression sum = assertInstanceOf(BinaryExpression.class, parse("a + b * c"));
        assertEquals(BinaryOperator.ADD, sum.operator());
        BinaryExpression product = assertInstanceOf(BinaryExpression.class, sum.right());
        assertEquals(BinaryOperator.MULTIPLY, product.operator());
    }

    @Test
    void testSubtractionIsLeftAssociative() {
        BinaryExpression outer = assertInstanceOf(BinaryExpression.class, parse("a - b - c"));
        assertInstanceOf(BinaryExpression.class, outer.left());
    }

    @Test
    void testExponentIsRightAssociative() {
        BinaryExpression outer = assertInstanceOf(BinaryExpression.class, parse("a ** b ** c"));
        assertInstanceOf(BinaryExpression.class, outer.right());
    }

    @Test
    void testAssignmentIsRightAssociative() {
        AssignmentExpression outer = assertInstanceOf(AssignmentExpression.class, parse("a = b = 1"));
        assertInstanceOf(AssignmentExpression.class, outer.value());
    }

    @Test
    @DisplayName("Pretty output reproduces conventionally spaced source")
    void testPrettyRoundTrips() {
        assertRoundTrip("x ? 1 : 2");
        assertRoundTrip("foo(1, 2).bar[0]");
        assertRoundTrip("a ?? b || c && !d");
        assertRoundTrip("[1, 'two', null, true]");
        assertRoundTrip("typeof x === \"string\"");
        assertRoundTrip("(a + b) * c");
        assertRoundTrip("total += -delta");
        assertRoundTrip("a instanceof B");
    }

    @Test
    void testCompactOutput() {
        assertEquals("x?1:2", parse("x ? 1 : 2").toSource(ToStringOptions.COMPACT));
        assertEquals("[1,2,3]", parse("[1, 2, 3]").toSource(ToStringOptions.COMPACT));
        assertEquals("typeof x", parse("typeof x").toSource(ToStringOptions.COMPACT));
        assertEquals("a in b", parse("a in b").toSource(ToStringOptions.COMPACT));
        assertEquals("f(a,b+1)", parse("f(a, b + 1)").toSource(ToStringOptions.COMPACT));
    }

    @Test
    void testSpans() {
        CallExpression call = assertInstanceOf(CallExpression.class, parse("foo(1)"));
        assertEquals(new Span(0, 6), call.getPosition());
        NumberLiteral argument = assertInstanceOf(NumberLiteral.class, call.arguments().get(0));
        assertEquals(new Span(4, 5), argument.getPosition());
    }

    @Test
    void testKeywordAsPropertyName() {
        MemberExpression member = assertInstanceOf(MemberExpression.class, parse("config.const"));
        assertFalse(member.computed());
        assertEquals("config.const", member.toSource());
    }

    @Test
    void testLiteralValues() {
        assertEquals(255.0, assertInstanceOf(NumberLiteral.class, parse("0xFF")).value());
        StringLiteral string = assertInstanceOf(StringLiteral.class, parse("'it\\'s'"));
        assertEquals("it's", string.value());
        assertEquals("'it\\'s'", string.raw());
    }

    @Test
    void testStopsAtTopLevelComma() {
        TokenStream tokens = new TokenStream(Parser.tokenize("f(a, b), c"));
        ExpressionParser.parse(tokens, new ParsingState(10), ParseOptions.DEFAULT);
        assertTrue(tokens.check(TokenType.COMMA));
        assertEquals(6, tokens.position());
    }

    @Test
    void testInvalidAssignmentTarget() {
        ExpectedTokenException e = assertThrows(ExpectedTokenException.class, () -> parse("1 = 2"));
        assertTrue(e.getMessage().contains("Invalid left-hand side in assignment"));
        assertEquals(TokenType.ASSIGN, e.getToken().type());
    }

    @Test
    void testUnexpectedToken() {
        UnexpectedTokenException e = assertThrows(UnexpectedTokenException.class, () -> parse(")"));
        assertEquals(")", e.getFound().lexeme());
    }

    @Test
    void testEmptyInput() {
        assertThrows(UnexpectedEndException.class, () -> parse(""));
        assertThrows(UnexpectedEndException.class, () -> parse("a +"));
    }

    @Test
    void testUnclosedCall() {
        UnexpectedEndException e = assertThrows(UnexpectedEndException.class, () -> parse("f(1"));
        assertEquals(java.util.List.of(TokenType.RPAREN), e.getExpectedTypes());
    }
}
