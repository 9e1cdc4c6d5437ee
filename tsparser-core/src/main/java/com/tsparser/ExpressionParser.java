package com.tsparser;

import com.tsparser.ast.ArrayExpression;
import com.tsparser.ast.AssignmentExpression;
import com.tsparser.ast.AssignmentOperator;
import com.tsparser.ast.BinaryExpression;
import com.tsparser.ast.BinaryOperator;
import com.tsparser.ast.BooleanLiteral;
import com.tsparser.ast.CallExpression;
import com.tsparser.ast.ConditionalExpression;
import com.tsparser.ast.Expression;
import com.tsparser.ast.Identifier;
import com.tsparser.ast.MemberExpression;
import com.tsparser.ast.NullLiteral;
import com.tsparser.ast.NumberLiteral;
import com.tsparser.ast.ParenthesizedExpression;
import com.tsparser.ast.Span;
import com.tsparser.ast.StringLiteral;
import com.tsparser.ast.UnaryExpression;
import com.tsparser.ast.UnaryOperator;

import java.util.ArrayList;
import java.util.List;

/**
 * Pratt parser for initializer expressions. Parsing stops at a top-level comma,
 * so {@code const a = 1, b = 2} yields two declarations.
 */
public final class ExpressionParser {

    // Binding powers, lowest first
    private static final int BP_ASSIGNMENT = 2;     // right-associative
    private static final int BP_TERNARY = 3;
    private static final int BP_NULLISH = 4;
    private static final int BP_OR = 5;
    private static final int BP_AND = 6;
    private static final int BP_BIT_OR = 7;
    private static final int BP_BIT_XOR = 8;
    private static final int BP_BIT_AND = 9;
    private static final int BP_EQUALITY = 10;
    private static final int BP_RELATIONAL = 11;
    private static final int BP_SHIFT = 12;
    private static final int BP_ADDITIVE = 13;
    private static final int BP_MULTIPLICATIVE = 14;
    private static final int BP_EXPONENT = 15;      // right-associative
    private static final int BP_UNARY = 16;
    private static final int BP_POSTFIX = 17;

    private final TokenReader reader;

    private ExpressionParser(TokenReader reader) {
        this.reader = reader;
    }

    /** Has the {@link NodeReader} shape; expressions need neither state nor options. */
    public static Expression parse(TokenReader reader, ParsingState state, ParseOptions options) {
        return new ExpressionParser(reader).parseExpr(BP_ASSIGNMENT);
    }

    private Expression parseExpr(int minBp) {
        Expression left = parsePrefix();

        while (true) {
            Token token = reader.peek().orElse(null);
            if (token == null) {
                break;
            }
            TokenType tt = token.type();
            int lbp = switch (tt) {
                case ASSIGN, PLUS_ASSIGN, MINUS_ASSIGN, STAR_ASSIGN, SLASH_ASSIGN, PERCENT_ASSIGN,
                     STAR_STAR_ASSIGN, LEFT_SHIFT_ASSIGN, RIGHT_SHIFT_ASSIGN, UNSIGNED_RIGHT_SHIFT_ASSIGN,
                     BIT_AND_ASSIGN, BIT_OR_ASSIGN, BIT_XOR_ASSIGN, AND_ASSIGN, OR_ASSIGN,
                     QUESTION_QUESTION_ASSIGN -> BP_ASSIGNMENT;
                case QUESTION -> BP_TERNARY;
                case QUESTION_QUESTION -> BP_NULLISH;
                case OR -> BP_OR;
                case AND -> BP_AND;
                case BIT_OR -> BP_BIT_OR;
                case BIT_XOR -> BP_BIT_XOR;
                case BIT_AND -> BP_BIT_AND;
                case EQ, NE, EQ_STRICT, NE_STRICT -> BP_EQUALITY;
                case LT, LE, GT, GE, INSTANCEOF, IN -> BP_RELATIONAL;
                case LEFT_SHIFT, RIGHT_SHIFT, UNSIGNED_RIGHT_SHIFT -> BP_SHIFT;
                case PLUS, MINUS -> BP_ADDITIVE;
                case STAR, SLASH, PERCENT -> BP_MULTIPLICATIVE;
                case STAR_STAR -> BP_EXPONENT;
                case DOT, LBRACKET, LPAREN -> BP_POSTFIX;
                default -> -1;
            };
            if (lbp < 0 || lbp < minBp) {
                break;
            }
            reader.next();

            left = switch (tt) {
                case DOT -> parseMember(left);
                case LBRACKET -> parseComputedMember(left);
                case LPAREN -> parseCall(left);
                case QUESTION -> parseConditional(left);
                case STAR_STAR -> binary(left, tt, parseExpr(BP_EXPONENT));
                default -> {
                    AssignmentOperator assignment = AssignmentOperator.fromToken(tt);
                    if (assignment != null) {
                        yield parseAssignment(left, assignment, token);
                    }
                    // left-associative: RBP = LBP + 1
                    yield binary(left, tt, parseExpr(lbp + 1));
                }
            };
        }
        return left;
    }

    private Expression parsePrefix() {
        Token token = reader.next().orElseThrow(() -> UnexpectedEndException.at(reader, List.of(), "expression"));
        return switch (token.type()) {
            case NUMBER -> new NumberLiteral(token.lexeme(), (Double) token.literal(), token.span());
            case STRING -> new StringLiteral((String) token.literal(), token.lexeme(), token.span());
            case TRUE -> new BooleanLiteral(true, token.span());
            case FALSE -> new BooleanLiteral(false, token.span());
            case NULL -> new NullLiteral(token.span());
            case IDENTIFIER -> new Identifier(token.lexeme(), token.span());
            case LPAREN -> {
                Expression inner = parseExpr(BP_ASSIGNMENT);
                Token close = reader.expectNext(TokenType.RPAREN);
                yield new ParenthesizedExpression(inner, new Span(token.start(), close.end()));
            }
            case LBRACKET -> parseArray(token);
            case BANG, MINUS, PLUS, TILDE, TYPEOF, VOID -> {
                Expression argument = parseExpr(BP_UNARY);
                yield new UnaryExpression(UnaryOperator.fromToken(token.type()), argument,
                    new Span(token.start(), argument.end()));
            }
            default -> throw new UnexpectedTokenException(token, "expression");
        };
    }

    private Expression parseArray(Token open) {
        List<Expression> elements = new ArrayList<>();
        while (!reader.check(TokenType.RBRACKET)) {
            elements.add(parseExpr(BP_ASSIGNMENT));
            if (!reader.match(TokenType.COMMA)) {
                break;
            }
        }
        Token close = reader.expectNext(TokenType.RBRACKET);
        return new ArrayExpression(elements, new Span(open.start(), close.end()));
    }

    private Expression parseMember(Expression object) {
        Token name = reader.next().orElseThrow(() ->
            UnexpectedEndException.at(reader, List.of(TokenType.IDENTIFIER), "member access"));
        // Keywords are valid property names after a dot
        if (name.type() != TokenType.IDENTIFIER && !name.type().isKeyword()) {
            throw new UnexpectedTokenException(name, List.of(TokenType.IDENTIFIER));
        }
        Identifier property = new Identifier(name.lexeme(), name.span());
        return new MemberExpression(object, property, false, new Span(object.start(), name.end()));
    }

    private Expression parseComputedMember(Expression object) {
        Expression property = parseExpr(BP_ASSIGNMENT);
        Token close = reader.expectNext(TokenType.RBRACKET);
        return new MemberExpression(object, property, true, new Span(object.start(), close.end()));
    }

    private Expression parseCall(Expression callee) {
        List<Expression> arguments = new ArrayList<>();
        while (!reader.check(TokenType.RPAREN)) {
            arguments.add(parseExpr(BP_ASSIGNMENT));
            if (!reader.match(TokenType.COMMA)) {
                break;
            }
        }
        Token close = reader.expectNext(TokenType.RPAREN);
        return new CallExpression(callee, arguments, new Span(callee.start(), close.end()));
    }

    private Expression parseConditional(Expression test) {
        Expression consequent = parseExpr(BP_ASSIGNMENT);
        reader.expectNext(TokenType.COLON);
        Expression alternate = parseExpr(BP_ASSIGNMENT);
        return new ConditionalExpression(test, consequent, alternate, new Span(test.start(), alternate.end()));
    }

    private Expression parseAssignment(Expression target, AssignmentOperator operator, Token op) {
        if (!(target instanceof Identifier) && !(target instanceof MemberExpression)) {
            throw new ExpectedTokenException("Invalid left-hand side in assignment", op);
        }
        Expression value = parseExpr(BP_ASSIGNMENT); // right-associative
        return new AssignmentExpression(operator, target, value, new Span(target.start(), value.end()));
    }

    private static Expression binary(Expression left, TokenType op, Expression right) {
        return new BinaryExpression(BinaryOperator.fromToken(op), left, right, new Span(left.start(), right.end()));
    }
}
