package com.tsparser;

import com.tsparser.ast.Span;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts source text into tokens. Line comments are always dropped; block
 * comments become {@link TokenType#MULTI_LINE_COMMENT} tokens when
 * {@link ParseOptions#comments()} is set.
 */
public class Lexer {
    private final String source;
    private final ParseOptions options;
    private final List<Token> tokens = new ArrayList<>();

    private int position = 0;
    private int line = 1;

    // Start of the token being scanned
    private int tokenStart = 0;
    private int tokenLine = 1;

    public Lexer(String source) {
        this(source, ParseOptions.DEFAULT);
    }

    public Lexer(String source, ParseOptions options) {
        this.source = source;
        this.options = options;
    }

    public List<Token> tokenize() {
        while (true) {
            skipWhitespaceAndLineComments();
            if (isAtEnd()) {
                break;
            }
            tokenStart = position;
            tokenLine = line;
            scanToken();
        }
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(' -> add(TokenType.LPAREN);
            case ')' -> add(TokenType.RPAREN);
            case '[' -> add(TokenType.LBRACKET);
            case ']' -> add(TokenType.RBRACKET);
            case '{' -> add(TokenType.LBRACE);
            case '}' -> add(TokenType.RBRACE);
            case ',' -> add(TokenType.COMMA);
            case ';' -> add(TokenType.SEMICOLON);
            case ':' -> add(TokenType.COLON);
            case '~' -> add(TokenType.TILDE);
            case '.' -> {
                if (isDigit(peek())) {
                    scanNumber();
                } else if (peek() == '.' && peekNext() == '.') {
                    position += 2;
                    add(TokenType.DOT_DOT_DOT);
                } else {
                    add(TokenType.DOT);
                }
            }
            case '?' -> {
                if (match('?')) {
                    add(match('=') ? TokenType.QUESTION_QUESTION_ASSIGN : TokenType.QUESTION_QUESTION);
                } else {
                    add(TokenType.QUESTION);
                }
            }
            case '=' -> {
                if (match('=')) {
                    add(match('=') ? TokenType.EQ_STRICT : TokenType.EQ);
                } else if (match('>')) {
                    add(TokenType.ARROW);
                } else {
                    add(TokenType.ASSIGN);
                }
            }
            case '!' -> {
                if (match('=')) {
                    add(match('=') ? TokenType.NE_STRICT : TokenType.NE);
                } else {
                    add(TokenType.BANG);
                }
            }
            case '+' -> add(match('=') ? TokenType.PLUS_ASSIGN : TokenType.PLUS);
            case '-' -> add(match('=') ? TokenType.MINUS_ASSIGN : TokenType.MINUS);
            case '%' -> add(match('=') ? TokenType.PERCENT_ASSIGN : TokenType.PERCENT);
            case '^' -> add(match('=') ? TokenType.BIT_XOR_ASSIGN : TokenType.BIT_XOR);
            case '*' -> {
                if (match('*')) {
                    add(match('=') ? TokenType.STAR_STAR_ASSIGN : TokenType.STAR_STAR);
                } else {
                    add(match('=') ? TokenType.STAR_ASSIGN : TokenType.STAR);
                }
            }
            case '/' -> {
                if (match('*')) {
                    scanBlockComment();
                } else {
                    add(match('=') ? TokenType.SLASH_ASSIGN : TokenType.SLASH);
                }
            }
            case '&' -> {
                if (match('&')) {
                    add(match('=') ? TokenType.AND_ASSIGN : TokenType.AND);
                } else {
                    add(match('=') ? TokenType.BIT_AND_ASSIGN : TokenType.BIT_AND);
                }
            }
            case '|' -> {
                if (match('|')) {
                    add(match('=') ? TokenType.OR_ASSIGN : TokenType.OR);
                } else {
                    add(match('=') ? TokenType.BIT_OR_ASSIGN : TokenType.BIT_OR);
                }
            }
            case '<' -> {
                if (match('<')) {
                    add(match('=') ? TokenType.LEFT_SHIFT_ASSIGN : TokenType.LEFT_SHIFT);
                } else {
                    add(match('=') ? TokenType.LE : TokenType.LT);
                }
            }
            case '>' -> scanGreaterThan();
            case '"', '\'' -> scanString(c);
            default -> {
                if (isDigit(c)) {
                    scanNumber();
                } else if (isIdentifierStart(c)) {
                    scanIdentifier();
                } else {
                    throw new ParseException("LexError", new Span(tokenStart, position), null,
                        "Unexpected character '" + c + "'");
                }
            }
        }
    }

    // Generic argument lists close with '>>' too; the type parser splits these tokens itself
    private void scanGreaterThan() {
        if (match('>')) {
            if (match('>')) {
                add(match('=') ? TokenType.UNSIGNED_RIGHT_SHIFT_ASSIGN : TokenType.UNSIGNED_RIGHT_SHIFT);
            } else {
                add(match('=') ? TokenType.RIGHT_SHIFT_ASSIGN : TokenType.RIGHT_SHIFT);
            }
        } else {
            add(match('=') ? TokenType.GE : TokenType.GT);
        }
    }

    private void skipWhitespaceAndLineComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == '\n') {
                line++;
                position++;
            } else if (c == ' ' || c == '\t' || c == '\r' || c == '\f' || c == '\u000B'
                || c == '\u00A0' || c == '\uFEFF') {
                position++;
            } else if (c == '/' && peekNext() == '/') {
                while (!isAtEnd() && peek() != '\n') {
                    position++;
                }
            } else {
                return;
            }
        }
    }

    private void scanBlockComment() {
        int bodyStart = position;
        while (!(peek() == '*' && peekNext() == '/')) {
            if (isAtEnd()) {
                throw new ParseException("LexError", new Span(tokenStart, position), "comment",
                    "Unterminated comment");
            }
            if (advance() == '\n') {
                line++;
            }
        }
        String body = source.substring(bodyStart, position);
        position += 2;
        if (options.comments()) {
            add(TokenType.MULTI_LINE_COMMENT, body);
        }
    }

    private void scanString(char quote) {
        StringBuilder value = new StringBuilder();
        while (true) {
            if (isAtEnd() || peek() == '\n') {
                throw new ParseException("LexError", new Span(tokenStart, position), "string literal",
                    "Unterminated string literal");
            }
            char c = advance();
            if (c == quote) {
                break;
            }
            if (c == '\\') {
                scanEscape(value);
            } else {
                value.append(c);
            }
        }
        add(TokenType.STRING, value.toString());
    }

    private void scanEscape(StringBuilder value) {
        if (isAtEnd()) {
            throw new ParseException("LexError", new Span(tokenStart, position), "string literal",
                "Unterminated string literal");
        }
        char c = advance();
        switch (c) {
            case 'n' -> value.append('\n');
            case 't' -> value.append('\t');
            case 'r' -> value.append('\r');
            case 'b' -> value.append('\b');
            case 'f' -> value.append('\f');
            case 'v' -> value.append('\u000B');
            case '0' -> value.append('\0');
            case 'x' -> value.append((char) readHex(2));
            case 'u' -> {
                if (match('{')) {
                    int start = position;
                    while (!isAtEnd() && peek() != '}') {
                        position++;
                    }
                    int codePoint = parseHex(source.substring(start, position), start);
                    if (!match('}')) {
                        throw new ParseException("LexError", new Span(tokenStart, position), "string literal",
                            "Unterminated string literal");
                    }
                    value.appendCodePoint(codePoint);
                } else {
                    value.append((char) readHex(4));
                }
            }
            case '\r' -> {
                if (match('\n')) {
                    line++;
                }
            }
            case '\n' -> line++;
            default -> value.append(c);
        }
    }

    private int readHex(int digits) {
        int start = position;
        if (position + digits > source.length()) {
            throw new ParseException("LexError", new Span(start, source.length()), "string literal",
                "Invalid escape sequence");
        }
        position += digits;
        return parseHex(source.substring(start, position), start);
    }

    private int parseHex(String digits, int start) {
        int value = 0;
        for (int i = 0; i < digits.length(); i++) {
            int digit = Character.digit(digits.charAt(i), 16);
            if (digit < 0) {
                throw new ParseException("LexError", new Span(start, position), "string literal",
                    "Invalid escape sequence '" + digits + "'");
            }
            value = value * 16 + digit;
            if (value > Character.MAX_CODE_POINT) {
                throw new ParseException("LexError", new Span(start, position), "string literal",
                    "Code point out of range in '\\u{" + digits + "}'");
            }
        }
        if (digits.isEmpty()) {
            throw new ParseException("LexError", new Span(start, position), "string literal",
                "Invalid escape sequence");
        }
        return value;
    }

    private void scanNumber() {
        char first = source.charAt(tokenStart);
        if (first == '0' && (peek() == 'x' || peek() == 'X' || peek() == 'o' || peek() == 'O'
            || peek() == 'b' || peek() == 'B')) {
            char prefix = Character.toLowerCase(advance());
            int radix = prefix == 'x' ? 16 : prefix == 'o' ? 8 : 2;
            int digitsStart = position;
            while (Character.digit(peek(), radix) >= 0 || peek() == '_') {
                position++;
            }
            String digits = source.substring(digitsStart, position).replace("_", "");
            if (digits.isEmpty()) {
                throw new ParseException("LexError", new Span(tokenStart, position), "number literal",
                    "Missing digits after '0" + prefix + "'");
            }
            add(TokenType.NUMBER, new BigInteger(digits, radix).doubleValue());
            return;
        }

        while (isDigit(peek()) || peek() == '_') {
            position++;
        }
        if (peek() == '.' && first != '.') {
            position++;
        }
        while (isDigit(peek()) || peek() == '_') {
            position++;
        }
        if (peek() == 'e' || peek() == 'E') {
            int mark = position;
            position++;
            if (peek() == '+' || peek() == '-') {
                position++;
            }
            if (!isDigit(peek())) {
                position = mark;
            }
            while (isDigit(peek())) {
                position++;
            }
        }
        String text = source.substring(tokenStart, position).replace("_", "");
        add(TokenType.NUMBER, Double.parseDouble(text));
    }

    private void scanIdentifier() {
        while (isIdentifierPart(peek())) {
            position++;
        }
        String word = source.substring(tokenStart, position);
        add(TokenType.keywordOrIdentifier(word));
    }

    private void add(TokenType type) {
        add(type, null);
    }

    private void add(TokenType type, Object literal) {
        String lexeme = source.substring(tokenStart, position);
        tokens.add(new Token(type, lexeme, literal, new Span(tokenStart, position), tokenLine, line));
    }

    private boolean isAtEnd() {
        return position >= source.length();
    }

    private char advance() {
        return source.charAt(position++);
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(position) != expected) {
            return false;
        }
        position++;
        return true;
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(position);
    }

    private char peekNext() {
        return position + 1 >= source.length() ? '\0' : source.charAt(position + 1);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return c == '$' || c == '_' || Character.isLetter(c);
    }

    private static boolean isIdentifierPart(char c) {
        return c == '$' || c == '_' || Character.isLetterOrDigit(c);
    }
}
