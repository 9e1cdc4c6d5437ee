package com.tsparser;

public enum TokenType {
    // Literals and names
    IDENTIFIER("identifier"),
    NUMBER("number"),
    STRING("string"),
    MULTI_LINE_COMMENT("comment"),

    // Keywords
    CONST("const"),
    LET("let"),
    VAR("var"),
    TRUE("true"),
    FALSE("false"),
    NULL("null"),
    TYPEOF("typeof"),
    VOID("void"),
    IN("in"),
    INSTANCEOF("instanceof"),

    // Punctuation
    LPAREN("("),
    RPAREN(")"),
    LBRACKET("["),
    RBRACKET("]"),
    LBRACE("{"),
    RBRACE("}"),
    COMMA(","),
    SEMICOLON(";"),
    COLON(":"),
    DOT("."),
    DOT_DOT_DOT("..."),
    QUESTION("?"),
    QUESTION_QUESTION("??"),
    ARROW("=>"),

    // Assignment
    ASSIGN("="),
    PLUS_ASSIGN("+="),
    MINUS_ASSIGN("-="),
    STAR_ASSIGN("*="),
    SLASH_ASSIGN("/="),
    PERCENT_ASSIGN("%="),
    STAR_STAR_ASSIGN("**="),
    LEFT_SHIFT_ASSIGN("<<="),
    RIGHT_SHIFT_ASSIGN(">>="),
    UNSIGNED_RIGHT_SHIFT_ASSIGN(">>>="),
    BIT_AND_ASSIGN("&="),
    BIT_OR_ASSIGN("|="),
    BIT_XOR_ASSIGN("^="),
    AND_ASSIGN("&&="),
    OR_ASSIGN("||="),
    QUESTION_QUESTION_ASSIGN("??="),

    // Operators
    EQ("=="),
    NE("!="),
    EQ_STRICT("==="),
    NE_STRICT("!=="),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">="),
    PLUS("+"),
    MINUS("-"),
    STAR("*"),
    SLASH("/"),
    PERCENT("%"),
    STAR_STAR("**"),
    LEFT_SHIFT("<<"),
    RIGHT_SHIFT(">>"),
    UNSIGNED_RIGHT_SHIFT(">>>"),
    BANG("!"),
    TILDE("~"),
    AND("&&"),
    OR("||"),
    BIT_AND("&"),
    BIT_OR("|"),
    BIT_XOR("^");

    private final String display;

    TokenType(String display) {
        this.display = display;
    }

    /**
     * Text used for this kind in diagnostics: the punctuator or keyword itself,
     * or a descriptive word for literal and name kinds.
     */
    public String display() {
        return display;
    }

    public boolean isKeyword() {
        return switch (this) {
            case CONST, LET, VAR, TRUE, FALSE, NULL, TYPEOF, VOID, IN, INSTANCEOF -> true;
            default -> false;
        };
    }

    static TokenType keywordOrIdentifier(String word) {
        return switch (word) {
            case "const" -> CONST;
            case "let" -> LET;
            case "var" -> VAR;
            case "true" -> TRUE;
            case "false" -> FALSE;
            case "null" -> NULL;
            case "typeof" -> TYPEOF;
            case "void" -> VOID;
            case "in" -> IN;
            case "instanceof" -> INSTANCEOF;
            default -> IDENTIFIER;
        };
    }
}
