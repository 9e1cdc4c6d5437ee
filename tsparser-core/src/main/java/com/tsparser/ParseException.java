package com.tsparser;

import com.tsparser.ast.Span;

/**
 * Base class of every failure raised while lexing or parsing.
 */
public class ParseException extends RuntimeException {

    private final String errorType;
    private final Token token;
    private final Span span;
    private final String expected;
    private final String context;

    public ParseException(String errorType, Token token, String expected, String context, String message) {
        this(errorType, token, token != null ? token.span() : null, expected, context, message);
    }

    public ParseException(String errorType, Span span, String context, String message) {
        this(errorType, null, span, null, context, message);
    }

    protected ParseException(String errorType, Token token, Span span, String expected, String context, String message) {
        super(formatMessage(errorType, span, context, message));
        this.errorType = errorType;
        this.token = token;
        this.span = span;
        this.expected = expected;
        this.context = context;
    }

    private static String formatMessage(String errorType, Span span, String context, String message) {
        StringBuilder sb = new StringBuilder();
        sb.append(errorType).append(": ").append(message);
        if (context != null) {
            sb.append(" (in ").append(context).append(")");
        }
        if (span != null) {
            sb.append(" at ").append(span);
        }
        return sb.toString();
    }

    public String getErrorType() {
        return errorType;
    }

    /** The offending token, or null when the failure is not tied to one (end of input, lexing). */
    public Token getToken() {
        return token;
    }

    public Span getSpan() {
        return span;
    }

    public String getExpected() {
        return expected;
    }

    public String getContext() {
        return context;
    }
}
