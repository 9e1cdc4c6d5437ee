package com.tsparser;

/**
 * Grammar violation reported with a free-form message, such as a rest element
 * that is not last in a destructuring pattern.
 */
public class ExpectedTokenException extends ParseException {

    public ExpectedTokenException(String message, Token token) {
        super("SyntaxError", token, null, null, message);
    }
}
