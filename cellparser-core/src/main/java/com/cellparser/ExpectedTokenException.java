package com.cellparser;

/**
 * Raised when the grammar requires a particular construct at a token and
 * finds something else.
 */
public class ExpectedTokenException extends ParseException {

    private final Token token;

    public ExpectedTokenException(String message, Token token) {
        super("SyntaxError", token, message);
        this.token = token;
    }

    public Token token() {
        return token;
    }
}
