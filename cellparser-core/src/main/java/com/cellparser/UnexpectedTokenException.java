package com.cellparser;

/**
 * Raised when a token cannot start or continue the production being parsed.
 */
public class UnexpectedTokenException extends ParseException {

    private final Token token;
    private final String context;

    public UnexpectedTokenException(Token token, String context) {
        super("SyntaxError", token,
            token.type() == TokenType.EOF ? "Unexpected end of input" : "Unexpected token");
        this.token = token;
        this.context = context;
    }

    public Token token() {
        return token;
    }

    /**
     * The production that was being parsed, e.g. "expression".
     */
    public String context() {
        return context;
    }
}
