package com.cellparser;

/**
 * A positioned diagnostic. Every syntax error raised while tokenizing,
 * parsing or resolving a cell is a ParseException (or a subclass).
 */
public class ParseException extends RuntimeException {

    private final String errorType;
    private final int position;
    private final int line;
    private final int column;

    public ParseException(String errorType, String message, int position, int line, int column) {
        super(message);
        this.errorType = errorType;
        this.position = position;
        this.line = line;
        this.column = column;
    }

    public ParseException(String errorType, Token token, String message) {
        this(errorType, message, token.position(), token.line(), token.column());
    }

    /**
     * "SyntaxError" for every error raised by this library.
     */
    public String errorType() {
        return errorType;
    }

    /**
     * Offset into the source text.
     */
    public int position() {
        return position;
    }

    /**
     * 1-based line.
     */
    public int line() {
        return line;
    }

    /**
     * 0-based column.
     */
    public int column() {
        return column;
    }
}
