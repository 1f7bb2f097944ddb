package com.cellparser;

/**
 * A lexical token.
 *
 * @param type        the token kind
 * @param lexeme      identifier name (escapes decoded), or the source text of the token
 * @param literal     decoded value for literals: Double, String, RegexInfo; null otherwise
 * @param line        1-based line of the first character
 * @param column      0-based column of the first character
 * @param position    offset of the first character
 * @param endPosition offset just past the last character
 * @param endLine     line of the position just past the token
 * @param endColumn   column of the position just past the token
 * @param raw         raw template text (templates only)
 * @param escaped     true if an identifier was spelled with unicode escapes
 */
public record Token(
    TokenType type,
    String lexeme,
    Object literal,
    int line,
    int column,
    int position,
    int endPosition,
    int endLine,
    int endColumn,
    String raw,
    boolean escaped
) {

    public boolean is(TokenType type, String lexeme) {
        return this.type == type && this.lexeme.equals(lexeme);
    }

    /**
     * True for an unescaped identifier token spelling the given word.
     * Used for contextual keywords such as {@code async}, {@code of} or {@code viewof}.
     */
    public boolean isContextual(String word) {
        return type == TokenType.IDENTIFIER && !escaped && lexeme.equals(word);
    }

    @Override
    public String toString() {
        return type + "(" + lexeme + ") at " + line + ":" + column;
    }
}
