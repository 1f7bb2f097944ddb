package com.cellparser;

public enum TokenType {
    // Literals
    NUMBER,
    STRING,
    REGEX,
    TEMPLATE_LITERAL,   // `text` with no substitutions
    TEMPLATE_HEAD,      // `text${
    TEMPLATE_MIDDLE,    // }text${
    TEMPLATE_TAIL,      // }text`
    TRUE,
    FALSE,
    NULL,
    IDENTIFIER,

    // Keywords
    VAR,
    LET,
    CONST,
    FUNCTION,
    CLASS,
    EXTENDS,
    RETURN,
    IF,
    ELSE,
    FOR,
    WHILE,
    DO,
    BREAK,
    CONTINUE,
    SWITCH,
    CASE,
    DEFAULT,
    TRY,
    CATCH,
    FINALLY,
    THROW,
    NEW,
    TYPEOF,
    VOID,
    DELETE,
    THIS,
    SUPER,
    IN,
    INSTANCEOF,
    IMPORT,
    EXPORT,
    WITH,
    DEBUGGER,
    ENUM,

    // Punctuation
    LPAREN,
    RPAREN,
    LBRACE,
    RBRACE,
    LBRACKET,
    RBRACKET,
    SEMICOLON,
    COMMA,
    DOT,
    DOT_DOT_DOT,
    QUESTION,
    QUESTION_DOT,
    COLON,
    ARROW,

    // Operators
    PLUS,
    MINUS,
    STAR,
    SLASH,
    PERCENT,
    STAR_STAR,
    INCREMENT,
    DECREMENT,
    BANG,
    TILDE,
    BIT_AND,
    BIT_OR,
    BIT_XOR,
    AND,
    OR,
    QUESTION_QUESTION,
    LEFT_SHIFT,
    RIGHT_SHIFT,
    UNSIGNED_RIGHT_SHIFT,
    EQ,
    NE,
    EQ_STRICT,
    NE_STRICT,
    LT,
    LE,
    GT,
    GE,

    // Assignment
    ASSIGN,
    PLUS_ASSIGN,
    MINUS_ASSIGN,
    STAR_ASSIGN,
    SLASH_ASSIGN,
    PERCENT_ASSIGN,
    STAR_STAR_ASSIGN,
    LEFT_SHIFT_ASSIGN,
    RIGHT_SHIFT_ASSIGN,
    UNSIGNED_RIGHT_SHIFT_ASSIGN,
    BIT_AND_ASSIGN,
    BIT_OR_ASSIGN,
    BIT_XOR_ASSIGN,

    EOF
}
