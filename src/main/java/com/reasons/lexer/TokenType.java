package com.reasons.lexer;

/**
 * Token types produced by the lexer.
 */
public enum TokenType {
    // Literals
    IDENTIFIER,
    NUMBER,
    STRING,
    TRUE,
    FALSE,
    NULL,

    // Structure keywords
    IF,
    THEN,
    ELSE,
    END,
    RULE,
    WHEN,
    DO,
    RETURN,

    // Consequence keywords
    WIN,
    LOSE,
    DRAW,
    SKIP,
    PASS,
    FAIL,

    // Logical
    AND,
    OR,
    NOT,

    // Chaining
    CHAIN,
    SEQUENCE,
    PARALLEL,

    // Comparison
    EQ,
    NE,
    LT,
    LE,
    GT,
    GE,

    // Arithmetic
    PLUS,
    MINUS,
    STAR,
    SLASH,
    PERCENT,
    CARET,

    // Punctuation
    ASSIGN,
    IMPLIES,
    LPAREN,
    RPAREN,
    LBRACE,
    RBRACE,
    COMMA,
    SEMICOLON,
    QUESTION,
    COLON,
    DOT,

    // Layout
    NEWLINE,
    COMMENT,

    // Special
    ERROR,
    EOF;

    /**
     * Whether this token is one of the shorthand consequence keywords.
     */
    public boolean isConsequence() {
        return switch (this) {
            case WIN, LOSE, DRAW, SKIP, PASS, FAIL -> true;
            default -> false;
        };
    }
}
