package com.reasons.lexer;

/**
 * A token produced by the lexer.
 *
 * @param type    Token type
 * @param text    Matched source text, or the diagnostic message for {@link TokenType#ERROR}
 * @param literal Parsed value for numbers and strings, otherwise null
 * @param line    1-based line of the first character
 * @param column  1-based column of the first character
 * @param length  Number of source characters consumed
 */
public record Token(TokenType type, String text, Object literal, int line, int column, int length) {

    public boolean is(TokenType expected) {
        return type == expected;
    }

    Token withType(TokenType newType) {
        return new Token(newType, text, literal, line, column, length);
    }

    @Override
    public String toString() {
        return type + "('" + text + "') at " + line + ":" + column;
    }
}
