package com.reasons.lexer;

import java.util.Map;
import java.util.Set;

/**
 * Keyword and operator tables for the lexer.
 */
public final class LexerConfig {

    private LexerConfig() {
    }

    /**
     * Keywords recognized in every mode.
     */
    public static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
            // Structure
            Map.entry("if", TokenType.IF),
            Map.entry("then", TokenType.THEN),
            Map.entry("else", TokenType.ELSE),
            Map.entry("end", TokenType.END),
            Map.entry("rule", TokenType.RULE),
            Map.entry("when", TokenType.WHEN),
            Map.entry("do", TokenType.DO),
            Map.entry("return", TokenType.RETURN),

            // Consequences
            Map.entry("win", TokenType.WIN),
            Map.entry("lose", TokenType.LOSE),
            Map.entry("draw", TokenType.DRAW),
            Map.entry("skip", TokenType.SKIP),
            Map.entry("pass", TokenType.PASS),
            Map.entry("fail", TokenType.FAIL),

            // Logical
            Map.entry("and", TokenType.AND),
            Map.entry("or", TokenType.OR),
            Map.entry("not", TokenType.NOT),

            // Chaining
            Map.entry("seq", TokenType.SEQUENCE),
            Map.entry("par", TokenType.PARALLEL),

            // Literals
            Map.entry("true", TokenType.TRUE),
            Map.entry("false", TokenType.FALSE),
            Map.entry("null", TokenType.NULL)
    );

    /**
     * Terse spellings available only in golf mode. Matched case-sensitively.
     */
    public static final Map<String, TokenType> GOLF_KEYWORDS = Map.of(
            "T", TokenType.TRUE,
            "F", TokenType.FALSE,
            "ret", TokenType.RETURN
    );

    /**
     * Single-letter consequences promoted in golf mode when the lexer is in
     * {@link LexerContext#CONSEQUENCE}.
     */
    public static final Map<String, TokenType> GOLF_CONSEQUENCES = Map.of(
            "w", TokenType.WIN,
            "l", TokenType.LOSE,
            "d", TokenType.DRAW,
            "s", TokenType.SKIP,
            "p", TokenType.PASS,
            "f", TokenType.FAIL
    );

    /**
     * Tokens the lexer stops at when resynchronizing.
     */
    public static final Set<TokenType> SYNC_TOKENS = Set.of(
            TokenType.SEMICOLON,
            TokenType.NEWLINE,
            TokenType.END,
            TokenType.RBRACE,
            TokenType.EOF
    );

    /**
     * Maximum length of an error token message.
     */
    public static final int MAX_ERROR_LENGTH = 256;

    /**
     * Number of tokens that can be inspected ahead of the current position.
     */
    public static final int LOOKAHEAD = 3;

    /**
     * Operator and punctuation characters.
     */
    public static final class Operators {
        public static final char LEFT_PAREN = '(';
        public static final char RIGHT_PAREN = ')';
        public static final char LEFT_BRACE = '{';
        public static final char RIGHT_BRACE = '}';
        public static final char COMMA = ',';
        public static final char SEMICOLON = ';';
        public static final char QUESTION = '?';
        public static final char COLON = ':';
        public static final char DOT = '.';
        public static final char PLUS = '+';
        public static final char MINUS = '-';
        public static final char STAR = '*';
        public static final char SLASH = '/';
        public static final char PERCENT = '%';
        public static final char CARET = '^';
        public static final char EQUALS = '=';
        public static final char BANG = '!';
        public static final char LESS = '<';
        public static final char GREATER = '>';
        public static final char AMPERSAND = '&';
        public static final char PIPE = '|';
        public static final char HASH = '#';
        public static final char QUOTE_DOUBLE = '"';
        public static final char QUOTE_SINGLE = '\'';
        public static final char BACKSLASH = '\\';
        public static final char UNDERSCORE = '_';
        public static final char NEWLINE = '\n';

        private Operators() {
        }
    }
}
