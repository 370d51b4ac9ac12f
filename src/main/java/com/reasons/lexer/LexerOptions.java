package com.reasons.lexer;

/**
 * Lexer behavior switches.
 *
 * @param golfMode      Enable terse keywords, shorthand operators and newline separators
 * @param skipComments  Drop comments instead of producing COMMENT tokens
 * @param caseSensitive Match keywords case-sensitively
 */
public record LexerOptions(boolean golfMode, boolean skipComments, boolean caseSensitive) {

    public static LexerOptions defaults() {
        return new LexerOptions(false, true, true);
    }

    public static LexerOptions golf() {
        return new LexerOptions(true, true, true);
    }

    public LexerOptions withGolfMode(boolean enabled) {
        return new LexerOptions(enabled, skipComments, caseSensitive);
    }
}
