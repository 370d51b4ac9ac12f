package com.reasons.lexer;

/**
 * Syntactic position the parser is in while requesting tokens.
 * Identifiers are interpreted differently in a consequence position.
 */
public enum LexerContext {
    DEFAULT,
    CONDITION,
    CONSEQUENCE,
    RULE_BODY
}
