package com.reasons.parser;

/**
 * Category of a front-end diagnostic.
 */
public enum ErrorKind {
    /** Malformed token reported by the lexer. */
    LEXICAL,
    /** Unexpected or missing token. */
    SYNTAX,
    /** Nesting ceiling exceeded. */
    STRUCTURAL,
    /** A node could not be built from the parsed parts. */
    CONSTRUCTION
}
