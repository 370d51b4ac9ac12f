package com.reasons.parser;

import com.reasons.lexer.TokenType;

/**
 * Binding strength of infix operators, weakest first.
 */
public enum Precedence {
    NONE,
    ASSIGNMENT,
    TERNARY,
    OR,
    AND,
    EQUALITY,
    COMPARISON,
    TERM,
    FACTOR,
    UNARY,
    CALL,
    PRIMARY;

    /**
     * The next tighter level, used for the right operand of left-associative operators.
     */
    public Precedence next() {
        Precedence[] values = values();
        return this == PRIMARY ? PRIMARY : values[ordinal() + 1];
    }

    /**
     * Infix precedence of a token, {@link #NONE} if it is not an infix operator.
     */
    public static Precedence of(TokenType type) {
        return switch (type) {
            case ASSIGN -> ASSIGNMENT;
            case QUESTION -> TERNARY;
            case OR -> OR;
            case AND -> AND;
            case EQ, NE -> EQUALITY;
            case LT, LE, GT, GE -> COMPARISON;
            case PLUS, MINUS -> TERM;
            case STAR, SLASH, PERCENT, CARET -> FACTOR;
            case LPAREN, DOT -> CALL;
            default -> NONE;
        };
    }
}
