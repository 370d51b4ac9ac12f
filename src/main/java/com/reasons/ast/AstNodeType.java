package com.reasons.ast;

/**
 * Kinds of abstract syntax tree nodes.
 */
public enum AstNodeType {
    PROGRAM,
    RULE,
    BLOCK,
    DECISION,
    CONSEQUENCE,
    LOGIC_OP,
    COMPARISON,
    ARITHMETIC,
    IDENTIFIER,
    LITERAL,
    CHAIN,
    ASSIGNMENT,
    FUNCTION_CALL,
    PROPERTY_ACCESS,
    RETURN;

    /**
     * Whether nodes of this kind hold an ordered, growable child list
     * rather than fixed operand slots.
     */
    public boolean hasOrderedChildren() {
        return switch (this) {
            case PROGRAM, BLOCK, CHAIN, FUNCTION_CALL -> true;
            default -> false;
        };
    }
}
