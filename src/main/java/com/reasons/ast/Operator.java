package com.reasons.ast;

/**
 * Operators carried by logic, comparison and arithmetic nodes.
 */
public enum Operator {
    // Logic
    AND("and", Category.LOGIC, false),
    OR("or", Category.LOGIC, false),
    NOT("not", Category.LOGIC, true),

    // Comparison
    EQ("==", Category.COMPARISON, false),
    NE("!=", Category.COMPARISON, false),
    LT("<", Category.COMPARISON, false),
    LE("<=", Category.COMPARISON, false),
    GT(">", Category.COMPARISON, false),
    GE(">=", Category.COMPARISON, false),

    // Arithmetic
    ADD("+", Category.ARITHMETIC, false),
    SUBTRACT("-", Category.ARITHMETIC, false),
    MULTIPLY("*", Category.ARITHMETIC, false),
    DIVIDE("/", Category.ARITHMETIC, false),
    MODULO("%", Category.ARITHMETIC, false),
    POWER("^", Category.ARITHMETIC, false),
    NEGATE("-", Category.ARITHMETIC, true);

    public enum Category {
        LOGIC,
        COMPARISON,
        ARITHMETIC
    }

    private final String symbol;
    private final Category category;
    private final boolean unary;

    Operator(String symbol, Category category, boolean unary) {
        this.symbol = symbol;
        this.category = category;
        this.unary = unary;
    }

    public String symbol() {
        return symbol;
    }

    public Category category() {
        return category;
    }

    public boolean isUnary() {
        return unary;
    }
}
