package com.reasons.runtime;

import com.reasons.ast.AstNode;

/**
 * Evaluates expression nodes against an environment.
 */
public interface ExpressionEvaluator {

    /**
     * Evaluate an expression.
     *
     * @param environment Variables and functions
     * @param node        Expression to evaluate
     * @return the value, possibly null
     * @throws com.reasons.exception.EvaluationException if the expression cannot be evaluated
     */
    Object evaluate(RuntimeEnvironment environment, AstNode node);

    /**
     * Whether a value counts as true in a condition.
     */
    default boolean isTruthy(Object value) {
        return Values.isTruthy(value);
    }
}
