package com.reasons.exception;

/**
 * Thrown by the expression evaluator when an expression cannot be evaluated:
 * type mismatches, unknown functions, wrong argument counts.
 */
public class EvaluationException extends ReasonsException {

    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
