package com.reasons.exception;

/**
 * Base exception for all Reasons exceptions.
 */
public class ReasonsException extends RuntimeException {

    public ReasonsException(String message) {
        super(message);
    }

    public ReasonsException(String message, Throwable cause) {
        super(message, cause);
    }
}
