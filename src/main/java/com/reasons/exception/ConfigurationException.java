package com.reasons.exception;

/**
 * Thrown when configuration is invalid or cannot be loaded.
 */
public class ConfigurationException extends ReasonsException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
