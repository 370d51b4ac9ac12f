package com.reasons.runtime;

/**
 * Result of executing one action.
 *
 * @param handled Whether anything took responsibility for the action
 * @param success Whether the action completed
 * @param value   Value produced by the action, may be null
 * @param message Failure or informational message, may be null
 */
public record ConsequenceResult(boolean handled, boolean success, Object value, String message) {

    public static ConsequenceResult success(Object value) {
        return new ConsequenceResult(true, true, value, null);
    }

    public static ConsequenceResult failure(String message) {
        return new ConsequenceResult(true, false, null, message);
    }

    public static ConsequenceResult unhandled() {
        return new ConsequenceResult(false, false, null, "No handler accepted the action");
    }
}
