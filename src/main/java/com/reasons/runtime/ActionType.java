package com.reasons.runtime;

/**
 * What an action node does when executed. Handlers are registered per type.
 */
public enum ActionType {
    /** Untyped action; handlers registered for ANY see every action. */
    ANY,
    /** Assigns a variable. */
    UPDATE,
    /** Sends a notification. */
    NOTIFY,
    /** Writes a log record. */
    LOG,
    /** Computes a value. */
    CALCULATE
}
