package com.reasons.trace;

public enum TraceEventType {
    CONDITION,
    CONSEQUENCE,
    OUTCOME
}
