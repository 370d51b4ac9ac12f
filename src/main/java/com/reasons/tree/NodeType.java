package com.reasons.tree;

/**
 * Variants of decision tree nodes.
 */
public enum NodeType {
    CONDITION("condition"),
    ACTION("action"),
    OUTCOME("outcome");

    private final String tag;

    NodeType(String tag) {
        this.tag = tag;
    }

    /**
     * Lower-case name passed to serialization callbacks.
     */
    public String tag() {
        return tag;
    }
}
