package com.reasons.ast;

/**
 * Kind of a consequence node. Everything except {@link #ACTION} is a
 * shorthand outcome keyword.
 */
public enum ConsequenceType {
    ACTION(null),
    WIN("win"),
    LOSE("lose"),
    DRAW("draw"),
    SKIP("skip"),
    PASS("pass"),
    FAIL("fail");

    private final String keyword;

    ConsequenceType(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public boolean isShorthand() {
        return this != ACTION;
    }
}
