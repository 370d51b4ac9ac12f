package com.reasons.ast;

/**
 * How the consequences of a chain are combined.
 */
public enum ChainType {
    SEQUENTIAL(">>"),
    PARALLEL("par");

    private final String symbol;

    ChainType(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
