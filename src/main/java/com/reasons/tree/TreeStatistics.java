package com.reasons.tree;

/**
 * Node counts of a decision tree by type.
 */
public record TreeStatistics(int totalNodes, int conditionCount, int actionCount, int outcomeCount) {
}
