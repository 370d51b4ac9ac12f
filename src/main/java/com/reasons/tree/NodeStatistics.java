package com.reasons.tree;

/**
 * Snapshot of the running statistics of one node.
 *
 * @param executionCount       Number of recorded visits
 * @param trueProbability      Smoothed frequency of the true branch (or of successful actions)
 * @param falseProbability     Smoothed frequency of the false branch (or of failed actions)
 * @param averageLatencyMillis Smoothed time spent in the node
 */
public record NodeStatistics(
        long executionCount,
        double trueProbability,
        double falseProbability,
        double averageLatencyMillis
) {

    public static final NodeStatistics EMPTY = new NodeStatistics(0, 0.0, 0.0, 0.0);
}
