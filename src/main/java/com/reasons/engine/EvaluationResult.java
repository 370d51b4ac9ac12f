package com.reasons.engine;

import com.reasons.trace.TraceEntry;

import java.util.List;

/**
 * Result of evaluating a decision tree.
 */
public interface EvaluationResult {

    /**
     * Name of the evaluated tree.
     */
    String getTreeName();

    /**
     * Value the evaluation produced, null if no outcome or action was reached.
     */
    Object getValue();

    /**
     * Check if the evaluation produced a value.
     */
    boolean isMatched();

    /**
     * Human-readable explanation, null when explanations are disabled.
     */
    String getExplanation();

    /**
     * Recorded events, empty when tracing is disabled.
     */
    List<TraceEntry> getTrace();

    /**
     * Compact rendering of the path taken, null when tracing is disabled.
     */
    String getDecisionPath();
}
