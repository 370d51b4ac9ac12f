package com.reasons.trace;

import com.reasons.tree.TreeNode;

/**
 * Builds human-readable explanations of why an evaluation reached an outcome.
 */
public interface Explainer extends TraceListener {

    /**
     * Explain the outcome at the given node from the events reported so far.
     */
    String generateExplanation(TreeNode node);
}
