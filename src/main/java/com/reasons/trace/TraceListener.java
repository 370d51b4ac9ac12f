package com.reasons.trace;

import com.reasons.tree.TreeNode;

/**
 * Receives evaluation events from the tree evaluator.
 */
public interface TraceListener {

    void reportCondition(TreeNode node, boolean branchTaken);

    void reportConsequence(TreeNode node, boolean success);

    void reportOutcome(TreeNode node);
}
