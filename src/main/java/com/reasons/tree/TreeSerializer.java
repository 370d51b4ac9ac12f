package com.reasons.tree;

/**
 * Callback for {@link DecisionTree#serialize(TreeNode, TreeSerializer)}.
 */
@FunctionalInterface
public interface TreeSerializer {

    /**
     * @param node Visited node
     * @param kind "condition", "action" or "outcome"
     */
    void accept(TreeNode node, String kind);
}
