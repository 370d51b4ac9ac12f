package com.reasons.tree;

import com.reasons.ast.AstNode;
import com.reasons.runtime.ActionType;
import com.reasons.runtime.Values;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A node of a decision tree: a condition with two optional branches, a list
 * of actions, or an outcome value.
 * <p>
 * Only condition nodes have children. Statistics are updated under the node's
 * monitor so that inspection through {@link #statistics()} is safe while an
 * evaluation is running.
 */
public final class TreeNode {

    /**
     * Weight of the newest sample in the smoothed statistics.
     */
    public static final double SMOOTHING_FACTOR = 0.2;

    private NodeType type;
    private String id;
    private String description;
    private TreeNode parent;

    private AstNode condition;
    private double weight;
    private TreeNode trueBranch;
    private TreeNode falseBranch;

    private List<AstNode> actions;
    private ActionType actionType;

    private Object value;
    private String explanation;

    private long executionCount;
    private double trueProbability;
    private double falseProbability;
    private double averageLatencyMillis;

    private TreeNode(NodeType type) {
        this.type = type;
    }

    /**
     * Condition node owning the given expression.
     *
     * @return empty if the expression is null
     */
    public static Optional<TreeNode> createCondition(AstNode expression, double weight) {
        if (expression == null) {
            return Optional.empty();
        }
        TreeNode node = new TreeNode(NodeType.CONDITION);
        node.condition = expression;
        node.weight = weight;
        return Optional.of(node);
    }

    /**
     * Action node owning the given actions, executed in order.
     *
     * @return empty if the list is null or empty, or the type is null
     */
    public static Optional<TreeNode> createAction(List<AstNode> actions, ActionType type) {
        if (actions == null || actions.isEmpty() || type == null || actions.contains(null)) {
            return Optional.empty();
        }
        TreeNode node = new TreeNode(NodeType.ACTION);
        node.actions = new ArrayList<>(actions);
        node.actionType = type;
        return Optional.of(node);
    }

    /**
     * Outcome node holding a copy of the value.
     */
    public static TreeNode createOutcome(Object value) {
        TreeNode node = new TreeNode(NodeType.OUTCOME);
        node.value = Values.copy(value);
        return node;
    }

    // ---- branches ----

    public void setTrueBranch(TreeNode branch) {
        requireCondition();
        detach(trueBranch);
        trueBranch = adopt(branch);
    }

    public void setFalseBranch(TreeNode branch) {
        requireCondition();
        detach(falseBranch);
        falseBranch = adopt(branch);
    }

    private void requireCondition() {
        if (type != NodeType.CONDITION) {
            throw new IllegalStateException(type.tag() + " nodes are leaves and cannot have branches");
        }
    }

    private TreeNode adopt(TreeNode branch) {
        if (branch == null) {
            return null;
        }
        if (branch.parent != null) {
            throw new IllegalArgumentException("Node is already attached to a parent");
        }
        for (TreeNode ancestor = this; ancestor != null; ancestor = ancestor.parent) {
            if (ancestor == branch) {
                throw new IllegalArgumentException("Node cannot be its own descendant");
            }
        }
        branch.parent = this;
        return branch;
    }

    private static void detach(TreeNode branch) {
        if (branch != null) {
            branch.parent = null;
        }
    }

    void clearParent() {
        parent = null;
    }

    // ---- statistics ----

    /**
     * Record one visit.
     *
     * @param branchTaken   Condition result, or action success
     * @param latencyMillis Time spent in the node
     */
    public synchronized void recordVisit(boolean branchTaken, double latencyMillis) {
        double keep = 1.0 - SMOOTHING_FACTOR;
        executionCount++;
        averageLatencyMillis = keep * averageLatencyMillis + SMOOTHING_FACTOR * latencyMillis;
        if (type == NodeType.OUTCOME) {
            return;
        }
        if (branchTaken) {
            trueProbability = keep * trueProbability + SMOOTHING_FACTOR;
            falseProbability *= keep;
        } else {
            falseProbability = keep * falseProbability + SMOOTHING_FACTOR;
            trueProbability *= keep;
        }
    }

    public synchronized NodeStatistics statistics() {
        return new NodeStatistics(executionCount, trueProbability, falseProbability, averageLatencyMillis);
    }

    public synchronized void resetStatistics() {
        executionCount = 0;
        trueProbability = 0.0;
        falseProbability = 0.0;
        averageLatencyMillis = 0.0;
    }

    // ---- copy and replacement ----

    /**
     * Deep copy of this subtree including statistics and cached explanations.
     * The copy has no parent.
     */
    public TreeNode copy() {
        TreeNode copy = new TreeNode(type);
        copy.copyFieldsFrom(this);
        copy.condition = condition != null ? condition.copy() : null;
        if (actions != null) {
            copy.actions = new ArrayList<>(actions.size());
            for (AstNode action : actions) {
                copy.actions.add(action.copy());
            }
        }
        copy.value = Values.copy(value);
        if (trueBranch != null) {
            copy.trueBranch = trueBranch.copy();
            copy.trueBranch.parent = copy;
        }
        if (falseBranch != null) {
            copy.falseBranch = falseBranch.copy();
            copy.falseBranch.parent = copy;
        }
        return copy;
    }

    /**
     * Overwrite this node with the content of one of its descendants, keeping
     * this node's position in the tree. The survivor's branches are re-parented
     * here; everything else previously below this node is discarded.
     */
    void replaceWith(TreeNode survivor) {
        TreeNode newTrue = survivor.trueBranch;
        TreeNode newFalse = survivor.falseBranch;

        type = survivor.type;
        copyFieldsFrom(survivor);
        condition = survivor.condition;
        actions = survivor.actions;
        value = survivor.value;

        trueBranch = newTrue;
        falseBranch = newFalse;
        if (trueBranch != null) {
            trueBranch.parent = this;
        }
        if (falseBranch != null) {
            falseBranch.parent = this;
        }

        survivor.parent = null;
        survivor.trueBranch = null;
        survivor.falseBranch = null;
    }

    private void copyFieldsFrom(TreeNode source) {
        NodeStatistics stats = source.statistics();
        id = source.id;
        description = source.description;
        weight = source.weight;
        actionType = source.actionType;
        explanation = source.getExplanation();
        synchronized (this) {
            executionCount = stats.executionCount();
            trueProbability = stats.trueProbability();
            falseProbability = stats.falseProbability();
            averageLatencyMillis = stats.averageLatencyMillis();
        }
    }

    // ---- accessors ----

    public NodeType getType() {
        return type;
    }

    public boolean is(NodeType expected) {
        return type == expected;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public TreeNode getParent() {
        return parent;
    }

    public AstNode getCondition() {
        return condition;
    }

    public double getWeight() {
        return weight;
    }

    public TreeNode getTrueBranch() {
        return trueBranch;
    }

    public TreeNode getFalseBranch() {
        return falseBranch;
    }

    /**
     * Actions of an action node, empty for other nodes.
     */
    public List<AstNode> getActions() {
        return actions == null ? List.of() : Collections.unmodifiableList(actions);
    }

    public ActionType getActionType() {
        return actionType;
    }

    public Object getValue() {
        return value;
    }

    public synchronized String getExplanation() {
        return explanation;
    }

    synchronized void setExplanation(String explanation) {
        this.explanation = explanation;
    }

    @Override
    public String toString() {
        String label = id != null ? id : "?";
        return switch (type) {
            case CONDITION -> "condition[" + label + "] " + condition;
            case ACTION -> "action[" + label + "] " + actionType + " " + actions;
            case OUTCOME -> "outcome[" + label + "] " + Values.format(value);
        };
    }
}
