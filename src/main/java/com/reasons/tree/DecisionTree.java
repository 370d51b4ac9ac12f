package com.reasons.tree;

import com.reasons.runtime.Values;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A named decision tree: the root node, a table of named variables and a
 * registry of every reachable node.
 * <p>
 * The registry is rebuilt whenever the structure changes ({@link #setRoot}
 * or optimization). Structural changes require exclusive access to the tree;
 * evaluations may run concurrently with each other.
 */
public final class DecisionTree {

    private static final Logger log = LoggerFactory.getLogger(DecisionTree.class);

    private final String name;
    private TreeNode root;
    private final Map<String, Object> variables = new LinkedHashMap<>();
    private final List<TreeNode> registry = new ArrayList<>();
    private boolean optimized;

    private long evaluationCount;
    private double averageLatencyMillis;

    public DecisionTree(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public String getName() {
        return name;
    }

    public TreeNode getRoot() {
        return root;
    }

    /**
     * Replace the root. The previous root and everything below it is
     * discarded, the optimized flag is cleared and the registry rebuilt.
     *
     * @throws IllegalArgumentException if the new root is attached to another node
     */
    public void setRoot(TreeNode newRoot) {
        if (newRoot != null && newRoot.getParent() != null) {
            throw new IllegalArgumentException("Root node must not have a parent");
        }
        if (root != null && root != newRoot) {
            root.clearParent();
        }
        root = newRoot;
        optimized = false;
        rebuildRegistry();
    }

    /**
     * Define a variable. Redefining a name replaces its value.
     */
    public void addVariable(String variable, Object value) {
        variables.put(Objects.requireNonNull(variable, "variable"), Values.copy(value));
    }

    public Map<String, Object> getVariables() {
        return Collections.unmodifiableMap(variables);
    }

    public boolean isOptimized() {
        return optimized;
    }

    void markOptimized() {
        optimized = true;
    }

    /**
     * Rebuild the node registry by a pre-order walk from the root.
     */
    void rebuildRegistry() {
        registry.clear();
        serialize(root, (node, kind) -> registry.add(node));
        log.trace("Tree '{}' registry rebuilt with {} node(s)", name, registry.size());
    }

    /**
     * Nodes in pre-order.
     */
    public List<TreeNode> nodes() {
        return Collections.unmodifiableList(registry);
    }

    public Optional<TreeNode> findNode(String id) {
        if (id == null) {
            return Optional.empty();
        }
        for (TreeNode node : registry) {
            if (id.equals(node.getId())) {
                return Optional.of(node);
            }
        }
        return Optional.empty();
    }

    /**
     * Nodes from the root down to the given node, or an empty list if the node
     * is not part of this tree.
     */
    public List<TreeNode> pathTo(TreeNode node) {
        boolean member = false;
        for (TreeNode candidate : registry) {
            if (candidate == node) {
                member = true;
                break;
            }
        }
        if (!member) {
            return List.of();
        }
        LinkedList<TreeNode> path = new LinkedList<>();
        for (TreeNode current = node; current != null; current = current.getParent()) {
            path.addFirst(current);
        }
        return path;
    }

    /**
     * Node counts, computed from the registry.
     */
    public TreeStatistics statistics() {
        int conditions = 0;
        int actions = 0;
        int outcomes = 0;
        for (TreeNode node : registry) {
            switch (node.getType()) {
                case CONDITION -> conditions++;
                case ACTION -> actions++;
                case OUTCOME -> outcomes++;
            }
        }
        return new TreeStatistics(registry.size(), conditions, actions, outcomes);
    }

    /**
     * Length of the longest root-to-leaf path, 0 for an empty tree.
     */
    public int maxDepth() {
        return depth(root);
    }

    private static int depth(TreeNode node) {
        if (node == null) {
            return 0;
        }
        return 1 + Math.max(depth(node.getTrueBranch()), depth(node.getFalseBranch()));
    }

    /**
     * Deep copy: nodes, expressions, values, statistics and variables. The
     * copy is independent of this tree.
     */
    public DecisionTree copy() {
        DecisionTree copy = new DecisionTree(name);
        copy.root = root != null ? root.copy() : null;
        variables.forEach(copy::addVariable);
        copy.optimized = optimized;
        copy.rebuildRegistry();
        return copy;
    }

    synchronized void recordEvaluation(double latencyMillis) {
        evaluationCount++;
        averageLatencyMillis = (1.0 - TreeNode.SMOOTHING_FACTOR) * averageLatencyMillis
                + TreeNode.SMOOTHING_FACTOR * latencyMillis;
    }

    public synchronized long getEvaluationCount() {
        return evaluationCount;
    }

    public synchronized double getAverageLatencyMillis() {
        return averageLatencyMillis;
    }

    /**
     * Pre-order walk calling the callback with each node and its kind tag.
     * Only condition nodes are descended into.
     */
    public static void serialize(TreeNode root, TreeSerializer callback) {
        if (root == null) {
            return;
        }
        callback.accept(root, root.getType().tag());
        if (root.is(NodeType.CONDITION)) {
            serialize(root.getTrueBranch(), callback);
            serialize(root.getFalseBranch(), callback);
        }
    }

    @Override
    public String toString() {
        return "DecisionTree[" + name + ", nodes=" + registry.size() + ", optimized=" + optimized + "]";
    }
}
