package com.reasons.tree;

import com.reasons.ast.AstNode;
import com.reasons.ast.AstNodeType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Folds condition nodes whose guard is a boolean literal into the branch the
 * literal selects. A condition whose selected branch is absent is kept.
 */
public final class TreeOptimizer {

    private static final Logger log = LoggerFactory.getLogger(TreeOptimizer.class);

    private TreeOptimizer() {
    }

    /**
     * Optimize a tree in place. Does nothing if the tree is already optimized.
     *
     * @return number of folded conditions
     */
    public static int optimize(DecisionTree tree) {
        if (tree.isOptimized()) {
            log.trace("Tree '{}' already optimized", tree.getName());
            return 0;
        }
        int folded = fold(tree.getRoot());
        tree.markOptimized();
        tree.rebuildRegistry();
        log.debug("Optimized tree '{}': folded {} condition(s), {} node(s) remain",
                tree.getName(), folded, tree.statistics().totalNodes());
        return folded;
    }

    private static int fold(TreeNode node) {
        if (node == null) {
            return 0;
        }
        int folded = 0;
        while (node.is(NodeType.CONDITION)) {
            Boolean constant = constantGuard(node.getCondition());
            if (constant == null) {
                break;
            }
            TreeNode selected = constant ? node.getTrueBranch() : node.getFalseBranch();
            if (selected == null) {
                break;
            }
            log.trace("Folding constant condition {} into {}", node, selected);
            node.replaceWith(selected);
            folded++;
        }
        if (node.is(NodeType.CONDITION)) {
            folded += fold(node.getTrueBranch());
            folded += fold(node.getFalseBranch());
        }
        return folded;
    }

    private static Boolean constantGuard(AstNode guard) {
        if (guard != null && guard.is(AstNodeType.LITERAL) && guard.literal() instanceof Boolean value) {
            return value;
        }
        return null;
    }
}
