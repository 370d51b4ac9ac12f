package com.reasons.ast;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Structural checks for syntax trees built or modified outside the parser.
 */
public final class AstValidator {

    /**
     * Maximum nesting depth of a valid tree.
     */
    public static final int MAX_DEPTH = 1024;

    private AstValidator() {
    }

    /**
     * Result of a validation.
     *
     * @param valid   Whether the tree passed all checks
     * @param message Reason for rejection, null when valid
     */
    public record Result(boolean valid, String message) {

        static Result ok() {
            return new Result(true, null);
        }

        static Result rejected(String message) {
            return new Result(false, message);
        }
    }

    private record Frame(AstNode node, int depth) {
    }

    /**
     * Reject trees deeper than {@link #MAX_DEPTH}, children whose parent link
     * does not point back at their holder, and nodes reachable twice.
     */
    public static Result validate(AstNode root) {
        return validate(root, MAX_DEPTH);
    }

    /**
     * Same checks as {@link #validate(AstNode)} with a caller-supplied depth
     * limit, for subtrees that will sit below other nodes.
     */
    public static Result validate(AstNode root, int maxDepth) {
        if (root == null) {
            return Result.rejected("Tree is empty");
        }

        Set<AstNode> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root, 1));

        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            AstNode node = frame.node();

            if (frame.depth() > maxDepth) {
                return Result.rejected("Tree exceeds maximum depth of " + maxDepth);
            }
            if (!seen.add(node)) {
                return Result.rejected(node.type() + " node is reachable more than once");
            }

            for (AstNode child : node.children()) {
                if (child == null) {
                    continue;
                }
                if (child.parent() != node) {
                    return Result.rejected(child.type() + " child of " + node.type()
                            + " has a dangling parent reference");
                }
                stack.push(new Frame(child, frame.depth() + 1));
            }
        }
        return Result.ok();
    }
}
