package com.reasons.ast;

/**
 * Callback for AST traversal.
 */
@FunctionalInterface
public interface AstVisitor {

    /**
     * Visit a node.
     *
     * @return false to stop the traversal
     */
    boolean visit(AstNode node);
}
