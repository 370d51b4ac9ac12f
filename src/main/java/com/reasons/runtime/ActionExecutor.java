package com.reasons.runtime;

import com.reasons.ast.AstNode;

/**
 * Executes the actions of action nodes.
 */
public interface ActionExecutor {

    /**
     * Execute one action.
     *
     * @param environment Variables and functions
     * @param action      Action expression or consequence node
     * @param type        Action type of the owning node
     * @return the result; failures are reported in the result, not thrown
     */
    ConsequenceResult executeConsequence(RuntimeEnvironment environment, AstNode action, ActionType type);
}
