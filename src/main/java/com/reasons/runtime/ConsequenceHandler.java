package com.reasons.runtime;

import com.reasons.ast.AstNode;

/**
 * Application hook for actions. Return {@link ConsequenceResult#unhandled()}
 * to let the next handler (or the built-in evaluation) take the action.
 */
@FunctionalInterface
public interface ConsequenceHandler {

    ConsequenceResult handle(RuntimeEnvironment environment, AstNode action, ActionType type);
}
