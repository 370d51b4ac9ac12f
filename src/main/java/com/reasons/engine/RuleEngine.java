package com.reasons.engine;

import com.reasons.parser.ParseResult;
import com.reasons.runtime.ActionType;
import com.reasons.runtime.ConsequenceHandler;
import com.reasons.runtime.EnvironmentFactory;
import com.reasons.runtime.RuntimeEnvironment;
import com.reasons.tree.DecisionTree;

import java.util.Optional;
import java.util.Set;

/**
 * Compiles rule sources into decision trees and evaluates them.
 */
public interface RuleEngine {

    /**
     * Parse and lower a rules source, installing its trees. Trees with the
     * same name as an installed tree replace it. Nothing is installed when
     * the source has errors.
     */
    CompilationResult load(String source);

    /**
     * Reload the rules source named in the configuration, if any.
     */
    void reload();

    /**
     * Evaluate an installed tree.
     *
     * @throws IllegalArgumentException if no tree has that name
     */
    EvaluationResult evaluate(String treeName, RuntimeEnvironment environment);

    /**
     * Evaluate an installed tree against variables given as a JSON object.
     */
    default EvaluationResult evaluate(String treeName, String json) {
        return evaluate(treeName, EnvironmentFactory.fromJson(json));
    }

    /**
     * Parse a standalone expression.
     */
    ParseResult parseExpression(String expression);

    /**
     * Parse and evaluate a standalone expression.
     *
     * @throws IllegalArgumentException if the expression has syntax errors
     */
    Object evaluateExpression(String expression, RuntimeEnvironment environment);

    Optional<DecisionTree> tree(String name);

    Set<String> treeNames();

    void registerHandler(ActionType type, ConsequenceHandler handler);
}
