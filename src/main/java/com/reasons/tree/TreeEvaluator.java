package com.reasons.tree;

import com.reasons.ast.AstNode;
import com.reasons.runtime.ActionExecutor;
import com.reasons.runtime.ConsequenceResult;
import com.reasons.runtime.ExpressionEvaluator;
import com.reasons.runtime.RuntimeEnvironment;
import com.reasons.runtime.Values;
import com.reasons.trace.Explainer;
import com.reasons.trace.TraceListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * Walks a decision tree from its root.
 * <p>
 * A condition selects its true or false branch; an absent branch ends the
 * walk with the result computed so far (null if none). An action node runs
 * all of its actions and ends the walk with the value of the last successful
 * one. An outcome node ends the walk with a copy of its value. Every visited
 * node records its statistics.
 */
public class TreeEvaluator {

    private static final Logger log = LoggerFactory.getLogger(TreeEvaluator.class);

    private final ExpressionEvaluator expressionEvaluator;
    private final ActionExecutor actionExecutor;

    public TreeEvaluator(ExpressionEvaluator expressionEvaluator, ActionExecutor actionExecutor) {
        this.expressionEvaluator = Objects.requireNonNull(expressionEvaluator, "expressionEvaluator");
        this.actionExecutor = Objects.requireNonNull(actionExecutor, "actionExecutor");
    }

    public Object evaluate(DecisionTree tree, RuntimeEnvironment environment) {
        return evaluate(tree, environment, null, null);
    }

    /**
     * Evaluate a tree.
     *
     * @param tree        Tree to walk
     * @param environment Variables and functions; tree variables fill in names it does not define
     * @param explainer   Optional explainer
     * @param trace       Optional trace listener
     * @return the result value, possibly null
     * @throws com.reasons.exception.EvaluationException if a condition cannot be evaluated
     */
    public Object evaluate(DecisionTree tree, RuntimeEnvironment environment,
                           Explainer explainer, TraceListener trace) {
        long treeStart = System.nanoTime();
        environment.pushScope();
        try {
            for (Map.Entry<String, Object> variable : tree.getVariables().entrySet()) {
                if (!environment.isDefined(variable.getKey())) {
                    environment.define(variable.getKey(), Values.copy(variable.getValue()));
                }
            }
            Object result = walk(tree.getRoot(), environment, explainer, trace);
            log.debug("Tree '{}' evaluated to {}", tree.getName(), result);
            return result;
        } finally {
            environment.popScope();
            tree.recordEvaluation(elapsedMillis(treeStart));
        }
    }

    private Object walk(TreeNode start, RuntimeEnvironment environment, Explainer explainer, TraceListener trace) {
        Object result = null;
        TreeNode current = start;

        while (current != null) {
            long nodeStart = System.nanoTime();
            switch (current.getType()) {
                case CONDITION -> {
                    Object value = expressionEvaluator.evaluate(environment, current.getCondition());
                    boolean taken = expressionEvaluator.isTruthy(value);
                    current.recordVisit(taken, elapsedMillis(nodeStart));
                    log.trace("Condition {} -> {}", current, taken);
                    if (trace != null) {
                        trace.reportCondition(current, taken);
                    }
                    if (explainer != null) {
                        explainer.reportCondition(current, taken);
                    }
                    current = taken ? current.getTrueBranch() : current.getFalseBranch();
                }
                case ACTION -> {
                    for (AstNode action : current.getActions()) {
                        ConsequenceResult outcome = actionExecutor.executeConsequence(
                                environment, action, current.getActionType());
                        boolean success = outcome.handled() && outcome.success();
                        if (success) {
                            result = outcome.value();
                        } else {
                            log.debug("Action {} in node {} did not succeed: {}", action, current.getId(),
                                    outcome.message());
                        }
                        current.recordVisit(success, elapsedMillis(nodeStart));
                        if (trace != null) {
                            trace.reportConsequence(current, success);
                        }
                        if (explainer != null) {
                            explainer.reportConsequence(current, success);
                        }
                    }
                    current = null;
                }
                case OUTCOME -> {
                    result = Values.copy(current.getValue());
                    if (explainer != null) {
                        explainer.reportOutcome(current);
                        if (current.getExplanation() == null) {
                            current.setExplanation(explainer.generateExplanation(current));
                        }
                    }
                    current.recordVisit(true, elapsedMillis(nodeStart));
                    if (trace != null) {
                        trace.reportOutcome(current);
                    }
                    current = null;
                }
            }
        }
        return result;
    }

    private static double elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }
}
