package com.reasons.runtime;

import com.reasons.ast.AstNode;
import com.reasons.exception.EvaluationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs registered handlers for the action type, then handlers registered for
 * {@link ActionType#ANY}, and evaluates the action itself when none of them
 * handled it.
 */
public class DefaultActionExecutor implements ActionExecutor {

    private static final Logger log = LoggerFactory.getLogger(DefaultActionExecutor.class);

    private final ExpressionEvaluator evaluator;
    private final Map<ActionType, List<ConsequenceHandler>> handlers = new EnumMap<>(ActionType.class);

    public DefaultActionExecutor(ExpressionEvaluator evaluator) {
        this.evaluator = evaluator;
        for (ActionType type : ActionType.values()) {
            handlers.put(type, new CopyOnWriteArrayList<>());
        }
    }

    public DefaultActionExecutor registerHandler(ActionType type, ConsequenceHandler handler) {
        handlers.get(type).add(handler);
        return this;
    }

    @Override
    public ConsequenceResult executeConsequence(RuntimeEnvironment environment, AstNode action, ActionType type) {
        ConsequenceResult result = runHandlers(environment, action, type, type);
        if (result.handled()) {
            return result;
        }
        if (type != ActionType.ANY) {
            result = runHandlers(environment, action, type, ActionType.ANY);
            if (result.handled()) {
                return result;
            }
        }

        try {
            Object value = evaluator.evaluate(environment, action);
            log.trace("Action '{}' ({}) produced {}", action, type, value);
            return ConsequenceResult.success(value);
        } catch (EvaluationException e) {
            log.warn("Action '{}' failed: {}", action, e.getMessage());
            return ConsequenceResult.failure(e.getMessage());
        }
    }

    private ConsequenceResult runHandlers(RuntimeEnvironment environment, AstNode action,
                                          ActionType type, ActionType registeredFor) {
        for (ConsequenceHandler handler : handlers.get(registeredFor)) {
            ConsequenceResult result = handler.handle(environment, action, type);
            if (result != null && result.handled()) {
                return result;
            }
        }
        return ConsequenceResult.unhandled();
    }
}
