package com.reasons.runtime;

import com.reasons.ast.AstNode;
import com.reasons.ast.Operator;
import com.reasons.exception.EvaluationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Tree-walking evaluator for rule expressions.
 * <p>
 * Undefined variables evaluate to null. Logic operators short-circuit and
 * yield booleans. Ordering comparisons accept two numbers or two strings;
 * booleans and null support only {@code ==} and {@code !=}.
 */
public class DefaultExpressionEvaluator implements ExpressionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(DefaultExpressionEvaluator.class);

    @Override
    public Object evaluate(RuntimeEnvironment environment, AstNode node) {
        if (node == null) {
            return null;
        }
        return switch (node.type()) {
            case LITERAL -> node.literal();
            case IDENTIFIER -> lookup(environment, node.text());
            case PROPERTY_ACCESS -> evaluateProperty(environment, node);
            case LOGIC_OP -> evaluateLogic(environment, node);
            case COMPARISON -> compare(node.operator(),
                    evaluate(environment, node.left()), evaluate(environment, node.right()));
            case ARITHMETIC -> evaluateArithmetic(environment, node);
            case DECISION -> {
                if (isTruthy(evaluate(environment, node.condition()))) {
                    yield evaluate(environment, node.trueBranch());
                }
                yield evaluate(environment, node.falseBranch());
            }
            case ASSIGNMENT -> {
                Object value = evaluate(environment, node.operand());
                environment.assign(node.text(), value);
                yield value;
            }
            case FUNCTION_CALL -> evaluateCall(environment, node);
            case CONSEQUENCE -> evaluateConsequence(environment, node);
            case RETURN -> evaluate(environment, node.operand());
            case RULE -> evaluate(environment, node.operand());
            case PROGRAM, BLOCK, CHAIN -> {
                Object last = null;
                for (AstNode child : node.children()) {
                    last = evaluate(environment, child);
                }
                yield last;
            }
        };
    }

    private Object lookup(RuntimeEnvironment environment, String name) {
        if (!environment.isDefined(name)) {
            log.trace("Variable '{}' is undefined, using null", name);
            return null;
        }
        return environment.get(name);
    }

    private Object evaluateProperty(RuntimeEnvironment environment, AstNode node) {
        String qualified = qualifiedName(node);
        if (qualified != null && environment.isDefined(qualified)) {
            return environment.get(qualified);
        }
        Object target = evaluate(environment, node.operand());
        if (target == null) {
            return null;
        }
        if (target instanceof Map<?, ?> map) {
            return map.get(node.text());
        }
        throw new EvaluationException("Cannot read property '" + node.text() + "' of " + Values.typeName(target));
    }

    /**
     * {@code a.b.c} for a chain of property accesses rooted at an identifier, otherwise null.
     */
    private static String qualifiedName(AstNode node) {
        return switch (node.type()) {
            case IDENTIFIER -> node.text();
            case PROPERTY_ACCESS -> {
                String owner = node.operand() != null ? qualifiedName(node.operand()) : null;
                yield owner == null ? null : owner + "." + node.text();
            }
            default -> null;
        };
    }

    private Object evaluateLogic(RuntimeEnvironment environment, AstNode node) {
        return switch (node.operator()) {
            case AND -> isTruthy(evaluate(environment, node.left()))
                    && isTruthy(evaluate(environment, node.right()));
            case OR -> isTruthy(evaluate(environment, node.left()))
                    || isTruthy(evaluate(environment, node.right()));
            case NOT -> !isTruthy(evaluate(environment, node.operand()));
            default -> throw new EvaluationException("Unsupported logic operator: " + node.operator());
        };
    }

    private Object compare(Operator operator, Object left, Object right) {
        if (operator == Operator.EQ) {
            return Values.equal(left, right);
        }
        if (operator == Operator.NE) {
            return !Values.equal(left, right);
        }

        int order;
        if (left instanceof Number a && right instanceof Number b) {
            order = Double.compare(a.doubleValue(), b.doubleValue());
        } else if (left instanceof String a && right instanceof String b) {
            order = a.compareTo(b);
        } else {
            throw new EvaluationException("Cannot compare " + Values.typeName(left) + " with "
                    + Values.typeName(right) + " using '" + operator.symbol() + "'");
        }

        return switch (operator) {
            case LT -> order < 0;
            case LE -> order <= 0;
            case GT -> order > 0;
            case GE -> order >= 0;
            default -> throw new EvaluationException("Unsupported comparison operator: " + operator);
        };
    }

    private Object evaluateArithmetic(RuntimeEnvironment environment, AstNode node) {
        Operator operator = node.operator();
        if (operator == Operator.NEGATE) {
            return -Values.toNumber(evaluate(environment, node.operand()), operator.symbol());
        }

        Object left = evaluate(environment, node.left());
        Object right = evaluate(environment, node.right());
        if (operator == Operator.ADD && (left instanceof String || right instanceof String)) {
            return Values.format(left) + Values.format(right);
        }

        double a = Values.toNumber(left, operator.symbol());
        double b = Values.toNumber(right, operator.symbol());
        return switch (operator) {
            case ADD -> a + b;
            case SUBTRACT -> a - b;
            case MULTIPLY -> a * b;
            case DIVIDE -> {
                if (b == 0.0) {
                    throw new EvaluationException("Division by zero");
                }
                yield a / b;
            }
            case MODULO -> {
                if (b == 0.0) {
                    throw new EvaluationException("Modulo by zero");
                }
                yield a % b;
            }
            case POWER -> Math.pow(a, b);
            default -> throw new EvaluationException("Unsupported arithmetic operator: " + operator);
        };
    }

    private Object evaluateCall(RuntimeEnvironment environment, AstNode node) {
        RuntimeFunction function = environment.function(node.text())
                .orElseThrow(() -> new EvaluationException("Unknown function '" + node.text() + "'"));
        List<Object> arguments = new ArrayList<>(node.childCount());
        for (AstNode argument : node.children()) {
            arguments.add(evaluate(environment, argument));
        }
        return function.invoke(arguments);
    }

    /**
     * Shorthand consequences evaluate to their keyword. A named action calls
     * the function of that name when one is registered, otherwise it
     * evaluates to its name.
     */
    private Object evaluateConsequence(RuntimeEnvironment environment, AstNode node) {
        if (node.consequenceType().isShorthand()) {
            return node.consequenceType().keyword();
        }
        return environment.function(node.text())
                .map(f -> f.invoke(List.of()))
                .orElse(node.text());
    }
}
