package com.reasons.runtime;

import com.reasons.exception.EvaluationException;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * A named function callable from rule expressions.
 *
 * @param name    Function name
 * @param minArgs Minimum argument count
 * @param maxArgs Maximum argument count, -1 for unbounded
 * @param body    Implementation receiving the evaluated arguments
 */
public record RuntimeFunction(String name, int minArgs, int maxArgs, Function<List<Object>, Object> body) {

    public RuntimeFunction {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(body, "body");
        if (minArgs < 0 || (maxArgs >= 0 && maxArgs < minArgs)) {
            throw new IllegalArgumentException("Invalid arity for function '" + name + "'");
        }
    }

    public Object invoke(List<Object> arguments) {
        int count = arguments.size();
        if (count < minArgs || (maxArgs >= 0 && count > maxArgs)) {
            throw new EvaluationException("Function '" + name + "' expects "
                    + describeArity() + " argument(s), got " + count);
        }
        return body.apply(arguments);
    }

    private String describeArity() {
        if (maxArgs < 0) {
            return "at least " + minArgs;
        }
        return minArgs == maxArgs ? String.valueOf(minArgs) : minArgs + " to " + maxArgs;
    }
}
