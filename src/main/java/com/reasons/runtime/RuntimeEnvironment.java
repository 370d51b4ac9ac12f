package com.reasons.runtime;

import com.reasons.exception.EvaluationException;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Variables and functions visible to rule evaluation.
 * <p>
 * Variables live in a stack of scopes; lookups search from the innermost
 * scope outwards. An environment belongs to one evaluation at a time.
 */
public final class RuntimeEnvironment {

    private final Deque<Map<String, Object>> scopes = new ArrayDeque<>();
    private final Map<String, RuntimeFunction> functions;

    private RuntimeEnvironment(Builder builder) {
        this.scopes.push(new HashMap<>(builder.variables));
        this.functions = new HashMap<>(builder.functions);
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isDefined(String name) {
        for (Map<String, Object> scope : scopes) {
            if (scope.containsKey(name)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Value of a variable, or null when it is undefined or holds null.
     */
    public Object get(String name) {
        for (Map<String, Object> scope : scopes) {
            if (scope.containsKey(name)) {
                return scope.get(name);
            }
        }
        return null;
    }

    /**
     * Define a variable in the innermost scope.
     */
    public void define(String name, Object value) {
        scopes.peek().put(name, value);
    }

    /**
     * Update the innermost scope that defines the variable, or define it in
     * the global scope.
     */
    public void assign(String name, Object value) {
        for (Map<String, Object> scope : scopes) {
            if (scope.containsKey(name)) {
                scope.put(name, value);
                return;
            }
        }
        scopes.peekLast().put(name, value);
    }

    public void pushScope() {
        scopes.push(new HashMap<>());
    }

    public void popScope() {
        if (scopes.size() == 1) {
            throw new IllegalStateException("Cannot pop the global scope");
        }
        scopes.pop();
    }

    public int scopeDepth() {
        return scopes.size();
    }

    /**
     * Visible variables, inner scopes shadowing outer ones.
     */
    public Map<String, Object> snapshot() {
        Map<String, Object> result = new LinkedHashMap<>();
        Iterator<Map<String, Object>> outermostFirst = scopes.descendingIterator();
        while (outermostFirst.hasNext()) {
            result.putAll(outermostFirst.next());
        }
        return Collections.unmodifiableMap(result);
    }

    public Optional<RuntimeFunction> function(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    public void registerFunction(RuntimeFunction function) {
        functions.put(function.name(), function);
    }

    /**
     * Builder for RuntimeEnvironment.
     */
    public static final class Builder {

        private final Map<String, Object> variables = new HashMap<>();
        private final Map<String, RuntimeFunction> functions = new HashMap<>();

        private Builder() {
            builtins().forEach(f -> functions.put(f.name(), f));
        }

        public Builder variable(String name, Object value) {
            variables.put(name, Values.normalize(value));
            return this;
        }

        public Builder variables(Map<String, ?> values) {
            values.forEach(this::variable);
            return this;
        }

        public Builder function(RuntimeFunction function) {
            functions.put(function.name(), function);
            return this;
        }

        public RuntimeEnvironment build() {
            return new RuntimeEnvironment(this);
        }
    }

    private static List<RuntimeFunction> builtins() {
        return List.of(
                new RuntimeFunction("min", 1, -1, args -> args.stream()
                        .mapToDouble(a -> Values.toNumber(a, "min")).min().orElseThrow()),
                new RuntimeFunction("max", 1, -1, args -> args.stream()
                        .mapToDouble(a -> Values.toNumber(a, "max")).max().orElseThrow()),
                new RuntimeFunction("abs", 1, 1, args -> Math.abs(Values.toNumber(args.get(0), "abs"))),
                new RuntimeFunction("len", 1, 1, args -> length(args.get(0))),
                new RuntimeFunction("str", 1, 1, args -> Values.format(args.get(0))),
                new RuntimeFunction("num", 1, 1, args -> toNumber(args.get(0)))
        );
    }

    private static Object length(Object value) {
        if (value instanceof String s) {
            return (double) s.length();
        }
        if (value instanceof List<?> list) {
            return (double) list.size();
        }
        if (value instanceof Map<?, ?> map) {
            return (double) map.size();
        }
        throw new EvaluationException("len() expects a string, list or map, got " + Values.typeName(value));
    }

    private static Object toNumber(Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof Boolean b) {
            return b ? 1.0 : 0.0;
        }
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                throw new EvaluationException("Cannot convert '" + s + "' to a number", e);
            }
        }
        throw new EvaluationException("Cannot convert " + Values.typeName(value) + " to a number");
    }
}
