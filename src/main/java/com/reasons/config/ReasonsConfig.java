package com.reasons.config;

import com.reasons.lexer.LexerOptions;
import com.reasons.trace.ExecutionTrace;
import com.reasons.tree.TreeBuilder;

/**
 * Root configuration.
 *
 * @param name            Engine name, used in logs
 * @param rulesPath       Rules source to load at startup (classpath: or file path), may be null
 * @param lexer           Lexer options
 * @param optimize        Fold constant conditions when loading rules
 * @param defaultWeight   Weight of condition nodes built from rules
 * @param tracing         Record an execution trace for each evaluation
 * @param explanations    Produce an explanation for each evaluation
 * @param maxTraceEntries Entries kept per trace
 */
public record ReasonsConfig(
        String name,
        String rulesPath,
        LexerOptions lexer,
        boolean optimize,
        double defaultWeight,
        boolean tracing,
        boolean explanations,
        int maxTraceEntries
) {

    public ReasonsConfig {
        if (name == null || name.isBlank()) {
            name = "reasons";
        }
        if (lexer == null) {
            lexer = LexerOptions.defaults();
        }
        if (maxTraceEntries <= 0) {
            throw new IllegalArgumentException("maxTraceEntries must be positive: " + maxTraceEntries);
        }
    }

    public static ReasonsConfig defaults() {
        return new ReasonsConfig("reasons", null, LexerOptions.defaults(), true,
                TreeBuilder.DEFAULT_WEIGHT, false, true, ExecutionTrace.DEFAULT_MAX_ENTRIES);
    }

    public ReasonsConfig withLexer(LexerOptions options) {
        return new ReasonsConfig(name, rulesPath, options, optimize, defaultWeight,
                tracing, explanations, maxTraceEntries);
    }

    public ReasonsConfig withTracing(boolean enabled) {
        return new ReasonsConfig(name, rulesPath, lexer, optimize, defaultWeight,
                enabled, explanations, maxTraceEntries);
    }
}
