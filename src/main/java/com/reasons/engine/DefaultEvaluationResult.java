package com.reasons.engine;

import com.reasons.runtime.Values;
import com.reasons.trace.ExecutionTrace;
import com.reasons.trace.TraceEntry;

import java.util.List;

/**
 * Default implementation of EvaluationResult.
 */
public class DefaultEvaluationResult implements EvaluationResult {

    private final String treeName;
    private final Object value;
    private final String explanation;
    private final List<TraceEntry> trace;
    private final String decisionPath;

    private DefaultEvaluationResult(String treeName, Object value, String explanation,
                                    List<TraceEntry> trace, String decisionPath) {
        this.treeName = treeName;
        this.value = value;
        this.explanation = explanation;
        this.trace = trace;
        this.decisionPath = decisionPath;
    }

    /**
     * @param trace Trace of the evaluation, may be null
     */
    public static DefaultEvaluationResult of(String treeName, Object value, String explanation, ExecutionTrace trace) {
        if (trace == null) {
            return new DefaultEvaluationResult(treeName, value, explanation, List.of(), null);
        }
        return new DefaultEvaluationResult(treeName, value, explanation,
                List.copyOf(trace.entries()), trace.decisionPath());
    }

    @Override
    public String getTreeName() {
        return treeName;
    }

    @Override
    public Object getValue() {
        return value;
    }

    @Override
    public boolean isMatched() {
        return value != null;
    }

    @Override
    public String getExplanation() {
        return explanation;
    }

    @Override
    public List<TraceEntry> getTrace() {
        return trace;
    }

    @Override
    public String getDecisionPath() {
        return decisionPath;
    }

    @Override
    public String toString() {
        return "EvaluationResult{" +
                "tree=" + treeName +
                ", value=" + Values.format(value) +
                ", path=" + (decisionPath != null ? decisionPath : "none") +
                '}';
    }
}
