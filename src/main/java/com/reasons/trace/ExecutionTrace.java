package com.reasons.trace;

import com.reasons.runtime.Values;
import com.reasons.tree.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Records evaluation events in order, up to a fixed number of entries.
 */
public class ExecutionTrace implements TraceListener {

    private static final Logger log = LoggerFactory.getLogger(ExecutionTrace.class);

    public static final int DEFAULT_MAX_ENTRIES = 10_000;

    private final int maxEntries;
    private final List<TraceEntry> entries = new ArrayList<>();
    private long sequence;
    private long dropped;

    public ExecutionTrace() {
        this(DEFAULT_MAX_ENTRIES);
    }

    public ExecutionTrace(int maxEntries) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
        }
        this.maxEntries = maxEntries;
    }

    @Override
    public void reportCondition(TreeNode node, boolean branchTaken) {
        record(TraceEventType.CONDITION, node, String.valueOf(node.getCondition()), branchTaken);
    }

    @Override
    public void reportConsequence(TreeNode node, boolean success) {
        record(TraceEventType.CONSEQUENCE, node, String.valueOf(node.getActions()), success);
    }

    @Override
    public void reportOutcome(TreeNode node) {
        record(TraceEventType.OUTCOME, node, Values.format(node.getValue()), true);
    }

    private void record(TraceEventType type, TreeNode node, String detail, boolean flag) {
        sequence++;
        log.debug("trace #{} {} [{}] {} -> {}", sequence, type, node.getId(), detail, flag);
        if (entries.size() >= maxEntries) {
            dropped++;
            return;
        }
        entries.add(new TraceEntry(type, sequence, node.getId(), detail, flag));
    }

    public List<TraceEntry> entries() {
        return Collections.unmodifiableList(entries);
    }

    /**
     * Events that did not fit into the trace.
     */
    public long droppedEntries() {
        return dropped;
    }

    /**
     * Compact rendering of the recorded path, e.g. {@code x:T -> y > 3:F -> "lose"}.
     */
    public String decisionPath() {
        return entries.stream()
                .map(entry -> switch (entry.type()) {
                    case CONDITION -> entry.detail() + ":" + (entry.flag() ? "T" : "F");
                    case CONSEQUENCE -> entry.detail() + (entry.flag() ? "" : " (failed)");
                    case OUTCOME -> "\"" + entry.detail() + "\"";
                })
                .collect(Collectors.joining(" -> "));
    }

    public void clear() {
        entries.clear();
        sequence = 0;
        dropped = 0;
    }
}
