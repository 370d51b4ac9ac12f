package com.reasons.trace;

/**
 * One recorded evaluation event.
 *
 * @param type     Event kind
 * @param sequence Position of the event in the trace, starting at 1
 * @param nodeId   Id of the node, may be null
 * @param detail   Rendered condition, actions or outcome value
 * @param flag     Branch taken for conditions, success for consequences, true for outcomes
 */
public record TraceEntry(TraceEventType type, long sequence, String nodeId, String detail, boolean flag) {
}
