package com.bpmnnarrator.core.model;

import java.util.Objects;

/**
 * Directed edge of the flow graph.
 *
 * <p>{@code orderIndex} preserves the declaration order of the outgoing edges of a source. The
 * default flow of an element always carries the highest index among its sequence flows.
 *
 * @param id edge identifier (sequence flow id, or a synthetic id for virtual edges)
 * @param sourceId source element id
 * @param targetId target element id
 * @param label branch label derived from the flow name or condition, or empty
 * @param orderIndex position among the outgoing edges of the source
 * @param defaultFlow whether this is the default ("else") flow of the source
 * @param origin whether the edge was declared or installed by the graph builder
 */
public record FlowEdge(
    String id,
    String sourceId,
    String targetId,
    String label,
    int orderIndex,
    boolean defaultFlow,
    EdgeOrigin origin
) {
    /**
     * Compact constructor with validation.
     */
    public FlowEdge {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(sourceId, "sourceId must not be null");
        Objects.requireNonNull(targetId, "targetId must not be null");
        Objects.requireNonNull(origin, "origin must not be null");
        if (label == null) {
            label = "";
        }
    }

    /**
     * Returns whether this edge was installed by the builder rather than declared.
     *
     * @return true for link and boundary edges
     */
    public boolean isVirtual() {
        return origin != EdgeOrigin.SEQUENCE_FLOW;
    }
}
