package com.bpmnnarrator.core.traversal;

/**
 * Traversal status of an element.
 */
public enum NodeStatus {
    /** Not reached yet. */
    UNVISITED,
    /** Numbered and on the active path. */
    IN_PROGRESS,
    /** Convergence point waiting for the remaining branches of its divergence. */
    PENDING,
    /** Numbered and completely walked. */
    VISITED
}
