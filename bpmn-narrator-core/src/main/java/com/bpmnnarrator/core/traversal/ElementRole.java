package com.bpmnnarrator.core.traversal;

/**
 * Structural role of a numbered element in the traversed graph.
 */
public enum ElementRole {
    /** At most one successor and one predecessor. */
    PLAIN,
    /** More than one successor: branches follow. */
    SPLIT,
    /** Several predecessors and at most one successor. */
    MERGE
}
