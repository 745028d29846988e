package com.bpmnnarrator.core.traversal;

import java.util.Objects;

/**
 * Status of an element during traversal, with its number once assigned.
 *
 * @param status traversal status
 * @param number assigned number, null while unvisited or pending
 */
public record NodeState(NodeStatus status, StepNumber number) {

    public static final NodeState UNVISITED = new NodeState(NodeStatus.UNVISITED, null);
    public static final NodeState PENDING = new NodeState(NodeStatus.PENDING, null);

    public NodeState {
        Objects.requireNonNull(status, "status must not be null");
        boolean numbered = status == NodeStatus.IN_PROGRESS || status == NodeStatus.VISITED;
        if (numbered != (number != null)) {
            throw new IllegalArgumentException("number must be set exactly for numbered states: " + status);
        }
    }

    public static NodeState inProgress(StepNumber number) {
        return new NodeState(NodeStatus.IN_PROGRESS, number);
    }

    public static NodeState visited(StepNumber number) {
        return new NodeState(NodeStatus.VISITED, number);
    }
}
