package com.bpmnnarrator.core.traversal;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mutable state of one traversal run: element states and convergence arrival counters.
 *
 * <p>Created fresh for every run and discarded afterwards.
 */
final class NumberingState {

    private final Map<String, NodeState> states = new HashMap<>();
    private final Map<String, StepNumber> numbers = new LinkedHashMap<>();
    private final Map<String, Integer> arrivals = new LinkedHashMap<>();

    NodeState state(String id) {
        return states.getOrDefault(id, NodeState.UNVISITED);
    }

    void enter(String id, StepNumber number) {
        require(id, NodeStatus.UNVISITED);
        states.put(id, NodeState.inProgress(number));
        numbers.put(id, number);
    }

    void finish(String id) {
        require(id, NodeStatus.IN_PROGRESS);
        states.put(id, NodeState.visited(numbers.get(id)));
    }

    void markPending(String id) {
        require(id, NodeStatus.UNVISITED);
        states.put(id, NodeState.PENDING);
    }

    void releasePending(String id) {
        require(id, NodeStatus.PENDING);
        states.remove(id);
    }

    /**
     * Records one more branch arriving at a convergence point.
     *
     * @return arrivals so far, including this one
     */
    int arrive(String id) {
        return arrivals.merge(id, 1, Integer::sum);
    }

    Map<String, StepNumber> numbers() {
        return Collections.unmodifiableMap(numbers);
    }

    Map<String, Integer> arrivals() {
        return Collections.unmodifiableMap(arrivals);
    }

    private void require(String id, NodeStatus expected) {
        NodeStatus actual = state(id).status();
        if (actual != expected) {
            throw new IllegalStateException("Element " + id + " is " + actual + ", expected " + expected);
        }
    }
}
