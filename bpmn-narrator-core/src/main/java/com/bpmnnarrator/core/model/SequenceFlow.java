package com.bpmnnarrator.core.model;

import java.util.Objects;

/**
 * A sequence flow as declared in the BPMN document.
 *
 * @param id flow identifier
 * @param name flow label (often the gateway condition in plain words), or empty
 * @param sourceRef id of the source element
 * @param targetRef id of the target element
 * @param conditionExpression condition expression text, or empty
 */
public record SequenceFlow(
    String id,
    String name,
    String sourceRef,
    String targetRef,
    String conditionExpression
) {
    /**
     * Compact constructor with validation.
     */
    public SequenceFlow {
        Objects.requireNonNull(id, "id must not be null");
        if (name == null) {
            name = "";
        }
        if (conditionExpression == null) {
            conditionExpression = "";
        }
    }
}
