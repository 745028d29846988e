package com.bpmnnarrator.core.model;

import java.util.Objects;

/**
 * Represents a message exchanged between pools of a collaboration.
 *
 * @param id message flow identifier
 * @param name message label, possibly empty
 * @param sourceRef id of the sending element or pool
 * @param targetRef id of the receiving element or pool
 */
public record MessageFlow(
    String id,
    String name,
    String sourceRef,
    String targetRef
) {
    /**
     * Compact constructor with validation.
     */
    public MessageFlow {
        Objects.requireNonNull(sourceRef, "sourceRef must not be null");
        Objects.requireNonNull(targetRef, "targetRef must not be null");
        if (name == null) {
            name = "";
        }
    }
}
