package com.bpmnnarrator.core.model;

import java.util.Objects;

/**
 * A collaboration participant (pool).
 *
 * @param id participant identifier
 * @param name pool name, possibly empty
 * @param processRef id of the process the pool contains, or null for black-box pools
 */
public record Participant(
    String id,
    String name,
    String processRef
) {
    /**
     * Compact constructor with validation.
     */
    public Participant {
        Objects.requireNonNull(id, "id must not be null");
        if (name == null) {
            name = "";
        }
    }
}
