package com.bpmnnarrator.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A BPMN process with its flow elements and sequence flows, in document order.
 *
 * @param id process identifier
 * @param name display title (process name, else participant name), possibly empty
 * @param elements flow elements in document order
 * @param flows sequence flows in document order
 */
public record ProcessDefinition(
    String id,
    String name,
    List<ProcessElement> elements,
    List<SequenceFlow> flows
) {
    /**
     * Compact constructor with validation.
     */
    public ProcessDefinition {
        Objects.requireNonNull(id, "id must not be null");
        if (name == null) {
            name = "";
        }
        elements = elements == null ? List.of() : List.copyOf(elements);
        flows = flows == null ? List.of() : List.copyOf(flows);
    }

    /**
     * Returns whether the process declares at least one start event.
     *
     * @return true if a start event exists
     */
    public boolean hasStartEvent() {
        return elements.stream().anyMatch(e -> e.kind() == ElementKind.START_EVENT);
    }
}
