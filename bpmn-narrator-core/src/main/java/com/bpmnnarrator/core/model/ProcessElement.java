package com.bpmnnarrator.core.model;

import java.util.Objects;

/**
 * A flow element of a BPMN process (task, gateway, event).
 *
 * @param id identifier, unique within the diagram
 * @param kind element classification
 * @param tagName BPMN tag local name (e.g. "userTask"), kept for type labels
 * @param name raw label, possibly empty or spanning several lines
 * @param eventDefinition event flavour without the "EventDefinition" suffix (e.g. "timer"), or empty
 * @param linkName link name for link events, or empty
 * @param attachedToRef host activity id for boundary events, or null
 * @param defaultFlowId id of the default outgoing sequence flow, or null
 * @param details actor, systems, documents and annotations
 */
public record ProcessElement(
    String id,
    ElementKind kind,
    String tagName,
    String name,
    String eventDefinition,
    String linkName,
    String attachedToRef,
    String defaultFlowId,
    ElementDetails details
) {
    /**
     * Compact constructor with validation.
     */
    public ProcessElement {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(tagName, "tagName must not be null");
        if (name == null) {
            name = "";
        }
        if (eventDefinition == null) {
            eventDefinition = "";
        }
        if (linkName == null) {
            linkName = "";
        }
        if (details == null) {
            details = ElementDetails.empty();
        }
    }

    /**
     * Returns a copy with replaced details.
     *
     * @param newDetails the details to attach
     * @return updated element
     */
    public ProcessElement withDetails(ElementDetails newDetails) {
        return new ProcessElement(id, kind, tagName, name, eventDefinition, linkName,
            attachedToRef, defaultFlowId, newDetails);
    }
}
