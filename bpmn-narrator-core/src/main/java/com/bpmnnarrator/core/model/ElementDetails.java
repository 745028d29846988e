package com.bpmnnarrator.core.model;

import java.util.List;

/**
 * Descriptive fields attached to a flow element.
 *
 * <p>Values are kept as read from the diagram and may contain line breaks; they are cleaned up
 * by the label normalizer before rendering.
 *
 * @param actor lane (actor) responsible for the element, or null when unknown
 * @param systems names of data stores associated with the element
 * @param documents names of data objects associated with the element
 * @param annotations texts of annotations associated with the element
 */
public record ElementDetails(
    String actor,
    List<String> systems,
    List<String> documents,
    List<String> annotations
) {
    /**
     * Compact constructor with validation.
     */
    public ElementDetails {
        systems = systems == null ? List.of() : List.copyOf(systems);
        documents = documents == null ? List.of() : List.copyOf(documents);
        annotations = annotations == null ? List.of() : List.copyOf(annotations);
    }

    /**
     * Creates details with no actor and no associated artifacts.
     *
     * @return empty details
     */
    public static ElementDetails empty() {
        return new ElementDetails(null, List.of(), List.of(), List.of());
    }

    /**
     * Returns a copy with the given actor.
     *
     * @param newActor actor name
     * @return updated details
     */
    public ElementDetails withActor(String newActor) {
        return new ElementDetails(newActor, systems, documents, annotations);
    }
}
