package com.bpmnnarrator.core.narrative;

import java.util.List;

/**
 * Single-line label fields of an element. Absent fields are empty, never null.
 *
 * @param name element name
 * @param actor lane name
 * @param type human-readable task type, empty for plain tasks and non-activities
 * @param systems systems joined by {@code ", "}
 * @param documents documents joined by {@code ", "}
 * @param annotations distinct annotation texts in attachment order
 */
public record NormalizedFields(
    String name,
    String actor,
    String type,
    String systems,
    String documents,
    List<String> annotations
) {
    public NormalizedFields {
        name = name == null ? "" : name;
        actor = actor == null ? "" : actor;
        type = type == null ? "" : type;
        systems = systems == null ? "" : systems;
        documents = documents == null ? "" : documents;
        annotations = annotations == null ? List.of() : List.copyOf(annotations);
    }

    public static NormalizedFields empty() {
        return new NormalizedFields("", "", "", "", "", List.of());
    }

    /**
     * Returns whether no detail field (actor, type, systems, documents, annotations) is set.
     */
    public boolean hasNoDetails() {
        return actor.isEmpty() && type.isEmpty() && systems.isEmpty() && documents.isEmpty() && annotations.isEmpty();
    }
}
