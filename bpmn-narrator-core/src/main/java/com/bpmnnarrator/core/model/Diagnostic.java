package com.bpmnnarrator.core.model;

import java.util.Objects;

/**
 * A recoverable anomaly reported alongside the narrative.
 *
 * @param type anomaly type
 * @param elementId id of the element concerned, or null
 * @param message human-readable description, rendered as a trailing note
 */
public record Diagnostic(
    DiagnosticType type,
    String elementId,
    String message
) {
    /**
     * Compact constructor with validation.
     */
    public Diagnostic {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }
}
