package com.bpmnnarrator.core.narrative;

import com.bpmnnarrator.core.model.Diagnostic;
import com.bpmnnarrator.core.traversal.TraversalResult;

import java.util.List;
import java.util.Objects;

/**
 * Narrative text of a document with the diagnostics collected while producing it.
 *
 * @param documentName name of the converted document
 * @param text newline-terminated narrative, including the trailing notes
 * @param diagnostics recoverable problems, in the order they were found
 * @param traversals traversal of every rendered process
 */
public record NarrativeResult(
    String documentName,
    String text,
    List<Diagnostic> diagnostics,
    List<TraversalResult> traversals
) {
    public NarrativeResult {
        Objects.requireNonNull(documentName, "documentName must not be null");
        Objects.requireNonNull(text, "text must not be null");
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
        traversals = traversals == null ? List.of() : List.copyOf(traversals);
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }
}
