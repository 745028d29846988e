package com.bpmnnarrator.core.graph;

import com.bpmnnarrator.core.model.Diagnostic;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Outcome of link resolution for one process.
 *
 * @param targets catch event id per resolved throw event id
 * @param unmatchedThrows throw events without a catch; rendered as terminal steps
 * @param detachedCatches catch events that no throw reaches; reported once, never as unreachable
 * @param diagnostics unmatched and ambiguous link diagnostics
 */
public record LinkResolution(
    Map<String, String> targets,
    Set<String> unmatchedThrows,
    Set<String> detachedCatches,
    List<Diagnostic> diagnostics
) {
    public LinkResolution {
        targets = targets == null ? Map.of() : Map.copyOf(targets);
        unmatchedThrows = unmatchedThrows == null ? Set.of() : Set.copyOf(unmatchedThrows);
        detachedCatches = detachedCatches == null ? Set.of() : Set.copyOf(detachedCatches);
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    /**
     * Returns whether a link event was paired.
     *
     * @param id link event id
     * @return true for a throw with a target or a catch reached by a throw
     */
    public boolean isResolved(String id) {
        return targets.containsKey(id) || targets.containsValue(id);
    }
}
