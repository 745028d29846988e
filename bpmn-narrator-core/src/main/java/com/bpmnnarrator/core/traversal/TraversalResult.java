package com.bpmnnarrator.core.traversal;

import com.bpmnnarrator.core.model.Diagnostic;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of traversing one process.
 *
 * @param processId traversed process
 * @param steps steps in visitation order
 * @param numbers assigned number per element id, in assignment order
 * @param arrivals branches that reached each convergence point
 * @param diagnostics unreachable element diagnostics
 */
public record TraversalResult(
    String processId,
    List<NarrativeStep> steps,
    Map<String, StepNumber> numbers,
    Map<String, Integer> arrivals,
    List<Diagnostic> diagnostics
) {
    public TraversalResult {
        steps = steps == null ? List.of() : List.copyOf(steps);
        numbers = numbers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(numbers));
        arrivals = arrivals == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(arrivals));
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    /**
     * Returns the number assigned to an element.
     *
     * @param elementId element id
     * @return number, or null when the element was not numbered
     */
    public StepNumber numberOf(String elementId) {
        return numbers.get(elementId);
    }
}
