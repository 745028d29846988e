package com.bpmnnarrator.core.narrative;

import com.bpmnnarrator.core.graph.ElementCatalog;
import com.bpmnnarrator.core.model.ProcessDefinition;
import com.bpmnnarrator.core.traversal.TraversalResult;

import java.util.Objects;

/**
 * A process together with its catalog and traversal, ready to be rendered.
 *
 * @param process parsed process
 * @param catalog element catalog of the process
 * @param traversal traversal result
 */
public record TraversedProcess(
    ProcessDefinition process,
    ElementCatalog catalog,
    TraversalResult traversal
) {
    public TraversedProcess {
        Objects.requireNonNull(process, "process must not be null");
        Objects.requireNonNull(catalog, "catalog must not be null");
        Objects.requireNonNull(traversal, "traversal must not be null");
    }
}
