package com.bpmnnarrator.core.graph;

import com.bpmnnarrator.core.error.MalformedGraphException;
import com.bpmnnarrator.core.model.ElementKind;
import com.bpmnnarrator.core.model.ProcessDefinition;
import com.bpmnnarrator.core.model.ProcessElement;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Registry of the flow elements of one process, keyed by id, in document order.
 */
public final class ElementCatalog {

    private final String processId;
    private final Map<String, ProcessElement> elements;

    private ElementCatalog(String processId, Map<String, ProcessElement> elements) {
        this.processId = processId;
        this.elements = Collections.unmodifiableMap(elements);
    }

    /**
     * Builds the catalog of a process.
     *
     * @param process parsed process
     * @return catalog in document order
     * @throws MalformedGraphException if two elements share an id
     */
    public static ElementCatalog of(ProcessDefinition process) {
        Objects.requireNonNull(process, "process must not be null");
        Map<String, ProcessElement> byId = new LinkedHashMap<>();
        for (ProcessElement element : process.elements()) {
            if (byId.putIfAbsent(element.id(), element) != null) {
                throw new MalformedGraphException("Duplicate element id: " + element.id(), element.id());
            }
        }
        return new ElementCatalog(process.id(), byId);
    }

    public String processId() {
        return processId;
    }

    public boolean contains(String id) {
        return elements.containsKey(id);
    }

    public Optional<ProcessElement> find(String id) {
        return Optional.ofNullable(elements.get(id));
    }

    /**
     * Returns an element that must exist.
     *
     * @param id element id
     * @return the element
     * @throws MalformedGraphException if no element has this id
     */
    public ProcessElement get(String id) {
        ProcessElement element = elements.get(id);
        if (element == null) {
            throw new MalformedGraphException("Unknown element id: " + id + " in process " + processId, id);
        }
        return element;
    }

    public Collection<ProcessElement> elements() {
        return elements.values();
    }

    public List<ProcessElement> ofKind(ElementKind kind) {
        return elements.values().stream()
            .filter(e -> e.kind() == kind)
            .toList();
    }

    public int size() {
        return elements.size();
    }
}
