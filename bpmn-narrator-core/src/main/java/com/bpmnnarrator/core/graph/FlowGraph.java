package com.bpmnnarrator.core.graph;

import com.bpmnnarrator.core.model.EdgeOrigin;
import com.bpmnnarrator.core.model.FlowEdge;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Directed graph over the element ids of one process.
 *
 * <p>Outgoing edges of a node are kept sorted by {@link FlowEdge#orderIndex()}: declaration
 * order, with the default flow last and boundary edges after the sequence flows. Virtual edges
 * (resolved links, boundary attachments) are traversed like sequence flows and count towards
 * in-degree.
 *
 * <p>Instances are built by {@link FlowGraphBuilder} and augmented by {@link LinkResolver};
 * they are owned by a single conversion and are not thread-safe.
 */
public final class FlowGraph {

    private final ElementCatalog catalog;
    private final Map<String, List<FlowEdge>> outgoing = new HashMap<>();
    private final Map<String, List<FlowEdge>> incoming = new HashMap<>();
    private final List<FlowEdge> edges = new ArrayList<>();

    FlowGraph(ElementCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
    }

    void addEdge(FlowEdge edge) {
        List<FlowEdge> out = outgoing.computeIfAbsent(edge.sourceId(), k -> new ArrayList<>());
        out.add(edge);
        out.sort(Comparator.comparingInt(FlowEdge::orderIndex));
        incoming.computeIfAbsent(edge.targetId(), k -> new ArrayList<>()).add(edge);
        edges.add(edge);
    }

    /**
     * Appends a virtual edge after all current outgoing edges of its source.
     */
    FlowEdge addVirtualEdge(String id, String sourceId, String targetId, String label, EdgeOrigin origin) {
        List<FlowEdge> out = outgoing(sourceId);
        int orderIndex = out.isEmpty() ? 0 : out.get(out.size() - 1).orderIndex() + 1;
        FlowEdge edge = new FlowEdge(id, sourceId, targetId, label, orderIndex, false, origin);
        addEdge(edge);
        return edge;
    }

    public ElementCatalog catalog() {
        return catalog;
    }

    /**
     * Returns the outgoing edges of a node in traversal order.
     *
     * @param id element id
     * @return ordered edges, empty for terminal nodes
     */
    public List<FlowEdge> outgoing(String id) {
        return List.copyOf(outgoing.getOrDefault(id, List.of()));
    }

    public List<FlowEdge> incoming(String id) {
        return List.copyOf(incoming.getOrDefault(id, List.of()));
    }

    /**
     * Returns the number of distinct predecessors of a node.
     *
     * @param id element id
     * @return distinct source count over all incoming edges
     */
    public int inDegree(String id) {
        return (int) incoming.getOrDefault(id, List.of()).stream()
            .map(FlowEdge::sourceId)
            .distinct()
            .count();
    }

    public int outDegree(String id) {
        return outgoing.getOrDefault(id, List.of()).size();
    }

    public List<FlowEdge> edges() {
        return List.copyOf(edges);
    }
}
