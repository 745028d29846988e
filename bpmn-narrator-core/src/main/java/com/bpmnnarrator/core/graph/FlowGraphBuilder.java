package com.bpmnnarrator.core.graph;

import com.bpmnnarrator.core.error.MalformedGraphException;
import com.bpmnnarrator.core.model.EdgeOrigin;
import com.bpmnnarrator.core.model.ElementKind;
import com.bpmnnarrator.core.model.FlowEdge;
import com.bpmnnarrator.core.model.ProcessDefinition;
import com.bpmnnarrator.core.model.ProcessElement;
import com.bpmnnarrator.core.model.SequenceFlow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the {@link FlowGraph} of a process from its sequence flows.
 *
 * <p>Order indexes follow document order per source element. A flow referenced by its source's
 * {@code default} attribute is moved to the highest index, so conditional branches come first.
 * Boundary events are attached to their host with a virtual edge ordered after the host's flows.
 */
public class FlowGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(FlowGraphBuilder.class);

    /**
     * Builds the graph.
     *
     * @param process parsed process
     * @return flow graph without link edges
     * @throws MalformedGraphException if a flow or boundary event references an unknown element
     */
    public FlowGraph build(ProcessDefinition process) {
        Objects.requireNonNull(process, "process must not be null");
        ElementCatalog catalog = ElementCatalog.of(process);
        FlowGraph graph = new FlowGraph(catalog);

        Map<String, List<SequenceFlow>> bySource = new LinkedHashMap<>();
        for (SequenceFlow flow : process.flows()) {
            requireEndpoint(catalog, flow.id(), "sourceRef", flow.sourceRef());
            requireEndpoint(catalog, flow.id(), "targetRef", flow.targetRef());
            bySource.computeIfAbsent(flow.sourceRef(), k -> new ArrayList<>()).add(flow);
        }

        bySource.forEach((sourceId, flows) -> {
            String defaultFlowId = catalog.get(sourceId).defaultFlowId();
            List<SequenceFlow> ordered = new ArrayList<>(flows);
            if (defaultFlowId != null) {
                boolean moved = ordered.removeIf(f -> f.id().equals(defaultFlowId));
                if (moved) {
                    ordered.add(flows.stream().filter(f -> f.id().equals(defaultFlowId)).findFirst().orElseThrow());
                } else {
                    log.debug("Default flow {} of {} is not one of its outgoing flows", defaultFlowId, sourceId);
                }
            }
            for (int i = 0; i < ordered.size(); i++) {
                SequenceFlow flow = ordered.get(i);
                graph.addEdge(new FlowEdge(
                    flow.id(),
                    flow.sourceRef(),
                    flow.targetRef(),
                    flow.name().isBlank() ? flow.conditionExpression() : flow.name(),
                    i,
                    flow.id().equals(defaultFlowId),
                    EdgeOrigin.SEQUENCE_FLOW));
            }
        });

        for (ProcessElement boundary : catalog.ofKind(ElementKind.BOUNDARY_EVENT)) {
            String hostId = boundary.attachedToRef();
            if (hostId == null || !catalog.contains(hostId)) {
                throw new MalformedGraphException("Boundary event " + boundary.id()
                    + " is attached to unknown element: " + hostId, boundary.id());
            }
            graph.addVirtualEdge("boundary_" + boundary.id(), hostId, boundary.id(), "", EdgeOrigin.BOUNDARY);
        }

        log.debug("Built flow graph of {}: {} elements, {} edges",
            process.id(), catalog.size(), graph.edges().size());
        return graph;
    }

    private static void requireEndpoint(ElementCatalog catalog, String flowId, String attribute, String ref) {
        if (ref == null || ref.isEmpty()) {
            throw new MalformedGraphException("Sequence flow " + flowId + " has no " + attribute, flowId);
        }
        if (!catalog.contains(ref)) {
            throw new MalformedGraphException("Sequence flow " + flowId + " references unknown element: " + ref, ref);
        }
    }
}
