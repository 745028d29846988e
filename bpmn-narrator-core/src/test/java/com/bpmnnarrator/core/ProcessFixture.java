package com.bpmnnarrator.core;

import com.bpmnnarrator.core.model.ElementDetails;
import com.bpmnnarrator.core.model.ElementKind;
import com.bpmnnarrator.core.model.ProcessDefinition;
import com.bpmnnarrator.core.model.ProcessElement;
import com.bpmnnarrator.core.model.SequenceFlow;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds {@link ProcessDefinition}s for tests without going through XML.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ProcessDefinition process = ProcessFixture.process("Pedido")
 *     .start("S").task("A", "Analisar").end("E")
 *     .flow("S", "A").flow("A", "E")
 *     .build();
 * }</pre>
 */
public final class ProcessFixture {

    private final String name;
    private final Map<String, ProcessElement> elements = new LinkedHashMap<>();
    private final List<SequenceFlow> flows = new ArrayList<>();
    private final Map<String, String> defaults = new HashMap<>();

    private ProcessFixture(String name) {
        this.name = name;
    }

    public static ProcessFixture process(String name) {
        return new ProcessFixture(name);
    }

    public ProcessFixture element(String id, ElementKind kind, String tag, String elementName) {
        elements.put(id, new ProcessElement(id, kind, tag, elementName, "", "", null, null, null));
        return this;
    }

    public ProcessFixture start(String id) {
        return element(id, ElementKind.START_EVENT, "startEvent", "");
    }

    public ProcessFixture end(String id) {
        return element(id, ElementKind.END_EVENT, "endEvent", "");
    }

    public ProcessFixture task(String id, String taskName) {
        return element(id, ElementKind.TASK, "task", taskName);
    }

    public ProcessFixture exclusive(String id, String gatewayName) {
        return element(id, ElementKind.EXCLUSIVE_GATEWAY, "exclusiveGateway", gatewayName);
    }

    public ProcessFixture parallel(String id) {
        return element(id, ElementKind.PARALLEL_GATEWAY, "parallelGateway", "");
    }

    public ProcessFixture linkThrow(String id, String linkName) {
        elements.put(id, new ProcessElement(id, ElementKind.LINK_THROW_EVENT, "intermediateThrowEvent",
            linkName, "link", linkName, null, null, null));
        return this;
    }

    public ProcessFixture linkCatch(String id, String linkName) {
        elements.put(id, new ProcessElement(id, ElementKind.LINK_CATCH_EVENT, "intermediateCatchEvent",
            linkName, "link", linkName, null, null, null));
        return this;
    }

    public ProcessFixture boundary(String id, String hostId, String flavour, String eventName) {
        elements.put(id, new ProcessElement(id, ElementKind.BOUNDARY_EVENT, "boundaryEvent",
            eventName, flavour, "", hostId, null, null));
        return this;
    }

    public ProcessFixture details(String id, ElementDetails details) {
        elements.put(id, elements.get(id).withDetails(details));
        return this;
    }

    public ProcessFixture flow(String sourceId, String targetId) {
        return flow(sourceId, targetId, "");
    }

    public ProcessFixture flow(String sourceId, String targetId, String label) {
        flows.add(new SequenceFlow("Flow_" + (flows.size() + 1), label, sourceId, targetId, ""));
        return this;
    }

    /**
     * Adds a flow and marks it as the default flow of its source.
     */
    public ProcessFixture defaultFlow(String sourceId, String targetId) {
        flow(sourceId, targetId);
        defaults.put(sourceId, flows.get(flows.size() - 1).id());
        return this;
    }

    public ProcessDefinition build() {
        List<ProcessElement> built = new ArrayList<>();
        for (ProcessElement element : elements.values()) {
            String defaultFlowId = defaults.get(element.id());
            built.add(defaultFlowId == null ? element : new ProcessElement(element.id(), element.kind(),
                element.tagName(), element.name(), element.eventDefinition(), element.linkName(),
                element.attachedToRef(), defaultFlowId, element.details()));
        }
        return new ProcessDefinition("Process_1", name, built, flows);
    }
}
