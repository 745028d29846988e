package com.bpmnnarrator.core.parser;

import com.bpmnnarrator.core.model.ElementKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps BPMN tag names to {@link ElementKind}s.
 *
 * <p>The mapping is a fixed table rather than type inspection. Intermediate throw and catch
 * events are refined to link kinds when they carry a {@code linkEventDefinition}.
 *
 * <p>Tags in {@link #NON_FLOW_TAGS} are part of a process but are not flow elements; the parser
 * consumes them silently. Any other tag that is absent from the table is unrecognized.
 */
public final class ElementClassifier {

    private static final Map<String, ElementKind> TABLE;

    static {
        Map<String, ElementKind> table = new LinkedHashMap<>();
        table.put("task", ElementKind.TASK);
        table.put("userTask", ElementKind.TASK);
        table.put("serviceTask", ElementKind.TASK);
        table.put("sendTask", ElementKind.TASK);
        table.put("receiveTask", ElementKind.TASK);
        table.put("manualTask", ElementKind.TASK);
        table.put("scriptTask", ElementKind.TASK);
        table.put("businessRuleTask", ElementKind.TASK);
        table.put("subProcess", ElementKind.SUB_PROCESS);
        table.put("adHocSubProcess", ElementKind.SUB_PROCESS);
        table.put("transaction", ElementKind.SUB_PROCESS);
        table.put("callActivity", ElementKind.SUB_PROCESS);
        table.put("exclusiveGateway", ElementKind.EXCLUSIVE_GATEWAY);
        table.put("parallelGateway", ElementKind.PARALLEL_GATEWAY);
        table.put("inclusiveGateway", ElementKind.INCLUSIVE_GATEWAY);
        table.put("eventBasedGateway", ElementKind.EVENT_BASED_GATEWAY);
        table.put("complexGateway", ElementKind.COMPLEX_GATEWAY);
        table.put("startEvent", ElementKind.START_EVENT);
        table.put("endEvent", ElementKind.END_EVENT);
        table.put("intermediateThrowEvent", ElementKind.INTERMEDIATE_EVENT);
        table.put("intermediateCatchEvent", ElementKind.INTERMEDIATE_EVENT);
        table.put("implicitThrowEvent", ElementKind.INTERMEDIATE_EVENT);
        table.put("boundaryEvent", ElementKind.BOUNDARY_EVENT);
        TABLE = Collections.unmodifiableMap(table);
    }

    /** Process children that are not flow elements. */
    public static final Set<String> NON_FLOW_TAGS = Set.of(
        "sequenceFlow", "laneSet", "documentation", "extensionElements", "ioSpecification",
        "property", "dataObject", "dataObjectReference", "dataStoreReference", "textAnnotation",
        "association", "group", "category", "auditing", "monitoring", "supports",
        "correlationSubscription", "resourceRole", "performer", "humanPerformer", "potentialOwner"
    );

    private ElementClassifier() {
        // Utility class
    }

    /**
     * Classifies a tag.
     *
     * @param tagName tag local name
     * @param eventDefinition event definition flavour (e.g. "link", "timer"), or empty
     * @return element kind, or empty when the tag is not a known flow element
     */
    public static Optional<ElementKind> classify(String tagName, String eventDefinition) {
        ElementKind kind = TABLE.get(tagName);
        if (kind == null) {
            return Optional.empty();
        }
        if ("link".equals(eventDefinition)) {
            if ("intermediateThrowEvent".equals(tagName)) {
                return Optional.of(ElementKind.LINK_THROW_EVENT);
            }
            if ("intermediateCatchEvent".equals(tagName)) {
                return Optional.of(ElementKind.LINK_CATCH_EVENT);
            }
        }
        return Optional.of(kind);
    }

    /**
     * Returns whether the tag is a known non-flow child of a process.
     *
     * @param tagName tag local name
     * @return true when the parser should skip it silently
     */
    public static boolean isNonFlowTag(String tagName) {
        return NON_FLOW_TAGS.contains(tagName);
    }

    /**
     * Returns the classification table in declaration order.
     *
     * @return unmodifiable tag-to-kind map
     */
    public static Map<String, ElementKind> table() {
        return TABLE;
    }
}
