package com.bpmnnarrator.core.parser;

import com.bpmnnarrator.core.model.Bounds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resolves the actor (lane name) of each flow element of a process.
 *
 * <p>Explicit {@code flowNodeRef} entries win; nested lanes come later in document order, so
 * the innermost lane overrides its parent. Elements without a reference can optionally be
 * placed by diagram geometry:
 * <ol>
 *   <li>the lane shape with the largest intersection, ties broken by the smaller lane</li>
 *   <li>otherwise the smallest lane shape containing the element centre</li>
 * </ol>
 * A parent lane enclosing the winner never competes with it. When the winner is tied with any
 * other candidate the actor is marked as ambiguous.
 */
final class LaneResolver {

    private static final Logger log = LoggerFactory.getLogger(LaneResolver.class);

    static final String AMBIGUOUS_SUFFIX = " (ambíguo)";

    private final Element definitions;
    private final boolean inferFromDiagram;

    LaneResolver(Element definitions, boolean inferFromDiagram) {
        this.definitions = definitions;
        this.inferFromDiagram = inferFromDiagram;
    }

    /**
     * Maps flow element ids of a process to actor names.
     *
     * @param process the process element
     * @param elementIds ids of the flow elements of the process
     * @return actor name per element id; elements without an actor are absent
     */
    Map<String, String> resolve(Element process, Set<String> elementIds) {
        Map<String, String> laneNames = new LinkedHashMap<>();
        Map<String, String> actors = new HashMap<>();

        for (Element lane : XmlElements.descendants(process, "lane")) {
            String laneId = XmlElements.attribute(lane, "id");
            String laneName = XmlElements.attribute(lane, "name");
            if (laneName.isEmpty()) {
                continue;
            }
            laneNames.put(laneId, laneName);
            for (Element ref : XmlElements.children(lane, "flowNodeRef")) {
                String nodeId = XmlElements.text(ref);
                if (!nodeId.isEmpty()) {
                    actors.put(nodeId, laneName);
                }
            }
        }

        if (inferFromDiagram && !laneNames.isEmpty()) {
            inferFromShapes(elementIds, laneNames, actors);
        }
        return actors;
    }

    private void inferFromShapes(Set<String> elementIds, Map<String, String> laneNames, Map<String, String> actors) {
        Map<String, Bounds> nodeBounds = new HashMap<>();
        Map<String, Bounds> laneBounds = new LinkedHashMap<>();
        for (Element shape : XmlElements.descendants(definitions, XmlElements.BPMNDI_NS, "BPMNShape")) {
            String elementId = shape.getAttribute("bpmnElement");
            List<Element> bounds = XmlElements.descendants(shape, XmlElements.DC_NS, "Bounds");
            if (elementId.isEmpty() || bounds.isEmpty()) {
                continue;
            }
            Bounds rect = toBounds(bounds.get(0));
            if (elementIds.contains(elementId)) {
                nodeBounds.put(elementId, rect);
            }
            if (laneNames.containsKey(elementId)) {
                laneBounds.put(elementId, rect);
            }
        }

        nodeBounds.forEach((nodeId, rect) -> {
            if (actors.containsKey(nodeId)) {
                return;
            }
            String actor = byIntersection(rect, laneBounds, laneNames);
            if (actor == null) {
                actor = byCentre(rect, laneBounds, laneNames);
            }
            if (actor != null) {
                log.debug("Actor of {} inferred from diagram: {}", nodeId, actor);
                actors.put(nodeId, actor);
            }
        });
    }

    private static String byIntersection(Bounds rect, Map<String, Bounds> laneBounds, Map<String, String> laneNames) {
        record Overlap(String laneId, double shared, double laneArea) {}

        List<Overlap> overlaps = new ArrayList<>();
        laneBounds.forEach((laneId, lane) -> {
            double shared = rect.intersectionArea(lane);
            if (shared > 0) {
                overlaps.add(new Overlap(laneId, shared, lane.area()));
            }
        });
        if (overlaps.isEmpty()) {
            return null;
        }
        overlaps.sort(Comparator.comparingDouble(Overlap::shared).reversed()
            .thenComparingDouble(Overlap::laneArea));
        Overlap best = overlaps.get(0);
        Bounds bestLane = laneBounds.get(best.laneId());
        boolean tied = overlaps.stream()
            .skip(1)
            .anyMatch(o -> o.shared() == best.shared() && !laneBounds.get(o.laneId()).encloses(bestLane));
        String name = laneNames.get(best.laneId());
        return tied ? name + AMBIGUOUS_SUFFIX : name;
    }

    private static String byCentre(Bounds rect, Map<String, Bounds> laneBounds, Map<String, String> laneNames) {
        List<Map.Entry<String, Bounds>> containing = laneBounds.entrySet().stream()
            .filter(e -> e.getValue().contains(rect.centerX(), rect.centerY()))
            .sorted(Comparator.comparingDouble(e -> e.getValue().area()))
            .toList();
        if (containing.isEmpty()) {
            return null;
        }
        Bounds bestLane = containing.get(0).getValue();
        boolean tied = containing.stream()
            .skip(1)
            .anyMatch(e -> !e.getValue().encloses(bestLane));
        String name = laneNames.get(containing.get(0).getKey());
        return tied ? name + AMBIGUOUS_SUFFIX : name;
    }

    private static Bounds toBounds(Element bounds) {
        return new Bounds(
            number(bounds, "x"),
            number(bounds, "y"),
            number(bounds, "width"),
            number(bounds, "height"));
    }

    private static double number(Element element, String attribute) {
        String value = element.getAttribute(attribute);
        if (value.isEmpty()) {
            return 0;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric {}='{}' in diagram bounds", attribute, value);
            return 0;
        }
    }
}
