package com.bpmnnarrator.core.traversal;

import com.bpmnnarrator.core.config.NarrativeOptions;
import com.bpmnnarrator.core.graph.FlowGraph;
import com.bpmnnarrator.core.graph.LinkResolution;
import com.bpmnnarrator.core.model.ElementKind;
import com.bpmnnarrator.core.model.FlowEdge;
import com.bpmnnarrator.core.model.ProcessElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * View of a {@link FlowGraph} with transparent elements contracted away.
 *
 * <p>An element is transparent when it gets no line of its own and is simply passed through:
 * <ul>
 *   <li>resolved link events with a single outgoing edge, unless link events are shown</li>
 *   <li>pure merge gateways (several predecessors, one successor) other than parallel ones,
 *       unless merge gateways are rendered</li>
 * </ul>
 * An edge into a transparent element continues to that element's successor. The edge keeps
 * its own label, or takes the label of the edge it continues through.
 */
final class StepGraph {

    private static final Logger log = LoggerFactory.getLogger(StepGraph.class);

    /**
     * Contracted edge.
     *
     * @param targetId first non-transparent element reached
     * @param label branch label
     * @param defaultFlow whether the originating flow is a default flow
     * @param via transparent elements passed through, in order
     */
    record Step(String targetId, String label, boolean defaultFlow, List<String> via) {}

    private final FlowGraph graph;
    private final Set<String> transparent;
    private final Map<String, List<Step>> successors = new HashMap<>();
    private final Map<String, Set<String>> predecessors = new HashMap<>();

    private StepGraph(FlowGraph graph, Set<String> transparent) {
        this.graph = graph;
        this.transparent = transparent;
        for (ProcessElement element : graph.catalog().elements()) {
            if (transparent.contains(element.id())) {
                continue;
            }
            List<Step> steps = new ArrayList<>();
            for (FlowEdge edge : graph.outgoing(element.id())) {
                Step step = contract(edge);
                steps.add(step);
                predecessors.computeIfAbsent(step.targetId(), k -> new LinkedHashSet<>()).add(element.id());
            }
            successors.put(element.id(), List.copyOf(steps));
        }
    }

    static StepGraph of(FlowGraph graph, LinkResolution links, NarrativeOptions options) {
        Set<String> transparent = new HashSet<>();
        for (ProcessElement element : graph.catalog().elements()) {
            if (isTransparent(element, graph, links, options)) {
                transparent.add(element.id());
            }
        }
        breakTransparentCycles(graph, transparent);
        if (!transparent.isEmpty()) {
            log.debug("Transparent elements: {}", transparent);
        }
        return new StepGraph(graph, transparent);
    }

    boolean isTransparent(String id) {
        return transparent.contains(id);
    }

    List<Step> successors(String id) {
        return successors.getOrDefault(id, List.of());
    }

    /**
     * Returns the number of distinct non-transparent predecessors.
     */
    int inDegree(String id) {
        return predecessors.getOrDefault(id, Set.of()).size();
    }

    /**
     * Convergence points of a divergence.
     *
     * @param mergePoints elements where branches of the divergence meet
     * @param region elements reachable from any branch before a settled element
     */
    record Convergence(Set<String> mergePoints, Set<String> region) {}

    /**
     * Returns the elements at which branches of a divergence meet.
     *
     * <p>Each branch is explored without entering settled elements (the diverging element, the
     * active path and anything already numbered), since a branch walk stops there. Elements with
     * several predecessors reachable from two or more branches are candidates. Exploration stops
     * at candidates, so a round finds only first meeting points; a branch start that is itself a
     * candidate still counts and is explored past.
     *
     * <p>Branches meeting at a point then continue as one stream from it, and the search repeats
     * until no further candidate is met by two streams. In a staggered join where {@code A} and
     * {@code B} meet at {@code M1} and {@code M1} meets {@code C} at {@code M2}, both {@code M1}
     * and {@code M2} belong to the divergence.
     *
     * @param divergentId diverging element
     * @param settled elements a branch walk cannot pass through
     * @return meeting points and the region explored by the branches
     */
    Convergence mergePoints(String divergentId, Predicate<String> settled) {
        Predicate<String> blocked = id -> id.equals(divergentId) || settled.test(id);
        List<Step> branches = successors(divergentId);
        Map<String, Integer> reachCount = new HashMap<>();
        Set<String> region = new HashSet<>();
        for (Step branch : branches) {
            Set<String> reached = explore(branch.targetId(), blocked, Set.of());
            region.addAll(reached);
            for (String id : reached) {
                reachCount.merge(id, 1, Integer::sum);
            }
        }
        Set<String> candidates = new HashSet<>();
        reachCount.forEach((id, count) -> {
            if (count > 1 && inDegree(id) > 1) {
                candidates.add(id);
            }
        });
        if (candidates.isEmpty()) {
            return new Convergence(Set.of(), region);
        }

        Set<String> merges = new LinkedHashSet<>();
        List<String> streams = new ArrayList<>();
        branches.forEach(branch -> streams.add(branch.targetId()));
        while (true) {
            Map<String, Integer> meetCount = new HashMap<>();
            List<Set<String>> met = new ArrayList<>();
            for (String stream : streams) {
                Set<String> reached = new HashSet<>(explore(stream, blocked, candidates));
                reached.retainAll(candidates);
                reached.removeAll(merges);
                reached.forEach(id -> meetCount.merge(id, 1, Integer::sum));
                met.add(reached);
            }
            Set<String> found = new LinkedHashSet<>();
            meetCount.forEach((id, count) -> {
                if (count > 1) {
                    found.add(id);
                }
            });
            if (found.isEmpty()) {
                break;
            }
            merges.addAll(found);

            List<String> next = new ArrayList<>(found);
            for (int i = 0; i < streams.size(); i++) {
                if (Collections.disjoint(met.get(i), found)) {
                    next.add(streams.get(i));
                }
            }
            streams.clear();
            streams.addAll(next);
        }
        return new Convergence(merges, region);
    }

    /**
     * Returns whether every predecessor of an element is the diverging element or lies in the
     * region of its branches.
     */
    boolean enclosedBy(String id, String divergentId, Set<String> region) {
        for (String predecessor : predecessors.getOrDefault(id, Set.of())) {
            if (!predecessor.equals(divergentId) && !region.contains(predecessor)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Orders convergence points so that a point comes before the points it leads to.
     *
     * <p>Points that reach each other keep their given order.
     *
     * @param ids convergence points in arrival order
     * @param settled elements a walk cannot pass through
     * @return the same points, upstream first
     */
    List<String> upstreamFirst(List<String> ids, Predicate<String> settled) {
        List<String> remaining = new ArrayList<>(ids);
        List<String> ordered = new ArrayList<>(ids.size());
        while (!remaining.isEmpty()) {
            String next = remaining.stream()
                .filter(id -> remaining.stream().noneMatch(other -> !other.equals(id) && reaches(other, id, settled)))
                .findFirst()
                .orElse(remaining.get(0));
            ordered.add(next);
            remaining.remove(next);
        }
        return ordered;
    }

    private boolean reaches(String fromId, String toId, Predicate<String> settled) {
        Predicate<String> blocked = id -> !id.equals(fromId) && !id.equals(toId) && settled.test(id);
        return explore(fromId, blocked, Set.of()).contains(toId);
    }

    private Set<String> explore(String startId, Predicate<String> blocked, Set<String> stopAt) {
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        if (blocked.test(startId)) {
            return seen;
        }
        seen.add(startId);
        queue.add(startId);
        while (!queue.isEmpty()) {
            String id = queue.poll();
            if (!id.equals(startId) && stopAt.contains(id)) {
                continue;
            }
            for (Step step : successors(id)) {
                String next = step.targetId();
                if (!blocked.test(next) && seen.add(next)) {
                    queue.add(next);
                }
            }
        }
        return seen;
    }

    private Step contract(FlowEdge edge) {
        String label = edge.label();
        String target = edge.targetId();
        List<String> via = new ArrayList<>();
        while (transparent.contains(target)) {
            via.add(target);
            FlowEdge next = graph.outgoing(target).get(0);
            if (label.isEmpty()) {
                label = next.label();
            }
            target = next.targetId();
        }
        return new Step(target, label, edge.defaultFlow(), List.copyOf(via));
    }

    private static boolean isTransparent(ProcessElement element, FlowGraph graph,
                                         LinkResolution links, NarrativeOptions options) {
        String id = element.id();
        if (graph.outDegree(id) != 1) {
            return false;
        }
        if (element.kind().isLink()) {
            return !options.showLinkEvents() && links.isResolved(id);
        }
        return element.kind().isGateway()
            && element.kind() != ElementKind.PARALLEL_GATEWAY
            && !options.renderMergeGateways()
            && graph.inDegree(id) > 1;
    }

    /**
     * Makes elements opaque until no chain of transparent elements loops back on itself.
     */
    private static void breakTransparentCycles(FlowGraph graph, Set<String> transparent) {
        boolean changed = true;
        while (changed) {
            changed = false;
            for (String start : List.copyOf(transparent)) {
                Set<String> chain = new HashSet<>();
                String current = start;
                while (transparent.contains(current) && chain.add(current)) {
                    current = graph.outgoing(current).get(0).targetId();
                }
                if (transparent.contains(current)) {
                    log.debug("Transparent cycle through {}, rendering it", current);
                    transparent.remove(current);
                    changed = true;
                }
            }
        }
    }
}
