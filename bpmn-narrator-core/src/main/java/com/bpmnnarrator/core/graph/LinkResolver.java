package com.bpmnnarrator.core.graph;

import com.bpmnnarrator.core.model.Diagnostic;
import com.bpmnnarrator.core.model.DiagnosticType;
import com.bpmnnarrator.core.model.EdgeOrigin;
import com.bpmnnarrator.core.model.ElementKind;
import com.bpmnnarrator.core.model.ProcessElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Pairs intermediate link throw events with link catch events of the same name.
 *
 * <p>Each resolved throw gets a virtual {@link EdgeOrigin#LINK} edge to its catch, so the
 * traversal continues at the catch's successors as if a sequence flow connected them. Several
 * throws may share one catch. When two catches share a name the first one in document order is
 * used and the name is reported as ambiguous.
 *
 * <p>Problems are never fatal: they are returned as diagnostics.
 */
public class LinkResolver {

    private static final Logger log = LoggerFactory.getLogger(LinkResolver.class);

    /**
     * Resolves the links of a graph, adding link edges to it.
     *
     * @param graph flow graph to augment
     * @return resolution outcome and diagnostics
     */
    public LinkResolution resolve(FlowGraph graph) {
        ElementCatalog catalog = graph.catalog();
        Map<String, List<ProcessElement>> catchesByName = new LinkedHashMap<>();
        for (ProcessElement catchEvent : catalog.ofKind(ElementKind.LINK_CATCH_EVENT)) {
            catchesByName.computeIfAbsent(catchEvent.linkName(), k -> new ArrayList<>()).add(catchEvent);
        }

        Map<String, String> targets = new LinkedHashMap<>();
        Set<String> unmatchedThrows = new LinkedHashSet<>();
        Set<String> reachedCatches = new LinkedHashSet<>();
        List<Diagnostic> diagnostics = new ArrayList<>();

        for (ProcessElement throwEvent : catalog.ofKind(ElementKind.LINK_THROW_EVENT)) {
            List<ProcessElement> candidates = throwEvent.linkName().isEmpty()
                ? List.of()
                : catchesByName.getOrDefault(throwEvent.linkName(), List.of());
            if (candidates.isEmpty()) {
                unmatchedThrows.add(throwEvent.id());
                diagnostics.add(unmatched(throwEvent, "disparo"));
                continue;
            }
            ProcessElement target = candidates.get(0);
            graph.addVirtualEdge("link_" + throwEvent.id() + "_" + target.id(),
                throwEvent.id(), target.id(), "", EdgeOrigin.LINK);
            targets.put(throwEvent.id(), target.id());
            reachedCatches.add(target.id());
            log.debug("Link '{}' resolved: {} -> {}", throwEvent.linkName(), throwEvent.id(), target.id());
        }

        Set<String> detachedCatches = new LinkedHashSet<>();
        catchesByName.forEach((name, catches) -> {
            if (catches.size() > 1 && !name.isEmpty()) {
                String ids = String.join(", ", catches.stream().map(ProcessElement::id).toList());
                log.warn("Link name '{}' has {} catch events ({}), using {}", name, catches.size(), ids, catches.get(0).id());
                diagnostics.add(new Diagnostic(DiagnosticType.AMBIGUOUS_LINK, catches.get(0).id(),
                    "Link ambíguo: '" + name + "' possui " + catches.size() + " eventos de captura (" + ids
                        + "); usado " + catches.get(0).id()));
            }
            for (ProcessElement catchEvent : catches) {
                if (reachedCatches.contains(catchEvent.id())) {
                    continue;
                }
                detachedCatches.add(catchEvent.id());
                if (catches.get(0) == catchEvent || name.isEmpty()) {
                    diagnostics.add(unmatched(catchEvent, "captura"));
                }
            }
        });

        return new LinkResolution(targets, unmatchedThrows, detachedCatches, diagnostics);
    }

    private static Diagnostic unmatched(ProcessElement event, String role) {
        String name = event.linkName().isEmpty() ? "(sem nome)" : "'" + event.linkName() + "'";
        log.warn("Unmatched link {} event {} named {}", role, event.id(), name);
        return new Diagnostic(DiagnosticType.UNMATCHED_LINK, event.id(),
            "Link sem correspondência: " + role + " " + name + " (" + event.id() + ")");
    }
}
