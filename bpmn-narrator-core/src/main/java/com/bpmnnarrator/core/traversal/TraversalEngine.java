package com.bpmnnarrator.core.traversal;

import com.bpmnnarrator.core.config.NarrativeOptions;
import com.bpmnnarrator.core.config.StartEventPolicy;
import com.bpmnnarrator.core.error.NoStartEventException;
import com.bpmnnarrator.core.graph.ElementCatalog;
import com.bpmnnarrator.core.graph.FlowGraph;
import com.bpmnnarrator.core.graph.LinkResolution;
import com.bpmnnarrator.core.model.Diagnostic;
import com.bpmnnarrator.core.model.DiagnosticType;
import com.bpmnnarrator.core.model.ElementKind;
import com.bpmnnarrator.core.model.ProcessElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Walks a flow graph in execution order and assigns hierarchical step numbers.
 *
 * <p>Every element moves through {@link NodeStatus}: unvisited, in progress while it is on the
 * active path, visited once its walk completes. Rules:
 * <ul>
 *   <li>an element with one successor continues its sequence: {@code 1 → 2}</li>
 *   <li>an element with several successors diverges: its branches are numbered
 *       {@code N.1 … N.k} in order index order, each walked depth-first</li>
 *   <li>an element where branches of an open divergence first meet is a convergence point:
 *       arriving branches stop there, and it is walked once after all branches, with the next
 *       number of the diverging element's sequence</li>
 *   <li>reaching an element on the active path yields a single {@code BACK_REFERENCE}; reaching
 *       a visited element yields a single forward or back reference</li>
 *   <li>a branch leading straight into a convergence point yields a forward reference to it</li>
 *   <li>end events, elements without successors and unmatched link throws end a branch</li>
 *   <li>unmatched link catches are walked after the start events, marked as unmatched</li>
 * </ul>
 * Every element is numbered at most once, so a run terminates on any cyclic graph.
 *
 * <p>Instances are stateless and can be shared; each {@link #traverse} call owns its state.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * FlowGraph graph = new FlowGraphBuilder().build(process);
 * LinkResolution links = new LinkResolver().resolve(graph);
 * TraversalResult result = new TraversalEngine(NarrativeOptions.defaults()).traverse(graph, links);
 * }</pre>
 */
public class TraversalEngine {

    private static final Logger log = LoggerFactory.getLogger(TraversalEngine.class);

    private final NarrativeOptions options;

    public TraversalEngine(NarrativeOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    /**
     * Traverses a graph whose links are already resolved.
     *
     * @param graph flow graph of one process
     * @param links link resolution of the same graph
     * @return numbered steps and unreachable element diagnostics
     * @throws NoStartEventException if the process has no start event
     */
    public TraversalResult traverse(FlowGraph graph, LinkResolution links) {
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(links, "links must not be null");
        return new Run(graph, links).execute();
    }

    /**
     * An open divergence and the convergence points its branches stopped at.
     */
    private static final class Frame {
        private final String divergentId;
        private final StepGraph.Convergence convergence;
        private final List<String> pending = new ArrayList<>();

        private Frame(String divergentId, StepGraph.Convergence convergence) {
            this.divergentId = divergentId;
            this.convergence = convergence;
        }

        private boolean waitsFor(String id) {
            return convergence.mergePoints().contains(id);
        }
    }

    private final class Run {
        private final ElementCatalog catalog;
        private final LinkResolution links;
        private final StepGraph stepGraph;
        private final NumberingState state = new NumberingState();
        private final List<NarrativeStep> steps = new ArrayList<>();
        private final Deque<Frame> frames = new ArrayDeque<>();
        private final Set<String> passedThrough = new HashSet<>();
        private final Map<Integer, String> deferredReferences = new LinkedHashMap<>();

        private Run(FlowGraph graph, LinkResolution links) {
            this.catalog = graph.catalog();
            this.links = links;
            this.stepGraph = StepGraph.of(graph, links, options);
        }

        private TraversalResult execute() {
            List<ProcessElement> roots = roots();
            boolean prefixed = roots.size() > 1 && options.startEventPolicy() == StartEventPolicy.PREFIXED;
            BranchSequence topLevel = BranchSequence.topLevel();

            for (ProcessElement root : roots) {
                walkRoot(root.id(), prefixed, topLevel);
            }
            // unmatched link catches follow the roots and do not change the start policy
            for (ProcessElement element : catalog.elements()) {
                if (links.detachedCatches().contains(element.id())) {
                    log.debug("Walking unmatched link catch {} as an extra root", element.id());
                    walkRoot(element.id(), prefixed, topLevel);
                }
            }

            resolveDeferredReferences();
            List<Diagnostic> diagnostics = unreachable();
            log.debug("Traversed process {}: {} steps, {} numbered elements",
                catalog.processId(), steps.size(), state.numbers().size());
            return new TraversalResult(catalog.processId(), steps, state.numbers(), state.arrivals(), diagnostics);
        }

        private void walkRoot(String id, boolean prefixed, BranchSequence topLevel) {
            if (state.state(id).status() != NodeStatus.UNVISITED) {
                return;
            }
            BranchSequence sequence = prefixed ? BranchSequence.headedAt(topLevel.allocate()) : topLevel;
            walk(id, sequence, "", false, false);
        }

        private List<ProcessElement> roots() {
            List<ProcessElement> roots = new ArrayList<>(catalog.ofKind(ElementKind.START_EVENT));
            if (roots.isEmpty()) {
                throw new NoStartEventException("Process " + catalog.processId() + " has no start event");
            }
            if (options.renderDisconnectedRoots()) {
                for (ProcessElement element : catalog.elements()) {
                    if (element.kind() != ElementKind.START_EVENT
                        && !stepGraph.isTransparent(element.id())
                        && !links.detachedCatches().contains(element.id())
                        && stepGraph.inDegree(element.id()) == 0) {
                        log.debug("Element {} has no incoming flow, walking it as an extra root", element.id());
                        roots.add(element);
                    }
                }
            }
            return roots;
        }

        /**
         * Walks a chain of elements from {@code startId}.
         *
         * <p>Linear successors are followed in a loop; divergences recurse into their branches
         * and continue the loop with their last convergence point.
         *
         * @param forceStart walk the start element even if it is a convergence point of an open frame
         */
        private void walk(String startId, BranchSequence sequence, String label, boolean defaultBranch,
                          boolean forceStart) {
            List<String> chain = new ArrayList<>();
            String current = startId;
            String branchLabel = label;
            boolean branchDefault = defaultBranch;
            boolean force = forceStart;

            try {
                while (current != null) {
                    NodeState nodeState = state.state(current);
                    StepNumber here = sequence.peek();
                    switch (nodeState.status()) {
                        case IN_PROGRESS -> {
                            reference(StepKind.BACK_REFERENCE, current, nodeState.number(), here, branchLabel, branchDefault);
                            return;
                        }
                        case VISITED -> {
                            StepKind kind = nodeState.number().compareTo(here) > 0
                                ? StepKind.FORWARD_REFERENCE
                                : StepKind.BACK_REFERENCE;
                            reference(kind, current, nodeState.number(), here, branchLabel, branchDefault);
                            return;
                        }
                        case PENDING -> {
                            if (chain.isEmpty()) {
                                deferReference(current, here, branchLabel, branchDefault);
                            }
                            int arrivals = state.arrive(current);
                            log.debug("Branch arrives at convergence point {} ({} arrivals)", current, arrivals);
                            return;
                        }
                        default -> {
                            // unvisited: numbered below
                        }
                    }

                    if (!force && stepGraph.inDegree(current) > 1) {
                        Frame frame = frameWaitingFor(current);
                        if (frame != null) {
                            if (chain.isEmpty()) {
                                deferReference(current, here, branchLabel, branchDefault);
                            }
                            frame.pending.add(current);
                            state.markPending(current);
                            state.arrive(current);
                            log.debug("Convergence point {} of {} deferred", current, frame.divergentId);
                            return;
                        }
                    }
                    force = false;

                    StepNumber number = sequence.allocate();
                    state.enter(current, number);
                    chain.add(current);

                    List<StepGraph.Step> next = stepGraph.successors(current);
                    boolean unmatchedThrow = links.unmatchedThrows().contains(current);
                    boolean unmatched = unmatchedThrow || links.detachedCatches().contains(current);
                    steps.add(new NarrativeStep(
                        unmatched ? StepKind.UNMATCHED_LINK : StepKind.ELEMENT,
                        number,
                        current,
                        number.depth(),
                        branchLabel,
                        branchDefault,
                        role(current, next)));
                    branchLabel = "";
                    branchDefault = false;

                    if (unmatchedThrow || next.isEmpty()) {
                        return;
                    }
                    if (next.size() == 1) {
                        passedThrough.addAll(next.get(0).via());
                        current = next.get(0).targetId();
                        continue;
                    }
                    current = diverge(current, number, sequence, next);
                    force = true;
                }
            } finally {
                chain.forEach(state::finish);
            }
        }

        /**
         * Walks the branches of a diverging element, then its convergence points.
         *
         * @return the last convergence point, to be walked by the caller's loop, or null
         */
        private String diverge(String id, StepNumber number, BranchSequence sequence, List<StepGraph.Step> next) {
            Frame frame = new Frame(id, stepGraph.mergePoints(id, this::settled));
            log.debug("Element {} ({}) diverges into {} branches, convergence points {}",
                id, number, next.size(), frame.convergence.mergePoints());

            frames.push(frame);
            List<StepNumber> heads = sequence.branchHeads(number, next.size());
            for (int i = 0; i < next.size(); i++) {
                StepGraph.Step branch = next.get(i);
                passedThrough.addAll(branch.via());
                walk(branch.targetId(), BranchSequence.headedAt(heads.get(i)), branch.label(), branch.defaultFlow(), false);
            }
            frames.pop();

            if (frame.pending.isEmpty()) {
                return null;
            }
            List<String> merges = stepGraph.upstreamFirst(frame.pending, this::settled);
            for (int i = 0; i < merges.size() - 1; i++) {
                String merge = merges.get(i);
                state.releasePending(merge);
                walk(merge, sequence, "", false, true);
            }
            String last = merges.get(merges.size() - 1);
            state.releasePending(last);
            return last;
        }

        private boolean settled(String id) {
            return state.state(id).status() != NodeStatus.UNVISITED;
        }

        /**
         * Returns the innermost open divergence that owns a convergence point: every predecessor
         * of the point lies within its branches. Falls back to the innermost divergence whose
         * branches meet there when none encloses it, as with flows entering from another start.
         */
        private Frame frameWaitingFor(String id) {
            Frame fallback = null;
            for (Frame frame : frames) {
                if (!frame.waitsFor(id)) {
                    continue;
                }
                if (stepGraph.enclosedBy(id, frame.divergentId, frame.convergence.region())) {
                    return frame;
                }
                if (fallback == null) {
                    fallback = frame;
                }
            }
            return fallback;
        }

        private void reference(StepKind kind, String targetId, StepNumber target, StepNumber here,
                               String label, boolean defaultBranch) {
            log.debug("Reference {} to {} ({}) at {}", kind, targetId, target, here);
            steps.add(new NarrativeStep(kind, target, targetId, here.depth(), label, defaultBranch, ElementRole.PLAIN));
        }

        /**
         * Records a branch that leads straight into a convergence point. Its number is filled in
         * once the convergence point has been walked.
         */
        private void deferReference(String targetId, StepNumber here, String label, boolean defaultBranch) {
            deferredReferences.put(steps.size(), targetId);
            steps.add(new NarrativeStep(StepKind.FORWARD_REFERENCE, here, targetId, here.depth(), label,
                defaultBranch, ElementRole.PLAIN));
        }

        private void resolveDeferredReferences() {
            deferredReferences.forEach((index, targetId) -> {
                StepNumber target = state.numbers().get(targetId);
                if (target == null) {
                    return;
                }
                NarrativeStep placeholder = steps.get(index);
                steps.set(index, new NarrativeStep(StepKind.FORWARD_REFERENCE, target, targetId,
                    placeholder.depth(), placeholder.branchLabel(), placeholder.defaultBranch(), ElementRole.PLAIN));
            });
        }

        private ElementRole role(String id, List<StepGraph.Step> next) {
            if (next.size() > 1) {
                return ElementRole.SPLIT;
            }
            return stepGraph.inDegree(id) > 1 ? ElementRole.MERGE : ElementRole.PLAIN;
        }

        private List<Diagnostic> unreachable() {
            List<Diagnostic> diagnostics = new ArrayList<>();
            for (ProcessElement element : catalog.elements()) {
                String id = element.id();
                if (state.state(id).status() != NodeStatus.UNVISITED || passedThrough.contains(id)) {
                    continue;
                }
                String label = element.name().isBlank() ? element.tagName() : element.name().trim();
                log.warn("Element {} ({}) is not reachable from any start event", id, label);
                diagnostics.add(new Diagnostic(DiagnosticType.UNREACHABLE_ELEMENT, id,
                    "Elemento não alcançado a partir do início: " + label + " (" + id + ")"));
            }
            return diagnostics;
        }
    }
}
