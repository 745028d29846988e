package com.bpmnnarrator.core;

import com.bpmnnarrator.core.config.NarrativeOptions;
import com.bpmnnarrator.core.error.BpmnNarratorException;
import com.bpmnnarrator.core.error.BpmnParseException;
import com.bpmnnarrator.core.error.MalformedGraphException;
import com.bpmnnarrator.core.error.NoStartEventException;
import com.bpmnnarrator.core.graph.FlowGraph;
import com.bpmnnarrator.core.graph.FlowGraphBuilder;
import com.bpmnnarrator.core.graph.LinkResolution;
import com.bpmnnarrator.core.graph.LinkResolver;
import com.bpmnnarrator.core.model.BpmnDocument;
import com.bpmnnarrator.core.model.Diagnostic;
import com.bpmnnarrator.core.model.DiagnosticType;
import com.bpmnnarrator.core.model.ProcessDefinition;
import com.bpmnnarrator.core.narrative.NarrativeGenerator;
import com.bpmnnarrator.core.narrative.NarrativeResult;
import com.bpmnnarrator.core.narrative.TraversedProcess;
import com.bpmnnarrator.core.parser.BpmnParser;
import com.bpmnnarrator.core.traversal.TraversalEngine;
import com.bpmnnarrator.core.traversal.TraversalResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Converts BPMN 2.0 diagrams into numbered narrative text.
 *
 * <p>The pipeline runs leaf-first: {@link BpmnParser} reads the element catalog,
 * {@link FlowGraphBuilder} builds the flow graph of every process with a start event,
 * {@link LinkResolver} adds link edges, {@link TraversalEngine} numbers the steps and
 * {@link NarrativeGenerator} renders the text.
 *
 * <p>Fatal problems ({@link BpmnParseException}, {@link MalformedGraphException},
 * {@link NoStartEventException}) abort the conversion with no output. Everything else is
 * collected as {@link Diagnostic}s, appended to the text and returned with it.
 *
 * <p>Each call owns its graphs and numbering state, so one instance can serve concurrent
 * conversions.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * NarrativeResult result = new BpmnNarrator().convert(Path.of("pedido.bpmn"));
 * System.out.print(result.text());
 * }</pre>
 */
public class BpmnNarrator {

    private static final Logger log = LoggerFactory.getLogger(BpmnNarrator.class);

    private final NarrativeOptions options;
    private final BpmnParser parser;
    private final FlowGraphBuilder graphBuilder = new FlowGraphBuilder();
    private final LinkResolver linkResolver = new LinkResolver();
    private final TraversalEngine engine;
    private final NarrativeGenerator generator;

    public BpmnNarrator() {
        this(NarrativeOptions.defaults());
    }

    public BpmnNarrator(NarrativeOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.parser = new BpmnParser(options.inferLanesFromDiagram());
        this.engine = new TraversalEngine(options);
        this.generator = new NarrativeGenerator(options);
    }

    public NarrativeOptions options() {
        return options;
    }

    /**
     * Converts a BPMN file.
     *
     * @param file {@code .bpmn} or {@code .xml} file
     * @return narrative and diagnostics
     * @throws BpmnNarratorException if the file is missing or the conversion fails fatally
     */
    public NarrativeResult convert(Path file) {
        Objects.requireNonNull(file, "file must not be null");
        if (!Files.isRegularFile(file)) {
            throw new BpmnNarratorException("BPMN file not found: " + file);
        }
        log.debug("Converting {}", file);
        return convert(parser.parse(file));
    }

    /**
     * Converts BPMN XML read from a stream. The stream is not closed.
     *
     * @param in XML content
     * @param name document name, used as fallback title
     * @return narrative and diagnostics
     * @throws BpmnNarratorException if the conversion fails fatally
     */
    public NarrativeResult convert(InputStream in, String name) {
        return convert(parser.parse(in, name));
    }

    /**
     * Converts an already parsed document.
     *
     * @param document parsed document
     * @return narrative and diagnostics
     * @throws MalformedGraphException if a flow references an unknown element
     * @throws NoStartEventException if no process has a start event
     */
    public NarrativeResult convert(BpmnDocument document) {
        Objects.requireNonNull(document, "document must not be null");
        if (document.processes().isEmpty()) {
            throw new NoStartEventException("No process found in " + document.name());
        }

        List<Diagnostic> diagnostics = new ArrayList<>(document.diagnostics());
        List<TraversedProcess> traversed = new ArrayList<>();
        List<TraversalResult> traversals = new ArrayList<>();

        for (ProcessDefinition process : document.processes()) {
            if (!process.hasStartEvent()) {
                String label = process.name().isBlank() ? process.id() : process.name().trim();
                log.warn("Process {} has no start event and is skipped", process.id());
                diagnostics.add(new Diagnostic(DiagnosticType.MISSING_START_EVENT, process.id(),
                    "Processo sem evento de início ignorado: " + label));
                continue;
            }
            FlowGraph graph = graphBuilder.build(process);
            LinkResolution links = linkResolver.resolve(graph);
            TraversalResult traversal = engine.traverse(graph, links);
            diagnostics.addAll(links.diagnostics());
            diagnostics.addAll(traversal.diagnostics());
            traversed.add(new TraversedProcess(process, graph.catalog(), traversal));
            traversals.add(traversal);
        }

        if (traversed.isEmpty()) {
            throw new NoStartEventException("No process with a start event in " + document.name());
        }

        String text = generator.render(document, traversed, diagnostics);
        log.info("Converted {}: {} process(es), {} step(s), {} diagnostic(s)", document.name(), traversed.size(),
            traversals.stream().mapToInt(t -> t.steps().size()).sum(), diagnostics.size());
        return new NarrativeResult(document.name(), text, diagnostics, traversals);
    }
}
