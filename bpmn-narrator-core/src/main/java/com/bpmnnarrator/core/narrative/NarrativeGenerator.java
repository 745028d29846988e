package com.bpmnnarrator.core.narrative;

import com.bpmnnarrator.core.config.NarrativeOptions;
import com.bpmnnarrator.core.graph.ElementCatalog;
import com.bpmnnarrator.core.model.BpmnDocument;
import com.bpmnnarrator.core.model.Diagnostic;
import com.bpmnnarrator.core.model.ElementKind;
import com.bpmnnarrator.core.model.MessageFlow;
import com.bpmnnarrator.core.model.Participant;
import com.bpmnnarrator.core.model.ProcessDefinition;
import com.bpmnnarrator.core.model.ProcessElement;
import com.bpmnnarrator.core.traversal.ElementRole;
import com.bpmnnarrator.core.traversal.NarrativeStep;
import com.bpmnnarrator.core.traversal.StepKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Renders traversed processes as numbered narrative text.
 *
 * <h2>Output layout</h2>
 * <pre>
 * Titulo: Pedido
 * 1. Início: Pedido recebido
 * 2. Analisar pedido (Ator: Vendas; Tipo: Atividade de Usuário; Sistema: ERP)
 * 3. Pedido aprovado?
 *     3.1. [Sim] Faturar (Ator: Financeiro)
 *     3.2. [Caso contrário] Notificar cliente
 * 4. Fim
 *
 * Interações entre processos (message flows):
 * - Cliente | Vendas / Analisar pedido | Pedido
 *
 * Anotações não ligadas a elementos:
 * - "Revisar SLA"
 *
 * Observações:
 * - Link sem correspondência: disparo 'A' (Link_1)
 * </pre>
 *
 * <p>Each step line is indented once per numbering level below the top level. Detail fields
 * are omitted when empty, and so are the parentheses when every field is empty. The trailing
 * sections appear only when they have content.
 */
public class NarrativeGenerator {

    private static final Logger log = LoggerFactory.getLogger(NarrativeGenerator.class);

    private static final String NEWLINE = "\n";
    private static final String TITLE = "Titulo: ";
    private static final String NUMBER_SEPARATOR = ". ";
    private static final String FIELD_SEPARATOR = "; ";
    private static final String LIST_ITEM = "- ";
    private static final String COLUMN_SEPARATOR = " | ";
    private static final String POOL_SEPARATOR = " / ";

    // Section headers
    private static final String MESSAGE_FLOWS_SECTION = "Interações entre processos (message flows):";
    private static final String ORPHAN_ANNOTATIONS_SECTION = "Anotações não ligadas a elementos:";
    private static final String DIAGNOSTICS_SECTION = "Observações:";

    // Field labels
    private static final String ACTOR = "Ator: ";
    private static final String TYPE = "Tipo: ";
    private static final String SYSTEM = "Sistema: ";
    private static final String DOCUMENT = "Documento: ";
    private static final String ANNOTATION = "Anotação: ";

    // Element templates
    private static final String UNNAMED = "(sem nome)";
    private static final String START = "Início";
    private static final String END = "Fim";
    private static final String SUB_PROCESS = "Subprocesso: ";
    private static final String INTERMEDIATE_EVENT = "Evento intermediário";
    private static final String BOUNDARY_EVENT = "Evento de fronteira";
    private static final String LINK_THROW = "Link (disparo): ";
    private static final String LINK_CATCH = "Link (captura): ";
    private static final String UNMATCHED_LINK_MARKER = " [link sem correspondência]";
    private static final String PARALLEL_SPLIT_SUFFIX = " (em paralelo)";
    private static final String PARALLEL_SPLIT_UNNAMED = "Execução em paralelo";
    private static final String PARALLEL_MERGE = "Fim do paralelo (convergência)";
    private static final String MERGE_SUFFIX = " (convergência)";
    private static final String MERGE_UNNAMED = "Convergência";
    private static final String DEFAULT_BRANCH = "Caso contrário";
    private static final String BACK_REFERENCE = "(retorna a ";
    private static final String FORWARD_REFERENCE = "(segue para ";

    private static final Map<ElementKind, String> UNNAMED_GATEWAYS = Map.of(
        ElementKind.EXCLUSIVE_GATEWAY, "Gateway exclusivo",
        ElementKind.PARALLEL_GATEWAY, "Gateway paralelo",
        ElementKind.INCLUSIVE_GATEWAY, "Gateway inclusivo",
        ElementKind.EVENT_BASED_GATEWAY, "Gateway baseado em eventos",
        ElementKind.COMPLEX_GATEWAY, "Gateway complexo"
    );

    private static final Map<String, String> EVENT_FLAVOURS = Map.ofEntries(
        Map.entry("message", "mensagem"),
        Map.entry("timer", "temporizador"),
        Map.entry("signal", "sinal"),
        Map.entry("conditional", "condicional"),
        Map.entry("error", "erro"),
        Map.entry("escalation", "escalonamento"),
        Map.entry("compensate", "compensação"),
        Map.entry("cancel", "cancelamento"),
        Map.entry("terminate", "término"),
        Map.entry("link", "link")
    );

    private final NarrativeOptions options;

    public NarrativeGenerator(NarrativeOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    /**
     * Renders a whole document.
     *
     * @param document parsed document, for message flows and orphan annotations
     * @param processes traversed processes, in rendering order
     * @param diagnostics diagnostics to append as trailing notes
     * @return newline-terminated narrative
     */
    public String render(BpmnDocument document, List<TraversedProcess> processes, List<Diagnostic> diagnostics) {
        Objects.requireNonNull(document, "document must not be null");
        Objects.requireNonNull(processes, "processes must not be null");
        Objects.requireNonNull(diagnostics, "diagnostics must not be null");

        List<String> sections = new ArrayList<>();
        for (TraversedProcess process : processes) {
            sections.add(renderProcess(process, document.name()));
        }

        if (options.includeMessageFlows() && !document.messageFlows().isEmpty()) {
            sections.add(renderMessageFlows(document));
        }

        if (options.includeOrphanAnnotations()) {
            Set<String> orphans = new LinkedHashSet<>();
            document.orphanAnnotations().forEach(text -> {
                String cleaned = LabelNormalizer.clean(text);
                if (!cleaned.isEmpty()) {
                    orphans.add(cleaned);
                }
            });
            if (!orphans.isEmpty()) {
                StringBuilder sb = new StringBuilder(ORPHAN_ANNOTATIONS_SECTION).append(NEWLINE);
                orphans.forEach(text -> sb.append(LIST_ITEM).append(quote(text)).append(NEWLINE));
                sections.add(sb.toString());
            }
        }

        if (!diagnostics.isEmpty()) {
            StringBuilder sb = new StringBuilder(DIAGNOSTICS_SECTION).append(NEWLINE);
            diagnostics.forEach(d -> sb.append(LIST_ITEM).append(LabelNormalizer.clean(d.message())).append(NEWLINE));
            sections.add(sb.toString());
        }

        String text = String.join(NEWLINE, sections);
        log.debug("Rendered {} section(s), {} characters", sections.size(), text.length());
        return text.isEmpty() || text.endsWith(NEWLINE) ? text : text + NEWLINE;
    }

    /**
     * Renders the title and step lines of one process.
     *
     * @param process traversed process
     * @param fallbackTitle title used when the process and its pool are unnamed
     * @return newline-terminated lines
     */
    public String renderProcess(TraversedProcess process, String fallbackTitle) {
        String title = LabelNormalizer.clean(process.process().name());
        StringBuilder sb = new StringBuilder(TITLE)
            .append(title.isEmpty() ? LabelNormalizer.clean(fallbackTitle) : title)
            .append(NEWLINE);
        for (NarrativeStep step : process.traversal().steps()) {
            sb.append(renderStep(step, process.catalog())).append(NEWLINE);
        }
        return sb.toString();
    }

    /**
     * Renders one step line, including indentation and branch label.
     *
     * @param step traversal step
     * @param catalog catalog of the step's process
     * @return the line without line terminator
     */
    public String renderStep(NarrativeStep step, ElementCatalog catalog) {
        StringBuilder sb = new StringBuilder(options.indent().repeat(step.depth()));
        if (step.kind().isReference()) {
            sb.append(branchPrefix(step))
                .append(step.kind() == StepKind.FORWARD_REFERENCE ? FORWARD_REFERENCE : BACK_REFERENCE)
                .append(step.number())
                .append(')');
            return sb.toString();
        }

        ProcessElement element = catalog.find(step.elementId()).orElse(null);
        NormalizedFields fields = LabelNormalizer.normalize(element);
        sb.append(step.number()).append(NUMBER_SEPARATOR)
            .append(branchPrefix(step))
            .append(describe(element, fields, step.role()));
        if (element != null && !element.kind().isGateway()) {
            sb.append(details(fields, hasTaskType(element.kind())));
        }
        if (step.kind() == StepKind.UNMATCHED_LINK) {
            sb.append(UNMATCHED_LINK_MARKER);
        }
        return sb.toString();
    }

    private String describe(ProcessElement element, NormalizedFields fields, ElementRole role) {
        if (element == null) {
            return UNNAMED;
        }
        String name = fields.name();
        String named = name.isEmpty() ? UNNAMED : name;
        return switch (element.kind()) {
            case START_EVENT -> name.isEmpty() ? START : START + ": " + name;
            case END_EVENT -> name.isEmpty() ? END : END + ": " + name;
            case TASK -> named;
            case SUB_PROCESS -> SUB_PROCESS + named;
            case LINK_THROW_EVENT -> LINK_THROW + linkName(element, named);
            case LINK_CATCH_EVENT -> LINK_CATCH + linkName(element, named);
            case INTERMEDIATE_EVENT -> withFlavour(INTERMEDIATE_EVENT, element) + ": " + named;
            case BOUNDARY_EVENT -> withFlavour(BOUNDARY_EVENT, element) + ": " + named;
            case PARALLEL_GATEWAY -> describeParallel(name, role);
            case EXCLUSIVE_GATEWAY, INCLUSIVE_GATEWAY, EVENT_BASED_GATEWAY, COMPLEX_GATEWAY ->
                describeGateway(element.kind(), name, role);
            case OTHER -> name.isEmpty() ? element.tagName() : name;
        };
    }

    private static String describeParallel(String name, ElementRole role) {
        return switch (role) {
            case SPLIT -> name.isEmpty() ? PARALLEL_SPLIT_UNNAMED : name + PARALLEL_SPLIT_SUFFIX;
            case MERGE -> PARALLEL_MERGE;
            case PLAIN -> name.isEmpty() ? UNNAMED_GATEWAYS.get(ElementKind.PARALLEL_GATEWAY) : name;
        };
    }

    private static String describeGateway(ElementKind kind, String name, ElementRole role) {
        String unnamed = UNNAMED_GATEWAYS.get(kind);
        if (role == ElementRole.MERGE) {
            return name.isEmpty() ? MERGE_UNNAMED + " (" + unnamed + ")" : name + MERGE_SUFFIX;
        }
        if (name.isEmpty()) {
            return unnamed;
        }
        return name.endsWith("?") ? name : name + "?";
    }

    private static String linkName(ProcessElement element, String fallback) {
        String linkName = LabelNormalizer.clean(element.linkName());
        return linkName.isEmpty() ? fallback : linkName;
    }

    private static String withFlavour(String label, ProcessElement element) {
        String flavour = element.eventDefinition();
        if (flavour == null || flavour.isEmpty()) {
            return label;
        }
        return label + " (" + EVENT_FLAVOURS.getOrDefault(flavour, flavour) + ")";
    }

    private static boolean hasTaskType(ElementKind kind) {
        return kind == ElementKind.TASK || kind == ElementKind.SUB_PROCESS;
    }

    private static String details(NormalizedFields fields, boolean withType) {
        List<String> parts = new ArrayList<>();
        if (!fields.actor().isEmpty()) {
            parts.add(ACTOR + fields.actor());
        }
        if (withType && !fields.type().isEmpty()) {
            parts.add(TYPE + fields.type());
        }
        if (!fields.systems().isEmpty()) {
            parts.add(SYSTEM + fields.systems());
        }
        if (!fields.documents().isEmpty()) {
            parts.add(DOCUMENT + fields.documents());
        }
        if (!fields.annotations().isEmpty()) {
            parts.add(ANNOTATION + String.join(", ", fields.annotations().stream().map(NarrativeGenerator::quote).toList()));
        }
        return parts.isEmpty() ? "" : " (" + String.join(FIELD_SEPARATOR, parts) + ")";
    }

    private static String branchPrefix(NarrativeStep step) {
        String label = LabelNormalizer.clean(step.branchLabel());
        if (label.isEmpty() && step.defaultBranch()) {
            label = DEFAULT_BRANCH;
        }
        return label.isEmpty() ? "" : "[" + label + "] ";
    }

    private String renderMessageFlows(BpmnDocument document) {
        Map<String, String> poolByProcess = new HashMap<>();
        Map<String, String> poolByParticipant = new HashMap<>();
        for (Participant participant : document.participants()) {
            String name = LabelNormalizer.clean(participant.name());
            poolByParticipant.put(participant.id(), name.isEmpty() ? participant.id() : name);
            if (participant.processRef() != null && !participant.processRef().isEmpty()) {
                poolByProcess.putIfAbsent(participant.processRef(), poolByParticipant.get(participant.id()));
            }
        }

        Map<String, String> endpoints = new HashMap<>(poolByParticipant);
        for (ProcessDefinition process : document.processes()) {
            String pool = poolByProcess.getOrDefault(process.id(), LabelNormalizer.clean(process.name()));
            if (pool.isEmpty()) {
                pool = process.id();
            }
            for (ProcessElement element : process.elements()) {
                String name = LabelNormalizer.clean(element.name());
                endpoints.put(element.id(), pool + POOL_SEPARATOR + (name.isEmpty() ? UNNAMED : name));
            }
        }

        StringBuilder sb = new StringBuilder(MESSAGE_FLOWS_SECTION).append(NEWLINE);
        for (MessageFlow flow : document.messageFlows()) {
            String name = LabelNormalizer.clean(flow.name());
            sb.append(LIST_ITEM)
                .append(endpoints.getOrDefault(flow.sourceRef(), flow.sourceRef()))
                .append(COLUMN_SEPARATOR)
                .append(endpoints.getOrDefault(flow.targetRef(), flow.targetRef()))
                .append(COLUMN_SEPARATOR)
                .append(name.isEmpty() ? UNNAMED : name)
                .append(NEWLINE);
        }
        return sb.toString();
    }

    private static String quote(String text) {
        return "\"" + text + "\"";
    }
}
