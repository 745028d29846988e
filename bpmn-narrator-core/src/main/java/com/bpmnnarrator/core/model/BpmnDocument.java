package com.bpmnnarrator.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Everything read from one BPMN file.
 *
 * <p>This is the intermediate representation that bridges the parser and the conversion
 * pipeline. Processes keep document order.
 *
 * @param name document name (file stem), used as fallback title
 * @param processes processes in document order
 * @param participants collaboration pools
 * @param messageFlows message flows between pools
 * @param orphanAnnotations annotation texts not attached to any element
 * @param diagnostics anomalies found while parsing
 */
public record BpmnDocument(
    String name,
    List<ProcessDefinition> processes,
    List<Participant> participants,
    List<MessageFlow> messageFlows,
    List<String> orphanAnnotations,
    List<Diagnostic> diagnostics
) {
    /**
     * Compact constructor with validation.
     */
    public BpmnDocument {
        Objects.requireNonNull(name, "name must not be null");
        processes = processes == null ? List.of() : List.copyOf(processes);
        participants = participants == null ? List.of() : List.copyOf(participants);
        messageFlows = messageFlows == null ? List.of() : List.copyOf(messageFlows);
        orphanAnnotations = orphanAnnotations == null ? List.of() : List.copyOf(orphanAnnotations);
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }
}
