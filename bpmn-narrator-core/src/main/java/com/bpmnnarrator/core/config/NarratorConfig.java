package com.bpmnnarrator.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root configuration, loaded from {@code bpmn-narrator.yaml}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * narrative:
 *   showLinkEvents: false
 *   startEventPolicy: PREFIXED
 *   renderMergeGateways: false
 *   renderDisconnectedRoots: false
 *   inferLanesFromDiagram: true
 *   includeMessageFlows: true
 *   includeOrphanAnnotations: true
 *   indent: "    "
 *
 * output:
 *   directory: "."
 *   extension: "txt"
 * }</pre>
 *
 * @param narrative traversal and rendering options
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NarratorConfig(
    @JsonProperty("narrative") NarrativeOptions narrative,
    @JsonProperty("output") OutputSettings output
) {
    public NarratorConfig {
        if (narrative == null) {
            narrative = NarrativeOptions.defaults();
        }
        if (output == null) {
            output = OutputSettings.defaults();
        }
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static NarratorConfig defaults() {
        return new NarratorConfig(NarrativeOptions.defaults(), OutputSettings.defaults());
    }

    public NarratorConfig withNarrative(NarrativeOptions newNarrative) {
        return new NarratorConfig(newNarrative, output);
    }

    /**
     * Output settings.
     *
     * @param directory directory for written narratives
     * @param extension extension of written narratives, without dot
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputSettings(
        @JsonProperty("directory") String directory,
        @JsonProperty("extension") String extension
    ) {
        public OutputSettings {
            if (directory == null || directory.isBlank()) {
                directory = ".";
            }
            if (extension == null || extension.isBlank()) {
                extension = "txt";
            }
        }

        public static OutputSettings defaults() {
            return new OutputSettings(".", "txt");
        }
    }
}
