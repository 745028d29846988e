package com.bpmnnarrator.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Switches controlling traversal and rendering of the narrative.
 *
 * <p>Missing values fall back to the defaults of {@link #defaults()}, so a partial YAML section
 * is valid.
 *
 * @param showLinkEvents render resolved link events as numbered steps instead of transparent jumps
 * @param startEventPolicy numbering policy for several start events
 * @param renderMergeGateways give pure exclusive/inclusive/complex merge gateways their own line
 * @param renderDisconnectedRoots walk elements without incoming flow as extra roots
 * @param inferLanesFromDiagram place elements without lane reference by diagram geometry
 * @param includeMessageFlows append the message flow section
 * @param includeOrphanAnnotations append annotations attached to no element
 * @param indent prefix repeated once per numbering level below the top level
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NarrativeOptions(
    @JsonProperty("showLinkEvents") Boolean showLinkEvents,
    @JsonProperty("startEventPolicy") StartEventPolicy startEventPolicy,
    @JsonProperty("renderMergeGateways") Boolean renderMergeGateways,
    @JsonProperty("renderDisconnectedRoots") Boolean renderDisconnectedRoots,
    @JsonProperty("inferLanesFromDiagram") Boolean inferLanesFromDiagram,
    @JsonProperty("includeMessageFlows") Boolean includeMessageFlows,
    @JsonProperty("includeOrphanAnnotations") Boolean includeOrphanAnnotations,
    @JsonProperty("indent") String indent
) {
    public static final String DEFAULT_INDENT = "    ";

    /**
     * Compact constructor filling defaults.
     */
    public NarrativeOptions {
        if (showLinkEvents == null) {
            showLinkEvents = false;
        }
        if (startEventPolicy == null) {
            startEventPolicy = StartEventPolicy.PREFIXED;
        }
        if (renderMergeGateways == null) {
            renderMergeGateways = false;
        }
        if (renderDisconnectedRoots == null) {
            renderDisconnectedRoots = false;
        }
        if (inferLanesFromDiagram == null) {
            inferLanesFromDiagram = true;
        }
        if (includeMessageFlows == null) {
            includeMessageFlows = true;
        }
        if (includeOrphanAnnotations == null) {
            includeOrphanAnnotations = true;
        }
        if (indent == null) {
            indent = DEFAULT_INDENT;
        }
    }

    /**
     * Creates the default options.
     *
     * @return default options
     */
    public static NarrativeOptions defaults() {
        return new NarrativeOptions(null, null, null, null, null, null, null, null);
    }

    public NarrativeOptions withShowLinkEvents(boolean value) {
        return new NarrativeOptions(value, startEventPolicy, renderMergeGateways, renderDisconnectedRoots,
            inferLanesFromDiagram, includeMessageFlows, includeOrphanAnnotations, indent);
    }

    public NarrativeOptions withStartEventPolicy(StartEventPolicy value) {
        return new NarrativeOptions(showLinkEvents, value, renderMergeGateways, renderDisconnectedRoots,
            inferLanesFromDiagram, includeMessageFlows, includeOrphanAnnotations, indent);
    }

    public NarrativeOptions withRenderMergeGateways(boolean value) {
        return new NarrativeOptions(showLinkEvents, startEventPolicy, value, renderDisconnectedRoots,
            inferLanesFromDiagram, includeMessageFlows, includeOrphanAnnotations, indent);
    }

    public NarrativeOptions withRenderDisconnectedRoots(boolean value) {
        return new NarrativeOptions(showLinkEvents, startEventPolicy, renderMergeGateways, value,
            inferLanesFromDiagram, includeMessageFlows, includeOrphanAnnotations, indent);
    }

    public NarrativeOptions withInferLanesFromDiagram(boolean value) {
        return new NarrativeOptions(showLinkEvents, startEventPolicy, renderMergeGateways, renderDisconnectedRoots,
            value, includeMessageFlows, includeOrphanAnnotations, indent);
    }
}
