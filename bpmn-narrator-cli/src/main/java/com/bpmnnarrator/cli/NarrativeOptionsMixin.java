package com.bpmnnarrator.cli;

import com.bpmnnarrator.core.config.ConfigLoader;
import com.bpmnnarrator.core.config.NarrativeOptions;
import com.bpmnnarrator.core.config.NarratorConfig;
import com.bpmnnarrator.core.config.StartEventPolicy;
import picocli.CommandLine.Option;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Options shared by {@code convert} and {@code validate}: the configuration file and the
 * flags that override its {@code narrative} section.
 */
public class NarrativeOptionsMixin {

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: " + ConfigLoader.DEFAULT_FILE_NAME + " when present)"
    )
    private Path configPath;

    @Option(names = {"--show-links"}, description = "Render link events as numbered steps")
    private Boolean showLinks;

    @Option(
        names = {"--start-policy"},
        description = "Numbering of several start events: ${COMPLETION-CANDIDATES}"
    )
    private StartEventPolicy startPolicy;

    @Option(names = {"--render-merges"}, description = "Give merge gateways their own line")
    private Boolean renderMerges;

    @Option(names = {"--disconnected-roots"}, description = "Walk elements without incoming flow as extra roots")
    private Boolean disconnectedRoots;

    @Option(names = {"--no-lane-inference"}, description = "Do not place elements in lanes by diagram geometry")
    private boolean noLaneInference;

    /**
     * Loads the configuration and applies command-line overrides.
     *
     * <p>An explicit {@code --config} is always loaded; the default file only when it exists.
     *
     * @return effective configuration
     */
    NarratorConfig resolveConfig() {
        NarratorConfig config;
        if (configPath != null) {
            config = ConfigLoader.load(configPath);
        } else {
            Path defaultPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);
            config = Files.exists(defaultPath) ? ConfigLoader.load(defaultPath) : NarratorConfig.defaults();
        }

        NarrativeOptions options = config.narrative();
        if (showLinks != null) {
            options = options.withShowLinkEvents(showLinks);
        }
        if (startPolicy != null) {
            options = options.withStartEventPolicy(startPolicy);
        }
        if (renderMerges != null) {
            options = options.withRenderMergeGateways(renderMerges);
        }
        if (disconnectedRoots != null) {
            options = options.withRenderDisconnectedRoots(disconnectedRoots);
        }
        if (noLaneInference) {
            options = options.withInferLanesFromDiagram(false);
        }
        return config.withNarrative(options);
    }
}
