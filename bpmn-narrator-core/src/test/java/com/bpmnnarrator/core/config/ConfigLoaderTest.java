package com.bpmnnarrator.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            narrative:
              showLinkEvents: true
              startEventPolicy: SEQUENTIAL
              renderMergeGateways: true
              renderDisconnectedRoots: true
              inferLanesFromDiagram: false
              includeMessageFlows: false
              includeOrphanAnnotations: false
              indent: "\\t"

            output:
              directory: "./narrativas"
              extension: "md"
            """);

        NarratorConfig config = ConfigLoader.load(configFile);

        NarrativeOptions narrative = config.narrative();
        assertThat(narrative.showLinkEvents()).isTrue();
        assertThat(narrative.startEventPolicy()).isEqualTo(StartEventPolicy.SEQUENTIAL);
        assertThat(narrative.renderMergeGateways()).isTrue();
        assertThat(narrative.renderDisconnectedRoots()).isTrue();
        assertThat(narrative.inferLanesFromDiagram()).isFalse();
        assertThat(narrative.includeMessageFlows()).isFalse();
        assertThat(narrative.includeOrphanAnnotations()).isFalse();
        assertThat(narrative.indent()).isEqualTo("\t");
        assertThat(config.output().directory()).isEqualTo("./narrativas");
        assertThat(config.output().extension()).isEqualTo("md");
    }

    @Test
    void load_partialYaml_fillsMissingValuesWithDefaults() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            narrative:
              showLinkEvents: true
            unknownSection:
              foo: bar
            """);

        NarratorConfig config = ConfigLoader.load(configFile);

        assertThat(config.narrative().showLinkEvents()).isTrue();
        assertThat(config.narrative().startEventPolicy()).isEqualTo(StartEventPolicy.PREFIXED);
        assertThat(config.narrative().indent()).isEqualTo(NarrativeOptions.DEFAULT_INDENT);
        assertThat(config.output()).isEqualTo(NarratorConfig.OutputSettings.defaults());
    }

    @Test
    void load_fileDoesNotExist_returnsDefaults() {
        NarratorConfig config = ConfigLoader.load(tempDir.resolve("nonexistent.yaml"));

        assertThat(config).isEqualTo(NarratorConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, "invalid: yaml: syntax: [[[");

        NarratorConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(NarratorConfig.defaults());
    }

    @Test
    void load_unknownPolicy_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            narrative:
              startEventPolicy: RANDOM
            """);

        NarratorConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(NarratorConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, "");

        NarratorConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(NarratorConfig.defaults());
    }

    @Test
    void load_directoryInsteadOfFile_returnsDefaults() throws IOException {
        Path directory = Files.createDirectory(tempDir.resolve("directory"));

        NarratorConfig config = ConfigLoader.load(directory);

        assertThat(config).isEqualTo(NarratorConfig.defaults());
    }

    @Test
    void toYaml_writtenDefaults_loadBackUnchanged() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, ConfigLoader.toYaml(NarratorConfig.defaults()));

        NarratorConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(NarratorConfig.defaults());
        assertThat(Files.readString(configFile)).contains("startEventPolicy", "PREFIXED", "extension");
    }
}
