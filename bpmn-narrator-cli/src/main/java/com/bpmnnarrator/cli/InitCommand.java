package com.bpmnnarrator.cli;

import com.bpmnnarrator.core.config.ConfigLoader;
import com.bpmnnarrator.core.config.NarratorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Writes a {@code bpmn-narrator.yaml} holding the default configuration.
 */
@Command(
    name = "init",
    description = "Create a default bpmn-narrator.yaml",
    mixinStandardHelpOptions = true
)
public class InitCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(InitCommand.class);

    @Option(
        names = {"-d", "--directory"},
        description = "Directory to create the configuration in (default: current directory)",
        defaultValue = "."
    )
    private Path directory;

    @Option(
        names = {"-f", "--force"},
        description = "Overwrite an existing configuration file"
    )
    private boolean force;

    @Override
    public Integer call() {
        Path target = directory.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        if (Files.exists(target) && !force) {
            System.err.println("✗ " + target + " already exists (use --force to overwrite)");
            return 1;
        }

        try {
            Files.createDirectories(directory);
            Files.writeString(target, ConfigLoader.toYaml(NarratorConfig.defaults()), StandardCharsets.UTF_8);
            log.debug("Wrote default configuration to {}", target.toAbsolutePath());
            System.out.println("✓ Created " + target.normalize());
            return 0;
        } catch (IOException e) {
            log.error("Failed to write configuration", e);
            System.err.println("✗ Init failed: " + e.getMessage());
            return 1;
        }
    }
}
