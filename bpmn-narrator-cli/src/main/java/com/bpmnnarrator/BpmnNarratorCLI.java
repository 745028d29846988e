package com.bpmnnarrator;

import ch.qos.logback.classic.Level;
import com.bpmnnarrator.cli.ConvertCommand;
import com.bpmnnarrator.cli.InitCommand;
import com.bpmnnarrator.cli.ListCommand;
import com.bpmnnarrator.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for BPMN Narrator.
 *
 * <p>BPMN Narrator turns BPMN 2.0 process diagrams into numbered, human-readable narrative text.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code convert} - Convert a diagram (or a folder of diagrams) into narrative text</li>
 *   <li>{@code validate} - Convert and report diagnostics only</li>
 *   <li>{@code list} - List output renderers or the element classification table</li>
 *   <li>{@code init} - Write a default configuration file</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Print the narrative of a diagram
 * bpmn-narrator convert pedido.bpmn
 *
 * # Write pedido.txt into ./out
 * bpmn-narrator convert pedido.bpmn -o out
 *
 * # Fail the build when a diagram has dangling links or unreachable elements
 * bpmn-narrator validate pedido.bpmn --strict
 * }</pre>
 */
@Command(
    name = "bpmn-narrator",
    mixinStandardHelpOptions = true,
    version = "BPMN Narrator 1.0.0-SNAPSHOT",
    description = "Converts BPMN 2.0 diagrams into numbered narrative text",
    subcommands = {
        ConvertCommand.class,
        ValidateCommand.class,
        ListCommand.class,
        InitCommand.class
    }
)
public class BpmnNarratorCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(BpmnNarratorCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("BPMN Narrator - BPMN to narrative text converter");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'bpmn-narrator --help' to see available commands");
        System.out.println("Use 'bpmn-narrator <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Logging configured (verbose: {}, quiet: {})", verbose, quiet);
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line. Global options are applied before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine createCommandLine() {
        BpmnNarratorCLI cli = new BpmnNarratorCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }
}
