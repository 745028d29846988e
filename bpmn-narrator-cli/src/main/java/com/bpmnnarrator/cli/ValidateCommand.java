package com.bpmnnarrator.cli;

import com.bpmnnarrator.core.BpmnNarrator;
import com.bpmnnarrator.core.config.NarratorConfig;
import com.bpmnnarrator.core.error.BpmnNarratorException;
import com.bpmnnarrator.core.error.MalformedGraphException;
import com.bpmnnarrator.core.model.Diagnostic;
import com.bpmnnarrator.core.narrative.NarrativeResult;
import com.bpmnnarrator.core.traversal.TraversalResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Converts a diagram and reports its diagnostics without printing the narrative.
 *
 * <p>Exit codes: 0 when the diagram converts, 1 when the conversion fails, 2 when
 * {@code --strict} is given and diagnostics were reported.
 */
@Command(
    name = "validate",
    description = "Check a BPMN diagram and report diagnostics",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    static final int EXIT_DIAGNOSTICS = 2;

    @Parameters(
        index = "0",
        description = "BPMN file to validate"
    )
    private Path input;

    @Option(
        names = {"--strict"},
        description = "Exit with code 2 when any diagnostic is reported"
    )
    private boolean strict;

    @Mixin
    private NarrativeOptionsMixin narrativeOptions;

    @Override
    public Integer call() {
        try {
            NarratorConfig config = narrativeOptions.resolveConfig();
            NarrativeResult result = new BpmnNarrator(config.narrative()).convert(input);

            int steps = result.traversals().stream().mapToInt(t -> t.steps().size()).sum();
            System.out.println("✓ " + input.getFileName() + ": " + result.traversals().size()
                + " process(es), " + steps + " step(s)");
            for (TraversalResult traversal : result.traversals()) {
                log.debug("Process {}: {} numbered element(s)", traversal.processId(), traversal.numbers().size());
            }

            if (!result.hasDiagnostics()) {
                System.out.println("✓ No diagnostics");
                return 0;
            }

            System.out.println("⚠ " + result.diagnostics().size() + " diagnostic(s):");
            for (Diagnostic diagnostic : result.diagnostics()) {
                System.out.printf("  • [%s] %s%n", diagnostic.type(), diagnostic.message());
            }
            return strict ? EXIT_DIAGNOSTICS : 0;

        } catch (MalformedGraphException e) {
            log.error("Validation failed at element {}: {}", e.getElementId(), e.getMessage());
            System.err.println("✗ Invalid diagram: " + e.getMessage());
            return 1;
        } catch (BpmnNarratorException e) {
            log.error("Validation failed: {}", e.getMessage(), e);
            System.err.println("✗ Validation failed: " + e.getMessage());
            return 1;
        }
    }
}
