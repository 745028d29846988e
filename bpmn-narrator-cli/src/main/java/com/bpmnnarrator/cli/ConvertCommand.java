package com.bpmnnarrator.cli;

import com.bpmnnarrator.core.BpmnNarrator;
import com.bpmnnarrator.core.config.NarratorConfig;
import com.bpmnnarrator.core.error.BpmnNarratorException;
import com.bpmnnarrator.core.narrative.NarrativeResult;
import com.bpmnnarrator.core.renderer.NarrativeFile;
import com.bpmnnarrator.core.renderer.NarrativeOutput;
import com.bpmnnarrator.core.renderer.OutputRenderer;
import com.bpmnnarrator.core.renderer.RenderContext;
import com.bpmnnarrator.core.renderer.RendererRegistry;
import com.bpmnnarrator.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Converts BPMN diagrams into narrative text.
 *
 * <p>The input is a single {@code .bpmn}/{@code .xml} file or a directory, in which case every
 * {@code .bpmn} file directly inside it is converted. Without {@code --output} the narrative is
 * printed to standard output; with it, one text file per diagram is written. An output path
 * ending in the output extension names the file itself when a single diagram is converted.
 *
 * <p>Every file is converted before anything is written, so a fatal error in one diagram
 * produces no output at all.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * bpmn-narrator convert pedido.bpmn
 * bpmn-narrator convert pedido.bpmn -o narrativa.txt
 * bpmn-narrator convert diagramas/ -o narrativas/ --show-links
 * }</pre>
 */
@Command(
    name = "convert",
    description = "Convert BPMN diagrams into numbered narrative text",
    mixinStandardHelpOptions = true
)
public class ConvertCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ConvertCommand.class);

    @Parameters(
        index = "0",
        description = "BPMN file or directory of .bpmn files"
    )
    private Path input;

    @Option(
        names = {"-o", "--output"},
        description = "Output directory, or output file for a single diagram (default: standard output)"
    )
    private Path output;

    @Mixin
    private NarrativeOptionsMixin narrativeOptions;

    @Override
    public Integer call() {
        try {
            NarratorConfig config = narrativeOptions.resolveConfig();
            List<Path> files = inputFiles();
            if (files.isEmpty()) {
                System.err.println("✗ No .bpmn files found in " + input);
                return 1;
            }

            BpmnNarrator narrator = new BpmnNarrator(config.narrative());
            String extension = config.output().extension();
            List<NarrativeFile> narratives = new ArrayList<>();
            int diagnostics = 0;
            for (Path file : files) {
                log.info("Converting: {}", file);
                NarrativeResult result = narrator.convert(file);
                diagnostics += result.diagnostics().size();
                narratives.add(new NarrativeFile(FileUtils.outputFileName(file, extension), result.text()));
            }

            if (output == null) {
                render("console", new NarrativeOutput(narratives), ".");
            } else {
                writeFiles(narratives, extension);
            }

            if (diagnostics > 0) {
                log.warn("{} diagnostic(s) reported, see the Observações section", diagnostics);
            }
            return 0;

        } catch (BpmnNarratorException e) {
            log.error("Conversion failed: {}", e.getMessage(), e);
            System.err.println("✗ Conversion failed: " + e.getMessage());
            return 1;
        } catch (Exception e) {
            log.error("Conversion failed", e);
            System.err.println("✗ Conversion failed: " + e.getMessage());
            return 1;
        }
    }

    private List<Path> inputFiles() throws IOException {
        if (Files.isDirectory(input)) {
            return FileUtils.findBpmnFiles(input);
        }
        if (!Files.isRegularFile(input)) {
            throw new BpmnNarratorException("BPMN file not found: " + input);
        }
        if (!FileUtils.isBpmnFile(input)) {
            log.warn("Input {} has no .bpmn or .xml extension, converting anyway", input);
        }
        return List.of(input);
    }

    private void writeFiles(List<NarrativeFile> narratives, String extension) {
        boolean namesFile = narratives.size() == 1
            && !Files.isDirectory(output)
            && FileUtils.getExtension(output).equalsIgnoreCase(extension);

        if (namesFile) {
            Path parent = output.toAbsolutePath().getParent();
            NarrativeFile renamed = new NarrativeFile(output.getFileName().toString(), narratives.get(0).content());
            render("filesystem", NarrativeOutput.of(renamed), parent.toString());
            System.out.println("✓ Narrative written to " + output);
            return;
        }

        render("filesystem", new NarrativeOutput(narratives), output.toString());
        System.out.println("✓ " + narratives.size() + " narrative(s) written to " + output);
    }

    private void render(String rendererId, NarrativeOutput narratives, String directory) {
        OutputRenderer renderer = RendererRegistry.find(rendererId)
            .orElseThrow(() -> new IllegalStateException("Renderer not registered: " + rendererId));
        renderer.render(narratives, new RenderContext(directory, Map.of()));
    }
}
