package com.bpmnnarrator.core.renderer.impl;

import com.bpmnnarrator.core.renderer.NarrativeFile;
import com.bpmnnarrator.core.renderer.NarrativeOutput;
import com.bpmnnarrator.core.renderer.OutputRenderer;
import com.bpmnnarrator.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Renderer that writes narratives to the filesystem as UTF-8 text.
 *
 * <p>Creates the output directory automatically and overwrites existing files.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * RenderContext context = new RenderContext("./narratives", Map.of());
 * NarrativeOutput output = NarrativeOutput.of(new NarrativeFile("pedido.txt", text));
 *
 * new FileSystemRenderer().render(output, context);
 * // Creates: ./narratives/pedido.txt
 * }</pre>
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemRenderer.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public String getDescription() {
        return "Writes narratives as UTF-8 text files";
    }

    @Override
    public void render(NarrativeOutput output, RenderContext context) {
        Path outputDir = Paths.get(context.outputDirectory());
        logger.debug("Rendering {} narrative(s) to filesystem at: {}", output.files().size(), outputDir);

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }

        for (NarrativeFile file : output.files()) {
            writeFile(outputDir, file);
        }
    }

    private void writeFile(Path outputDir, NarrativeFile file) {
        Path targetPath = outputDir.resolve(file.relativePath());
        try {
            Path parentDir = targetPath.getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }
            Files.writeString(targetPath, file.content(), StandardCharsets.UTF_8);
            logger.info("Wrote narrative: {} ({} characters)", targetPath, file.content().length());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + targetPath, e);
        }
    }
}
