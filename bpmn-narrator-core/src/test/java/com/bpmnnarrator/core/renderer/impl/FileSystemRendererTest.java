package com.bpmnnarrator.core.renderer.impl;

import com.bpmnnarrator.core.renderer.NarrativeFile;
import com.bpmnnarrator.core.renderer.NarrativeOutput;
import com.bpmnnarrator.core.renderer.RenderContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link FileSystemRenderer}.
 */
class FileSystemRendererTest {

    @TempDir
    Path tempDir;

    private FileSystemRenderer renderer;

    @BeforeEach
    void setUp() {
        renderer = new FileSystemRenderer();
    }

    @Test
    void getId_returnsFilesystem() {
        assertThat(renderer.getId()).isEqualTo("filesystem");
    }

    @Test
    void render_createsMissingDirectoryAndWritesUtf8() throws IOException {
        // Given
        Path outputDir = tempDir.resolve("narrativas/2024");
        NarrativeOutput output = NarrativeOutput.of(new NarrativeFile("pedido.txt", "Titulo: Pedido\n1. Início\n"));

        // When
        renderer.render(output, new RenderContext(outputDir.toString(), Map.of()));

        // Then
        Path written = outputDir.resolve("pedido.txt");
        assertThat(written).exists();
        assertThat(Files.readString(written, StandardCharsets.UTF_8)).isEqualTo("Titulo: Pedido\n1. Início\n");
    }

    @Test
    void render_multipleFiles_writesEach() throws IOException {
        // Given
        NarrativeOutput output = new NarrativeOutput(List.of(
            new NarrativeFile("a.txt", "A\n"),
            new NarrativeFile("sub/b.txt", "B\n")));

        // When
        renderer.render(output, new RenderContext(tempDir.toString(), Map.of()));

        // Then
        assertThat(Files.readString(tempDir.resolve("a.txt"))).isEqualTo("A\n");
        assertThat(Files.readString(tempDir.resolve("sub/b.txt"))).isEqualTo("B\n");
    }

    @Test
    void render_existingFile_isOverwritten() throws IOException {
        // Given
        Files.writeString(tempDir.resolve("a.txt"), "antigo");

        // When
        renderer.render(NarrativeOutput.of(new NarrativeFile("a.txt", "novo")), new RenderContext(tempDir.toString(), Map.of()));

        // Then
        assertThat(Files.readString(tempDir.resolve("a.txt"))).isEqualTo("novo");
    }

    @Test
    void render_outputDirectoryIsAFile_throws() throws IOException {
        // Given
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "x");

        // When / Then
        assertThatThrownBy(() -> renderer.render(NarrativeOutput.of(new NarrativeFile("a.txt", "A")),
            new RenderContext(blocker.toString(), Map.of())))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Failed to create output directory");
    }
}
