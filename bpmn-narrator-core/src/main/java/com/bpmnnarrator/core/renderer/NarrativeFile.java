package com.bpmnnarrator.core.renderer;

import java.util.Objects;

/**
 * A narrative to be rendered.
 *
 * @param relativePath file name relative to the output directory (e.g. "pedido.txt")
 * @param content narrative text
 */
public record NarrativeFile(
    String relativePath,
    String content
) {
    public NarrativeFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }
}
