package com.bpmnnarrator.core.renderer;

import java.util.List;
import java.util.Objects;

/**
 * Narratives produced by one invocation, in input order.
 *
 * @param files narratives to render
 */
public record NarrativeOutput(
    List<NarrativeFile> files
) {
    public NarrativeOutput {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
    }

    public static NarrativeOutput of(NarrativeFile file) {
        return new NarrativeOutput(List.of(file));
    }
}
