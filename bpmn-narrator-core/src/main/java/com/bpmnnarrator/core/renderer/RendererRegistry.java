package com.bpmnnarrator.core.renderer;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Looks up {@link OutputRenderer}s registered through {@link ServiceLoader}.
 */
public final class RendererRegistry {

    private RendererRegistry() {
        // Utility class
    }

    /**
     * Returns all registered renderers in discovery order.
     *
     * @return renderers
     */
    public static List<OutputRenderer> all() {
        List<OutputRenderer> renderers = new ArrayList<>();
        ServiceLoader.load(OutputRenderer.class).forEach(renderers::add);
        return renderers;
    }

    /**
     * Finds a renderer by id.
     *
     * @param id renderer id
     * @return the renderer, if registered
     */
    public static Optional<OutputRenderer> find(String id) {
        return all().stream().filter(r -> r.getId().equals(id)).findFirst();
    }
}
