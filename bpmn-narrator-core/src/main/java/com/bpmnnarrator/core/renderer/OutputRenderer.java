package com.bpmnnarrator.core.renderer;

/**
 * Destination for rendered narratives.
 *
 * <p>Renderers are discovered via Java Service Provider Interface (SPI). Registration:
 * {@code META-INF/services/com.bpmnnarrator.core.renderer.OutputRenderer}
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class ClipboardRenderer implements OutputRenderer {
 *     @Override
 *     public String getId() {
 *         return "clipboard";
 *     }
 *
 *     @Override
 *     public void render(NarrativeOutput output, RenderContext context) {
 *         output.files().forEach(file -> copy(file.content()));
 *     }
 * }
 * }</pre>
 *
 * @see NarrativeOutput
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns the unique, lowercase identifier of this renderer (e.g. "console").
     *
     * @return renderer identifier
     */
    String getId();

    /**
     * Returns a one-line description for listings.
     *
     * @return description
     */
    default String getDescription() {
        return getId();
    }

    /**
     * Writes the narratives to the destination.
     *
     * @param output narratives to render
     * @param context rendering context with output directory and settings
     * @throws IllegalStateException if the destination cannot be written
     */
    void render(NarrativeOutput output, RenderContext context);
}
