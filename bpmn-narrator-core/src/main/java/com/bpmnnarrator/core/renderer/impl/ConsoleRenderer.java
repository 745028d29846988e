package com.bpmnnarrator.core.renderer.impl;

import com.bpmnnarrator.core.renderer.NarrativeFile;
import com.bpmnnarrator.core.renderer.NarrativeOutput;
import com.bpmnnarrator.core.renderer.OutputRenderer;
import com.bpmnnarrator.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Renderer that prints narratives to standard output.
 *
 * <p>A single narrative is printed verbatim, so the output can be piped. Several narratives are
 * separated by a header line naming each file.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code console.colors} - ANSI colors for headers ("true"/"false", default: "false")</li>
 *   <li>{@code console.showHeaders} - force headers on or off (default: only for several files)</li>
 * </ul>
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleRenderer.class);

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD_CYAN = "\u001B[1m\u001B[36m";
    private static final String HEADER_MARK = "==> ";
    private static final String HEADER_END = " <==";

    private final PrintStream out;

    public ConsoleRenderer() {
        this(System.out);
    }

    public ConsoleRenderer(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public String getDescription() {
        return "Prints narratives to standard output";
    }

    @Override
    public void render(NarrativeOutput output, RenderContext context) {
        boolean useColors = Boolean.parseBoolean(context.getSettingOrDefault("console.colors", "false"));
        boolean showHeaders = Boolean.parseBoolean(context.getSettingOrDefault(
            "console.showHeaders", String.valueOf(output.files().size() > 1)));

        logger.debug("Rendering {} narrative(s) to console (headers: {})", output.files().size(), showHeaders);

        for (int i = 0; i < output.files().size(); i++) {
            NarrativeFile file = output.files().get(i);
            if (i > 0) {
                out.println();
            }
            if (showHeaders) {
                String prefix = useColors ? ANSI_BOLD_CYAN : "";
                String suffix = useColors ? ANSI_RESET : "";
                out.println(prefix + HEADER_MARK + file.relativePath() + HEADER_END + suffix);
            }
            out.print(file.content());
        }
        out.flush();
    }
}
