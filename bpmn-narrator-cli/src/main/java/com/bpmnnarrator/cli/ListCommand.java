package com.bpmnnarrator.cli;

import com.bpmnnarrator.core.model.ElementKind;
import com.bpmnnarrator.core.parser.ElementClassifier;
import com.bpmnnarrator.core.renderer.OutputRenderer;
import com.bpmnnarrator.core.renderer.RendererRegistry;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Lists registered output renderers or the BPMN element classification table.
 */
@Command(
    name = "list",
    description = "List available renderers or recognized BPMN elements",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    @Parameters(
        index = "0",
        description = "What to list: renderers, elements",
        defaultValue = "renderers"
    )
    private String type;

    @Override
    public Integer call() {
        return switch (type.toLowerCase()) {
            case "renderers" -> {
                listRenderers();
                yield 0;
            }
            case "elements" -> {
                listElements();
                yield 0;
            }
            default -> {
                System.err.println("Unknown type: " + type);
                System.err.println("Valid types: renderers, elements");
                yield 1;
            }
        };
    }

    private void listRenderers() {
        List<OutputRenderer> renderers = RendererRegistry.all();
        System.out.println("Available Renderers:");
        System.out.println();
        if (renderers.isEmpty()) {
            System.out.println("  (No renderers found)");
        } else {
            for (OutputRenderer renderer : renderers) {
                System.out.printf("  • %s - %s%n", renderer.getId(), renderer.getDescription());
            }
        }
    }

    private void listElements() {
        System.out.println("Recognized BPMN Elements:");
        System.out.println();
        for (Map.Entry<String, ElementKind> entry : ElementClassifier.table().entrySet()) {
            System.out.printf("  • %s (%s)%n", entry.getKey(), entry.getValue());
        }
        System.out.println();
        System.out.println("Events are further classified by their event definition (link, message, timer, ...).");
    }
}
