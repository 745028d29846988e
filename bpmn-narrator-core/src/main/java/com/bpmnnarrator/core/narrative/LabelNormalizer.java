package com.bpmnnarrator.core.narrative;

import com.bpmnnarrator.core.model.ElementDetails;
import com.bpmnnarrator.core.model.ProcessElement;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Turns raw element labels into single-line text.
 *
 * <p>Line breaks, tabs, non-breaking spaces and runs of spaces collapse to one space and the
 * result is trimmed. Systems and documents are deduplicated, sorted and joined with
 * {@code ", "}; annotations are deduplicated in attachment order. Normalizing never fails:
 * a missing element or field yields empty strings.
 */
public final class LabelNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00A0\\u2007\\u202F\\u200B]+");
    private static final String LIST_SEPARATOR = ", ";

    private static final Map<String, String> TASK_TYPES = Map.ofEntries(
        Map.entry("userTask", "Atividade de Usuário"),
        Map.entry("serviceTask", "Atividade de Serviço"),
        Map.entry("sendTask", "Atividade de Envio"),
        Map.entry("receiveTask", "Atividade de Recebimento"),
        Map.entry("manualTask", "Atividade Manual"),
        Map.entry("scriptTask", "Atividade de Script"),
        Map.entry("businessRuleTask", "Regra de Negócio"),
        Map.entry("callActivity", "Atividade de Chamada"),
        Map.entry("transaction", "Transação"),
        Map.entry("adHocSubProcess", "Subprocesso Ad Hoc")
    );

    private LabelNormalizer() {
        // Utility class
    }

    /**
     * Normalizes the label fields of an element.
     *
     * @param element element, may be null
     * @return normalized fields, all empty for a null element
     */
    public static NormalizedFields normalize(ProcessElement element) {
        if (element == null) {
            return NormalizedFields.empty();
        }
        ElementDetails details = element.details() == null ? ElementDetails.empty() : element.details();
        return new NormalizedFields(
            clean(element.name()),
            clean(details.actor()),
            TASK_TYPES.getOrDefault(element.tagName(), ""),
            sortedDistinct(details.systems()),
            sortedDistinct(details.documents()),
            distinct(details.annotations()));
    }

    /**
     * Collapses whitespace to single spaces and trims.
     *
     * @param text raw text, may be null
     * @return cleaned text, empty for null
     */
    public static String clean(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    private static String sortedDistinct(Collection<String> values) {
        Set<String> cleaned = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        if (values != null) {
            for (String value : values) {
                String text = clean(value);
                if (!text.isEmpty()) {
                    cleaned.add(text);
                }
            }
        }
        return String.join(LIST_SEPARATOR, cleaned);
    }

    private static List<String> distinct(Collection<String> values) {
        Set<String> cleaned = new LinkedHashSet<>();
        if (values != null) {
            for (String value : values) {
                String text = clean(value);
                if (!text.isEmpty()) {
                    cleaned.add(text);
                }
            }
        }
        return new ArrayList<>(cleaned);
    }
}
