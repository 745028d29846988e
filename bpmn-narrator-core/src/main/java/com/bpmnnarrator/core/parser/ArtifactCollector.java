package com.bpmnnarrator.core.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Collects systems, documents and annotations and associates them with flow elements.
 *
 * <p>Artifacts are looked up across the whole document, since text annotations and
 * associations may live in a collaboration as well as in a process:
 * <ul>
 *   <li>{@code dataStoreReference} / {@code dataStore}: system</li>
 *   <li>{@code dataObjectReference} / {@code dataObject}: document</li>
 *   <li>{@code textAnnotation}: annotation</li>
 * </ul>
 *
 * <p>An artifact is attached to an element through an {@code association} (in either
 * direction) or through a {@code dataInputAssociation} / {@code dataOutputAssociation}
 * nested in the element. Annotations attached to nothing are returned separately.
 */
final class ArtifactCollector {

    private static final Logger log = LoggerFactory.getLogger(ArtifactCollector.class);

    /**
     * Artifact category.
     */
    enum Category { SYSTEM, DOCUMENT, ANNOTATION }

    /**
     * An artifact found in the document.
     *
     * @param category artifact category
     * @param text display text
     */
    record Artifact(Category category, String text) {}

    /**
     * Artifacts grouped by flow element.
     *
     * @param byElement artifacts per element id, in attachment order
     * @param orphanAnnotations annotation texts attached to no element
     */
    record Result(Map<String, List<Artifact>> byElement, List<String> orphanAnnotations) {

        /**
         * Returns the texts of one category attached to an element.
         *
         * @param elementId element id
         * @param category artifact category
         * @return texts in attachment order
         */
        List<String> texts(String elementId, Category category) {
            return byElement.getOrDefault(elementId, List.of()).stream()
                .filter(a -> a.category() == category)
                .map(Artifact::text)
                .toList();
        }
    }

    private final Element root;
    private final Set<String> elementIds;
    private final Map<String, Artifact> artifacts = new LinkedHashMap<>();
    private final Map<String, List<Artifact>> byElement = new HashMap<>();
    private final Set<String> attachedAnnotations = new LinkedHashSet<>();

    ArtifactCollector(Element root, Set<String> elementIds) {
        this.root = root;
        this.elementIds = elementIds;
    }

    /**
     * Indexes all artifacts and resolves their associations.
     *
     * @return artifacts per element and orphan annotations
     */
    Result collect() {
        indexArtifacts();

        for (Element association : XmlElements.descendants(root, "association")) {
            attach(XmlElements.attribute(association, "sourceRef"), XmlElements.attribute(association, "targetRef"));
        }
        for (Element input : XmlElements.descendants(root, "dataInputAssociation")) {
            String owner = ownerId(input);
            for (Element source : XmlElements.children(input, "sourceRef")) {
                attachToOwner(XmlElements.text(source), owner, input);
            }
        }
        for (Element output : XmlElements.descendants(root, "dataOutputAssociation")) {
            String owner = ownerId(output);
            XmlElements.firstChild(output, "targetRef")
                .ifPresent(target -> attachToOwner(XmlElements.text(target), owner, output));
        }

        List<String> orphans = new ArrayList<>();
        artifacts.forEach((id, artifact) -> {
            if (artifact.category() == Category.ANNOTATION && !attachedAnnotations.contains(id)) {
                orphans.add(artifact.text());
            }
        });

        log.debug("Collected {} artifacts, {} orphan annotations", artifacts.size(), orphans.size());
        return new Result(byElement, orphans);
    }

    private void indexArtifacts() {
        for (Element annotation : XmlElements.descendants(root, "textAnnotation")) {
            String text = XmlElements.firstChild(annotation, "text").map(XmlElements::text).orElse("");
            if (!text.isEmpty()) {
                artifacts.put(XmlElements.attribute(annotation, "id"), new Artifact(Category.ANNOTATION, text));
            }
        }

        Map<String, String> dataObjectNames = new HashMap<>();
        for (Element dataObject : XmlElements.descendants(root, "dataObject")) {
            String id = XmlElements.attribute(dataObject, "id");
            String name = XmlElements.attribute(dataObject, "name");
            dataObjectNames.put(id, name);
            artifacts.put(id, new Artifact(Category.DOCUMENT, name.isEmpty() ? id : name));
        }
        Map<String, String> dataStoreNames = new HashMap<>();
        for (Element dataStore : XmlElements.descendants(root, "dataStore")) {
            dataStoreNames.put(XmlElements.attribute(dataStore, "id"), XmlElements.attribute(dataStore, "name"));
        }

        for (Element reference : XmlElements.descendants(root, "dataObjectReference")) {
            String id = XmlElements.attribute(reference, "id");
            String name = firstNonEmpty(
                XmlElements.attribute(reference, "name"),
                dataObjectNames.getOrDefault(XmlElements.attribute(reference, "dataObjectRef"), ""),
                id);
            artifacts.put(id, new Artifact(Category.DOCUMENT, name));
        }
        for (Element reference : XmlElements.descendants(root, "dataStoreReference")) {
            String id = XmlElements.attribute(reference, "id");
            String name = firstNonEmpty(
                XmlElements.attribute(reference, "name"),
                dataStoreNames.getOrDefault(XmlElements.attribute(reference, "dataStoreRef"), ""),
                id);
            artifacts.put(id, new Artifact(Category.SYSTEM, name));
        }
    }

    private void attach(String source, String target) {
        if (artifacts.containsKey(source) && elementIds.contains(target)) {
            add(target, source);
        }
        if (artifacts.containsKey(target) && elementIds.contains(source)) {
            add(source, target);
        }
    }

    private void attachToOwner(String artifactId, String ownerId, Element association) {
        if (!artifacts.containsKey(artifactId)) {
            return;
        }
        if (ownerId != null && elementIds.contains(ownerId)) {
            add(ownerId, artifactId);
            return;
        }
        // Association declared outside an element: fall back to its explicit targetRef
        XmlElements.firstChild(association, "targetRef")
            .map(XmlElements::text)
            .filter(elementIds::contains)
            .ifPresent(target -> add(target, artifactId));
    }

    private void add(String elementId, String artifactId) {
        Artifact artifact = artifacts.get(artifactId);
        byElement.computeIfAbsent(elementId, k -> new ArrayList<>()).add(artifact);
        if (artifact.category() == Category.ANNOTATION) {
            attachedAnnotations.add(artifactId);
        }
    }

    private static String ownerId(Element association) {
        return association.getParentNode() instanceof Element parent
            ? XmlElements.attribute(parent, "id")
            : null;
    }

    private static String firstNonEmpty(String... values) {
        for (String value : values) {
            if (value != null && !value.isEmpty()) {
                return value;
            }
        }
        return "";
    }
}
