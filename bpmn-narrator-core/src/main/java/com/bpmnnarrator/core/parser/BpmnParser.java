package com.bpmnnarrator.core.parser;

import com.bpmnnarrator.core.error.BpmnParseException;
import com.bpmnnarrator.core.error.MalformedGraphException;
import com.bpmnnarrator.core.model.BpmnDocument;
import com.bpmnnarrator.core.model.Diagnostic;
import com.bpmnnarrator.core.model.DiagnosticType;
import com.bpmnnarrator.core.model.ElementDetails;
import com.bpmnnarrator.core.model.ElementKind;
import com.bpmnnarrator.core.model.MessageFlow;
import com.bpmnnarrator.core.model.Participant;
import com.bpmnnarrator.core.model.ProcessDefinition;
import com.bpmnnarrator.core.model.ProcessElement;
import com.bpmnnarrator.core.model.SequenceFlow;
import com.bpmnnarrator.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Reads BPMN 2.0 XML into a {@link BpmnDocument}.
 *
 * <p>The parser builds the element catalog of every top-level {@code process}: flow elements
 * classified by {@link ElementClassifier}, sequence flows in document order, actors from lanes
 * and the systems, documents and annotations attached through associations. Collaboration
 * participants and message flows are read as well.
 *
 * <p>Sub-processes are opaque: their inner elements are not collected. Unrecognized tags are
 * skipped and reported as {@link DiagnosticType#UNRECOGNIZED_ELEMENT}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * BpmnDocument document = new BpmnParser().parse(Path.of("order.bpmn"));
 * }</pre>
 */
public class BpmnParser {

    private static final Logger log = LoggerFactory.getLogger(BpmnParser.class);

    private static final String DEFINITIONS = "definitions";
    private static final String EVENT_DEFINITION_SUFFIX = "EventDefinition";

    private final boolean inferLanesFromDiagram;

    /**
     * Creates a parser that infers missing lane membership from diagram geometry.
     */
    public BpmnParser() {
        this(true);
    }

    /**
     * Creates a parser.
     *
     * @param inferLanesFromDiagram whether elements without a lane reference are placed by geometry
     */
    public BpmnParser(boolean inferLanesFromDiagram) {
        this.inferLanesFromDiagram = inferLanesFromDiagram;
    }

    /**
     * Parses a BPMN file.
     *
     * @param file path to a {@code .bpmn} or {@code .xml} file
     * @return parsed document, named after the file stem
     * @throws BpmnParseException if the file cannot be read or is not BPMN XML
     * @throws MalformedGraphException if an element lacks an id or ids are duplicated
     */
    public BpmnDocument parse(Path file) {
        Objects.requireNonNull(file, "file must not be null");
        try (InputStream in = Files.newInputStream(file)) {
            return parse(in, FileUtils.stem(file));
        } catch (IOException e) {
            throw new BpmnParseException("Cannot read " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parses BPMN XML from a stream. The stream is not closed.
     *
     * @param in XML content, UTF-8 unless the prolog says otherwise
     * @param name document name used as the fallback title
     * @return parsed document
     * @throws BpmnParseException if the content is not well-formed BPMN XML
     * @throws MalformedGraphException if an element lacks an id or ids are duplicated
     */
    public BpmnDocument parse(InputStream in, String name) {
        Objects.requireNonNull(in, "in must not be null");
        Objects.requireNonNull(name, "name must not be null");

        Element definitions = readDocument(in, name).getDocumentElement();
        if (!XmlElements.isBpmn(definitions, DEFINITIONS)) {
            throw new BpmnParseException("Not a BPMN 2.0 document: root element is <"
                + definitions.getTagName() + ">, expected bpmn:definitions");
        }

        List<Diagnostic> diagnostics = new ArrayList<>();
        List<Participant> participants = readParticipants(definitions);
        List<MessageFlow> messageFlows = readMessageFlows(definitions);

        Map<Element, List<ProcessElement>> rawElements = new LinkedHashMap<>();
        Map<Element, List<SequenceFlow>> flows = new LinkedHashMap<>();
        Set<String> seenIds = new HashSet<>();
        for (Element process : XmlElements.children(definitions, "process")) {
            List<ProcessElement> elements = new ArrayList<>();
            List<SequenceFlow> sequenceFlows = new ArrayList<>();
            readProcessChildren(process, elements, sequenceFlows, seenIds, diagnostics);
            rawElements.put(process, elements);
            flows.put(process, sequenceFlows);
        }

        Set<String> elementIds = new HashSet<>();
        rawElements.values().forEach(list -> list.forEach(e -> elementIds.add(e.id())));
        ArtifactCollector.Result artifacts = new ArtifactCollector(definitions, elementIds).collect();
        LaneResolver lanes = new LaneResolver(definitions, inferLanesFromDiagram);

        Map<String, String> participantNames = new HashMap<>();
        participants.forEach(p -> {
            if (p.processRef() != null && !p.processRef().isEmpty()) {
                participantNames.putIfAbsent(p.processRef(), p.name());
            }
        });

        List<ProcessDefinition> processes = new ArrayList<>();
        rawElements.forEach((process, elements) -> {
            String processId = XmlElements.attribute(process, "id");
            Set<String> ids = new HashSet<>();
            elements.forEach(e -> ids.add(e.id()));
            Map<String, String> actors = lanes.resolve(process, ids);

            List<ProcessElement> enriched = elements.stream()
                .map(e -> e.withDetails(new ElementDetails(
                    actors.get(e.id()),
                    artifacts.texts(e.id(), ArtifactCollector.Category.SYSTEM),
                    artifacts.texts(e.id(), ArtifactCollector.Category.DOCUMENT),
                    artifacts.texts(e.id(), ArtifactCollector.Category.ANNOTATION))))
                .toList();

            String title = XmlElements.attribute(process, "name");
            if (title.isEmpty()) {
                title = participantNames.getOrDefault(processId, "");
            }
            processes.add(new ProcessDefinition(processId, title, enriched, flows.get(process)));
            log.debug("Process {}: {} elements, {} sequence flows", processId, enriched.size(), flows.get(process).size());
        });

        log.info("Parsed {}: {} process(es), {} participant(s), {} message flow(s)",
            name, processes.size(), participants.size(), messageFlows.size());
        return new BpmnDocument(name, processes, participants, messageFlows,
            artifacts.orphanAnnotations(), diagnostics);
    }

    private Document readDocument(InputStream in, String name) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            return builder.parse(in);
        } catch (SAXException e) {
            throw new BpmnParseException("Malformed XML in " + name + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new BpmnParseException("Cannot read " + name + ": " + e.getMessage(), e);
        } catch (ParserConfigurationException e) {
            throw new BpmnParseException("XML parser unavailable: " + e.getMessage(), e);
        }
    }

    private void readProcessChildren(Element process, List<ProcessElement> elements,
                                     List<SequenceFlow> sequenceFlows, Set<String> seenIds,
                                     List<Diagnostic> diagnostics) {
        for (Element child : XmlElements.children(process)) {
            if (!XmlElements.BPMN_NS.equals(child.getNamespaceURI())) {
                continue;
            }
            String tag = child.getLocalName();

            if ("sequenceFlow".equals(tag)) {
                sequenceFlows.add(readSequenceFlow(child, sequenceFlows.size()));
                continue;
            }
            if (ElementClassifier.isNonFlowTag(tag)) {
                continue;
            }

            String eventDefinition = "";
            String linkName = "";
            Element definition = eventDefinition(child);
            if (definition != null) {
                String localName = definition.getLocalName();
                eventDefinition = localName.substring(0, localName.length() - EVENT_DEFINITION_SUFFIX.length());
                linkName = XmlElements.attribute(definition, "name");
            }

            Optional<ElementKind> kind = ElementClassifier.classify(tag, eventDefinition);
            if (kind.isEmpty()) {
                String id = XmlElements.attribute(child, "id");
                log.warn("Skipping unrecognized element <{}> {}", tag, id);
                diagnostics.add(new Diagnostic(DiagnosticType.UNRECOGNIZED_ELEMENT, id,
                    "Elemento não reconhecido ignorado: " + tag + (id.isEmpty() ? "" : " (" + id + ")")));
                continue;
            }

            String id = XmlElements.attribute(child, "id");
            if (id.isEmpty()) {
                throw new MalformedGraphException("<" + tag + "> element without id attribute", null);
            }
            if (!seenIds.add(id)) {
                throw new MalformedGraphException("Duplicate element id: " + id, id);
            }

            String name = XmlElements.attribute(child, "name");
            if (kind.get().isLink() && linkName.isEmpty()) {
                linkName = name.trim();
            }

            elements.add(new ProcessElement(
                id,
                kind.get(),
                tag,
                name,
                eventDefinition,
                linkName,
                emptyToNull(XmlElements.attribute(child, "attachedToRef")),
                emptyToNull(XmlElements.attribute(child, "default")),
                ElementDetails.empty()));
            log.debug("Element {} <{}> classified as {}", id, tag, kind.get());
        }
    }

    private SequenceFlow readSequenceFlow(Element flow, int index) {
        String id = XmlElements.attribute(flow, "id");
        if (id.isEmpty()) {
            // '#' cannot occur in a declared XML id
            id = "sequenceFlow#" + (index + 1);
            log.debug("Sequence flow without id, using {}", id);
        }
        String condition = XmlElements.firstChild(flow, "conditionExpression")
            .map(XmlElements::text)
            .orElse("");
        return new SequenceFlow(
            id,
            XmlElements.attribute(flow, "name"),
            XmlElements.attribute(flow, "sourceRef"),
            XmlElements.attribute(flow, "targetRef"),
            condition);
    }

    private List<Participant> readParticipants(Element definitions) {
        List<Participant> participants = new ArrayList<>();
        for (Element collaboration : XmlElements.children(definitions, "collaboration")) {
            for (Element participant : XmlElements.children(collaboration, "participant")) {
                participants.add(new Participant(
                    XmlElements.attribute(participant, "id"),
                    XmlElements.attribute(participant, "name"),
                    XmlElements.attribute(participant, "processRef")));
            }
        }
        return participants;
    }

    private List<MessageFlow> readMessageFlows(Element definitions) {
        List<MessageFlow> messageFlows = new ArrayList<>();
        for (Element collaboration : XmlElements.children(definitions, "collaboration")) {
            for (Element flow : XmlElements.children(collaboration, "messageFlow")) {
                messageFlows.add(new MessageFlow(
                    XmlElements.attribute(flow, "id"),
                    XmlElements.attribute(flow, "name"),
                    XmlElements.attribute(flow, "sourceRef"),
                    XmlElements.attribute(flow, "targetRef")));
            }
        }
        return messageFlows;
    }

    private static Element eventDefinition(Element element) {
        for (Element child : XmlElements.children(element)) {
            String localName = child.getLocalName();
            if (localName != null && localName.endsWith(EVENT_DEFINITION_SUFFIX)
                && localName.length() > EVENT_DEFINITION_SUFFIX.length()) {
                return child;
            }
        }
        return null;
    }

    private static String emptyToNull(String value) {
        return value.isEmpty() ? null : value;
    }
}
