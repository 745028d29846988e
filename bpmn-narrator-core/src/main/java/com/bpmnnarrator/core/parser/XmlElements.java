package com.bpmnnarrator.core.parser;

import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * DOM helpers shared by the BPMN readers.
 */
final class XmlElements {

    static final String BPMN_NS = "http://www.omg.org/spec/BPMN/20100524/MODEL";
    static final String BPMNDI_NS = "http://www.omg.org/spec/BPMN/20100524/DI";
    static final String DC_NS = "http://www.omg.org/spec/DD/20100524/DC";

    private XmlElements() {
        // Utility class
    }

    /**
     * Returns the element children of a node in document order.
     *
     * @param parent parent element
     * @return child elements
     */
    static List<Element> children(Element parent) {
        List<Element> result = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE) {
                result.add((Element) node);
            }
        }
        return result;
    }

    /**
     * Returns the BPMN-namespace children with the given local name.
     *
     * @param parent parent element
     * @param localName tag local name
     * @return matching child elements in document order
     */
    static List<Element> children(Element parent, String localName) {
        return children(parent).stream()
            .filter(child -> isBpmn(child, localName))
            .toList();
    }

    /**
     * Returns the first BPMN-namespace child with the given local name.
     *
     * @param parent parent element
     * @param localName tag local name
     * @return first match, if any
     */
    static Optional<Element> firstChild(Element parent, String localName) {
        return children(parent).stream()
            .filter(child -> isBpmn(child, localName))
            .findFirst();
    }

    /**
     * Returns all descendants in the given namespace with the given local name.
     *
     * @param root element to search below
     * @param namespace namespace URI
     * @param localName tag local name
     * @return matching elements in document order
     */
    static List<Element> descendants(Element root, String namespace, String localName) {
        List<Element> result = new ArrayList<>();
        NodeList nodes = root.getElementsByTagNameNS(namespace, localName);
        for (int i = 0; i < nodes.getLength(); i++) {
            result.add((Element) nodes.item(i));
        }
        return result;
    }

    /**
     * Returns all BPMN-namespace descendants with the given local name.
     *
     * @param root element to search below
     * @param localName tag local name
     * @return matching elements in document order
     */
    static List<Element> descendants(Element root, String localName) {
        return descendants(root, BPMN_NS, localName);
    }

    /**
     * Returns whether the element is in the BPMN namespace and has the given local name.
     *
     * @param element element to test
     * @param localName expected local name
     * @return true on match
     */
    static boolean isBpmn(Element element, String localName) {
        return BPMN_NS.equals(element.getNamespaceURI()) && localName.equals(element.getLocalName());
    }

    /**
     * Returns a trimmed attribute value.
     *
     * @param element element to read
     * @param name attribute name
     * @return trimmed value, empty string when absent
     */
    static String attribute(Element element, String name) {
        return element.hasAttribute(name) ? element.getAttribute(name).trim() : "";
    }

    /**
     * Returns the trimmed text content of an element.
     *
     * @param element element to read
     * @return trimmed text, empty string when there is none
     */
    static String text(Element element) {
        String content = element.getTextContent();
        return content == null ? "" : content.trim();
    }
}
