package com.bpmnnarrator.core.error;

/**
 * Thrown when the flow graph violates identifier integrity: a flow references an unknown
 * element, a flow element has no id, or two elements share one id.
 */
public class MalformedGraphException extends BpmnNarratorException {

    private final String elementId;

    /**
     * Creates an exception for the given element.
     *
     * @param message error description
     * @param elementId offending element or flow id, may be null
     */
    public MalformedGraphException(String message, String elementId) {
        super(message);
        this.elementId = elementId;
    }

    /**
     * Returns the id of the element or flow that broke integrity.
     *
     * @return element id, or null when the element has none
     */
    public String getElementId() {
        return elementId;
    }
}
