package com.bpmnnarrator.core.error;

/**
 * Thrown when a file cannot be read as a BPMN 2.0 XML document.
 */
public class BpmnParseException extends BpmnNarratorException {

    public BpmnParseException(String message) {
        super(message);
    }

    public BpmnParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
