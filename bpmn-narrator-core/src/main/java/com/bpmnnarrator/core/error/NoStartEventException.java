package com.bpmnnarrator.core.error;

/**
 * Thrown when a document offers no entry point: no process at all, or no process with a
 * start event.
 */
public class NoStartEventException extends BpmnNarratorException {

    public NoStartEventException(String message) {
        super(message);
    }
}
