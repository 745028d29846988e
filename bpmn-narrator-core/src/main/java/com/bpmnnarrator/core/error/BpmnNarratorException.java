package com.bpmnnarrator.core.error;

/**
 * Base class of the fatal errors raised while converting a BPMN diagram.
 *
 * <p>A fatal error aborts the conversion with no partial output. Recoverable anomalies are
 * reported as {@link com.bpmnnarrator.core.model.Diagnostic}s instead.
 */
public class BpmnNarratorException extends RuntimeException {

    /**
     * Creates an exception with a message.
     *
     * @param message error description
     */
    public BpmnNarratorException(String message) {
        super(message);
    }

    /**
     * Creates an exception with a message and cause.
     *
     * @param message error description
     * @param cause underlying failure
     */
    public BpmnNarratorException(String message, Throwable cause) {
        super(message, cause);
    }
}
