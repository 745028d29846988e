package com.bpmnnarrator.core.model;

/**
 * Recoverable anomalies found while converting a diagram.
 */
public enum DiagnosticType {
    /** Link throw without catch, or catch without throw */
    UNMATCHED_LINK,

    /** Several catch events share one link name */
    AMBIGUOUS_LINK,

    /** Element never reached from any root */
    UNREACHABLE_ELEMENT,

    /** Tag skipped by the parser */
    UNRECOGNIZED_ELEMENT,

    /** Process skipped because it has no start event */
    MISSING_START_EVENT
}
