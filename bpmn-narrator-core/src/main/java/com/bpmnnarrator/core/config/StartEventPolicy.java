package com.bpmnnarrator.core.config;

/**
 * Numbering policy for processes with more than one start event.
 */
public enum StartEventPolicy {
    /** Each start event opens its own sequence: 1, 1.1, 1.2 … then 2, 2.1 … */
    PREFIXED,
    /** All start events share one top-level sequence: 1, 2, 3 … */
    SEQUENTIAL
}
