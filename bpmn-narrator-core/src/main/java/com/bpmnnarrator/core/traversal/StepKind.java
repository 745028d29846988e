package com.bpmnnarrator.core.traversal;

/**
 * Kind of a narrative step.
 */
public enum StepKind {
    /** A numbered element. */
    ELEMENT,
    /** A numbered link throw event without matching catch; ends its branch. */
    UNMATCHED_LINK,
    /** Reference to an element numbered earlier or still on the active path. */
    BACK_REFERENCE,
    /** Reference to an element numbered later in the narrative. */
    FORWARD_REFERENCE;

    public boolean isReference() {
        return this == BACK_REFERENCE || this == FORWARD_REFERENCE;
    }
}
