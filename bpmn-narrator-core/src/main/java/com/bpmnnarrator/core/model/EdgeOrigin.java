package com.bpmnnarrator.core.model;

/**
 * Where a flow graph edge comes from.
 */
public enum EdgeOrigin {
    /** Declared sequence flow */
    SEQUENCE_FLOW,

    /** Virtual edge from a link throw event to its matching catch event */
    LINK,

    /** Virtual edge from an activity to a boundary event attached to it */
    BOUNDARY
}
