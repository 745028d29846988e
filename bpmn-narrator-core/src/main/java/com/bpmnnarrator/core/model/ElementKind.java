package com.bpmnnarrator.core.model;

/**
 * Classification of BPMN flow elements.
 *
 * <p>Every element read from a process carries exactly one kind. The mapping from BPMN tag
 * names to kinds lives in {@link com.bpmnnarrator.core.parser.ElementClassifier}.
 */
public enum ElementKind {
    /** Start event, the root of a traversal */
    START_EVENT,

    /** End event, terminates a branch */
    END_EVENT,

    /** Any activity type (task, userTask, serviceTask, ...) */
    TASK,

    /** Sub-process or call activity, rendered as a single opaque step */
    SUB_PROCESS,

    /** Exclusive (XOR) gateway */
    EXCLUSIVE_GATEWAY,

    /** Parallel (AND) gateway */
    PARALLEL_GATEWAY,

    /** Inclusive (OR) gateway */
    INCLUSIVE_GATEWAY,

    /** Event-based gateway */
    EVENT_BASED_GATEWAY,

    /** Complex gateway */
    COMPLEX_GATEWAY,

    /** Intermediate throw event carrying a link event definition */
    LINK_THROW_EVENT,

    /** Intermediate catch event carrying a link event definition */
    LINK_CATCH_EVENT,

    /** Intermediate event that is not a link (timer, message, signal, ...) */
    INTERMEDIATE_EVENT,

    /** Event attached to the boundary of an activity */
    BOUNDARY_EVENT,

    /** Recognized flow element without a more specific classification */
    OTHER;

    /**
     * Returns whether this kind is one of the gateway kinds.
     *
     * @return true for gateways
     */
    public boolean isGateway() {
        return switch (this) {
            case EXCLUSIVE_GATEWAY, PARALLEL_GATEWAY, INCLUSIVE_GATEWAY,
                 EVENT_BASED_GATEWAY, COMPLEX_GATEWAY -> true;
            default -> false;
        };
    }

    /**
     * Returns whether this kind is an intermediate link event (throw or catch).
     *
     * @return true for link events
     */
    public boolean isLink() {
        return this == LINK_THROW_EVENT || this == LINK_CATCH_EVENT;
    }

    /**
     * Returns whether this kind is an event of any sort.
     *
     * @return true for events
     */
    public boolean isEvent() {
        return switch (this) {
            case START_EVENT, END_EVENT, LINK_THROW_EVENT, LINK_CATCH_EVENT,
                 INTERMEDIATE_EVENT, BOUNDARY_EVENT -> true;
            default -> false;
        };
    }
}
