package com.bpmnnarrator.core.traversal;

import java.util.Objects;

/**
 * One entry of the traversal output, in visitation order.
 *
 * <p>For references, {@code number} and {@code elementId} identify the referenced element and
 * {@code depth} is the depth of the position where the reference appears.
 *
 * @param kind step kind
 * @param number element number, or referenced number
 * @param elementId element id, or referenced element id
 * @param depth nesting depth used for indentation
 * @param branchLabel flow name or condition when the step opens a branch, else empty
 * @param defaultBranch whether the step opens the default branch of its divergence
 * @param role structural role of the element; {@link ElementRole#PLAIN} for references
 */
public record NarrativeStep(
    StepKind kind,
    StepNumber number,
    String elementId,
    int depth,
    String branchLabel,
    boolean defaultBranch,
    ElementRole role
) {
    public NarrativeStep {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(number, "number must not be null");
        Objects.requireNonNull(elementId, "elementId must not be null");
        if (branchLabel == null) {
            branchLabel = "";
        }
        if (role == null) {
            role = ElementRole.PLAIN;
        }
    }

    /**
     * Returns whether this step is the first of a branch.
     */
    public boolean opensBranch() {
        return !branchLabel.isEmpty() || defaultBranch;
    }
}
