package com.bpmnnarrator.core.traversal;

import java.util.ArrayList;
import java.util.List;

/**
 * Allocates the numbers of one linear sequence of steps.
 *
 * <p>The top-level sequence counts {@code 1, 2, 3}. A branch sequence opened at head {@code H}
 * hands out {@code H} first, then {@code H.1, H.2} from the head's own sub-counter.
 */
final class BranchSequence {

    private final StepNumber head;
    private boolean headTaken;
    private int counter;

    private BranchSequence(StepNumber head) {
        this.head = head;
    }

    static BranchSequence topLevel() {
        return new BranchSequence(null);
    }

    static BranchSequence headedAt(StepNumber head) {
        return new BranchSequence(head);
    }

    /**
     * Returns the number the next {@link #allocate()} would hand out.
     */
    StepNumber peek() {
        if (head == null) {
            return StepNumber.of(counter + 1);
        }
        return headTaken ? head.child(counter + 1) : head;
    }

    StepNumber allocate() {
        StepNumber number = peek();
        if (head != null && !headTaken) {
            headTaken = true;
        } else {
            counter++;
        }
        return number;
    }

    /**
     * Returns the head numbers of the branches leaving a diverging step of this sequence.
     *
     * <p>A step that heads this sequence takes its branch heads from the sequence itself, so the
     * sequence resumes after them. Any other step opens child numbers {@code N.1 … N.k}.
     *
     * @param divergent number of the diverging step, the last one allocated
     * @param count number of branches
     * @return branch head numbers in branch order
     */
    List<StepNumber> branchHeads(StepNumber divergent, int count) {
        List<StepNumber> heads = new ArrayList<>(count);
        boolean headed = head != null && head.equals(divergent);
        for (int i = 1; i <= count; i++) {
            heads.add(headed ? allocate() : divergent.child(i));
        }
        return heads;
    }
}
