package com.conveyal.rastertools.processing;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a work item during a run. Items move forward one step at a time and may fail from any state that is
 * not already terminal.
 */
public enum WorkItemState {

    PENDING, READING, COMPUTING, WRITING, DONE, FAILED;

    public boolean isTerminal () {
        return this == DONE || this == FAILED;
    }

    public Set<WorkItemState> successors () {
        switch (this) {
            case PENDING: return EnumSet.of(READING, FAILED);
            case READING: return EnumSet.of(COMPUTING, FAILED);
            case COMPUTING: return EnumSet.of(WRITING, FAILED);
            case WRITING: return EnumSet.of(DONE, FAILED);
            default: return EnumSet.noneOf(WorkItemState.class);
        }
    }

    /**
     * @return the next state, once checked to be a legal move from this one.
     * @throws IllegalStateException otherwise.
     */
    public WorkItemState checkTransition (WorkItemState next) {
        if (!successors().contains(next)) {
            throw new IllegalStateException("Work item cannot go from " + this + " to " + next);
        }
        return next;
    }

}
