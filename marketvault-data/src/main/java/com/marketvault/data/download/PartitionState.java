package com.marketvault.data.download;

import com.marketvault.data.store.PartitionStatus;

/**
 * Lifecycle of one partition during a download.
 *
 * ABSENT and INCOMPLETE may move to FETCHING. FETCHING ends in COMPLETE or
 * INCOMPLETE after a commit, or falls back to the state it started from when
 * the fetch fails. COMPLETE is terminal.
 */
public enum PartitionState {
    ABSENT,
    FETCHING,
    INCOMPLETE,
    COMPLETE;

    public static PartitionState of(PartitionStatus status) {
        return switch (status) {
            case ABSENT -> ABSENT;
            case INCOMPLETE_PRESENT -> INCOMPLETE;
            case COMPLETE_PRESENT -> COMPLETE;
        };
    }

    public boolean canTransitionTo(PartitionState next) {
        return switch (this) {
            case ABSENT, INCOMPLETE -> next == FETCHING;
            case FETCHING -> next != FETCHING;
            case COMPLETE -> false;
        };
    }

    /**
     * @throws IllegalStateException if the transition is not allowed
     */
    public PartitionState transitionTo(PartitionState next) {
        if (!canTransitionTo(next)) {
            throw new IllegalStateException("Illegal partition transition " + this + " -> " + next);
        }
        return next;
    }

    /**
     * Whether a partition in this state must be fetched.
     */
    public boolean needsFetch() {
        return this == ABSENT || this == INCOMPLETE;
    }
}
