package com.farmvoice.ingest.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * States of the recording pipeline for a Job.
 *
 * Transitions (happy path):
 *   UPLOADED → TRANSCRIBING → TRANSCRIBED → PROCESSING → SYNCED
 *
 * FAILED is reachable from every non-terminal state. A reprocess request
 * moves any state back to UPLOADED.
 */
public enum JobStatus {
    UPLOADED,
    TRANSCRIBING,
    TRANSCRIBED,
    PROCESSING,
    SYNCED,
    FAILED;

    /** SYNCED or FAILED: nothing moves the job on without a reprocess. */
    public boolean isTerminal() {
        return this == SYNCED || this == FAILED;
    }

    /** Statuses a pipeline run can be left in after a crash. */
    public static Set<JobStatus> nonTerminal() {
        return EnumSet.of(UPLOADED, TRANSCRIBING, TRANSCRIBED, PROCESSING);
    }

    /**
     * Whether the pipeline may move a job from this status to {@code next}.
     * Reprocess resets are not pipeline edges and bypass this check.
     */
    public boolean canTransitionTo(JobStatus next) {
        if (next == FAILED) {
            return !isTerminal();
        }
        return switch (this) {
            case UPLOADED     -> next == TRANSCRIBING;
            case TRANSCRIBING -> next == TRANSCRIBED;
            case TRANSCRIBED  -> next == PROCESSING;
            case PROCESSING   -> next == SYNCED;
            case SYNCED, FAILED -> false;
        };
    }
}
