package com.storycast.processing.model;

/**
 * Lifecycle of one document analysis session.
 */
public enum SessionState {
    IDLE,
    RUNNING,
    /** Every batch was attempted; individual batches may still have failed. */
    COMPLETED,
    /** The pipeline could not start batching at all. */
    FAILED,
    /** Stopped between batches on request; the partial accumulator is kept. */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
