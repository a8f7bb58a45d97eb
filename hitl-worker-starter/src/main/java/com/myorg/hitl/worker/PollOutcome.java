package com.myorg.hitl.worker;

/** Result of one {@link DraftingWorker#runOnce()} cycle. */
public enum PollOutcome {
    /** A draft was persisted; poll again right away. */
    DRAFTED,
    /** Nothing eligible to claim. */
    IDLE,
    /** Retryable failure, claim rolled back. */
    RELEASED,
    /** Permanent failure or attempts exhausted; ticket parked for a human. */
    NEEDS_ATTENTION,
    /** A reviewer moved the ticket while it was being drafted; draft dropped. */
    SUPERSEDED,
    /** The claim itself (or its rollback) failed. */
    STORE_ERROR,
    /** Stop requested; any claim was handed back. */
    CANCELLED;

    public boolean pollImmediately() {
        return this == DRAFTED || this == SUPERSEDED;
    }
}
