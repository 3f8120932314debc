package com.oslira.bulk.model;

/**
 * Lifecycle of a submitted bulk run.
 */
public enum BatchRunStatus {
    /** Accepted, waiting for a run thread */
    QUEUED("queued", false),

    /** Groups are being dispatched */
    RUNNING("running", false),

    /** Every item has a final outcome and credits were reconciled */
    COMPLETE("complete", true),

    /** Stopped on request; items not yet dispatched were skipped and not charged */
    CANCELLED("cancelled", true),

    /** The run itself broke; item failures alone never lead here */
    FAILED("failed", true);

    private final String code;
    private final boolean finished;

    BatchRunStatus(String code, boolean finished) {
        this.code = code;
        this.finished = finished;
    }

    public String code() {
        return code;
    }

    public boolean isFinished() {
        return finished;
    }
}
