package com.oslira.bulk.exception;

/**
 * Cancel requested for a run that has already reached a final status.
 */
public class BatchAlreadyFinishedException extends RuntimeException {

    private final String batchId;
    private final String status;

    public BatchAlreadyFinishedException(String batchId, String status) {
        super("Batch " + batchId + " is already " + status);
        this.batchId = batchId;
        this.status = status;
    }

    public String getBatchId() {
        return batchId;
    }

    public String getStatus() {
        return status;
    }
}
