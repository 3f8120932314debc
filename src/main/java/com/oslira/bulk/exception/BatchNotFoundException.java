package com.oslira.bulk.exception;

/**
 * No run is tracked under the batch id, either because it never existed or because
 * it finished long enough ago to have been evicted.
 */
public class BatchNotFoundException extends RuntimeException {

    private final String batchId;

    public BatchNotFoundException(String batchId) {
        super("Batch not found: " + batchId);
        this.batchId = batchId;
    }

    public String getBatchId() {
        return batchId;
    }
}
