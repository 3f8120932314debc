package com.oslira.bulk.model;

/**
 * A work item paired with its final outcome.
 */
public record ItemResult<T>(
        WorkItem item,
        BatchOutcome<T> outcome
) {
    public boolean success() {
        return outcome.success();
    }
}
