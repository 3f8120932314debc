package com.oslira.bulk.service.batch;

/**
 * Caller-owned cancel flag, checked by the executor between groups.
 * Items already dispatched always run to their final outcome.
 */
@FunctionalInterface
public interface CancellationToken {

    CancellationToken NONE = () -> false;

    boolean isCancellationRequested();
}
