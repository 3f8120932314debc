package com.oslira.bulk.service.batch;

/**
 * Notified each time an item reaches its final outcome.
 * Calls are serialized; {@code completed} increases by one per call.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (completed, total) -> { };

    void onProgress(int completed, int total);
}
