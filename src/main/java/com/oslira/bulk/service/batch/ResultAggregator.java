package com.oslira.bulk.service.batch;

import com.oslira.bulk.model.BatchOutcome;
import com.oslira.bulk.model.BatchSummary;
import com.oslira.bulk.model.ItemResult;
import com.oslira.bulk.model.WorkItem;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Accumulates item outcomes for one run and builds the final {@link BatchSummary}.
 *
 * <p>{@link #record} is the single merge point; each submission slot is written exactly once.
 * Results keep submission order no matter in which order items settle.
 */
@Slf4j
public class ResultAggregator<T> {

    private final int total;
    private final ProgressListener listener;
    private final long startTime;
    private final List<ItemResult<T>> slots;

    private int completed;
    private long lastSettledAt;

    public ResultAggregator(int total, ProgressListener listener) {
        if (total < 0) {
            throw new IllegalArgumentException("total must be >= 0, was " + total);
        }
        this.total = total;
        this.listener = listener != null ? listener : ProgressListener.NONE;
        this.startTime = System.currentTimeMillis();
        this.lastSettledAt = startTime;
        this.slots = new ArrayList<>(Collections.nCopies(total, null));
    }

    /**
     * Record the final outcome of the item at {@code position} and notify the progress listener.
     *
     * @throws IllegalStateException if the slot was already recorded
     */
    public synchronized void record(int position, WorkItem item, BatchOutcome<T> outcome) {
        if (slots.get(position) != null) {
            throw new IllegalStateException("Outcome already recorded for position " + position);
        }
        slots.set(position, new ItemResult<>(item, outcome));
        completed++;
        lastSettledAt = System.currentTimeMillis();

        try {
            listener.onProgress(completed, total);
        } catch (RuntimeException e) {
            log.warn("Progress listener failed at {}/{}: {}", completed, total, e.getMessage());
        }
    }

    public synchronized int completed() {
        return completed;
    }

    public int total() {
        return total;
    }

    /**
     * Build the summary once every item has settled.
     *
     * @throws IllegalStateException if some item has no outcome yet
     */
    public synchronized BatchSummary<T> finish() {
        if (completed != total) {
            throw new IllegalStateException("Cannot finish: " + completed + "/" + total + " items settled");
        }
        int successful = 0;
        for (ItemResult<T> result : slots) {
            if (result.success()) {
                successful++;
            }
        }
        long totalDuration = total == 0 ? 0 : lastSettledAt - startTime;
        return new BatchSummary<>(total, successful, total - successful, totalDuration, slots);
    }
}
