package com.oslira.bulk.service.batch;

import com.oslira.bulk.model.AttemptRecord;
import com.oslira.bulk.model.BatchGroup;
import com.oslira.bulk.model.BatchOutcome;
import com.oslira.bulk.model.BatchSummary;
import com.oslira.bulk.model.ErrorKind;
import com.oslira.bulk.model.WorkItem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs batch groups one after another, fanning out each group's items concurrently.
 *
 * <p>Group N+1 is not dispatched until every item of group N has a final outcome,
 * which keeps at most one group's worth of calls in flight against the vendor.
 * A fixed cooldown separates consecutive groups. Item failures never stop the run;
 * a cancel request or an interrupt between groups fails the items not yet dispatched.
 */
@Service
@Slf4j
public class BatchExecutor {

    static final String NOT_DISPATCHED = "Batch interrupted before item was dispatched";
    static final String CANCELLED = "Batch cancelled before item was dispatched";
    static final String REJECTED = "Worker pool rejected the item";

    private final RetryController retryController;
    private final ErrorClassifier errorClassifier;
    private final BatchSettings settings;
    private final ExecutorService executor;
    private final Sleeper sleeper;

    @Autowired
    public BatchExecutor(
            RetryController retryController,
            ErrorClassifier errorClassifier,
            BatchSettings settings,
            @Qualifier("batchWorkerExecutor") ExecutorService executor) {
        this(retryController, errorClassifier, settings, executor, Sleeper.THREAD_SLEEP);
    }

    BatchExecutor(RetryController retryController, ErrorClassifier errorClassifier, BatchSettings settings,
                  ExecutorService executor, Sleeper sleeper) {
        this.retryController = retryController;
        this.errorClassifier = errorClassifier;
        this.settings = settings;
        this.executor = executor;
        this.sleeper = sleeper;
    }

    public <T> BatchSummary<T> execute(List<BatchGroup> groups, int totalItems,
                                       ItemProcessor<T> processor, ProgressListener listener) {
        return execute(groups, totalItems, processor, listener, CancellationToken.NONE);
    }

    /**
     * Process every group and return the summary.
     *
     * @param groups       groups in submission order
     * @param totalItems   number of items across all groups
     * @param processor    per-item operation
     * @param listener     progress callback, may be null
     * @param cancellation checked before each group after the first, may be null
     */
    public <T> BatchSummary<T> execute(List<BatchGroup> groups, int totalItems,
                                       ItemProcessor<T> processor, ProgressListener listener,
                                       CancellationToken cancellation) {
        CancellationToken token = cancellation != null ? cancellation : CancellationToken.NONE;
        ResultAggregator<T> aggregator = new ResultAggregator<>(totalItems, listener);
        int position = 0;

        for (int g = 0; g < groups.size(); g++) {
            BatchGroup group = groups.get(g);
            log.info("Processing group {}/{} ({} items)", g + 1, groups.size(), group.size());
            long groupStart = System.currentTimeMillis();

            List<CompletableFuture<Void>> futures = new ArrayList<>(group.size());
            for (WorkItem item : group.items()) {
                final int slot = position++;
                try {
                    futures.add(CompletableFuture
                            .supplyAsync(() -> retryController.execute(item, processor), executor)
                            .exceptionally(error -> unexpectedFailure(item, error))
                            .thenAccept(outcome -> aggregator.record(slot, item, outcome)));
                } catch (RejectedExecutionException e) {
                    log.error("Item {} could not be dispatched: {}", item.id(), e.getMessage());
                    aggregator.record(slot, item,
                            BatchOutcome.failed(REJECTED, ErrorKind.TRANSIENT, 0, 0, List.of()));
                }
            }

            // join-all: the next group waits for every item of this one
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

            log.info("Group {}/{} settled in {}ms ({}/{} items done)",
                    g + 1, groups.size(), System.currentTimeMillis() - groupStart,
                    aggregator.completed(), totalItems);

            if (g == groups.size() - 1) {
                break;
            }
            String stopReason = null;
            if (token.isCancellationRequested()) {
                stopReason = CANCELLED;
            } else if (!cooldown()) {
                stopReason = NOT_DISPATCHED;
            } else if (token.isCancellationRequested()) {
                stopReason = CANCELLED;
            }
            if (stopReason != null) {
                abandonRemaining(groups, g + 1, position, aggregator, stopReason);
                break;
            }
        }

        return aggregator.finish();
    }

    private boolean cooldown() {
        long cooldownMs = settings.interGroupCooldownMs();
        if (cooldownMs <= 0) {
            return true;
        }
        try {
            sleeper.sleep(cooldownMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private <T> void abandonRemaining(List<BatchGroup> groups, int fromGroup, int fromPosition,
                                      ResultAggregator<T> aggregator, String reason) {
        int position = fromPosition;
        for (int g = fromGroup; g < groups.size(); g++) {
            for (WorkItem item : groups.get(g).items()) {
                aggregator.record(position++, item,
                        BatchOutcome.failed(reason, ErrorKind.UNKNOWN, 0, 0, List.of()));
            }
        }
        log.warn("{}: {} items were not dispatched", reason, position - fromPosition);
    }

    private <T> BatchOutcome<T> unexpectedFailure(WorkItem item, Throwable error) {
        ErrorKind kind = errorClassifier.classify(error);
        String message = errorClassifier.describe(error);
        log.error("Unexpected failure processing item {}: {}", item.id(), message, error);
        Instant now = Instant.now();
        return BatchOutcome.failed(message, kind, 1, 0,
                List.of(AttemptRecord.failure(1, now, now, kind, message)));
    }
}
