package com.oslira.bulk.service.tracking;

import com.oslira.bulk.model.BatchProgress;
import com.oslira.bulk.model.BatchRunStatus;
import com.oslira.bulk.model.BulkAnalysisResult;
import com.oslira.bulk.service.batch.CancellationToken;
import com.oslira.bulk.service.batch.ProgressListener;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Live state of one submitted run. The engine reports into it as a progress listener
 * and polls it as a cancellation token; HTTP callers read it through {@link #snapshot()}.
 */
public class BatchRun implements ProgressListener, CancellationToken {

    private final String batchId;
    private final String accountId;
    private final String analysisType;
    private final int total;
    private final Instant createdAt;
    private final Clock clock;
    private final AtomicBoolean cancelRequested = new AtomicBoolean();

    private BatchRunStatus status = BatchRunStatus.QUEUED;
    private int completed;
    private Instant finishedAt;
    private String error;
    private BulkAnalysisResult result;

    BatchRun(String batchId, String accountId, String analysisType, int total, Clock clock) {
        this.batchId = batchId;
        this.accountId = accountId;
        this.analysisType = analysisType;
        this.total = total;
        this.clock = clock;
        this.createdAt = clock.instant();
    }

    public String getBatchId() {
        return batchId;
    }

    public String getAccountId() {
        return accountId;
    }

    public int getTotal() {
        return total;
    }

    public synchronized BatchRunStatus getStatus() {
        return status;
    }

    synchronized Instant getFinishedAt() {
        return finishedAt;
    }

    /**
     * Move a queued run to RUNNING.
     *
     * @return false if a cancel arrived while queued; the run is then CANCELLED with nothing dispatched
     */
    public synchronized boolean start() {
        if (status != BatchRunStatus.QUEUED) {
            throw new IllegalStateException("Batch " + batchId + " already " + status.code());
        }
        if (cancelRequested.get()) {
            finish(BatchRunStatus.CANCELLED);
            return false;
        }
        status = BatchRunStatus.RUNNING;
        return true;
    }

    @Override
    public synchronized void onProgress(int completed, int total) {
        this.completed = completed;
    }

    @Override
    public boolean isCancellationRequested() {
        return cancelRequested.get();
    }

    /**
     * @return false if the run had already finished and the request was ignored
     */
    public synchronized boolean requestCancel() {
        if (status.isFinished()) {
            return false;
        }
        cancelRequested.set(true);
        return true;
    }

    /**
     * @param skippedItems true if the cancel request left items undispatched
     */
    public synchronized void complete(BulkAnalysisResult result, boolean skippedItems) {
        this.result = result;
        this.completed = total;
        finish(skippedItems ? BatchRunStatus.CANCELLED : BatchRunStatus.COMPLETE);
    }

    public synchronized void fail(String error) {
        this.error = error;
        finish(BatchRunStatus.FAILED);
    }

    public synchronized BatchProgress snapshot() {
        int percent = total > 0 ? (int) ((long) completed * 100 / total) : 100;
        return new BatchProgress(batchId, analysisType, status.code(), total, completed, percent,
                cancelRequested.get(), createdAt, finishedAt, error, result);
    }

    private void finish(BatchRunStatus finalStatus) {
        this.status = finalStatus;
        this.finishedAt = clock.instant();
    }
}
