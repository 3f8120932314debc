package com.oslira.bulk.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Batch engine and billing metrics.
 *
 * View at: http://localhost:8080/actuator/metrics
 *
 * Key metrics:
 * - batch.items.total     → Items processed (success + failed)
 * - batch.items.success   → Items that succeeded
 * - batch.items.failed    → Items that failed terminally or exhausted retries
 * - batch.item.retries    → Attempts beyond the first
 * - batch.run.time        → Wall clock per run
 * - batch.item.time       → Per-item time across attempts (use MEAN for avg)
 * - batch.credits.charged → Credits written to the ledger
 * - batch.ledger.failures → Ledger updates that failed after a completed run
 * - batch.runs.cancelled  → Submitted runs stopped by a cancel request
 */
@Component
@Getter
public class AppMetrics {

    private final Timer runTimer;
    private final Timer itemTimer;

    private final Counter runsCounter;
    private final Counter itemsTotalCounter;
    private final Counter itemsSuccessCounter;
    private final Counter itemsFailedCounter;
    private final Counter itemRetriesCounter;
    private final Counter creditsChargedCounter;
    private final Counter ledgerFailuresCounter;
    private final Counter runsCancelledCounter;

    public AppMetrics(MeterRegistry registry) {
        this.runTimer = Timer.builder("batch.run.time")
                .description("End-to-end time of one batch run")
                .register(registry);

        this.itemTimer = Timer.builder("batch.item.time")
                .description("Per-item time including retries and backoff")
                .register(registry);

        this.runsCounter = Counter.builder("batch.runs")
                .description("Batch runs executed")
                .register(registry);

        this.itemsTotalCounter = Counter.builder("batch.items.total")
                .description("Items processed (success + failed)")
                .register(registry);

        this.itemsSuccessCounter = Counter.builder("batch.items.success")
                .description("Successfully processed items")
                .register(registry);

        this.itemsFailedCounter = Counter.builder("batch.items.failed")
                .description("Failed items")
                .register(registry);

        this.itemRetriesCounter = Counter.builder("batch.item.retries")
                .description("Attempts beyond the first")
                .register(registry);

        this.creditsChargedCounter = Counter.builder("batch.credits.charged")
                .description("Credits deducted for successful items")
                .register(registry);

        this.ledgerFailuresCounter = Counter.builder("batch.ledger.failures")
                .description("Credit ledger updates that failed after a completed run")
                .register(registry);

        this.runsCancelledCounter = Counter.builder("batch.runs.cancelled")
                .description("Submitted runs stopped by a cancel request")
                .register(registry);
    }

    public void recordRunTime(long millis) {
        runsCounter.increment();
        runTimer.record(millis, TimeUnit.MILLISECONDS);
    }

    public void recordItemTime(long millis) {
        itemTimer.record(millis, TimeUnit.MILLISECONDS);
    }

    public void incrementItemsProcessed(int total, int success, int failed) {
        itemsTotalCounter.increment(total);
        itemsSuccessCounter.increment(success);
        itemsFailedCounter.increment(failed);
    }

    public void incrementRetries(int retries) {
        itemRetriesCounter.increment(retries);
    }

    public void incrementCreditsCharged(int credits) {
        creditsChargedCounter.increment(credits);
    }

    public void incrementLedgerFailures() {
        ledgerFailuresCounter.increment();
    }

    public void incrementRunsCancelled() {
        runsCancelledCounter.increment();
    }
}
