package com.oslira.bulk.service.batch;

import com.oslira.bulk.config.AppMetrics;
import com.oslira.bulk.model.BatchGroup;
import com.oslira.bulk.model.BatchStatistics;
import com.oslira.bulk.model.BatchSummary;
import com.oslira.bulk.model.ComplexityClass;
import com.oslira.bulk.model.ItemResult;
import com.oslira.bulk.model.WorkItem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;

/**
 * Entry point of the batch engine.
 *
 * Pipeline per run:
 * 1. BatchPartitioner - split items into groups sized by complexity class
 * 2. BatchExecutor    - groups in sequence, items of a group in parallel
 * 3. RetryController  - per-item retries with exponential backoff
 * 4. ResultAggregator - ordered summary with counts and timings
 *
 * Item failures are data in the returned summary; nothing is thrown for them.
 */
@Service
@Slf4j
public class BatchProcessingEngine {

    private final BatchPartitioner partitioner;
    private final BatchExecutor batchExecutor;
    private final AppMetrics metrics;

    public BatchProcessingEngine(BatchPartitioner partitioner, BatchExecutor batchExecutor, AppMetrics metrics) {
        this.partitioner = partitioner;
        this.batchExecutor = batchExecutor;
        this.metrics = metrics;
    }

    /**
     * Process every item and return the run summary.
     *
     * @param items      items in submission order
     * @param complexity class used to pick the group size
     * @param processor  per-item operation
     * @param onProgress called after each item settles, may be null
     * @param cancellation checked between groups; items not yet dispatched fail once it is set
     */
    public <T> BatchSummary<T> processBatch(List<WorkItem> items, ComplexityClass complexity,
                                            ItemProcessor<T> processor, ProgressListener onProgress,
                                            CancellationToken cancellation) {
        Objects.requireNonNull(items, "items");
        Objects.requireNonNull(complexity, "complexity");
        Objects.requireNonNull(processor, "processor");

        if (items.isEmpty()) {
            log.info("No items submitted, nothing to process");
            return BatchSummary.empty();
        }

        long startTime = System.currentTimeMillis();
        List<BatchGroup> groups = partitioner.partition(items, complexity);

        log.info("═══════════════════════════════════════════════════════════════");
        log.info("BATCH START: {} {} items in {} groups", items.size(), complexity.code(), groups.size());
        log.info("═══════════════════════════════════════════════════════════════");

        BatchSummary<T> summary = batchExecutor.execute(groups, items.size(), processor, onProgress, cancellation);
        BatchStatistics stats = summary.statistics();

        long totalTime = System.currentTimeMillis() - startTime;
        recordMetrics(summary, stats, totalTime);

        log.info("═══════════════════════════════════════════════════════════════");
        log.info("BATCH COMPLETE | Total: {}ms", totalTime);
        log.info("  Successful: {}/{} | Failed: {} | Retries: {} | Success rate: {}%",
                summary.successful(), summary.total(), summary.failed(),
                stats.totalRetries(), stats.successRatePercent());
        log.info("═══════════════════════════════════════════════════════════════");

        return summary;
    }

    public <T> BatchSummary<T> processBatch(List<WorkItem> items, ComplexityClass complexity,
                                            ItemProcessor<T> processor, ProgressListener onProgress) {
        return processBatch(items, complexity, processor, onProgress, CancellationToken.NONE);
    }

    public <T> BatchSummary<T> processBatch(List<WorkItem> items, ComplexityClass complexity,
                                            ItemProcessor<T> processor) {
        return processBatch(items, complexity, processor, null, CancellationToken.NONE);
    }

    private void recordMetrics(BatchSummary<?> summary, BatchStatistics stats, long totalTime) {
        metrics.recordRunTime(totalTime);
        metrics.incrementItemsProcessed(summary.total(), summary.successful(), summary.failed());
        metrics.incrementRetries(stats.totalRetries());
        for (ItemResult<?> result : summary.results()) {
            metrics.recordItemTime(result.outcome().durationMs());
        }
    }
}
