package com.oslira.bulk.model;

import java.util.List;

/**
 * Aggregate over every work item of one run.
 * Results are in submission order regardless of completion order.
 */
public record BatchSummary<T>(
        int total,
        int successful,
        int failed,
        long totalDurationMs,
        List<ItemResult<T>> results
) {
    public BatchSummary {
        results = List.copyOf(results);
    }

    public static <T> BatchSummary<T> empty() {
        return new BatchSummary<>(0, 0, 0, 0, List.of());
    }

    public List<ItemResult<T>> successes() {
        return results.stream().filter(ItemResult::success).toList();
    }

    public List<ItemResult<T>> failures() {
        return results.stream().filter(r -> !r.success()).toList();
    }

    public BatchStatistics statistics() {
        int totalAttempts = results.stream().mapToInt(r -> r.outcome().attempts()).sum();
        int totalRetries = results.stream().mapToInt(r -> r.outcome().retries()).sum();
        if (total == 0) {
            return new BatchStatistics(0.0, 0, totalAttempts, totalRetries);
        }
        double successRate = Math.round(successful * 10000.0 / total) / 100.0;
        long avgDuration = Math.round((double) totalDurationMs / total);
        return new BatchStatistics(successRate, avgDuration, totalAttempts, totalRetries);
    }
}
