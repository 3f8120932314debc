package com.oslira.bulk.model;

import java.time.Instant;

/**
 * Point-in-time view of a tracked run.
 *
 * @param overallProgress settled items as a whole percentage, rounded down
 * @param result          set once the run is complete or cancelled
 */
public record BatchProgress(
        String batchId,
        String analysisType,
        String status,
        int total,
        int completed,
        int overallProgress,
        boolean cancelRequested,
        Instant createdAt,
        Instant finishedAt,
        String error,
        BulkAnalysisResult result
) {}
