package com.oslira.bulk.model;

import java.util.List;

/**
 * Outcome of a bulk analysis request, returned to the HTTP caller.
 *
 * @param ledgerRecorded false if credits could not be written to the ledger;
 *                       the analyses themselves are still valid
 */
public record BulkAnalysisResult(
        String batchId,
        String analysisType,
        int totalRequested,
        int successful,
        int failed,
        long totalDurationMs,
        List<ProfileStatus> profiles,
        int creditsUsed,
        int creditsRemaining,
        CostLedgerEntry cost,
        BatchStatistics statistics,
        boolean ledgerRecorded
) {}
