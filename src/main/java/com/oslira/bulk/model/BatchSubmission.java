package com.oslira.bulk.model;

/**
 * Returned with 202 Accepted when a bulk run is queued.
 *
 * @param creditsReserved worst-case credits checked against the balance; only successes are charged
 * @param progressUrl     where to poll the run
 */
public record BatchSubmission(
        String batchId,
        String analysisType,
        int totalRequested,
        int creditsReserved,
        String status,
        String progressUrl,
        String message
) {}
