package com.oslira.bulk.model;

/**
 * Derived statistics for a finished run.
 *
 * @param successRatePercent successful / total as a percentage, 2 decimals; 0 for an empty run
 * @param avgDurationMs      total run duration / total items, rounded
 * @param totalAttempts      attempts summed over all items
 * @param totalRetries       attempts beyond each item's first; equals totalAttempts - total
 *                           when every item was dispatched
 */
public record BatchStatistics(
        double successRatePercent,
        long avgDurationMs,
        int totalAttempts,
        int totalRetries
) {}
