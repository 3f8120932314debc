package com.oslira.bulk.model;

import java.math.BigDecimal;

/**
 * Credits and cost owed for a finished run, computed from successful items only.
 *
 * @param creditsCharged         credits to deduct from the account
 * @param actualCost             real cost incurred, USD
 * @param averageCostPerSuccess  actualCost / billableItems, 0 when nothing succeeded
 * @param efficiencyRatio        creditsCharged / actualCost, 0 when actualCost is 0
 * @param billableItems          number of successful items
 */
public record CostLedgerEntry(
        int creditsCharged,
        BigDecimal actualCost,
        BigDecimal averageCostPerSuccess,
        BigDecimal efficiencyRatio,
        int billableItems
) {
    public static CostLedgerEntry zero() {
        return new CostLedgerEntry(0, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, 0);
    }
}
