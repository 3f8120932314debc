package com.oslira.bulk.model;

import java.math.BigDecimal;

/**
 * Price of one successful item of a complexity class.
 *
 * @param creditsPerItem    credits charged to the account
 * @param actualCostPerItem real vendor cost in USD when the result does not report its own
 */
public record ItemCost(
        int creditsPerItem,
        BigDecimal actualCostPerItem
) {
    public ItemCost {
        if (creditsPerItem < 0) {
            throw new IllegalArgumentException("creditsPerItem must be >= 0");
        }
        if (actualCostPerItem == null || actualCostPerItem.signum() < 0) {
            throw new IllegalArgumentException("actualCostPerItem must be >= 0");
        }
    }
}
