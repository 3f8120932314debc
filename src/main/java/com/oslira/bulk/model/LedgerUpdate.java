package com.oslira.bulk.model;

import java.math.BigDecimal;

/**
 * Usage to record against an account after a run has been reconciled.
 */
public record LedgerUpdate(
        String accountId,
        int credits,
        BigDecimal actualCost,
        String description,
        String transactionType
) {}
