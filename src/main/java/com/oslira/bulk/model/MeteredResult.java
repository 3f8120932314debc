package com.oslira.bulk.model;

import java.math.BigDecimal;

/**
 * A processing result that knows what it actually cost to produce.
 * When present this overrides the cost table's per-item estimate.
 */
public interface MeteredResult {

    BigDecimal actualCost();
}
