package com.oslira.bulk.service.billing;

import com.oslira.bulk.model.BatchSummary;
import com.oslira.bulk.model.CostLedgerEntry;
import com.oslira.bulk.model.ItemCost;
import com.oslira.bulk.model.ItemResult;
import com.oslira.bulk.model.MeteredResult;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Computes what a finished run owes. Only successful items are billed.
 *
 * <p>Pure: no I/O and no state, so reconciling the same summary twice gives the same entry.
 * Writing the result to the ledger is the caller's job.
 */
@Component
public class CreditReconciler {

    private static final int COST_SCALE = 6;
    private static final int RATIO_SCALE = 2;

    public CostLedgerEntry reconcile(BatchSummary<?> summary, CostTable costTable) {
        int credits = 0;
        int billable = 0;
        BigDecimal actualCost = BigDecimal.ZERO;

        for (ItemResult<?> result : summary.results()) {
            if (!result.success()) {
                continue;
            }
            ItemCost cost = costTable.costFor(result.item().complexity());
            credits += cost.creditsPerItem();
            actualCost = actualCost.add(actualCostOf(result, cost));
            billable++;
        }

        if (billable == 0) {
            return CostLedgerEntry.zero();
        }

        BigDecimal averageCost = actualCost.divide(BigDecimal.valueOf(billable), COST_SCALE, RoundingMode.HALF_UP);
        BigDecimal efficiency = actualCost.signum() > 0
                ? BigDecimal.valueOf(credits).divide(actualCost, RATIO_SCALE, RoundingMode.HALF_UP)
                : BigDecimal.ZERO;

        return new CostLedgerEntry(credits, actualCost, averageCost, efficiency, billable);
    }

    private static BigDecimal actualCostOf(ItemResult<?> result, ItemCost cost) {
        if (result.outcome().payload() instanceof MeteredResult metered && metered.actualCost() != null) {
            return metered.actualCost();
        }
        return cost.actualCostPerItem();
    }
}
