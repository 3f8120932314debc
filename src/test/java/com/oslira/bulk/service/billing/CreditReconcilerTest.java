package com.oslira.bulk.service.billing;

import com.oslira.bulk.model.BatchOutcome;
import com.oslira.bulk.model.BatchSummary;
import com.oslira.bulk.model.ComplexityClass;
import com.oslira.bulk.model.CostLedgerEntry;
import com.oslira.bulk.model.ErrorKind;
import com.oslira.bulk.model.ItemCost;
import com.oslira.bulk.model.ItemResult;
import com.oslira.bulk.model.MeteredResult;
import com.oslira.bulk.model.WorkItem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CreditReconcilerTest {

    private final CreditReconciler reconciler = new CreditReconciler();
    private final CostTable costTable = CostTable.defaults();

    @Test
    @DisplayName("Only successful items should be billed")
    void shouldBillSuccessesOnly() {
        // Given: 10 deep items, 7 succeed
        BatchSummary<String> summary = summary(ComplexityClass.DEEP, 7, 3);

        // When
        CostLedgerEntry entry = reconciler.reconcile(summary, costTable);

        // Then
        assertThat(entry.creditsCharged()).isEqualTo(14);
        assertThat(entry.billableItems()).isEqualTo(7);
        assertThat(entry.actualCost()).isEqualByComparingTo("0.021");
        assertThat(entry.averageCostPerSuccess()).isEqualByComparingTo("0.003");
        assertThat(entry.efficiencyRatio()).isEqualByComparingTo("666.67");
    }

    @Test
    @DisplayName("Reconciling the same summary twice should give the same entry")
    void shouldBeIdempotent() {
        BatchSummary<String> summary = summary(ComplexityClass.XRAY, 2, 1);

        assertThat(reconciler.reconcile(summary, costTable)).isEqualTo(reconciler.reconcile(summary, costTable));
    }

    @Test
    @DisplayName("No successes should reconcile to zero without dividing by zero")
    void shouldReturnZeroWhenNothingSucceeded() {
        CostLedgerEntry entry = reconciler.reconcile(summary(ComplexityClass.LIGHT, 0, 4), costTable);

        assertThat(entry).isEqualTo(CostLedgerEntry.zero());
        assertThat(reconciler.reconcile(BatchSummary.empty(), costTable)).isEqualTo(CostLedgerEntry.zero());
    }

    @Test
    void zeroActualCost_givesZeroEfficiency() {
        CostTable free = new CostTable(Map.of(ComplexityClass.LIGHT, new ItemCost(1, BigDecimal.ZERO)));

        CostLedgerEntry entry = reconciler.reconcile(summary(ComplexityClass.LIGHT, 3, 0), free);

        assertThat(entry.creditsCharged()).isEqualTo(3);
        assertThat(entry.efficiencyRatio()).isEqualByComparingTo("0");
        assertThat(entry.averageCostPerSuccess()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("Results that report their own cost should override the table")
    void shouldPreferMeteredCost() {
        WorkItem a = new WorkItem("a", ComplexityClass.LIGHT);
        WorkItem b = new WorkItem("b", ComplexityClass.LIGHT);
        MeteredResult metered = () -> new BigDecimal("0.004");
        BatchSummary<Object> summary = new BatchSummary<>(2, 2, 0, 10, List.of(
                new ItemResult<Object>(a, BatchOutcome.<Object>succeeded(metered, 1, 5, List.of())),
                new ItemResult<Object>(b, BatchOutcome.<Object>succeeded("plain", 1, 5, List.of()))));

        CostLedgerEntry entry = reconciler.reconcile(summary, costTable);

        assertThat(entry.creditsCharged()).isEqualTo(2);
        assertThat(entry.actualCost()).isEqualByComparingTo("0.007");
        assertThat(entry.averageCostPerSuccess()).isEqualByComparingTo("0.0035");
    }

    @Test
    void missingCostEntry_shouldThrow() {
        CostTable lightOnly = new CostTable(Map.of(ComplexityClass.LIGHT, new ItemCost(1, BigDecimal.ONE)));

        assertThatThrownBy(() -> reconciler.reconcile(summary(ComplexityClass.XRAY, 1, 0), lightOnly))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void costTable_creditsForCount() {
        assertThat(costTable.creditsFor(ComplexityClass.LIGHT, 50)).isEqualTo(50);
        assertThat(costTable.creditsFor(ComplexityClass.DEEP, 10)).isEqualTo(20);
        assertThat(costTable.creditsFor(ComplexityClass.XRAY, 3)).isEqualTo(9);
    }

    private static BatchSummary<String> summary(ComplexityClass complexity, int successes, int failures) {
        List<ItemResult<String>> results = new ArrayList<>();
        for (int i = 0; i < successes; i++) {
            results.add(new ItemResult<>(new WorkItem("ok_" + i, complexity),
                    BatchOutcome.succeeded("ok_" + i, 1, 10, List.of())));
        }
        for (int i = 0; i < failures; i++) {
            results.add(new ItemResult<>(new WorkItem("bad_" + i, complexity),
                    BatchOutcome.failed("Scraper timed out", ErrorKind.TRANSIENT, 3, 10, List.of())));
        }
        return new BatchSummary<>(results.size(), successes, failures, 100, results);
    }
}
