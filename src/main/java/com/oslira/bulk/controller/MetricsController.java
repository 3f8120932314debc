package com.oslira.bulk.controller;

import com.oslira.bulk.config.AppMetrics;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Batch engine metrics in one response.
 *
 * GET /api/metrics/batch
 */
@RestController
@RequestMapping("/api/metrics")
@RequiredArgsConstructor
public class MetricsController {

    private final AppMetrics appMetrics;

    @GetMapping("/batch")
    public Map<String, Object> getBatchMetrics() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("timestamp", Instant.now().toString());

        Map<String, Object> items = new LinkedHashMap<>();
        double total = appMetrics.getItemsTotalCounter().count();
        double success = appMetrics.getItemsSuccessCounter().count();
        items.put("total", (long) total);
        items.put("success", (long) success);
        items.put("failed", (long) appMetrics.getItemsFailedCounter().count());
        items.put("retries", (long) appMetrics.getItemRetriesCounter().count());
        items.put("successRate", total > 0 ? String.format("%.2f%%", success * 100.0 / total) : "N/A");
        response.put("items", items);

        Map<String, Object> billing = new LinkedHashMap<>();
        billing.put("creditsCharged", (long) appMetrics.getCreditsChargedCounter().count());
        billing.put("ledgerFailures", (long) appMetrics.getLedgerFailuresCounter().count());
        response.put("billing", billing);

        Map<String, Object> timing = new LinkedHashMap<>();
        timing.put("runs", timerSummary(appMetrics.getRunTimer()));
        timing.put("items", timerSummary(appMetrics.getItemTimer()));
        response.put("timing", timing);

        return response;
    }

    private static Map<String, Object> timerSummary(Timer timer) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("count", timer.count());
        summary.put("meanMs", Math.round(timer.mean(TimeUnit.MILLISECONDS)));
        summary.put("maxMs", Math.round(timer.max(TimeUnit.MILLISECONDS)));
        return summary;
    }
}
