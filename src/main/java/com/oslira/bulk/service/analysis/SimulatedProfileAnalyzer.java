package com.oslira.bulk.service.analysis;

import com.oslira.bulk.exception.ItemProcessingException;
import com.oslira.bulk.model.ComplexityClass;
import com.oslira.bulk.model.ErrorKind;
import com.oslira.bulk.model.ProfileAnalysis;
import com.oslira.bulk.model.WorkItem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import java.util.regex.Pattern;

/**
 * Stand-in for the scraping vendor and AI scoring calls.
 *
 * Behaviour:
 * - sleeps a configurable latency per call (heavier classes take longer)
 * - rejects malformed usernames as a validation failure (terminal)
 * - fails a configurable fraction of calls with a scraper timeout (transient)
 * - scores deterministically from the username so repeated runs agree
 */
@Service
@Slf4j
public class SimulatedProfileAnalyzer implements ProfileAnalyzer {

    private static final Pattern USERNAME = Pattern.compile("^[A-Za-z0-9._]{1,30}$");
    private static final BigDecimal SCRAPING_COST = new BigDecimal("0.003");
    private static final Map<ComplexityClass, BigDecimal> AI_COST = Map.of(
            ComplexityClass.LIGHT, new BigDecimal("0.001"),
            ComplexityClass.DEEP, new BigDecimal("0.006"),
            ComplexityClass.XRAY, new BigDecimal("0.012")
    );
    private static final Map<ComplexityClass, Integer> LATENCY_FACTOR = Map.of(
            ComplexityClass.LIGHT, 1,
            ComplexityClass.DEEP, 2,
            ComplexityClass.XRAY, 3
    );

    private final long latencyMs;
    private final double transientFailureRate;

    public SimulatedProfileAnalyzer(
            @Value("${app.analyzer.latency-ms:200}") long latencyMs,
            @Value("${app.analyzer.transient-failure-rate:0.0}") double transientFailureRate) {
        if (transientFailureRate < 0.0 || transientFailureRate > 1.0) {
            throw new IllegalArgumentException("transient-failure-rate must be within [0, 1], was " + transientFailureRate);
        }
        this.latencyMs = latencyMs;
        this.transientFailureRate = transientFailureRate;
        log.info("SimulatedProfileAnalyzer initialized with latency {}ms, transient failure rate {}",
                latencyMs, transientFailureRate);
    }

    @Override
    public ProfileAnalysis analyze(WorkItem item, String businessProfileId) throws InterruptedException {
        String username = item.id();
        if (!USERNAME.matcher(username).matches()) {
            throw new ItemProcessingException(ErrorKind.VALIDATION, "VALIDATION_ERROR",
                    "Invalid Instagram username: " + username);
        }

        long latency = latencyMs * LATENCY_FACTOR.getOrDefault(item.complexity(), 1);
        if (latency > 0) {
            Thread.sleep(latency);
        }

        if (transientFailureRate > 0 && ThreadLocalRandom.current().nextDouble() < transientFailureRate) {
            throw new ItemProcessingException(ErrorKind.TRANSIENT, "SCRAPER_TIMEOUT",
                    "Scraper timed out for " + username);
        }

        int seed = Math.floorMod((username.toLowerCase(Locale.ROOT) + ":" + businessProfileId).hashCode(),
                Integer.MAX_VALUE);
        int overall = 40 + seed % 61;
        int nicheFit = 30 + (seed / 61) % 71;
        int engagement = 20 + (seed / 4331) % 81;

        return new ProfileAnalysis(
                "run_" + UUID.randomUUID().toString().replace("-", "").substring(0, 16),
                username,
                item.complexity(),
                overall,
                nicheFit,
                engagement,
                summarize(username, overall),
                SCRAPING_COST.add(AI_COST.getOrDefault(item.complexity(), BigDecimal.ZERO)),
                LocalDateTime.now()
        );
    }

    private static String summarize(String username, int score) {
        if (score >= 80) return "@" + username + " is a strong fit for outreach.";
        if (score >= 60) return "@" + username + " is a reasonable fit worth a follow-up.";
        return "@" + username + " is a weak fit for this business.";
    }
}
