package com.oslira.bulk.config;

import com.oslira.bulk.model.ComplexityClass;
import com.oslira.bulk.model.ItemCost;
import com.oslira.bulk.service.batch.BatchSettings;
import com.oslira.bulk.service.batch.GroupSizeTable;
import com.oslira.bulk.service.billing.CostTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Builds the engine's immutable settings from {@code app.batch.*} and {@code app.billing.*}.
 * Invalid values fail startup.
 */
@Configuration
@Slf4j
public class BatchEngineConfig {

    @Bean
    public BatchSettings batchSettings(
            @Value("${app.batch.max-attempts:3}") int maxAttempts,
            @Value("${app.batch.base-delay-ms:5000}") long baseDelayMs,
            @Value("${app.batch.inter-group-cooldown-ms:1000}") long interGroupCooldownMs) {
        BatchSettings settings = new BatchSettings(maxAttempts, baseDelayMs, interGroupCooldownMs);
        log.info("Batch settings: {}", settings);
        return settings;
    }

    @Bean
    public GroupSizeTable groupSizeTable(
            @Value("${app.batch.group-size.light:8}") int light,
            @Value("${app.batch.group-size.deep:5}") int deep,
            @Value("${app.batch.group-size.xray:3}") int xray,
            @Value("${app.batch.group-size.default:10}") int fallback) {
        GroupSizeTable table = new GroupSizeTable(Map.of(
                ComplexityClass.LIGHT, light,
                ComplexityClass.DEEP, deep,
                ComplexityClass.XRAY, xray
        ), fallback);
        log.info("Group sizes: {}", table);
        return table;
    }

    @Bean
    public CostTable costTable(
            @Value("${app.billing.credits.light:1}") int lightCredits,
            @Value("${app.billing.credits.deep:2}") int deepCredits,
            @Value("${app.billing.credits.xray:3}") int xrayCredits,
            @Value("${app.billing.actual-cost.light:0.003}") BigDecimal lightCost,
            @Value("${app.billing.actual-cost.deep:0.003}") BigDecimal deepCost,
            @Value("${app.billing.actual-cost.xray:0.003}") BigDecimal xrayCost) {
        return new CostTable(Map.of(
                ComplexityClass.LIGHT, new ItemCost(lightCredits, lightCost),
                ComplexityClass.DEEP, new ItemCost(deepCredits, deepCost),
                ComplexityClass.XRAY, new ItemCost(xrayCredits, xrayCost)
        ));
    }
}
