package com.oslira.bulk.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Scored profile returned by the analyzer for one username.
 */
public record ProfileAnalysis(
        String runId,
        String username,
        ComplexityClass analysisType,
        int overallScore,
        int nicheFitScore,
        int engagementScore,
        String summary,
        BigDecimal actualCost,
        LocalDateTime analyzedAt
) implements MeteredResult {}
