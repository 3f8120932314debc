package com.oslira.bulk.model;

import java.util.List;

/**
 * Bulk analysis submission: analyze every username for one business profile.
 */
public record BulkAnalysisRequest(
        String accountId,
        String businessProfileId,
        String analysisType,
        List<String> usernames
) {}
