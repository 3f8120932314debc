package com.oslira.bulk.service.analysis;

import com.oslira.bulk.model.ProfileAnalysis;
import com.oslira.bulk.model.WorkItem;

/**
 * Scrapes and scores one profile for a business profile.
 *
 * <p>Implementations signal failures with
 * {@link com.oslira.bulk.exception.ItemProcessingException} so the batch engine knows
 * whether a retry can help.
 */
public interface ProfileAnalyzer {

    ProfileAnalysis analyze(WorkItem item, String businessProfileId) throws Exception;
}
