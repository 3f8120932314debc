package com.oslira.bulk.model;

/**
 * Per-username line of a bulk analysis response.
 *
 * @param status "complete" or "failed"
 */
public record ProfileStatus(
        String username,
        String status,
        Integer overallScore,
        String error,
        String errorKind,
        int attempts
) {
    public static ProfileStatus from(ItemResult<ProfileAnalysis> result) {
        BatchOutcome<ProfileAnalysis> outcome = result.outcome();
        if (outcome.success()) {
            return new ProfileStatus(result.item().id(), "complete",
                    outcome.payload() != null ? outcome.payload().overallScore() : null,
                    null, null, outcome.attempts());
        }
        return new ProfileStatus(result.item().id(), "failed", null,
                outcome.errorMessage(), outcome.errorKind().name(), outcome.attempts());
    }
}
