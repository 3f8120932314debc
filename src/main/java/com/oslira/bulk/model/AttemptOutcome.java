package com.oslira.bulk.model;

/**
 * Result of a single processing attempt.
 */
public enum AttemptOutcome {
    SUCCESS,
    RETRYABLE_FAILURE,
    TERMINAL_FAILURE
}
