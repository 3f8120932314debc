package com.oslira.bulk.service.batch;

/**
 * Retry and pacing settings for a batch run.
 *
 * <p>The defaults (3 attempts, 5000ms base delay, 1000ms cooldown) come from the
 * scraping vendor integration and have not been load-tested; treat them as
 * starting points for operational tuning.
 *
 * @param maxAttempts          attempts per item including the first, at least 1
 * @param baseDelayMs          backoff before the 2nd attempt; doubles for each later attempt up to 60s
 * @param interGroupCooldownMs pause between two consecutive groups
 */
public record BatchSettings(
        int maxAttempts,
        long baseDelayMs,
        long interGroupCooldownMs
) {
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_BASE_DELAY_MS = 5000;
    public static final long DEFAULT_INTER_GROUP_COOLDOWN_MS = 1000;
    public static final long MAX_BACKOFF_MS = 60_000;

    public BatchSettings {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, was " + maxAttempts);
        }
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException("baseDelayMs must be >= 0, was " + baseDelayMs);
        }
        if (interGroupCooldownMs < 0) {
            throw new IllegalArgumentException("interGroupCooldownMs must be >= 0, was " + interGroupCooldownMs);
        }
    }

    public static BatchSettings defaults() {
        return new BatchSettings(DEFAULT_MAX_ATTEMPTS, DEFAULT_BASE_DELAY_MS, DEFAULT_INTER_GROUP_COOLDOWN_MS);
    }

    /**
     * Delay to wait after a failed attempt: base * 2^(attempt-1), capped at {@link #MAX_BACKOFF_MS}.
     *
     * @param attempt the 1-based attempt that just failed
     */
    public long backoffDelayMs(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1, was " + attempt);
        }
        if (baseDelayMs == 0) {
            return 0;
        }
        int exponent = Math.min(attempt - 1, 62);
        // past this point the shift would exceed the cap, or overflow
        if (baseDelayMs > (MAX_BACKOFF_MS >> exponent)) {
            return MAX_BACKOFF_MS;
        }
        return baseDelayMs << exponent;
    }
}
