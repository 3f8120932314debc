package com.oslira.bulk.model;

import java.util.List;

/**
 * Final outcome of one work item after all of its attempts.
 *
 * @param success      true if the last attempt succeeded
 * @param payload      processor result, null on failure
 * @param errorMessage message of the last failed attempt, null on success
 * @param errorKind    kind of the last failure, null on success
 * @param attempts     number of attempts actually made
 * @param durationMs   wall-clock time across all attempts and backoff
 * @param attemptLog   every attempt in order
 */
public record BatchOutcome<T>(
        boolean success,
        T payload,
        String errorMessage,
        ErrorKind errorKind,
        int attempts,
        long durationMs,
        List<AttemptRecord> attemptLog
) {
    public BatchOutcome {
        attemptLog = attemptLog != null ? List.copyOf(attemptLog) : List.of();
    }

    public static <T> BatchOutcome<T> succeeded(T payload, int attempts, long durationMs,
                                                List<AttemptRecord> attemptLog) {
        return new BatchOutcome<>(true, payload, null, null, attempts, durationMs, attemptLog);
    }

    public static <T> BatchOutcome<T> failed(String errorMessage, ErrorKind errorKind, int attempts,
                                             long durationMs, List<AttemptRecord> attemptLog) {
        return new BatchOutcome<>(false, null,
                errorMessage != null ? errorMessage : "Unknown error",
                errorKind != null ? errorKind : ErrorKind.UNKNOWN,
                attempts, durationMs, attemptLog);
    }

    /**
     * Retries beyond the first attempt.
     */
    public int retries() {
        return Math.max(0, attempts - 1);
    }
}
