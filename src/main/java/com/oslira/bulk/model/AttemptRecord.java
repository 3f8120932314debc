package com.oslira.bulk.model;

import java.time.Instant;

/**
 * One attempt at processing a work item.
 * Attempt numbers start at 1 and are contiguous per item.
 */
public record AttemptRecord(
        int attemptNumber,
        Instant startedAt,
        Instant finishedAt,
        AttemptOutcome outcome,
        ErrorKind errorKind,
        String errorMessage
) {
    public static AttemptRecord success(int attemptNumber, Instant startedAt, Instant finishedAt) {
        return new AttemptRecord(attemptNumber, startedAt, finishedAt, AttemptOutcome.SUCCESS, null, null);
    }

    public static AttemptRecord failure(int attemptNumber, Instant startedAt, Instant finishedAt,
                                        ErrorKind kind, String errorMessage) {
        AttemptOutcome outcome = kind.isTerminal()
                ? AttemptOutcome.TERMINAL_FAILURE
                : AttemptOutcome.RETRYABLE_FAILURE;
        return new AttemptRecord(attemptNumber, startedAt, finishedAt, outcome, kind, errorMessage);
    }

    public long durationMs() {
        return finishedAt.toEpochMilli() - startedAt.toEpochMilli();
    }
}
