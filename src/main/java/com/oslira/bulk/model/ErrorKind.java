package com.oslira.bulk.model;

import java.util.Locale;
import java.util.Map;

/**
 * Closed set of failure kinds attached to a failed item.
 *
 * <p>Business kinds are terminal: retrying cannot change the answer, so the item
 * fails on the first attempt. {@link #TRANSIENT} and {@link #UNKNOWN} are retried
 * with backoff until attempts run out.
 */
public enum ErrorKind {
    VALIDATION(true),
    UNAUTHORIZED(true),
    NOT_FOUND(true),
    DUPLICATE(true),
    INSUFFICIENT_RESOURCE(true),
    TRANSIENT(false),
    UNKNOWN(false);

    private static final Map<String, ErrorKind> BUSINESS_CODES = Map.of(
            "INSUFFICIENT_CREDITS", INSUFFICIENT_RESOURCE,
            "VALIDATION_ERROR", VALIDATION,
            "DUPLICATE_ANALYSIS", DUPLICATE,
            "UNAUTHORIZED", UNAUTHORIZED,
            "NOT_FOUND", NOT_FOUND
    );

    private final boolean terminal;

    ErrorKind(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }

    /**
     * Map an upstream error code (e.g. {@code INSUFFICIENT_CREDITS}) to its kind.
     * Codes outside the known business set map to {@link #UNKNOWN}.
     */
    public static ErrorKind fromCode(String code) {
        if (code == null) {
            return UNKNOWN;
        }
        return BUSINESS_CODES.getOrDefault(code.trim().toUpperCase(Locale.ROOT), UNKNOWN);
    }
}
