package com.oslira.bulk.model;

import java.util.Locale;

/**
 * Complexity tier of a profile analysis.
 * Drives both the batch group size and the credits charged per item.
 */
public enum ComplexityClass {
    LIGHT("light"),
    DEEP("deep"),
    XRAY("xray");

    private final String code;

    ComplexityClass(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Parse a wire code such as "light" or "XRAY".
     *
     * @throws IllegalArgumentException for an unknown or blank code
     */
    public static ComplexityClass fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("analysis type is required");
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (ComplexityClass value : values()) {
            if (value.code.equals(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("analysis type must be \"light\", \"deep\", or \"xray\": " + code);
    }
}
