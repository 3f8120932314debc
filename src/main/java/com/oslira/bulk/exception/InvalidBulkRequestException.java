package com.oslira.bulk.exception;

/**
 * Bulk request rejected before any work was dispatched.
 */
public class InvalidBulkRequestException extends RuntimeException {

    private final String code;

    public InvalidBulkRequestException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
