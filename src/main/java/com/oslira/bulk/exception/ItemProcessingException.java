package com.oslira.bulk.exception;

import com.oslira.bulk.model.ErrorKind;

/**
 * Raised by an item processor to tag a failure with its kind.
 *
 * <p>Terminal kinds (validation, not found, insufficient credits, ...) end the item
 * immediately. {@link ErrorKind#TRANSIENT} is retried with backoff.
 */
public class ItemProcessingException extends RuntimeException {

    private final ErrorKind kind;
    private final String code;

    public ItemProcessingException(ErrorKind kind, String code, String message) {
        this(kind, code, message, null);
    }

    public ItemProcessingException(ErrorKind kind, String code, String message, Throwable cause) {
        super("[" + code + "] " + message, cause);
        this.kind = kind;
        this.code = code;
    }

    /**
     * Build from an upstream business code such as {@code INSUFFICIENT_CREDITS}.
     */
    public static ItemProcessingException fromCode(String code, String message) {
        return new ItemProcessingException(ErrorKind.fromCode(code), code, message);
    }

    public static ItemProcessingException transientFailure(String code, String message, Throwable cause) {
        return new ItemProcessingException(ErrorKind.TRANSIENT, code, message, cause);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getCode() {
        return code;
    }
}
