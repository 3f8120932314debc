package com.oslira.bulk.exception;

/**
 * Account balance does not cover the credits a request needs.
 */
public class InsufficientCreditsException extends RuntimeException {

    private final String accountId;
    private final int required;
    private final int available;

    public InsufficientCreditsException(String accountId, int required, int available) {
        super("Insufficient credits. Need " + required + ", have " + available);
        this.accountId = accountId;
        this.required = required;
        this.available = available;
    }

    public String getAccountId() {
        return accountId;
    }

    public int getRequired() {
        return required;
    }

    public int getAvailable() {
        return available;
    }
}
