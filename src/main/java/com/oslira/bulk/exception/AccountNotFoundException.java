package com.oslira.bulk.exception;

/**
 * No credit balance exists for the account.
 */
public class AccountNotFoundException extends RuntimeException {

    public AccountNotFoundException(String accountId) {
        super("Account not found: " + accountId);
    }
}
