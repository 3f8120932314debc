package com.oslira.bulk.repository;

import com.oslira.bulk.model.LedgerUpdate;

/**
 * Account credit balances and the usage transactions recorded against them.
 */
public interface CreditLedger {

    /**
     * @throws com.oslira.bulk.exception.AccountNotFoundException if the account has no balance row
     */
    int availableCredits(String accountId);

    /**
     * Deduct the update's credits and append a transaction row, atomically.
     *
     * @return balance after the deduction
     * @throws com.oslira.bulk.exception.InsufficientCreditsException if the balance is too low
     * @throws com.oslira.bulk.exception.AccountNotFoundException if the account has no balance row
     */
    int recordUsage(LedgerUpdate update);
}
