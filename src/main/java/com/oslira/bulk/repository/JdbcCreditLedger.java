package com.oslira.bulk.repository;

import com.oslira.bulk.exception.AccountNotFoundException;
import com.oslira.bulk.exception.InsufficientCreditsException;
import com.oslira.bulk.model.LedgerUpdate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Credit ledger backed by the {@code credit_balances} and {@code credit_transactions} tables.
 */
@Repository
@Slf4j
public class JdbcCreditLedger implements CreditLedger {

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final SqlTemplateLoader sqlLoader;

    public JdbcCreditLedger(NamedParameterJdbcTemplate jdbcTemplate, SqlTemplateLoader sqlLoader) {
        this.jdbcTemplate = jdbcTemplate;
        this.sqlLoader = sqlLoader;
    }

    @Override
    public int availableCredits(String accountId) {
        try {
            Integer balance = jdbcTemplate.queryForObject(
                    sqlLoader.load("findBalance"),
                    new MapSqlParameterSource("accountId", accountId),
                    Integer.class);
            return balance != null ? balance : 0;
        } catch (EmptyResultDataAccessException e) {
            throw new AccountNotFoundException(accountId);
        }
    }

    @Override
    @Transactional
    public int recordUsage(LedgerUpdate update) {
        if (update.credits() < 0) {
            throw new IllegalArgumentException("credits must be >= 0, was " + update.credits());
        }
        LocalDateTime now = LocalDateTime.now();

        // conditional update: never lets the balance go negative
        int updated = jdbcTemplate.update(sqlLoader.load("deductCredits"), new MapSqlParameterSource()
                .addValue("accountId", update.accountId())
                .addValue("amount", update.credits())
                .addValue("updatedAt", Timestamp.valueOf(now)));

        if (updated == 0) {
            int available = availableCredits(update.accountId());
            throw new InsufficientCreditsException(update.accountId(), update.credits(), available);
        }

        int balanceAfter = availableCredits(update.accountId());

        jdbcTemplate.update(sqlLoader.load("insertTransaction"), new MapSqlParameterSource()
                .addValue("transactionId", "txn_" + UUID.randomUUID().toString().replace("-", ""))
                .addValue("accountId", update.accountId())
                .addValue("amount", -update.credits())
                .addValue("balanceAfter", balanceAfter)
                .addValue("transactionType", update.transactionType())
                .addValue("description", update.description())
                .addValue("actualCost", update.actualCost())
                .addValue("createdAt", Timestamp.valueOf(now)));

        log.info("Recorded {} credits for account {} ({}), balance now {}",
                update.credits(), update.accountId(), update.transactionType(), balanceAfter);
        return balanceAfter;
    }
}
