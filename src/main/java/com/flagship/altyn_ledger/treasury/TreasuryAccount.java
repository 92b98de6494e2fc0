package com.flagship.altyn_ledger.treasury;

import com.flagship.altyn_ledger.ledger.AssetType;
import com.flagship.altyn_ledger.ledger.LedgerAmounts;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;

/**
 * Atomic operations on the singleton treasury row (id = 1).
 *
 * Every mutating ledger flow calls {@link #lock()} first. The row lock
 * serializes transfers, payments, emissions and dividend runs against each
 * other, so the fee pool read by a dividend run cannot change underneath it.
 *
 * All mutators require an existing transaction: a treasury update is only
 * meaningful next to the wallet changes and log entry it accompanies.
 */
@Service
@Slf4j
public class TreasuryAccount {

    private static final String TREASURY_COLUMNS =
        "collected_fees, total_coins_in_circulation, total_token_supply, updated_at";

    private final JdbcTemplate jdbcTemplate;

    public TreasuryAccount(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Takes the global ledger write lock and returns the locked snapshot.
     * Held until the surrounding transaction commits or rolls back.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Treasury lock() {
        return jdbcTemplate.queryForObject(
            "SELECT " + TREASURY_COLUMNS + " FROM treasury WHERE id = 1 FOR UPDATE",
            treasuryRowMapper()
        );
    }

    @Transactional(readOnly = true)
    public Treasury current() {
        return jdbcTemplate.queryForObject(
            "SELECT " + TREASURY_COLUMNS + " FROM treasury WHERE id = 1",
            treasuryRowMapper()
        );
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void creditFees(BigDecimal fee) {
        if (fee.signum() == 0) {
            return;
        }
        if (fee.signum() < 0) {
            throw new IllegalArgumentException("Fee credit must not be negative: " + fee.toPlainString());
        }
        update("collected_fees = collected_fees + ?", fee);
    }

    /**
     * Removes {@code amount} from the fee pool. The pool can never go negative:
     * the UPDATE only matches when the pool covers the amount.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void drainFees(BigDecimal amount) {
        int updated = jdbcTemplate.update(
            "UPDATE treasury SET collected_fees = collected_fees - ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE id = 1 AND collected_fees >= ?",
            amount,
            amount
        );
        if (updated != 1) {
            throw new IllegalStateException("Fee pool does not cover drain of " + amount.toPlainString());
        }
        log.debug("Drained treasury fees: amount={}", amount);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void increaseCirculation(BigDecimal amount) {
        update("total_coins_in_circulation = total_coins_in_circulation + ?", amount);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void increaseTokenSupply(BigDecimal amount) {
        update("total_token_supply = total_token_supply + ?", amount);
    }

    private void update(String assignment, BigDecimal amount) {
        int updated = jdbcTemplate.update(
            "UPDATE treasury SET " + assignment + ", updated_at = CURRENT_TIMESTAMP WHERE id = 1",
            amount
        );
        if (updated != 1) {
            throw new IllegalStateException("Treasury row is missing");
        }
    }

    private RowMapper<Treasury> treasuryRowMapper() {
        return (rs, rowNum) -> new Treasury(
            LedgerAmounts.coins(rs.getBigDecimal("collected_fees")),
            LedgerAmounts.coins(rs.getBigDecimal("total_coins_in_circulation")),
            rs.getBigDecimal("total_token_supply").setScale(AssetType.TOKEN.getScale(), LedgerAmounts.ROUNDING),
            rs.getTimestamp("updated_at").toInstant()
        );
    }
}
