package com.flagship.altyn_ledger.dividend;

import com.flagship.altyn_ledger.ledger.AssetType;
import com.flagship.altyn_ledger.ledger.LedgerAmounts;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persists dividend runs and their per-holder breakdown.
 */
@Repository
public class DividendPayoutRepository {

    private final JdbcTemplate jdbcTemplate;

    public DividendPayoutRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void save(DividendPayout payout) {
        jdbcTemplate.update(
            "INSERT INTO dividend_payouts (id, total_distributed, holders_count, token_supply, distributed_by, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?)",
            payout.getId(),
            payout.getTotalDistributed(),
            payout.getHoldersCount(),
            payout.getTokenSupply(),
            payout.getDistributedBy(),
            Timestamp.from(payout.getCreatedAt())
        );

        List<DividendShare> details = payout.getDistributionDetails();
        for (int i = 0; i < details.size(); i++) {
            DividendShare share = details.get(i);
            jdbcTemplate.update(
                "INSERT INTO dividend_payout_shares (payout_id, share_order, user_id, token_balance, " +
                "token_percentage, amount, transaction_id) VALUES (?, ?, ?, ?, ?, ?, ?)",
                payout.getId(),
                i,
                share.getUserId(),
                share.getTokenBalance(),
                share.getTokenPercentage(),
                share.getAmount(),
                share.getTransactionId()
            );
        }
    }

    @Transactional(readOnly = true)
    public Optional<DividendPayout> findById(UUID id) {
        return jdbcTemplate.query(
            "SELECT id, total_distributed, holders_count, token_supply, distributed_by, created_at " +
            "FROM dividend_payouts WHERE id = ?",
            payoutRowMapper(),
            id
        ).stream().findFirst();
    }

    /**
     * Most recent runs first, each with its full breakdown.
     */
    @Transactional(readOnly = true)
    public List<DividendPayout> findRecent(int limit) {
        return jdbcTemplate.query(
            "SELECT id, total_distributed, holders_count, token_supply, distributed_by, created_at " +
            "FROM dividend_payouts ORDER BY created_at DESC, id LIMIT ?",
            payoutRowMapper(),
            limit
        );
    }

    @Transactional(readOnly = true)
    public long count() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM dividend_payouts", Long.class);
        return count != null ? count : 0L;
    }

    private List<DividendShare> findShares(UUID payoutId) {
        return jdbcTemplate.query(
            "SELECT user_id, token_balance, token_percentage, amount, transaction_id " +
            "FROM dividend_payout_shares WHERE payout_id = ? ORDER BY share_order",
            (rs, rowNum) -> {
                String transactionId = rs.getString("transaction_id");
                return new DividendShare(
                    rs.getString("user_id"),
                    rs.getBigDecimal("token_balance").setScale(AssetType.TOKEN.getScale(), LedgerAmounts.ROUNDING),
                    rs.getBigDecimal("token_percentage"),
                    LedgerAmounts.coins(rs.getBigDecimal("amount")),
                    transactionId != null ? UUID.fromString(transactionId) : null
                );
            },
            payoutId
        );
    }

    private RowMapper<DividendPayout> payoutRowMapper() {
        return (rs, rowNum) -> {
            UUID id = UUID.fromString(rs.getString("id"));
            return new DividendPayout(
                id,
                LedgerAmounts.coins(rs.getBigDecimal("total_distributed")),
                rs.getInt("holders_count"),
                rs.getBigDecimal("token_supply").setScale(AssetType.TOKEN.getScale(), LedgerAmounts.ROUNDING),
                rs.getString("distributed_by"),
                rs.getTimestamp("created_at").toInstant(),
                findShares(id)
            );
        };
    }
}
