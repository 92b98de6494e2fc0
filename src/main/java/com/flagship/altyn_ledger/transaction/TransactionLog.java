package com.flagship.altyn_ledger.transaction;

import com.flagship.altyn_ledger.ledger.AssetType;
import com.flagship.altyn_ledger.ledger.LedgerAmounts;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only log of every balance-affecting event.
 *
 * Entries are immutable: the database trigger on ledger_transactions rejects
 * UPDATE and DELETE, so this class only ever inserts and reads.
 * The log is the source of truth for history, audits and idempotent replays.
 */
@Service
public class TransactionLog {

    private static final String TX_COLUMNS =
        "id, sequence_number, transaction_type, asset_type, from_user_id, to_user_id, " +
        "amount, fee, net_amount, description, idempotency_key, created_at";

    private final JdbcTemplate jdbcTemplate;

    public TransactionLog(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Appends an entry. Must run inside the same transaction as the balance
     * mutations it describes.
     *
     * @return the entry with its database-assigned sequence number
     * @throws org.springframework.dao.DuplicateKeyException if the idempotency key was already used
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public LedgerTransaction append(LedgerTransaction tx) {
        Long sequence = jdbcTemplate.queryForObject(
            "INSERT INTO ledger_transactions (id, transaction_type, asset_type, from_user_id, to_user_id, " +
            "amount, fee, net_amount, description, idempotency_key, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) RETURNING sequence_number",
            Long.class,
            tx.getId(),
            tx.getType().name(),
            tx.getAssetType().name(),
            tx.getFromUserId(),
            tx.getToUserId(),
            tx.getAmount(),
            tx.getFee(),
            tx.getNetAmount(),
            tx.getDescription(),
            tx.getIdempotencyKey(),
            Timestamp.from(tx.getCreatedAt())
        );
        if (sequence == null) {
            throw new IllegalStateException("No sequence number assigned to transaction " + tx.getId());
        }
        return tx.withSequenceNumber(sequence);
    }

    @Transactional(readOnly = true)
    public Optional<LedgerTransaction> findById(UUID id) {
        return jdbcTemplate.query(
            "SELECT " + TX_COLUMNS + " FROM ledger_transactions WHERE id = ?",
            transactionRowMapper(),
            id
        ).stream().findFirst();
    }

    @Transactional(readOnly = true)
    public Optional<LedgerTransaction> findByIdempotencyKey(String idempotencyKey) {
        if (idempotencyKey == null) {
            return Optional.empty();
        }
        return jdbcTemplate.query(
            "SELECT " + TX_COLUMNS + " FROM ledger_transactions WHERE idempotency_key = ?",
            transactionRowMapper(),
            idempotencyKey
        ).stream().findFirst();
    }

    /**
     * Entries where the user is sender or recipient, newest first.
     */
    @Transactional(readOnly = true)
    public List<LedgerTransaction> findForUser(String userId, int limit, int offset) {
        return jdbcTemplate.query(
            "SELECT " + TX_COLUMNS + " FROM ledger_transactions " +
            "WHERE from_user_id = ? OR to_user_id = ? " +
            "ORDER BY sequence_number DESC LIMIT ? OFFSET ?",
            transactionRowMapper(),
            userId,
            userId,
            limit,
            offset
        );
    }

    @Transactional(readOnly = true)
    public long countForUser(String userId) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM ledger_transactions WHERE from_user_id = ? OR to_user_id = ?",
            Long.class,
            userId,
            userId
        );
        return count != null ? count : 0L;
    }

    /**
     * Most recent entries of one type across all users, newest first.
     */
    @Transactional(readOnly = true)
    public List<LedgerTransaction> findRecentByType(TransactionType type, int limit) {
        return jdbcTemplate.query(
            "SELECT " + TX_COLUMNS + " FROM ledger_transactions WHERE transaction_type = ? " +
            "ORDER BY sequence_number DESC LIMIT ?",
            transactionRowMapper(),
            type.name(),
            limit
        );
    }

    /**
     * Total net amount a user received through one transaction type.
     */
    @Transactional(readOnly = true)
    public BigDecimal sumReceived(String userId, TransactionType type, AssetType assetType) {
        BigDecimal sum = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(net_amount), 0) FROM ledger_transactions " +
            "WHERE to_user_id = ? AND transaction_type = ? AND asset_type = ?",
            BigDecimal.class,
            userId,
            type.name(),
            assetType.name()
        );
        return (sum != null ? sum : BigDecimal.ZERO).setScale(assetType.getScale(), LedgerAmounts.ROUNDING);
    }

    /**
     * Net effect of the whole log on one asset: emissions and dividends enter
     * wallets, fees leave them. Used by reconciliation.
     */
    @Transactional(readOnly = true)
    public BigDecimal sumByType(TransactionType type, AssetType assetType) {
        BigDecimal sum = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(amount), 0) FROM ledger_transactions " +
            "WHERE transaction_type = ? AND asset_type = ?",
            BigDecimal.class,
            type.name(),
            assetType.name()
        );
        return (sum != null ? sum : BigDecimal.ZERO).setScale(assetType.getScale(), LedgerAmounts.ROUNDING);
    }

    @Transactional(readOnly = true)
    public BigDecimal sumFees() {
        BigDecimal sum = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(fee), 0) FROM ledger_transactions",
            BigDecimal.class
        );
        return LedgerAmounts.coins(sum != null ? sum : BigDecimal.ZERO);
    }

    private RowMapper<LedgerTransaction> transactionRowMapper() {
        return (rs, rowNum) -> {
            AssetType assetType = AssetType.valueOf(rs.getString("asset_type"));
            int scale = assetType.getScale();
            return new LedgerTransaction(
                UUID.fromString(rs.getString("id")),
                TransactionType.valueOf(rs.getString("transaction_type")),
                assetType,
                rs.getString("from_user_id"),
                rs.getString("to_user_id"),
                rs.getBigDecimal("amount").setScale(scale, LedgerAmounts.ROUNDING),
                LedgerAmounts.coins(rs.getBigDecimal("fee")),
                rs.getBigDecimal("net_amount").setScale(scale, LedgerAmounts.ROUNDING),
                rs.getString("description"),
                rs.getString("idempotency_key"),
                rs.getTimestamp("created_at").toInstant(),
                rs.getLong("sequence_number")
            );
        };
    }
}
