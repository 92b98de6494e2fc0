package com.flagship.altyn_ledger.ledger;

import com.flagship.altyn_ledger.error.InsufficientFundsException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Wallet store holding the COIN and TOKEN balance of every user.
 *
 * This service enforces the core invariants:
 * 1. credit and debit are the only ways a balance changes
 * 2. a debit checks and mutates in one conditional UPDATE, so concurrent
 *    debits can never overdraw a wallet (the CHECK constraint backs this up)
 * 3. wallets are created lazily on first touch and never deleted
 *
 * Callers are responsible for writing the matching transaction log entry in
 * the same database transaction.
 */
@Service
@Slf4j
public class WalletLedger {

    private static final String WALLET_COLUMNS = "user_id, coin_balance, token_balance, version";

    private final JdbcTemplate jdbcTemplate;

    public WalletLedger(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Adds {@code amount} to the user's balance, creating the wallet if needed.
     *
     * @return the normalized amount that was credited
     * @throws com.flagship.altyn_ledger.error.InvalidAmountException if amount is not positive
     */
    @Transactional
    public BigDecimal credit(String userId, AssetType assetType, BigDecimal amount) {
        BigDecimal normalized = LedgerAmounts.requirePositive(amount, assetType);
        ensureWallet(userId);

        String column = balanceColumn(assetType);
        int updated = jdbcTemplate.update(
            "UPDATE wallets SET " + column + " = " + column + " + ?, version = version + 1, " +
            "updated_at = CURRENT_TIMESTAMP WHERE user_id = ?",
            normalized,
            userId
        );
        if (updated != 1) {
            throw new IllegalStateException("Wallet disappeared during credit: " + userId);
        }

        log.debug("Credited wallet: userId={}, asset={}, amount={}", userId, assetType, normalized);
        return normalized;
    }

    /**
     * Subtracts {@code amount} from the user's balance.
     *
     * The balance check and the mutation are one statement: the row is only
     * updated when the current balance covers the amount. Zero affected rows
     * means the wallet is missing or short, and nothing was changed.
     *
     * @return the normalized amount that was debited
     * @throws InsufficientFundsException if the balance does not cover the amount
     */
    @Transactional
    public BigDecimal debit(String userId, AssetType assetType, BigDecimal amount) {
        BigDecimal normalized = LedgerAmounts.requirePositive(amount, assetType);

        String column = balanceColumn(assetType);
        int updated = jdbcTemplate.update(
            "UPDATE wallets SET " + column + " = " + column + " - ?, version = version + 1, " +
            "updated_at = CURRENT_TIMESTAMP WHERE user_id = ? AND " + column + " >= ?",
            normalized,
            userId,
            normalized
        );
        if (updated == 0) {
            throw new InsufficientFundsException(userId, assetType, normalized);
        }

        log.debug("Debited wallet: userId={}, asset={}, amount={}", userId, assetType, normalized);
        return normalized;
    }

    /**
     * Current balance, zero for users that never touched the ledger.
     */
    @Transactional(readOnly = true)
    public BigDecimal getBalance(String userId, AssetType assetType) {
        return getWallet(userId).balanceOf(assetType);
    }

    /**
     * Current wallet, or an empty wallet for unknown users.
     */
    @Transactional(readOnly = true)
    public Wallet getWallet(String userId) {
        return findWallet(userId).orElseGet(() -> Wallet.empty(userId));
    }

    @Transactional(readOnly = true)
    public Optional<Wallet> findWallet(String userId) {
        List<Wallet> wallets = jdbcTemplate.query(
            "SELECT " + WALLET_COLUMNS + " FROM wallets WHERE user_id = ?",
            walletRowMapper(),
            userId
        );
        return wallets.stream().findFirst();
    }

    /**
     * All wallets with a positive TOKEN balance, ordered by user id.
     * This is the stable order used for dividend allocation.
     */
    @Transactional(readOnly = true)
    public List<Wallet> findTokenHolders() {
        return jdbcTemplate.query(
            "SELECT " + WALLET_COLUMNS + " FROM wallets WHERE token_balance > 0 ORDER BY user_id",
            walletRowMapper()
        );
    }

    /**
     * Largest TOKEN holders first, ties broken by user id.
     */
    @Transactional(readOnly = true)
    public List<Wallet> findTopTokenHolders(int limit) {
        return jdbcTemplate.query(
            "SELECT " + WALLET_COLUMNS + " FROM wallets WHERE token_balance > 0 " +
            "ORDER BY token_balance DESC, user_id LIMIT ?",
            walletRowMapper(),
            limit
        );
    }

    @Transactional(readOnly = true)
    public long countTokenHolders() {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM wallets WHERE token_balance > 0",
            Long.class
        );
        return count != null ? count : 0L;
    }

    /**
     * Sum of one asset over every wallet. Used for conservation checks.
     */
    @Transactional(readOnly = true)
    public BigDecimal sumBalances(AssetType assetType) {
        String column = balanceColumn(assetType);
        BigDecimal sum = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(" + column + "), 0) FROM wallets",
            BigDecimal.class
        );
        return (sum != null ? sum : BigDecimal.ZERO).setScale(assetType.getScale(), LedgerAmounts.ROUNDING);
    }

    private void ensureWallet(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User ID is required");
        }
        jdbcTemplate.update(
            "INSERT INTO wallets (user_id) VALUES (?) ON CONFLICT (user_id) DO NOTHING",
            userId
        );
    }

    // Column names come from this switch only, never from caller input.
    private static String balanceColumn(AssetType assetType) {
        return switch (assetType) {
            case COIN -> "coin_balance";
            case TOKEN -> "token_balance";
        };
    }

    private RowMapper<Wallet> walletRowMapper() {
        return (rs, rowNum) -> new Wallet(
            rs.getString("user_id"),
            rs.getBigDecimal("coin_balance").setScale(AssetType.COIN.getScale(), LedgerAmounts.ROUNDING),
            rs.getBigDecimal("token_balance").setScale(AssetType.TOKEN.getScale(), LedgerAmounts.ROUNDING),
            rs.getLong("version")
        );
    }
}
