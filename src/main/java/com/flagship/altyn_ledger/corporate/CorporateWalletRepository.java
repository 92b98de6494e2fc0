package com.flagship.altyn_ledger.corporate;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

@Repository
public class CorporateWalletRepository {

    private static final String WALLET_COLUMNS = "organization_id, account_id, created_by, created_at";

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbcTemplate;

    public CorporateWalletRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.namedJdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate);
    }

    /**
     * @return false when the organization already had a wallet; nothing is changed then
     */
    public boolean insertIfAbsent(CorporateWallet wallet) {
        int inserted = jdbcTemplate.update(
            "INSERT INTO corporate_wallets (organization_id, account_id, created_by, created_at) " +
            "VALUES (?, ?, ?, ?) ON CONFLICT (organization_id) DO NOTHING",
            wallet.getOrganizationId(),
            wallet.getAccountId(),
            wallet.getCreatedBy(),
            Timestamp.from(wallet.getCreatedAt())
        );
        return inserted == 1;
    }

    public Optional<CorporateWallet> findByOrganizationId(String organizationId) {
        return jdbcTemplate.query(
            "SELECT " + WALLET_COLUMNS + " FROM corporate_wallets WHERE organization_id = ?",
            walletRowMapper(),
            organizationId
        ).stream().findFirst();
    }

    public Map<String, CorporateWallet> findByOrganizationIds(Collection<String> organizationIds) {
        Map<String, CorporateWallet> wallets = new HashMap<>();
        if (organizationIds.isEmpty()) {
            return wallets;
        }
        namedJdbcTemplate.query(
            "SELECT " + WALLET_COLUMNS + " FROM corporate_wallets WHERE organization_id IN (:ids)",
            new MapSqlParameterSource("ids", organizationIds),
            walletRowMapper()
        ).forEach(wallet -> wallets.put(wallet.getOrganizationId(), wallet));
        return wallets;
    }

    public boolean existsByAccountId(String accountId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM corporate_wallets WHERE account_id = ?",
            Integer.class,
            accountId
        );
        return count != null && count > 0;
    }

    private RowMapper<CorporateWallet> walletRowMapper() {
        return (rs, rowNum) -> new CorporateWallet(
            rs.getString("organization_id"),
            rs.getString("account_id"),
            rs.getString("created_by"),
            rs.getTimestamp("created_at").toInstant()
        );
    }
}
