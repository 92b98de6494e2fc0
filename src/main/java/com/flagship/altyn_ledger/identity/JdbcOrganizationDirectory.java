package com.flagship.altyn_ledger.identity;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link OrganizationDirectory} over the read-only ledger_organizations and
 * ledger_organization_admins mirrors.
 */
@Repository
public class JdbcOrganizationDirectory implements OrganizationDirectory {

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbcTemplate;

    public JdbcOrganizationDirectory(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.namedJdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate);
    }

    @Override
    public Optional<Organization> findById(String organizationId) {
        if (organizationId == null || organizationId.isBlank()) {
            return Optional.empty();
        }
        return jdbcTemplate.query(
            "SELECT organization_id, name FROM ledger_organizations WHERE organization_id = ?",
            organizationRowMapper(),
            organizationId
        ).stream().findFirst();
    }

    @Override
    public List<Organization> findAdministeredBy(String userId) {
        return jdbcTemplate.query(
            "SELECT o.organization_id, o.name FROM ledger_organizations o " +
            "JOIN ledger_organization_admins a ON a.organization_id = o.organization_id " +
            "WHERE a.user_id = ? ORDER BY o.name, o.organization_id",
            organizationRowMapper(),
            userId
        );
    }

    @Override
    public boolean isAdmin(String organizationId, String userId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM ledger_organization_admins WHERE organization_id = ? AND user_id = ?",
            Integer.class,
            organizationId,
            userId
        );
        return count != null && count > 0;
    }

    @Override
    public Map<String, String> names(Collection<String> organizationIds) {
        Map<String, String> names = new HashMap<>();
        if (organizationIds.isEmpty()) {
            return names;
        }
        namedJdbcTemplate.query(
            "SELECT organization_id, name FROM ledger_organizations WHERE organization_id IN (:ids)",
            new MapSqlParameterSource("ids", organizationIds),
            rs -> {
                names.put(rs.getString("organization_id"), rs.getString("name"));
            }
        );
        return names;
    }

    private RowMapper<Organization> organizationRowMapper() {
        return (rs, rowNum) -> new Organization(
            rs.getString("organization_id"),
            rs.getString("name")
        );
    }
}
