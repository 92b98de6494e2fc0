package com.flagship.altyn_ledger.identity;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * {@link UserDirectory} over the read-only ledger_users mirror that the
 * identity service keeps in sync.
 */
@Repository
public class JdbcUserDirectory implements UserDirectory {

    private static final String USER_COLUMNS = "user_id, display_name, email, is_admin";

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbcTemplate;

    public JdbcUserDirectory(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.namedJdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate);
    }

    @Override
    public Optional<UserProfile> findById(String userId) {
        if (userId == null || userId.isBlank()) {
            return Optional.empty();
        }
        return jdbcTemplate.query(
            "SELECT " + USER_COLUMNS + " FROM ledger_users WHERE user_id = ?",
            userRowMapper(),
            userId
        ).stream().findFirst();
    }

    @Override
    public Optional<UserProfile> findByEmail(String email) {
        if (email == null || email.isBlank()) {
            return Optional.empty();
        }
        return jdbcTemplate.query(
            "SELECT " + USER_COLUMNS + " FROM ledger_users WHERE LOWER(email) = LOWER(?)",
            userRowMapper(),
            email.trim()
        ).stream().findFirst();
    }

    @Override
    public Map<String, String> displayNames(Collection<String> userIds) {
        Map<String, String> names = new HashMap<>();
        if (userIds.isEmpty()) {
            return names;
        }
        namedJdbcTemplate.query(
            "SELECT user_id, display_name FROM ledger_users WHERE user_id IN (:ids)",
            new MapSqlParameterSource("ids", userIds),
            rs -> {
                names.put(rs.getString("user_id"), rs.getString("display_name"));
            }
        );
        return names;
    }

    private RowMapper<UserProfile> userRowMapper() {
        return (rs, rowNum) -> new UserProfile(
            rs.getString("user_id"),
            rs.getString("display_name"),
            rs.getString("email"),
            rs.getBoolean("is_admin")
        );
    }
}
