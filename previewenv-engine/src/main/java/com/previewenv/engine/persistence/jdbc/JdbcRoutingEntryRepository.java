package com.previewenv.engine.persistence.jdbc;

import com.previewenv.core.model.RoutingEntry;
import com.previewenv.core.repository.RoutingEntryRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL-backed implementation of RoutingEntryRepository.
 */
@Repository("jdbcRoutingEntryRepository")
@ConditionalOnProperty(name = "previewenv.store.mode", havingValue = "jdbc", matchIfMissing = true)
public class JdbcRoutingEntryRepository implements RoutingEntryRepository {

    private final JdbcTemplate jdbcTemplate;
    private final RoutingEntryRowMapper rowMapper = new RoutingEntryRowMapper();

    public JdbcRoutingEntryRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    @Transactional
    public void save(RoutingEntry entry) {
        String sql = """
            INSERT INTO routing_entries (
                environment_id, service_id, rule_ref, target_ref, registry_ref,
                compute_service_ref, priority, expires_at, created_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (environment_id, service_id) DO UPDATE SET
                rule_ref = EXCLUDED.rule_ref,
                target_ref = EXCLUDED.target_ref,
                registry_ref = EXCLUDED.registry_ref,
                compute_service_ref = EXCLUDED.compute_service_ref,
                priority = EXCLUDED.priority,
                expires_at = EXCLUDED.expires_at
            """;

        jdbcTemplate.update(sql,
            entry.environmentId(),
            entry.serviceId(),
            entry.ruleRef(),
            entry.targetRef(),
            entry.registryRef(),
            entry.computeServiceRef(),
            entry.priority(),
            toTimestamp(entry.expiresAt()),
            toTimestamp(entry.createdAt())
        );
    }

    @Override
    public Optional<RoutingEntry> find(String environmentId, String serviceId) {
        String sql = "SELECT * FROM routing_entries WHERE environment_id = ? AND service_id = ?";
        List<RoutingEntry> results = jdbcTemplate.query(sql, rowMapper, environmentId, serviceId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<RoutingEntry> findByEnvironment(String environmentId) {
        String sql = "SELECT * FROM routing_entries WHERE environment_id = ? ORDER BY service_id";
        return jdbcTemplate.query(sql, rowMapper, environmentId);
    }

    @Override
    @Transactional
    public int updateExpiry(String environmentId, Instant expiresAt) {
        String sql = "UPDATE routing_entries SET expires_at = ? WHERE environment_id = ?";
        return jdbcTemplate.update(sql, Timestamp.from(expiresAt), environmentId);
    }

    @Override
    @Transactional
    public void delete(String environmentId, String serviceId) {
        jdbcTemplate.update("DELETE FROM routing_entries WHERE environment_id = ? AND service_id = ?",
            environmentId, serviceId);
    }

    @Override
    @Transactional
    public int deleteByEnvironment(String environmentId) {
        return jdbcTemplate.update("DELETE FROM routing_entries WHERE environment_id = ?", environmentId);
    }

    private Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static class RoutingEntryRowMapper implements RowMapper<RoutingEntry> {
        @Override
        public RoutingEntry mapRow(ResultSet rs, int rowNum) throws SQLException {
            Timestamp expiresAt = rs.getTimestamp("expires_at");
            return new RoutingEntry(
                rs.getString("environment_id"),
                rs.getString("service_id"),
                rs.getString("rule_ref"),
                rs.getString("target_ref"),
                rs.getString("registry_ref"),
                rs.getString("compute_service_ref"),
                rs.getInt("priority"),
                expiresAt != null ? expiresAt.toInstant() : null,
                rs.getTimestamp("created_at").toInstant()
            );
        }
    }
}
