package com.previewenv.engine.persistence.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.previewenv.core.exception.OptimisticLockException;
import com.previewenv.core.model.Environment;
import com.previewenv.core.model.EnvironmentStatus;
import com.previewenv.core.model.PrMetadata;
import com.previewenv.core.model.ServiceState;
import com.previewenv.core.repository.EnvironmentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.*;

/**
 * PostgreSQL-backed implementation of EnvironmentRepository.
 * Creation is an insert-if-absent; every later write is conditional on the
 * stored version, so concurrent actions on one environment never lose updates.
 */
@Repository("jdbcEnvironmentRepository")
@ConditionalOnProperty(name = "previewenv.store.mode", havingValue = "jdbc", matchIfMissing = true)
public class JdbcEnvironmentRepository implements EnvironmentRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcEnvironmentRepository.class);

    private static final TypeReference<LinkedHashMap<String, ServiceState>> SERVICES_TYPE =
        new TypeReference<>() { };

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final EnvironmentRowMapper rowMapper;

    public JdbcEnvironmentRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.rowMapper = new EnvironmentRowMapper();
    }

    @Override
    @Transactional
    public boolean insert(Environment environment) {
        String sql = """
            INSERT INTO environments (
                environment_id, status, repository, branch, commit_ref,
                pr_metadata_json, preview_address, services_json,
                created_at, updated_at, expires_at, last_error, version
            ) VALUES (?, ?, ?, ?, ?, ?::jsonb, ?, ?::jsonb, ?, ?, ?, ?, ?)
            ON CONFLICT (environment_id) DO NOTHING
            """;

        int rows = jdbcTemplate.update(sql,
            environment.environmentId(),
            environment.status().name(),
            environment.repository(),
            environment.branch(),
            environment.commitRef(),
            toJson(environment.prMetadata()),
            environment.previewAddress(),
            toJson(environment.services()),
            toTimestamp(environment.createdAt()),
            toTimestamp(environment.updatedAt()),
            toTimestamp(environment.expiresAt()),
            environment.lastError(),
            environment.version()
        );

        if (rows == 0) {
            log.debug("Environment already exists: {}", environment.environmentId());
        }
        return rows == 1;
    }

    @Override
    @Transactional
    public void update(Environment environment) {
        String sql = """
            UPDATE environments SET
                status = ?,
                repository = ?,
                branch = ?,
                commit_ref = ?,
                pr_metadata_json = ?::jsonb,
                preview_address = ?,
                services_json = ?::jsonb,
                created_at = ?,
                updated_at = ?,
                expires_at = ?,
                last_error = ?,
                version = ?
            WHERE environment_id = ? AND version = ?
            """;

        long expected = environment.version() - 1;
        int rows = jdbcTemplate.update(sql,
            environment.status().name(),
            environment.repository(),
            environment.branch(),
            environment.commitRef(),
            toJson(environment.prMetadata()),
            environment.previewAddress(),
            toJson(environment.services()),
            toTimestamp(environment.createdAt()),
            toTimestamp(environment.updatedAt()),
            toTimestamp(environment.expiresAt()),
            environment.lastError(),
            environment.version(),
            environment.environmentId(),
            expected
        );

        if (rows == 0) {
            throw new OptimisticLockException("Environment", environment.environmentId(), expected);
        }
    }

    @Override
    public Optional<Environment> findById(String environmentId) {
        String sql = "SELECT * FROM environments WHERE environment_id = ?";
        List<Environment> results = jdbcTemplate.query(sql, rowMapper, environmentId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<Environment> findExpiringBefore(Collection<EnvironmentStatus> statuses, Instant cutoff, int limit) {
        if (statuses.isEmpty()) {
            return List.of();
        }
        String placeholders = String.join(", ", Collections.nCopies(statuses.size(), "?"));
        String sql = """
            SELECT * FROM environments
            WHERE status IN (%s)
              AND expires_at < ?
            ORDER BY expires_at
            LIMIT ?
            """.formatted(placeholders);

        List<Object> args = new ArrayList<>();
        statuses.forEach(s -> args.add(s.name()));
        args.add(Timestamp.from(cutoff));
        args.add(limit);
        return jdbcTemplate.query(sql, rowMapper, args.toArray());
    }

    @Override
    public List<Environment> findAll(EnvironmentStatus status, int limit) {
        if (status == null) {
            String sql = "SELECT * FROM environments ORDER BY updated_at DESC LIMIT ?";
            return jdbcTemplate.query(sql, rowMapper, limit);
        }
        String sql = "SELECT * FROM environments WHERE status = ? ORDER BY updated_at DESC LIMIT ?";
        return jdbcTemplate.query(sql, rowMapper, status.name(), limit);
    }

    @Override
    public Map<EnvironmentStatus, Long> countByStatus() {
        String sql = """
            SELECT status, COUNT(*) as count
            FROM environments
            GROUP BY status
            """;

        Map<EnvironmentStatus, Long> counts = new EnumMap<>(EnvironmentStatus.class);
        jdbcTemplate.query(sql, rs -> {
            counts.put(EnvironmentStatus.valueOf(rs.getString("status")), rs.getLong("count"));
        });
        return counts;
    }

    @Override
    @Transactional
    public int deleteDestroyedBefore(Instant updatedBefore) {
        String sql = """
            DELETE FROM environments
            WHERE status = 'DESTROYED'
              AND updated_at < ?
            """;
        return jdbcTemplate.update(sql, Timestamp.from(updatedBefore));
    }

    // ========== Helper Methods ==========

    private String toJson(Object obj) {
        if (obj == null) return null;
        try {
            return objectMapper.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize to JSON", e);
        }
    }

    private Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private class EnvironmentRowMapper implements RowMapper<Environment> {
        @Override
        public Environment mapRow(ResultSet rs, int rowNum) throws SQLException {
            try {
                return new Environment(
                    rs.getString("environment_id"),
                    EnvironmentStatus.valueOf(rs.getString("status")),
                    rs.getString("repository"),
                    rs.getString("branch"),
                    rs.getString("commit_ref"),
                    parsePrMetadata(rs.getString("pr_metadata_json")),
                    rs.getString("preview_address"),
                    parseServices(rs.getString("services_json")),
                    toInstant(rs.getTimestamp("created_at")),
                    toInstant(rs.getTimestamp("updated_at")),
                    toInstant(rs.getTimestamp("expires_at")),
                    rs.getString("last_error"),
                    rs.getLong("version")
                );
            } catch (JsonProcessingException e) {
                throw new SQLException("Failed to map environment row", e);
            }
        }

        private PrMetadata parsePrMetadata(String json) throws JsonProcessingException {
            if (json == null || json.isEmpty()) return null;
            return objectMapper.readValue(json, PrMetadata.class);
        }

        private Map<String, ServiceState> parseServices(String json) throws JsonProcessingException {
            if (json == null || json.isEmpty()) return Map.of();
            return objectMapper.readValue(json, SERVICES_TYPE);
        }

        private Instant toInstant(Timestamp ts) {
            return ts != null ? ts.toInstant() : null;
        }
    }
}
