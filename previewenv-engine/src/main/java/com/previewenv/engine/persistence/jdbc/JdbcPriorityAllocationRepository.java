package com.previewenv.engine.persistence.jdbc;

import com.previewenv.core.model.PriorityAllocation;
import com.previewenv.core.repository.PriorityAllocationRepository;
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
import java.util.List;

/**
 * PostgreSQL-backed implementation of PriorityAllocationRepository.
 *
 * The primary key on (routing_domain, priority) is the only thing standing
 * between two allocators racing for the same slot. The insert either wins
 * the key or affects no rows.
 */
@Repository("jdbcPriorityAllocationRepository")
@ConditionalOnProperty(name = "previewenv.store.mode", havingValue = "jdbc", matchIfMissing = true)
public class JdbcPriorityAllocationRepository implements PriorityAllocationRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcPriorityAllocationRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final PriorityAllocationRowMapper rowMapper = new PriorityAllocationRowMapper();

    public JdbcPriorityAllocationRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    @Transactional
    public boolean tryCreate(PriorityAllocation allocation) {
        String sql = """
            INSERT INTO priority_allocations (
                routing_domain, priority, environment_id, service_id,
                allocated_at, expires_at
            ) VALUES (?, ?, ?, ?, ?, ?)
            ON CONFLICT (routing_domain, priority) DO NOTHING
            """;

        int rows = jdbcTemplate.update(sql,
            allocation.routingDomain(),
            allocation.priority(),
            allocation.environmentId(),
            allocation.serviceId(),
            Timestamp.from(allocation.allocatedAt()),
            toTimestamp(allocation.expiresAt())
        );

        if (rows == 0) {
            log.debug("Priority {} in {} already allocated", allocation.priority(), allocation.routingDomain());
        }
        return rows == 1;
    }

    @Override
    public List<PriorityAllocation> findByDomain(String routingDomain) {
        String sql = "SELECT * FROM priority_allocations WHERE routing_domain = ? ORDER BY priority";
        return jdbcTemplate.query(sql, rowMapper, routingDomain);
    }

    @Override
    public List<PriorityAllocation> findByEnvironment(String routingDomain, String environmentId) {
        String sql = """
            SELECT * FROM priority_allocations
            WHERE routing_domain = ? AND environment_id = ?
            ORDER BY priority
            """;
        return jdbcTemplate.query(sql, rowMapper, routingDomain, environmentId);
    }

    @Override
    @Transactional
    public boolean delete(String routingDomain, int priority) {
        String sql = "DELETE FROM priority_allocations WHERE routing_domain = ? AND priority = ?";
        return jdbcTemplate.update(sql, routingDomain, priority) > 0;
    }

    @Override
    @Transactional
    public boolean deleteIfOwned(String routingDomain, int priority, String environmentId) {
        String sql = """
            DELETE FROM priority_allocations
            WHERE routing_domain = ? AND priority = ? AND environment_id = ?
            """;
        return jdbcTemplate.update(sql, routingDomain, priority, environmentId) > 0;
    }

    @Override
    @Transactional
    public int updateExpiry(String routingDomain, String environmentId, Instant expiresAt) {
        String sql = """
            UPDATE priority_allocations SET expires_at = ?
            WHERE routing_domain = ? AND environment_id = ?
            """;
        return jdbcTemplate.update(sql, Timestamp.from(expiresAt), routingDomain, environmentId);
    }

    @Override
    @Transactional
    public int deleteExpiredBefore(Instant expiredBefore) {
        String sql = "DELETE FROM priority_allocations WHERE expires_at < ?";
        return jdbcTemplate.update(sql, Timestamp.from(expiredBefore));
    }

    private Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static class PriorityAllocationRowMapper implements RowMapper<PriorityAllocation> {
        @Override
        public PriorityAllocation mapRow(ResultSet rs, int rowNum) throws SQLException {
            Timestamp expiresAt = rs.getTimestamp("expires_at");
            return new PriorityAllocation(
                rs.getString("routing_domain"),
                rs.getInt("priority"),
                rs.getString("environment_id"),
                rs.getString("service_id"),
                rs.getTimestamp("allocated_at").toInstant(),
                expiresAt != null ? expiresAt.toInstant() : null
            );
        }
    }
}
