package com.previewenv.engine.health;

import com.previewenv.engine.service.CapacityReport;
import com.previewenv.engine.service.EnvironmentQueryService;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.HashMap;
import java.util.Map;

/**
 * Health of the preview environment controller.
 * Reports health status based on:
 * - Database connectivity (jdbc store mode only)
 * - Routing priority capacity
 *
 * Exhausted capacity does not take the instance down, since teardowns must keep flowing.
 */
public class PreviewEnvHealthIndicator implements HealthIndicator {

    private final ObjectProvider<JdbcTemplate> jdbcTemplate;
    private final EnvironmentQueryService queries;

    public PreviewEnvHealthIndicator(ObjectProvider<JdbcTemplate> jdbcTemplate, EnvironmentQueryService queries) {
        this.jdbcTemplate = jdbcTemplate;
        this.queries = queries;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();

        try {
            JdbcTemplate jdbc = jdbcTemplate.getIfAvailable();
            if (jdbc != null && !checkDatabase(jdbc, details)) {
                return Health.down()
                    .withDetails(details)
                    .build();
            }

            checkCapacity(details);

            return Health.up()
                .withDetails(details)
                .build();

        } catch (Exception e) {
            return Health.down()
                .withException(e)
                .withDetails(details)
                .build();
        }
    }

    private boolean checkDatabase(JdbcTemplate jdbc, Map<String, Object> details) {
        try {
            Integer result = jdbc.queryForObject("SELECT 1", Integer.class);
            details.put("database", "connected");
            return result != null && result == 1;
        } catch (Exception e) {
            details.put("database", "disconnected");
            details.put("databaseError", e.getMessage());
            return false;
        }
    }

    private void checkCapacity(Map<String, Object> details) {
        CapacityReport report = queries.capacity();
        details.put("environments", report.environments());
        details.put("prioritiesUsed", report.priorities().used());
        details.put("prioritiesCapacity", report.priorities().capacity());
        details.put("capacityLevel", report.level().name());
        if (report.level() == CapacityReport.Level.CRITICAL) {
            details.put("capacityWarning", "Routing priorities nearly exhausted - new environments may fail to deploy");
        }
    }
}
