package com.previewenv.engine.service;

import com.previewenv.core.model.EnvironmentStatus;
import com.previewenv.engine.allocator.CapacityUsage;

import java.util.Map;

/**
 * Environment counts by status together with routing priority usage.
 */
public record CapacityReport(
    Map<EnvironmentStatus, Long> environments,
    CapacityUsage priorities
) {
    public enum Level { OK, WARNING, CRITICAL }

    public CapacityReport {
        environments = Map.copyOf(environments);
    }

    public Level level() {
        if (priorities.isCritical()) {
            return Level.CRITICAL;
        }
        return priorities.isWarning() ? Level.WARNING : Level.OK;
    }

    public long live() {
        return environments.entrySet().stream()
            .filter(e -> e.getKey().isLive())
            .mapToLong(Map.Entry::getValue)
            .sum();
    }
}
