package com.previewenv.sweeper;

import com.previewenv.core.exception.InvalidConfigurationException;

import java.time.Duration;

/**
 * @param interval       time between sweep passes
 * @param gracePeriod    how long CREATING/UPDATING may outlive expiresAt before it counts as stuck
 * @param batchSize      maximum environments read per scan
 * @param retention      how long DESTROYED records and expired allocations are kept before purge
 * @param purgeInterval  time between purge passes
 */
public record SweeperSettings(
    Duration interval,
    Duration gracePeriod,
    int batchSize,
    Duration retention,
    Duration purgeInterval
) {
    public static SweeperSettings defaults() {
        return new SweeperSettings(Duration.ofMinutes(15), Duration.ofMinutes(30), 100,
            Duration.ofDays(7), Duration.ofHours(1));
    }

    public SweeperSettings {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new InvalidConfigurationException("Sweep interval must be positive");
        }
        if (gracePeriod == null || gracePeriod.isNegative()) {
            throw new InvalidConfigurationException("Grace period must not be negative");
        }
        if (batchSize < 1) {
            throw new InvalidConfigurationException("Batch size must be at least 1, got " + batchSize);
        }
        if (retention == null || retention.isNegative()) {
            throw new InvalidConfigurationException("Retention must not be negative");
        }
        if (purgeInterval == null || purgeInterval.isZero() || purgeInterval.isNegative()) {
            throw new InvalidConfigurationException("Purge interval must be positive");
        }
    }
}
