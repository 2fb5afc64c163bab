package com.previewenv.core.model;

import java.time.Instant;

/**
 * Ownership of one slot in a routing domain's priority range.
 *
 * Primary Key: (routingDomain, priority)
 *
 * At most one allocation exists per key. The store enforces this with a
 * create-if-absent write.
 */
public record PriorityAllocation(
    String routingDomain,
    int priority,
    String environmentId,
    String serviceId,
    Instant allocatedAt,
    Instant expiresAt
) {
    public String key() {
        return key(routingDomain, priority);
    }

    public static String key(String routingDomain, int priority) {
        return routingDomain + "#" + priority;
    }

    public boolean isOwnedBy(String environmentId) {
        return this.environmentId.equals(environmentId);
    }
}
