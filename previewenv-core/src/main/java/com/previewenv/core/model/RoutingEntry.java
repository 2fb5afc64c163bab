package com.previewenv.core.model;

import java.time.Instant;

/**
 * Routing configuration of one deployed service.
 *
 * Primary Key: (environmentId, serviceId)
 *
 * Written once the service finished provisioning, removed with its teardown.
 * expiresAt mirrors the owning environment.
 */
public record RoutingEntry(
    String environmentId,
    String serviceId,
    String ruleRef,
    String targetRef,
    String registryRef,
    String computeServiceRef,
    int priority,
    Instant expiresAt,
    Instant createdAt
) {
    /**
     * @throws IllegalArgumentException if the service holds no priority
     */
    public static RoutingEntry from(String environmentId, ServiceState state, Instant expiresAt, Instant now) {
        Integer priority = state.priority();
        if (priority == null) {
            throw new IllegalArgumentException("Service " + state.serviceId() + " in " + environmentId
                + " holds no priority");
        }
        return new RoutingEntry(
            environmentId,
            state.serviceId(),
            state.ruleRef(),
            state.targetRef(),
            state.registryRef(),
            state.computeServiceRef(),
            priority,
            expiresAt,
            now
        );
    }

    public RoutingEntry withExpiresAt(Instant newExpiresAt) {
        return new RoutingEntry(
            environmentId, serviceId, ruleRef, targetRef, registryRef,
            computeServiceRef, priority, newExpiresAt, createdAt
        );
    }
}
