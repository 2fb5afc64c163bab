package com.previewenv.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One pull request's preview deployment.
 * Primary source of truth for environment state.
 *
 * Primary Key: environmentId
 *
 * Invariants:
 * - status transitions follow {@link EnvironmentStatus#canTransitionTo}
 * - expiresAt is set when the record is created
 * - version increases by one on every stored write
 */
public record Environment(
    // Primary key
    String environmentId,

    // State
    EnvironmentStatus status,

    // Source
    String repository,
    String branch,
    String commitRef,
    PrMetadata prMetadata,

    // Deployment
    String previewAddress,
    Map<String, ServiceState> services,

    // Timing
    Instant createdAt,
    Instant updatedAt,
    Instant expiresAt,

    // Error tracking
    String lastError,

    // Versioning (conditional writes)
    long version
) {
    public Environment {
        services = services == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(services));
    }

    /**
     * Create a new environment record in CREATING state for the given action.
     */
    public static Environment create(LifecycleAction action, String previewAddress, Instant now, Duration ttl) {
        return new Environment(
            action.environmentId(),
            EnvironmentStatus.CREATING,
            action.repository(),
            action.branch(),
            action.commitRef(),
            action.prMetadata(),
            previewAddress,
            Map.of(),
            now,
            now,
            now.plus(ttl),
            null,
            0L
        );
    }

    public boolean isLive() {
        return status.isLive();
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && expiresAt.isBefore(now);
    }

    public ServiceState service(String serviceId) {
        return services.get(serviceId);
    }

    /**
     * Create a copy with one service state added or replaced.
     */
    public Environment withService(ServiceState state) {
        Map<String, ServiceState> updated = new LinkedHashMap<>(services);
        updated.put(state.serviceId(), state);
        return toBuilder().services(updated).build();
    }

    public Environment withStatus(EnvironmentStatus newStatus) {
        return toBuilder().status(newStatus).build();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static class Builder {
        private final String environmentId;
        private EnvironmentStatus status;
        private String repository;
        private String branch;
        private String commitRef;
        private PrMetadata prMetadata;
        private String previewAddress;
        private Map<String, ServiceState> services;
        private Instant createdAt;
        private Instant updatedAt;
        private Instant expiresAt;
        private String lastError;
        private long version;

        public Builder(Environment environment) {
            this.environmentId = environment.environmentId();
            this.status = environment.status();
            this.repository = environment.repository();
            this.branch = environment.branch();
            this.commitRef = environment.commitRef();
            this.prMetadata = environment.prMetadata();
            this.previewAddress = environment.previewAddress();
            this.services = environment.services();
            this.createdAt = environment.createdAt();
            this.updatedAt = environment.updatedAt();
            this.expiresAt = environment.expiresAt();
            this.lastError = environment.lastError();
            this.version = environment.version();
        }

        public Builder status(EnvironmentStatus status) {
            this.status = status;
            return this;
        }

        public Builder branch(String branch) {
            this.branch = branch;
            return this;
        }

        public Builder commitRef(String commitRef) {
            this.commitRef = commitRef;
            return this;
        }

        public Builder prMetadata(PrMetadata prMetadata) {
            this.prMetadata = prMetadata;
            return this;
        }

        public Builder services(Map<String, ServiceState> services) {
            this.services = services;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder expiresAt(Instant expiresAt) {
            this.expiresAt = expiresAt;
            return this;
        }

        public Builder lastError(String lastError) {
            this.lastError = lastError;
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public Builder incrementVersion() {
            this.version++;
            return this;
        }

        public Environment build() {
            return new Environment(
                environmentId, status, repository, branch, commitRef, prMetadata,
                previewAddress, services, createdAt, updatedAt, expiresAt,
                lastError, version
            );
        }
    }
}
