package com.previewenv.engine.service;

import com.previewenv.core.exception.InvalidActionException;
import com.previewenv.core.exception.InvalidStateTransitionException;
import com.previewenv.core.exception.NotFoundException;
import com.previewenv.core.model.Environment;
import com.previewenv.core.model.EnvironmentStatus;
import com.previewenv.core.model.RoutingEntry;
import com.previewenv.core.repository.EnvironmentRepository;
import com.previewenv.core.repository.RoutingEntryRepository;
import com.previewenv.engine.allocator.PriorityAllocator;
import com.previewenv.engine.controller.ControllerSettings;
import com.previewenv.engine.store.EnvironmentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read access to environments plus TTL extension.
 */
public class EnvironmentQueryService {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentQueryService.class);

    public static final int DEFAULT_EXTENSION_HOURS = 24;
    public static final int MAX_LIST_SIZE = 500;

    private final EnvironmentStore store;
    private final EnvironmentRepository environments;
    private final RoutingEntryRepository routingEntries;
    private final PriorityAllocator allocator;
    private final ControllerSettings settings;

    public EnvironmentQueryService(
            EnvironmentStore store,
            EnvironmentRepository environments,
            RoutingEntryRepository routingEntries,
            PriorityAllocator allocator,
            ControllerSettings settings) {
        this.store = store;
        this.environments = environments;
        this.routingEntries = routingEntries;
        this.allocator = allocator;
        this.settings = settings;
    }

    public Environment get(String environmentId) {
        return find(environmentId)
            .orElseThrow(() -> new NotFoundException("Environment", environmentId));
    }

    public Optional<Environment> find(String environmentId) {
        return store.find(environmentId);
    }

    /**
     * @param status filter, or null for every status
     */
    public List<Environment> list(EnvironmentStatus status, int limit) {
        return environments.findAll(status, Math.min(Math.max(limit, 1), MAX_LIST_SIZE));
    }

    public List<RoutingEntry> routing(String environmentId) {
        get(environmentId);
        return routingEntries.findByEnvironment(environmentId);
    }

    public CapacityReport capacity() {
        return new CapacityReport(
            environments.countByStatus(),
            allocator.usage(settings.routingDomain()));
    }

    /**
     * Push the expiry of a live environment out by the given number of hours,
     * never beyond its creation time plus the maximum TTL.
     *
     * @throws InvalidStateTransitionException if the environment is not live
     */
    public Environment extendTtl(String environmentId, int hours) {
        if (hours <= 0) {
            throw new InvalidActionException("Extension must be a positive number of hours, got " + hours);
        }
        Environment extended = store.mutate(environmentId, env -> {
            if (!env.isLive()) {
                throw new InvalidStateTransitionException(environmentId, env.status(), "extend");
            }
            Instant cap = env.createdAt().plus(settings.maxTtl());
            Instant requested = env.expiresAt().plus(Duration.ofHours(hours));
            Instant next = requested.isAfter(cap) ? cap : requested;
            if (!next.isAfter(env.expiresAt())) {
                return env;
            }
            return env.toBuilder().expiresAt(next).build();
        }).orElseThrow(() -> new NotFoundException("Environment", environmentId));

        routingEntries.updateExpiry(environmentId, extended.expiresAt());
        allocator.extend(settings.routingDomain(), environmentId, extended.expiresAt());
        log.info("Extended {} to {}", environmentId, extended.expiresAt());
        return extended;
    }
}
