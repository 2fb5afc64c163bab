package com.previewenv.engine.controller;

import com.previewenv.core.exception.OptimisticLockException;
import com.previewenv.core.exception.PreviewEnvException;
import com.previewenv.core.model.*;
import com.previewenv.core.repository.RoutingEntryRepository;
import com.previewenv.engine.allocator.PriorityAllocator;
import com.previewenv.engine.catalog.ServiceCatalog;
import com.previewenv.engine.logging.LoggingContext;
import com.previewenv.engine.metrics.EnvironmentMetrics;
import com.previewenv.engine.service.LifecycleActionHandler;
import com.previewenv.engine.step.StepExecutor;
import com.previewenv.engine.store.EnvironmentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Lifecycle controller for preview environments.
 *
 * Resolves each action against the stored record into a plan and converges
 * the environment towards it. Coordination with concurrent actions happens
 * only through conditional writes in the store and the status state machine.
 */
public class EnvironmentController implements LifecycleActionHandler {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentController.class);

    static final int MAX_CLAIM_ATTEMPTS = 3;

    private final EnvironmentStore store;
    private final RoutingEntryRepository routingEntries;
    private final PriorityAllocator allocator;
    private final ServiceCatalog catalog;
    private final ServiceDeployer deployer;
    private final ServiceTeardown teardown;
    private final StepExecutor steps;
    private final EnvironmentMetrics metrics;
    private final ControllerSettings settings;
    private final Clock clock;

    public EnvironmentController(
            EnvironmentStore store,
            RoutingEntryRepository routingEntries,
            PriorityAllocator allocator,
            ServiceCatalog catalog,
            ServiceDeployer deployer,
            ServiceTeardown teardown,
            StepExecutor steps,
            EnvironmentMetrics metrics,
            ControllerSettings settings,
            Clock clock) {
        this.store = store;
        this.routingEntries = routingEntries;
        this.allocator = allocator;
        this.catalog = catalog;
        this.deployer = deployer;
        this.teardown = teardown;
        this.steps = steps;
        this.metrics = metrics;
        this.settings = settings;
        this.clock = clock;
    }

    @Override
    public void handle(LifecycleAction action) {
        action.validate();
        String environmentId = action.environmentId();
        Instant started = clock.instant();

        try (var ctx = LoggingContext.forAction(environmentId, action.action().name(), action.reason())) {
            log.info("Handling {} for {}", action.action(), environmentId);
            try {
                ActionPlan plan = dispatch(action);
                metrics.actionCompleted(action.action().name(), plan.name(), Duration.between(started, clock.instant()));
            } catch (RuntimeException e) {
                markFailed(environmentId, e);
                String errorCode = e instanceof PreviewEnvException pe ? pe.getErrorCode() : "INTERNAL_ERROR";
                metrics.actionFailed(action.action().name(), errorCode, Duration.between(started, clock.instant()));
                log.error("{} for {} failed: {}", action.action(), environmentId, e.getMessage(), e);
                throw e;
            }
        }
    }

    // ========== Dispatch ==========

    private ActionPlan dispatch(LifecycleAction action) {
        String environmentId = action.environmentId();
        long lastSeenVersion = -1;

        for (int attempt = 1; attempt <= MAX_CLAIM_ATTEMPTS; attempt++) {
            Optional<Environment> current = store.find(environmentId);
            EnvironmentStatus status = current.map(Environment::status).orElse(null);
            ActionPlan plan = ActionMerger.resolve(action.action(), status);
            lastSeenVersion = current.map(Environment::version).orElse(-1L);
            log.debug("{} against {} resolved to {}", action.action(), status, plan);

            switch (plan) {
                case NOOP -> {
                    log.info("Nothing to do for {} on {} ({})", action.action(), environmentId,
                        status == null ? "no record" : status);
                    return plan;
                }
                case PROVISION -> {
                    Optional<Environment> claimed = claim(action, current.orElse(null));
                    if (claimed.isEmpty()) {
                        log.info("Lost the race to create {}, re-resolving", environmentId);
                        continue;
                    }
                    provision(action, claimed.get(), current.orElse(null));
                    return plan;
                }
                case REFRESH -> {
                    refresh(action);
                    return plan;
                }
                case TEARDOWN -> {
                    tearDown(environmentId);
                    return plan;
                }
            }
        }
        throw new OptimisticLockException("Environment", environmentId, lastSeenVersion);
    }

    /**
     * Write the fresh CREATING record: create-if-absent for a new id, a
     * version-conditional overwrite of a DESTROYED or FAILED record otherwise.
     */
    private Optional<Environment> claim(LifecycleAction action, Environment previous) {
        Environment fresh = Environment.create(
            action,
            settings.previewAddressFor(action.environmentId()),
            clock.instant(),
            settings.defaultTtl());

        if (previous == null) {
            return store.create(fresh) ? Optional.of(fresh) : Optional.empty();
        }
        try {
            return Optional.of(store.replace(previous, fresh));
        } catch (OptimisticLockException e) {
            return Optional.empty();
        }
    }

    // ========== Provision ==========

    private void provision(LifecycleAction action, Environment environment, Environment previous) {
        String environmentId = environment.environmentId();
        log.info("Provisioning {} for {}@{} expiring at {}", environmentId,
            action.repository(), action.commitRef(), environment.expiresAt());

        if (previous != null && previous.status() == EnvironmentStatus.FAILED) {
            reclaimLeftovers(previous);
        }

        List<PreviewableService> services = catalog.servicesFor(action.repository());
        if (services.isEmpty()) {
            String diagnostic = "No previewable services configured for repository " + action.repository();
            log.warn(diagnostic);
            store.transition(environmentId, EnvironmentStatus.ACTIVE,
                env -> env.toBuilder().lastError(diagnostic).build());
            return;
        }

        for (PreviewableService service : services) {
            deployer.deploy(environment, service);
            if (!stillLive(environmentId)) {
                return;
            }
        }
        finishDeployment(environmentId);
    }

    /**
     * Resources recorded on a FAILED record that is being replaced.
     * The fresh record no longer lists them, so progress is not written back.
     */
    private void reclaimLeftovers(Environment previous) {
        List<ServiceState> leftovers = previous.services().values().stream()
            .filter(ServiceState::holdsResources)
            .collect(Collectors.toList());
        if (leftovers.isEmpty()) {
            return;
        }
        log.info("Reclaiming {} leftover services of failed {} before provisioning",
            leftovers.size(), previous.environmentId());
        for (ServiceState state : leftovers) {
            teardown.tearDown(previous.environmentId(), state, false);
        }
    }

    // ========== Refresh ==========

    private void refresh(LifecycleAction action) {
        String environmentId = action.environmentId();
        Instant expiresAt = clock.instant().plus(settings.defaultTtl());

        Optional<Environment> updating = store.transition(environmentId, EnvironmentStatus.UPDATING, env -> {
            Environment.Builder builder = env.toBuilder()
                .expiresAt(expiresAt)
                .commitRef(action.commitRef());
            if (action.branch() != null) {
                builder.branch(action.branch());
            }
            if (action.prMetadata() != null) {
                builder.prMetadata(action.prMetadata());
            }
            return builder.build();
        });
        if (updating.isEmpty() || updating.get().status() != EnvironmentStatus.UPDATING) {
            log.info("Refresh of {} superseded by a concurrent action", environmentId);
            return;
        }
        Environment environment = updating.get();
        log.info("Refreshing {} to {} expiring at {}", environmentId, action.commitRef(), expiresAt);

        for (ServiceState state : environment.services().values()) {
            if (state.hasComputeService()) {
                deployer.redeploy(environmentId, state);
            } else {
                // services that failed before their compute service existed are not repaired here
                log.info("Skipping redeploy of {} in {}: no compute service ({})",
                    state.serviceId(), environmentId, state.status());
            }
        }

        for (PreviewableService service : catalog.servicesFor(environment.repository())) {
            if (environment.service(service.serviceId()) == null) {
                deployer.deploy(environment, service);
                if (!stillLive(environmentId)) {
                    return;
                }
            }
        }

        steps.bestEffort("refreshRoutingExpiry", () -> routingEntries.updateExpiry(environmentId, expiresAt));
        steps.bestEffort("refreshPriorityExpiry",
            () -> allocator.extend(settings.routingDomain(), environmentId, expiresAt));

        finishDeployment(environmentId);
    }

    /**
     * Move the record to ACTIVE with the failures of its services. A record that a
     * concurrent action already finished stays ACTIVE and only gets its summary
     * recomputed, since services may have failed after that action summarized them.
     */
    private void finishDeployment(String environmentId) {
        Optional<Environment> finished = store.mutate(environmentId, env -> {
            if (env.status() == EnvironmentStatus.ACTIVE) {
                String summary = summarizeFailures(env);
                return Objects.equals(summary, env.lastError())
                    ? env
                    : env.toBuilder().lastError(summary).build();
            }
            if (!env.status().canTransitionTo(EnvironmentStatus.ACTIVE)) {
                log.info("Completion of {} superseded, record is {}", environmentId, env.status());
                return env;
            }
            return env.toBuilder()
                .status(EnvironmentStatus.ACTIVE)
                .lastError(summarizeFailures(env))
                .build();
        });
        finished.ifPresent(env -> {
            if (env.status() == EnvironmentStatus.ACTIVE) {
                log.info("{} is ACTIVE at {}", environmentId, env.previewAddress());
            }
        });
    }

    /**
     * False once a concurrent teardown or failure took the record out of the live states.
     */
    private boolean stillLive(String environmentId) {
        Optional<EnvironmentStatus> status = store.find(environmentId).map(Environment::status);
        if (status.isPresent() && status.get().isLive()) {
            return true;
        }
        log.info("{} is {}, stopping deployment", environmentId, status.map(Enum::name).orElse("gone"));
        return false;
    }

    static String summarizeFailures(Environment environment) {
        List<String> failures = environment.services().values().stream()
            .filter(s -> s.status() == ServiceStatus.FAILED)
            .map(s -> s.serviceId() + ": " + s.errorCode() + " " + s.lastError())
            .collect(Collectors.toList());
        return failures.isEmpty() ? null : String.join("; ", failures);
    }

    // ========== Teardown ==========

    private void tearDown(String environmentId) {
        Optional<Environment> destroying = store.transition(environmentId, EnvironmentStatus.DESTROYING);
        if (destroying.isEmpty()) {
            log.info("{} not found, nothing to destroy", environmentId);
            return;
        }
        if (destroying.get().status() != EnvironmentStatus.DESTROYING) {
            log.info("{} is {}, nothing to destroy", environmentId, destroying.get().status());
            return;
        }

        Environment snapshot = destroying.get();
        log.info("Destroying {} with {} services", environmentId, snapshot.services().size());
        for (ServiceState state : snapshot.services().values()) {
            teardown.tearDown(environmentId, state, true);
        }

        steps.bestEffort("deleteRoutingEntries", () -> routingEntries.deleteByEnvironment(environmentId));
        steps.bestEffort("releaseLingeringPriorities",
            () -> allocator.releaseAll(settings.routingDomain(), environmentId));

        store.transition(environmentId, EnvironmentStatus.DESTROYED)
            .filter(env -> env.status() == EnvironmentStatus.DESTROYED)
            .ifPresent(env -> log.info("{} destroyed", environmentId));
    }

    // ========== Failure ==========

    private void markFailed(String environmentId, RuntimeException cause) {
        String error = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        try {
            store.forceFailed(environmentId, error);
        } catch (RuntimeException storeError) {
            cause.addSuppressed(storeError);
            log.error("Could not mark {} FAILED: {}", environmentId, storeError.getMessage());
        }
    }
}
