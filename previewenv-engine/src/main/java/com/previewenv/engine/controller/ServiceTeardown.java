package com.previewenv.engine.controller;

import com.previewenv.core.backend.ComputeBackend;
import com.previewenv.core.backend.LoadBalancerBackend;
import com.previewenv.core.backend.ServiceRegistryBackend;
import com.previewenv.core.model.RoutingEntry;
import com.previewenv.core.model.ServiceState;
import com.previewenv.core.model.ServiceStatus;
import com.previewenv.core.repository.RoutingEntryRepository;
import com.previewenv.engine.allocator.PriorityAllocator;
import com.previewenv.engine.logging.LoggingContext;
import com.previewenv.engine.step.StepExecutor;
import com.previewenv.engine.step.StepOutcome;
import com.previewenv.engine.step.StepResult;
import com.previewenv.engine.store.EnvironmentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Reclaims the resources of one service.
 *
 * Order: routing rule, compute service (scale to zero, drain, delete),
 * routing target (after deregistration), registry entry, priority, routing entry.
 * Every step is best-effort and a resource that is already gone counts as reclaimed.
 */
public class ServiceTeardown {

    private static final Logger log = LoggerFactory.getLogger(ServiceTeardown.class);

    private final EnvironmentStore store;
    private final RoutingEntryRepository routingEntries;
    private final PriorityAllocator allocator;
    private final ComputeBackend compute;
    private final LoadBalancerBackend loadBalancer;
    private final ServiceRegistryBackend registry;
    private final StepExecutor steps;
    private final ControllerSettings settings;

    public ServiceTeardown(
            EnvironmentStore store,
            RoutingEntryRepository routingEntries,
            PriorityAllocator allocator,
            ComputeBackend compute,
            LoadBalancerBackend loadBalancer,
            ServiceRegistryBackend registry,
            StepExecutor steps,
            ControllerSettings settings) {
        this.store = store;
        this.routingEntries = routingEntries;
        this.allocator = allocator;
        this.compute = compute;
        this.loadBalancer = loadBalancer;
        this.registry = registry;
        this.steps = steps;
        this.settings = settings;
    }

    /**
     * Tear down one service from a snapshot of its state.
     *
     * @param persistProgress whether cleared handles are written back to the environment record;
     *                        false when reclaiming leftovers of a record that was already replaced
     * @return true if every step succeeded or found its resource already gone
     */
    public boolean tearDown(String environmentId, ServiceState snapshot, boolean persistProgress) {
        String serviceId = snapshot.serviceId();
        try (var scope = LoggingContext.forService(serviceId)) {
            log.info("Tearing down {} in {}", serviceId, environmentId);
            Progress progress = new Progress(environmentId, serviceId, persistProgress);
            progress.apply(s -> s.withStatus(ServiceStatus.DESTROYING));

            Integer priority = lookUpPriority(environmentId, snapshot);

            if (snapshot.ruleRef() != null) {
                StepResult<Void> result = steps.bestEffort("deleteRule",
                    () -> loadBalancer.deleteRule(snapshot.ruleRef()));
                progress.clearIf(result, s -> s.toBuilder().ruleRef(null).build());
            }

            if (snapshot.computeServiceRef() != null) {
                StepResult<Void> scaled = steps.bestEffort("scaleToZero",
                    () -> compute.scaleToZero(snapshot.computeServiceRef()));
                if (scaled.outcome() == StepOutcome.SUCCEEDED) {
                    pause(settings.drainWait(), "drain");
                }
                StepResult<Void> deleted = steps.bestEffort("deleteService",
                    () -> compute.deleteService(snapshot.computeServiceRef()));
                progress.clearIf(deleted, s -> s.toBuilder().computeServiceRef(null).build());
            }

            if (snapshot.targetRef() != null) {
                pause(settings.deregistrationWait(), "target deregistration");
                StepResult<Void> result = steps.bestEffort("deleteTarget",
                    () -> loadBalancer.deleteTarget(snapshot.targetRef()));
                progress.clearIf(result, s -> s.toBuilder().targetRef(null).build());
            }

            if (snapshot.registryRef() != null) {
                StepResult<Void> result = steps.bestEffort("deregister",
                    () -> registry.deregister(snapshot.registryRef()));
                progress.clearIf(result, s -> s.toBuilder().registryRef(null).build());
            }

            if (priority != null) {
                StepResult<Boolean> result = steps.bestEffort("releasePriority",
                    () -> allocator.release(settings.routingDomain(), priority, environmentId));
                progress.clearIf(result, s -> s.toBuilder().priority(null).build());
            }

            StepResult<Void> entryDeleted = steps.bestEffort("deleteRoutingEntry",
                () -> routingEntries.delete(environmentId, serviceId));
            progress.record(entryDeleted);

            if (progress.clean) {
                log.info("Tore down {} in {}", serviceId, environmentId);
            } else {
                log.warn("Teardown of {} in {} left resources behind", serviceId, environmentId);
            }
            return progress.clean;
        }
    }

    /**
     * The routing entry is the authoritative record of the priority; the service
     * state covers services whose entry was never written.
     */
    private Integer lookUpPriority(String environmentId, ServiceState snapshot) {
        StepResult<Optional<RoutingEntry>> entry = steps.bestEffort("findRoutingEntry",
            () -> routingEntries.find(environmentId, snapshot.serviceId()));
        if (entry.isSuccess() && entry.value() != null && entry.value().isPresent()) {
            return entry.value().get().priority();
        }
        return snapshot.priority();
    }

    private void pause(Duration wait, String what) {
        if (wait.isZero() || wait.isNegative()) {
            return;
        }
        try {
            log.debug("Waiting {} for {}", wait, what);
            Thread.sleep(wait.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for {}, continuing teardown", what);
        }
    }

    /**
     * Tracks the outcome of one service's teardown and writes cleared handles back.
     */
    private final class Progress {
        private final String environmentId;
        private final String serviceId;
        private final boolean persist;
        private boolean clean = true;

        Progress(String environmentId, String serviceId, boolean persist) {
            this.environmentId = environmentId;
            this.serviceId = serviceId;
            this.persist = persist;
        }

        void record(StepResult<?> result) {
            clean &= result.isSuccess();
        }

        void clearIf(StepResult<?> result, UnaryOperator<ServiceState> clear) {
            record(result);
            if (result.isSuccess()) {
                apply(clear);
            }
        }

        void apply(UnaryOperator<ServiceState> change) {
            if (!persist) {
                return;
            }
            steps.bestEffort("persistTeardownProgress", () -> store.mutate(environmentId, env -> {
                ServiceState current = env.service(serviceId);
                return current == null ? env : env.withService(change.apply(current));
            }));
        }
    }
}
