package com.previewenv.engine.controller;

import com.previewenv.core.backend.*;
import com.previewenv.core.exception.ResourceExhaustedException;
import com.previewenv.core.exception.StepFailedException;
import com.previewenv.core.model.Environment;
import com.previewenv.core.model.EnvironmentStatus;
import com.previewenv.core.model.PreviewableService;
import com.previewenv.core.model.RoutingEntry;
import com.previewenv.core.model.ServiceState;
import com.previewenv.core.model.ServiceStatus;
import com.previewenv.core.repository.RoutingEntryRepository;
import com.previewenv.engine.allocator.PriorityAllocator;
import com.previewenv.engine.logging.LoggingContext;
import com.previewenv.engine.metrics.EnvironmentMetrics;
import com.previewenv.engine.step.StepExecutor;
import com.previewenv.engine.step.StepResult;
import com.previewenv.engine.store.EnvironmentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Deploys one catalog service into an environment.
 *
 * Each handle is stored as soon as the step that produced it succeeded, so an
 * aborted deployment leaves behind exactly what a teardown needs to reclaim.
 * A failed critical step marks only this service FAILED.
 */
public class ServiceDeployer {

    private static final Logger log = LoggerFactory.getLogger(ServiceDeployer.class);

    static final String ROLLED_BACK = "ROLLED_BACK";

    private final EnvironmentStore store;
    private final RoutingEntryRepository routingEntries;
    private final PriorityAllocator allocator;
    private final ComputeBackend compute;
    private final LoadBalancerBackend loadBalancer;
    private final ServiceRegistryBackend registry;
    private final ServiceTeardown teardown;
    private final StepExecutor steps;
    private final EnvironmentMetrics metrics;
    private final ControllerSettings settings;
    private final Clock clock;

    public ServiceDeployer(
            EnvironmentStore store,
            RoutingEntryRepository routingEntries,
            PriorityAllocator allocator,
            ComputeBackend compute,
            LoadBalancerBackend loadBalancer,
            ServiceRegistryBackend registry,
            ServiceTeardown teardown,
            StepExecutor steps,
            EnvironmentMetrics metrics,
            ControllerSettings settings,
            Clock clock) {
        this.store = store;
        this.routingEntries = routingEntries;
        this.allocator = allocator;
        this.compute = compute;
        this.loadBalancer = loadBalancer;
        this.registry = registry;
        this.teardown = teardown;
        this.steps = steps;
        this.metrics = metrics;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Deploy a service that is not yet part of the environment.
     *
     * If the environment leaves its live states while the steps run, the
     * resources acquired so far are torn down again and null is returned.
     *
     * @return final state of the service, or null if another action already claimed it
     *         or the environment was no longer live
     */
    public ServiceState deploy(Environment environment, PreviewableService service) {
        String environmentId = environment.environmentId();
        String serviceId = service.serviceId();

        try (var scope = LoggingContext.forService(serviceId)) {
            if (!claim(environmentId, serviceId)) {
                return null;
            }

            log.info("Deploying {} into {}", serviceId, environmentId);
            Deployment deployment = new Deployment(environmentId, serviceId);
            try {
                try {
                    ServiceState deployed = runSteps(deployment, environment, service);
                    metrics.serviceDeployed(serviceId, true, null);
                    log.info("Deployed {} into {} at priority {}", serviceId, environmentId, deployed.priority());
                    return deployed;
                } catch (StepFailedException e) {
                    return recordFailure(deployment, e);
                }
            } catch (DeploymentAborted e) {
                rollBack(deployment, e.status);
                return null;
            }
        }
    }

    /**
     * Roll an already deployed service onto a new revision. Failures are logged, not raised.
     */
    public boolean redeploy(String environmentId, ServiceState state) {
        try (var scope = LoggingContext.forService(state.serviceId())) {
            StepResult<Void> result = steps.bestEffort("forceRedeploy",
                () -> compute.forceRedeploy(state.computeServiceRef()));
            if (result.isSuccess()) {
                log.info("Forced new deployment of {} in {}", state.serviceId(), environmentId);
            }
            return result.isSuccess();
        }
    }

    // ========== Steps ==========

    private ServiceState runSteps(Deployment deployment, Environment environment, PreviewableService service) {
        String environmentId = environment.environmentId();
        String serviceId = service.serviceId();

        String templateRef = steps.critical("registerTaskTemplate", () -> compute.registerTaskTemplate(
            new TaskTemplateSpec(environmentId, serviceId, environment.commitRef(), service.image(),
                service.cpu(), service.memory(), service.port(), service.healthCheckPath(),
                service.environment())));
        deployment.record(s -> s.toBuilder().templateRef(templateRef).build());

        String targetRef = steps.critical("createTarget", () -> loadBalancer.createTarget(
            new TargetSpec(environmentId, serviceId, service.port(), service.healthCheckPath(),
                service.healthCheck())));
        deployment.record(s -> s.toBuilder().targetRef(targetRef).build());

        int priority = steps.critical("allocatePriority", () -> allocator.allocate(
            settings.routingDomain(), environmentId, serviceId, environment.expiresAt()));
        deployment.record(s -> s.toBuilder().priority(priority).build());

        String ruleRef;
        try {
            ruleRef = steps.critical("createRule", () -> loadBalancer.createRule(
                RuleMatch.forEnvironment(environmentId, service.pathPattern()), targetRef, priority));
        } catch (StepFailedException e) {
            StepResult<Boolean> released = steps.bestEffort("releasePriority",
                () -> allocator.release(settings.routingDomain(), priority, environmentId));
            if (released.isSuccess()) {
                deployment.record(s -> s.toBuilder().priority(null).build());
            }
            throw e;
        }
        deployment.record(s -> s.toBuilder().ruleRef(ruleRef).build());

        String registryRef = steps.bestEffort("registerDiscovery",
            () -> registry.register(new RegistrySpec(environmentId, serviceId))).value();
        if (registryRef != null) {
            deployment.record(s -> s.toBuilder().registryRef(registryRef).build());
        }

        String computeServiceRef = steps.critical("createService", () -> compute.createService(
            new ComputeServiceSpec(environmentId, serviceId, templateRef, targetRef, registryRef, service.port())));
        deployment.record(s -> s.toBuilder().computeServiceRef(computeServiceRef).build());

        RoutingEntry entry = RoutingEntry.from(environmentId, deployment.acquired(),
            environment.expiresAt(), clock.instant());
        steps.critical("saveRoutingEntry", () -> {
            routingEntries.save(entry);
            return entry;
        });

        return deployment.record(s -> s.toBuilder()
            .status(ServiceStatus.ACTIVE)
            .lastError(null)
            .errorCode(null)
            .build());
    }

    /**
     * Add the service in DEPLOYING unless some action already added it or the
     * environment is no longer live.
     * The outcome is reset on every attempt, so its final value belongs to the write that was stored.
     */
    private boolean claim(String environmentId, String serviceId) {
        AtomicReference<EnvironmentStatus> refusedIn = new AtomicReference<>();
        AtomicBoolean claimed = new AtomicBoolean(false);
        store.mutate(environmentId, env -> {
            claimed.set(false);
            refusedIn.set(null);
            if (!env.status().isLive()) {
                refusedIn.set(env.status());
                return env;
            }
            if (env.service(serviceId) != null) {
                return env;
            }
            claimed.set(true);
            return env.withService(ServiceState.pending(serviceId).withStatus(ServiceStatus.DEPLOYING));
        });
        if (refusedIn.get() != null) {
            log.info("Not deploying {}: {} is {}", serviceId, environmentId, refusedIn.get());
        } else if (!claimed.get()) {
            log.info("Service {} already present in {}, leaving it to the action that added it",
                serviceId, environmentId);
        }
        return claimed.get();
    }

    private ServiceState recordFailure(Deployment deployment, StepFailedException e) {
        String environmentId = deployment.environmentId;
        String serviceId = deployment.serviceId;
        String errorCode = e.getErrorCode();
        if (ResourceExhaustedException.ERROR_CODE.equals(errorCode)) {
            log.error("Capacity exhausted deploying {} into {}: {}", serviceId, environmentId, e.getMessage());
            metrics.capacityExhausted(settings.routingDomain());
        } else {
            log.warn("Deployment of {} into {} failed at {}: {}", serviceId, environmentId, e.getStep(), e.getMessage());
        }
        metrics.serviceDeployed(serviceId, false, errorCode);
        return deployment.record(s -> s.withFailure(errorCode, e.getMessage()));
    }

    /**
     * A teardown that started mid-deployment only saw the handles recorded before it,
     * so everything this deployment acquired is reclaimed from its own copy.
     */
    private void rollBack(Deployment deployment, EnvironmentStatus status) {
        ServiceState acquired = deployment.acquired();
        log.warn("{} became {} while deploying {}, rolling back", deployment.environmentId, status,
            deployment.serviceId);
        metrics.serviceDeployed(deployment.serviceId, false, ROLLED_BACK);
        if (acquired.holdsResources()) {
            teardown.tearDown(deployment.environmentId, acquired, false);
        }
    }

    /**
     * Handles acquired by one deployment, kept locally and written through to the record.
     */
    private final class Deployment {
        private final String environmentId;
        private final String serviceId;
        private ServiceState acquired;

        Deployment(String environmentId, String serviceId) {
            this.environmentId = environmentId;
            this.serviceId = serviceId;
            this.acquired = ServiceState.pending(serviceId).withStatus(ServiceStatus.DEPLOYING);
        }

        ServiceState acquired() {
            return acquired;
        }

        /**
         * @throws DeploymentAborted if the environment is gone, no longer live or no longer lists the service
         */
        ServiceState record(UnaryOperator<ServiceState> change) {
            acquired = change.apply(acquired);
            AtomicReference<EnvironmentStatus> refusedIn = new AtomicReference<>();
            Optional<Environment> stored = store.mutate(environmentId, env -> {
                refusedIn.set(null);
                ServiceState current = env.service(serviceId);
                if (!env.status().isLive() || current == null) {
                    refusedIn.set(env.status());
                    return env;
                }
                return env.withService(change.apply(current));
            });
            if (stored.isEmpty() || refusedIn.get() != null) {
                throw new DeploymentAborted(refusedIn.get());
            }
            return stored.get().service(serviceId);
        }
    }

    private static final class DeploymentAborted extends RuntimeException {
        private final EnvironmentStatus status;

        DeploymentAborted(EnvironmentStatus status) {
            super("Environment left its live states: " + status, null, false, false);
            this.status = status;
        }
    }
}
