package com.previewenv.engine.metrics;

import com.previewenv.core.model.EnvironmentStatus;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.binder.MeterBinder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Metrics for the preview environment controller.
 *
 * Metrics exposed:
 * - Lifecycle actions by type, plan and outcome, with duration
 * - Service deployments by outcome
 * - Step failures by step and criticality
 * - Capacity exhaustion events
 * - Sweeper dispatches
 * - Environment counts by status and allocated priorities (synced gauges)
 */
public class EnvironmentMetrics implements MeterBinder {

    public static final String ACTIONS = "previewenv.actions";
    public static final String ACTION_DURATION = "previewenv.action.duration";
    public static final String SERVICE_DEPLOYMENTS = "previewenv.service.deployments";
    public static final String STEP_FAILURES = "previewenv.step.failures";
    public static final String CAPACITY_EXHAUSTED = "previewenv.capacity.exhausted";
    public static final String SWEEP_DISPATCHES = "previewenv.sweeper.dispatches";
    public static final String ENVIRONMENTS = "previewenv.environments";
    public static final String PRIORITIES_ALLOCATED = "previewenv.priorities.allocated";

    private MeterRegistry registry = new SimpleMeterRegistry();

    private final Map<EnvironmentStatus, AtomicInteger> statusGauges = new EnumMap<>(EnvironmentStatus.class);
    private final AtomicInteger allocatedPriorities = new AtomicInteger(0);

    public EnvironmentMetrics() {
        for (EnvironmentStatus status : EnvironmentStatus.values()) {
            statusGauges.put(status, new AtomicInteger(0));
        }
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;

        statusGauges.forEach((status, gauge) ->
            Gauge.builder(ENVIRONMENTS, gauge, AtomicInteger::get)
                .tag("status", status.name())
                .description("Number of environments in " + status + " state")
                .register(registry));

        Gauge.builder(PRIORITIES_ALLOCATED, allocatedPriorities, AtomicInteger::get)
            .description("Routing priorities currently allocated to preview environments")
            .register(registry);
    }

    // ========== Action Metrics ==========

    public void actionCompleted(String action, String plan, Duration duration) {
        Counter.builder(ACTIONS)
            .tag("action", action)
            .tag("plan", plan)
            .tag("outcome", "success")
            .description("Lifecycle actions handled")
            .register(registry)
            .increment();

        Timer.builder(ACTION_DURATION)
            .tag("action", action)
            .tag("outcome", "success")
            .description("Lifecycle action duration")
            .register(registry)
            .record(duration);
    }

    public void actionFailed(String action, String errorCode, Duration duration) {
        Counter.builder(ACTIONS)
            .tag("action", action)
            .tag("plan", "unknown")
            .tag("outcome", "failure")
            .tag("error_code", errorCode)
            .description("Lifecycle actions handled")
            .register(registry)
            .increment();

        Timer.builder(ACTION_DURATION)
            .tag("action", action)
            .tag("outcome", "failure")
            .description("Lifecycle action duration")
            .register(registry)
            .record(duration);
    }

    // ========== Service Metrics ==========

    public void serviceDeployed(String serviceId, boolean success, String errorCode) {
        Counter.builder(SERVICE_DEPLOYMENTS)
            .tag("service", serviceId)
            .tag("outcome", success ? "success" : "failure")
            .tag("error_code", errorCode == null ? "none" : errorCode)
            .description("Service deployments attempted")
            .register(registry)
            .increment();
    }

    public void stepFailed(String step, boolean critical) {
        Counter.builder(STEP_FAILURES)
            .tag("step", step)
            .tag("critical", String.valueOf(critical))
            .description("Backend step failures")
            .register(registry)
            .increment();
    }

    public void capacityExhausted(String routingDomain) {
        Counter.builder(CAPACITY_EXHAUSTED)
            .tag("domain", routingDomain)
            .description("Allocations rejected because the priority range was full")
            .register(registry)
            .increment();
    }

    // ========== Sweeper Metrics ==========

    public void sweepDispatched(String reason, boolean success) {
        Counter.builder(SWEEP_DISPATCHES)
            .tag("reason", reason)
            .tag("success", String.valueOf(success))
            .description("DESTROY actions issued by the sweeper")
            .register(registry)
            .increment();
    }

    // ========== Gauge Sync ==========

    /**
     * Update gauges from store state (accurate after restart and across instances).
     */
    public void syncStatusCounts(Map<EnvironmentStatus, Long> counts) {
        statusGauges.forEach((status, gauge) ->
            gauge.set(counts.getOrDefault(status, 0L).intValue()));
    }

    public void syncAllocatedPriorities(int count) {
        allocatedPriorities.set(count);
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
