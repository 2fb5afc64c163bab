package com.previewenv.sweeper;

import com.previewenv.core.model.Environment;
import com.previewenv.core.model.EnvironmentStatus;
import com.previewenv.core.model.LifecycleAction;
import com.previewenv.core.repository.EnvironmentRepository;
import com.previewenv.core.repository.PriorityAllocationRepository;
import com.previewenv.engine.logging.LoggingContext;
import com.previewenv.engine.metrics.EnvironmentMetrics;
import com.previewenv.engine.service.LifecycleActionHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Reconciling sweeper responsible for environments the event path left behind.
 *
 * Responsibilities:
 * - Destroy ACTIVE environments past their expiry
 * - Destroy environments stuck in CREATING/UPDATING past expiry plus a grace period
 * - Purge DESTROYED records and stale priority allocations after the retention window
 *
 * Destroys go through the same entry point as events, so a sweep racing an
 * event-driven DESTROY converges the same way two duplicate events do.
 */
public class ReconcilingSweeper {

    private static final Logger log = LoggerFactory.getLogger(ReconcilingSweeper.class);

    private final EnvironmentRepository environments;
    private final PriorityAllocationRepository allocations;
    private final LifecycleActionHandler handler;
    private final EnvironmentMetrics metrics;
    private final SweeperSettings settings;
    private final Clock clock;

    private final ScheduledExecutorService scheduler;
    private volatile boolean running = false;

    public ReconcilingSweeper(
            EnvironmentRepository environments,
            PriorityAllocationRepository allocations,
            LifecycleActionHandler handler,
            EnvironmentMetrics metrics,
            SweeperSettings settings,
            Clock clock) {
        this.environments = environments;
        this.allocations = allocations;
        this.handler = handler;
        this.metrics = metrics;
        this.settings = settings;
        this.clock = clock;
        this.scheduler = Executors.newScheduledThreadPool(1);
    }

    /**
     * Start periodic sweeps and purges.
     */
    public void start() {
        if (running) {
            log.warn("Sweeper already running");
            return;
        }

        running = true;
        log.info("Starting sweeper (interval {}, grace {})", settings.interval(), settings.gracePeriod());

        scheduler.scheduleWithFixedDelay(
            this::scheduledSweep,
            settings.interval().toMillis(),
            settings.interval().toMillis(),
            TimeUnit.MILLISECONDS
        );

        scheduler.scheduleWithFixedDelay(
            this::scheduledPurge,
            settings.purgeInterval().toMillis(),
            settings.purgeInterval().toMillis(),
            TimeUnit.MILLISECONDS
        );

        log.info("Sweeper started");
    }

    /**
     * Stop the sweeper.
     */
    public void stop() {
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Sweeper stopped");
    }

    public boolean isRunning() {
        return running;
    }

    private void scheduledSweep() {
        if (!running) return;

        try {
            sweep();
        } catch (Exception e) {
            log.error("Error in sweep", e);
        }
    }

    private void scheduledPurge() {
        if (!running) return;

        try {
            purge();
        } catch (Exception e) {
            log.error("Error in retention purge", e);
        }
    }

    // ========== Sweep ==========

    /**
     * Run one sweep pass. A failing destroy is logged and the pass continues.
     */
    public SweepReport sweep() {
        try (var ctx = LoggingContext.forSweep()) {
            Instant now = clock.instant();

            List<Environment> expired = environments.findExpiringBefore(
                Set.of(EnvironmentStatus.ACTIVE), now, settings.batchSize());
            List<Environment> overdue = environments.findExpiringBefore(
                Set.of(EnvironmentStatus.CREATING, EnvironmentStatus.UPDATING),
                now.minus(settings.gracePeriod()), settings.batchSize());

            // expired wins when an environment shows up in both scans
            Map<String, LifecycleAction> toDestroy = new LinkedHashMap<>();
            for (Environment env : expired) {
                toDestroy.putIfAbsent(env.environmentId(),
                    LifecycleAction.destroy(env, LifecycleAction.REASON_TTL_EXPIRED));
            }
            for (Environment env : overdue) {
                toDestroy.putIfAbsent(env.environmentId(),
                    LifecycleAction.destroy(env, LifecycleAction.REASON_STUCK_TRANSITION));
            }

            if (toDestroy.isEmpty()) {
                log.debug("Sweep found nothing to destroy");
                return SweepReport.empty();
            }

            log.info("Sweep found {} expired and {} overdue environments", expired.size(), overdue.size());

            int dispatched = 0;
            List<String> failed = new ArrayList<>();
            for (LifecycleAction action : toDestroy.values()) {
                try {
                    handler.handle(action);
                    dispatched++;
                    metrics.sweepDispatched(action.reason(), true);
                } catch (Exception e) {
                    failed.add(action.environmentId());
                    metrics.sweepDispatched(action.reason(), false);
                    log.error("Sweep DESTROY of {} ({}) failed: {}",
                        action.environmentId(), action.reason(), e.getMessage());
                }
            }

            SweepReport report = new SweepReport(expired.size(), overdue.size(), dispatched, failed);
            log.info("Sweep summary: expired={}, overdue={}, dispatched={}, failed={}",
                report.expired(), report.overdue(), report.dispatched(), report.failed().size());
            return report;
        }
    }

    // ========== Purge ==========

    /**
     * Delete DESTROYED records and allocations that expired longer ago than the retention window.
     */
    public PurgeReport purge() {
        Instant cutoff = clock.instant().minus(settings.retention());
        int purgedEnvironments = environments.deleteDestroyedBefore(cutoff);
        int purgedAllocations = allocations.deleteExpiredBefore(cutoff);
        if (purgedEnvironments > 0 || purgedAllocations > 0) {
            log.info("Purged {} destroyed environments and {} stale allocations older than {}",
                purgedEnvironments, purgedAllocations, cutoff);
        }
        return new PurgeReport(purgedEnvironments, purgedAllocations);
    }
}
