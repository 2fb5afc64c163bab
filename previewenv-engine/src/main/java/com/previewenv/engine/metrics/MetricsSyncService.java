package com.previewenv.engine.metrics;

import com.previewenv.core.repository.EnvironmentRepository;
import com.previewenv.engine.allocator.PriorityAllocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Periodically syncs gauge metrics from store state.
 * This keeps gauges accurate after restarts and across instances.
 */
public class MetricsSyncService {

    private static final Logger log = LoggerFactory.getLogger(MetricsSyncService.class);

    private final EnvironmentRepository environments;
    private final PriorityAllocator allocator;
    private final String routingDomain;
    private final EnvironmentMetrics metrics;

    public MetricsSyncService(
            EnvironmentRepository environments,
            PriorityAllocator allocator,
            String routingDomain,
            EnvironmentMetrics metrics) {
        this.environments = environments;
        this.allocator = allocator;
        this.routingDomain = routingDomain;
        this.metrics = metrics;
    }

    /**
     * Sync environment status gauges every 30 seconds.
     */
    @Scheduled(fixedRate = 30000, initialDelay = 5000)
    public void syncEnvironmentGauges() {
        try {
            metrics.syncStatusCounts(environments.countByStatus());
            log.debug("Synced environment status gauges");
        } catch (Exception e) {
            log.warn("Failed to sync environment status gauges: {}", e.getMessage());
        }
    }

    /**
     * Sync the allocated priority gauge every 30 seconds.
     */
    @Scheduled(fixedRate = 30000, initialDelay = 10000)
    public void syncPriorityGauge() {
        try {
            metrics.syncAllocatedPriorities(allocator.usage(routingDomain).used());
            log.debug("Synced allocated priority gauge");
        } catch (Exception e) {
            log.warn("Failed to sync allocated priority gauge: {}", e.getMessage());
        }
    }
}
