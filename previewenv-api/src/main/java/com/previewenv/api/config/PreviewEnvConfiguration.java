package com.previewenv.api.config;

import com.previewenv.core.backend.ComputeBackend;
import com.previewenv.core.backend.LoadBalancerBackend;
import com.previewenv.core.backend.ServiceRegistryBackend;
import com.previewenv.core.model.PreviewableService;
import com.previewenv.core.model.PriorityRange;
import com.previewenv.core.repository.EnvironmentRepository;
import com.previewenv.core.repository.PriorityAllocationRepository;
import com.previewenv.core.repository.RoutingEntryRepository;
import com.previewenv.engine.allocator.PriorityAllocator;
import com.previewenv.engine.catalog.ServiceCatalog;
import com.previewenv.engine.controller.ControllerSettings;
import com.previewenv.engine.controller.EnvironmentController;
import com.previewenv.engine.controller.ServiceDeployer;
import com.previewenv.engine.controller.ServiceTeardown;
import com.previewenv.engine.health.PreviewEnvHealthIndicator;
import com.previewenv.engine.metrics.EnvironmentMetrics;
import com.previewenv.engine.metrics.MetricsSyncService;
import com.previewenv.engine.service.EnvironmentQueryService;
import com.previewenv.engine.step.StepExecutor;
import com.previewenv.engine.store.EnvironmentStore;
import com.previewenv.sweeper.ReconcilingSweeper;
import com.previewenv.sweeper.SweeperSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Wires the engine, sweeper and backends from {@link PreviewEnvProperties}.
 * Engine classes take plain settings records and know nothing about Spring.
 */
@Configuration
@EnableConfigurationProperties(PreviewEnvProperties.class)
public class PreviewEnvConfiguration {

    private static final Logger log = LoggerFactory.getLogger(PreviewEnvConfiguration.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // ========== Settings ==========

    /**
     * @throws com.previewenv.core.exception.InvalidConfigurationException if the preview
     *         priority range overlaps a reserved range or a required value is missing
     */
    @Bean
    public ControllerSettings controllerSettings(PreviewEnvProperties properties) {
        PreviewEnvProperties.Priorities priorities = properties.getPriorities();
        PriorityRange range = new PriorityRange(priorities.getStart(), priorities.getEnd());
        range.requireDisjointFrom(priorities.getReserved().stream()
            .map(r -> new PriorityRange(r.getStart(), r.getEnd()))
            .toArray(PriorityRange[]::new));

        ControllerSettings settings = new ControllerSettings(
            properties.getDomainName(),
            properties.getRoutingDomain(),
            range,
            properties.getTtl().getDefaultTtl(),
            properties.getTtl().getMax(),
            properties.getTeardown().getDrainWait(),
            properties.getTeardown().getDeregistrationWait());
        log.info("Preview priorities {} on {}", range, settings.routingDomain());
        return settings;
    }

    @Bean
    public SweeperSettings sweeperSettings(PreviewEnvProperties properties) {
        PreviewEnvProperties.Sweeper sweeper = properties.getSweeper();
        return new SweeperSettings(sweeper.getInterval(), sweeper.getGracePeriod(),
            sweeper.getBatchSize(), sweeper.getRetention(), sweeper.getPurgeInterval());
    }

    @Bean
    public ServiceCatalog serviceCatalog(PreviewEnvProperties properties) {
        List<PreviewableService> services = properties.getServices().stream()
            .map(PreviewEnvConfiguration::toPreviewableService)
            .collect(Collectors.toList());
        log.info("Service catalog: {}", services.stream()
            .map(PreviewableService::serviceId)
            .collect(Collectors.joining(", ")));
        return new ServiceCatalog(services);
    }

    static PreviewableService toPreviewableService(PreviewEnvProperties.Service service) {
        return new PreviewableService(
            service.getServiceId(),
            service.getRepository(),
            service.getPathPattern(),
            service.getPort(),
            service.getHealthCheckPath(),
            service.getCpu(),
            service.getMemory(),
            service.getImage(),
            service.getEnvironment(),
            service.isEnabled(),
            null);
    }

    // ========== Engine ==========

    @Bean
    public EnvironmentStore environmentStore(EnvironmentRepository environments, Clock clock) {
        return new EnvironmentStore(environments, clock);
    }

    @Bean
    public PriorityAllocator priorityAllocator(PriorityAllocationRepository allocations,
                                               ControllerSettings settings, Clock clock) {
        return new PriorityAllocator(allocations, settings.priorityRange(), clock);
    }

    @Bean
    public StepExecutor stepExecutor(EnvironmentMetrics metrics) {
        return new StepExecutor(metrics);
    }

    @Bean
    public ServiceDeployer serviceDeployer(
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
        return new ServiceDeployer(store, routingEntries, allocator, compute, loadBalancer, registry,
            teardown, steps, metrics, settings, clock);
    }

    @Bean
    public ServiceTeardown serviceTeardown(
            EnvironmentStore store,
            RoutingEntryRepository routingEntries,
            PriorityAllocator allocator,
            ComputeBackend compute,
            LoadBalancerBackend loadBalancer,
            ServiceRegistryBackend registry,
            StepExecutor steps,
            ControllerSettings settings) {
        return new ServiceTeardown(store, routingEntries, allocator, compute, loadBalancer, registry,
            steps, settings);
    }

    @Bean
    public EnvironmentController environmentController(
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
        return new EnvironmentController(store, routingEntries, allocator, catalog, deployer, teardown,
            steps, metrics, settings, clock);
    }

    @Bean
    public EnvironmentQueryService environmentQueryService(
            EnvironmentStore store,
            EnvironmentRepository environments,
            RoutingEntryRepository routingEntries,
            PriorityAllocator allocator,
            ControllerSettings settings) {
        return new EnvironmentQueryService(store, environments, routingEntries, allocator, settings);
    }

    // ========== Background ==========

    /**
     * The sweeper is always available for manual passes; its schedule only runs when enabled.
     */
    @Bean(destroyMethod = "stop")
    public ReconcilingSweeper reconcilingSweeper(
            EnvironmentRepository environments,
            PriorityAllocationRepository allocations,
            EnvironmentController controller,
            EnvironmentMetrics metrics,
            SweeperSettings settings,
            Clock clock,
            PreviewEnvProperties properties) {
        ReconcilingSweeper sweeper = new ReconcilingSweeper(environments, allocations, controller,
            metrics, settings, clock);
        if (properties.getSweeper().isEnabled()) {
            sweeper.start();
        } else {
            log.info("Scheduled sweeps disabled");
        }
        return sweeper;
    }

    @Bean
    public MetricsSyncService metricsSyncService(EnvironmentRepository environments,
                                                 PriorityAllocator allocator,
                                                 ControllerSettings settings,
                                                 EnvironmentMetrics metrics) {
        return new MetricsSyncService(environments, allocator, settings.routingDomain(), metrics);
    }

    @Bean
    public PreviewEnvHealthIndicator previewEnvHealthIndicator(ObjectProvider<JdbcTemplate> jdbcTemplate,
                                                               EnvironmentQueryService queries) {
        return new PreviewEnvHealthIndicator(jdbcTemplate, queries);
    }
}
