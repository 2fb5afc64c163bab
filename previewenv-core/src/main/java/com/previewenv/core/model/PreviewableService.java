package com.previewenv.core.model;

import java.util.Map;

/**
 * Catalog entry for a service that can be deployed into preview environments.
 * A service is deployed for actions whose repository matches {@link #repository()}.
 */
public record PreviewableService(
    String serviceId,
    String repository,
    String pathPattern,
    int port,
    String healthCheckPath,
    int cpu,
    int memory,
    String image,
    Map<String, String> environment,
    boolean enabled,
    HealthCheck healthCheck
) {
    public PreviewableService {
        environment = environment == null ? Map.of() : Map.copyOf(environment);
        healthCheck = healthCheck == null ? HealthCheck.defaults() : healthCheck;
    }

    public boolean matches(String repository) {
        return enabled && this.repository.equals(repository);
    }

    /**
     * Load balancer health check tuning, in seconds and counts.
     */
    public record HealthCheck(
        int intervalSeconds,
        int timeoutSeconds,
        int healthyThreshold,
        int unhealthyThreshold
    ) {
        public static HealthCheck defaults() {
            return new HealthCheck(30, 5, 2, 3);
        }
    }
}
