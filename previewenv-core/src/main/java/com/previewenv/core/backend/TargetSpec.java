package com.previewenv.core.backend;

import com.previewenv.core.model.PreviewableService.HealthCheck;

/**
 * Inputs for creating the routing target of one service.
 */
public record TargetSpec(
    String environmentId,
    String serviceId,
    int port,
    String healthCheckPath,
    HealthCheck healthCheck
) {
    public String name() {
        return ResourceNames.targetName(environmentId, serviceId);
    }
}
