package com.previewenv.core.backend;

import java.util.Map;

/**
 * Inputs for registering a task template of one service in one environment.
 */
public record TaskTemplateSpec(
    String environmentId,
    String serviceId,
    String commitRef,
    String image,
    int cpu,
    int memory,
    int port,
    String healthCheckPath,
    Map<String, String> environment
) {
    public TaskTemplateSpec {
        environment = environment == null ? Map.of() : Map.copyOf(environment);
    }

    public String family() {
        return ResourceNames.serviceName(environmentId, serviceId);
    }
}
