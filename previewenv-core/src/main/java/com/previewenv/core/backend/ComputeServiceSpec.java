package com.previewenv.core.backend;

/**
 * Inputs for creating a compute service bound to its routing target.
 * registryRef is null when discovery registration was skipped or failed.
 */
public record ComputeServiceSpec(
    String environmentId,
    String serviceId,
    String templateRef,
    String targetRef,
    String registryRef,
    int containerPort
) {
    public String name() {
        return ResourceNames.serviceName(environmentId, serviceId);
    }
}
