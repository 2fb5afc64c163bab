package com.previewenv.core.backend;

/**
 * Inputs for registering a service discovery entry.
 */
public record RegistrySpec(String environmentId, String serviceId) {

    public String name() {
        return ResourceNames.serviceName(environmentId, serviceId);
    }
}
