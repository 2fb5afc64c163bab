package com.previewenv.engine.catalog;

import com.previewenv.core.exception.InvalidConfigurationException;
import com.previewenv.core.model.PreviewableService;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The services that can be deployed into preview environments, in deployment order.
 */
public class ServiceCatalog {

    private final List<PreviewableService> services;

    public ServiceCatalog(List<PreviewableService> services) {
        Set<String> seen = new HashSet<>();
        for (PreviewableService service : services) {
            if (!seen.add(service.serviceId())) {
                throw new InvalidConfigurationException("Duplicate service id in catalog: " + service.serviceId());
            }
        }
        this.services = List.copyOf(services);
    }

    /**
     * Enabled services built from the given repository.
     */
    public List<PreviewableService> servicesFor(String repository) {
        return services.stream()
            .filter(s -> s.matches(repository))
            .collect(Collectors.toList());
    }

    public Optional<PreviewableService> findById(String serviceId) {
        return services.stream()
            .filter(s -> s.enabled() && s.serviceId().equals(serviceId))
            .findFirst();
    }

    public List<PreviewableService> allEnabled() {
        return services.stream()
            .filter(PreviewableService::enabled)
            .collect(Collectors.toList());
    }
}
