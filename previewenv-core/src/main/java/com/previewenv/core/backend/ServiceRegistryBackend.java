package com.previewenv.core.backend;

/**
 * Service discovery. Both operations are best-effort from the controller's point of view.
 */
public interface ServiceRegistryBackend {

    /**
     * @return reference to the registry entry, passed on to the compute service
     */
    String register(RegistrySpec spec);

    void deregister(String registryRef);
}
