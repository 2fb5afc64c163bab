package com.previewenv.core.backend;

/**
 * Container compute substrate.
 *
 * Implementations throw {@link com.previewenv.core.exception.ResourceNotFoundException}
 * when a referenced resource is already gone, and
 * {@link com.previewenv.core.exception.BackendException} for any other failure.
 */
public interface ComputeBackend {

    /**
     * @return reference to the registered task template
     */
    String registerTaskTemplate(TaskTemplateSpec spec);

    /**
     * @return reference to the created compute service
     */
    String createService(ComputeServiceSpec spec);

    /**
     * Roll the service's tasks in place without touching its routing.
     */
    void forceRedeploy(String serviceRef);

    void scaleToZero(String serviceRef);

    void deleteService(String serviceRef);
}
