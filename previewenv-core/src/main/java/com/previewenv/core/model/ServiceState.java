package com.previewenv.core.model;

/**
 * Deployment state of one service inside an environment.
 *
 * Handles are null until the provisioning step that produces them succeeds.
 * A service whose deployment aborted keeps the handles it already acquired so
 * a later teardown can reclaim them; teardown clears each handle once the
 * corresponding resource is gone.
 */
public record ServiceState(
    String serviceId,
    ServiceStatus status,

    // Backend handles
    String templateRef,
    String targetRef,
    String ruleRef,
    String registryRef,
    String computeServiceRef,
    Integer priority,

    // Error tracking
    String lastError,
    String errorCode
) {
    /**
     * A service that has not been attempted yet.
     */
    public static ServiceState pending(String serviceId) {
        return new ServiceState(serviceId, ServiceStatus.PENDING,
            null, null, null, null, null, null, null, null);
    }

    public boolean hasComputeService() {
        return computeServiceRef != null;
    }

    /**
     * True while a reclaimable resource or priority is still recorded against this service.
     * Task templates are left registered, so templateRef does not count.
     */
    public boolean holdsResources() {
        return targetRef != null || ruleRef != null || registryRef != null
            || computeServiceRef != null || priority != null;
    }

    public ServiceState withStatus(ServiceStatus newStatus) {
        return toBuilder().status(newStatus).build();
    }

    public ServiceState withFailure(String errorCode, String error) {
        return toBuilder()
            .status(ServiceStatus.FAILED)
            .errorCode(errorCode)
            .lastError(error)
            .build();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static class Builder {
        private final String serviceId;
        private ServiceStatus status;
        private String templateRef;
        private String targetRef;
        private String ruleRef;
        private String registryRef;
        private String computeServiceRef;
        private Integer priority;
        private String lastError;
        private String errorCode;

        public Builder(ServiceState state) {
            this.serviceId = state.serviceId();
            this.status = state.status();
            this.templateRef = state.templateRef();
            this.targetRef = state.targetRef();
            this.ruleRef = state.ruleRef();
            this.registryRef = state.registryRef();
            this.computeServiceRef = state.computeServiceRef();
            this.priority = state.priority();
            this.lastError = state.lastError();
            this.errorCode = state.errorCode();
        }

        public Builder status(ServiceStatus status) {
            this.status = status;
            return this;
        }

        public Builder templateRef(String templateRef) {
            this.templateRef = templateRef;
            return this;
        }

        public Builder targetRef(String targetRef) {
            this.targetRef = targetRef;
            return this;
        }

        public Builder ruleRef(String ruleRef) {
            this.ruleRef = ruleRef;
            return this;
        }

        public Builder registryRef(String registryRef) {
            this.registryRef = registryRef;
            return this;
        }

        public Builder computeServiceRef(String computeServiceRef) {
            this.computeServiceRef = computeServiceRef;
            return this;
        }

        public Builder priority(Integer priority) {
            this.priority = priority;
            return this;
        }

        public Builder lastError(String lastError) {
            this.lastError = lastError;
            return this;
        }

        public Builder errorCode(String errorCode) {
            this.errorCode = errorCode;
            return this;
        }

        public ServiceState build() {
            return new ServiceState(
                serviceId, status, templateRef, targetRef, ruleRef,
                registryRef, computeServiceRef, priority, lastError, errorCode
            );
        }
    }
}
