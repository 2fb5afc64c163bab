package com.previewenv.core.model;

/**
 * Per-service deployment state inside an environment.
 */
public enum ServiceStatus {
    PENDING,
    DEPLOYING,
    ACTIVE,
    FAILED,
    DESTROYING
}
