package com.previewenv.core.backend;

/**
 * Naming of backend resources created for an environment.
 */
public final class ResourceNames {

    private static final int TARGET_NAME_MAX = 32;

    private ResourceNames() {
    }

    /**
     * Name shared by the task template family, compute service and registry entry.
     */
    public static String serviceName(String environmentId, String serviceId) {
        return environmentId + "-" + serviceId;
    }

    /**
     * Target names are limited to 32 characters, so both parts are truncated.
     */
    public static String targetName(String environmentId, String serviceId) {
        String name = truncate(environmentId, 20) + "-" + truncate(serviceId, 10);
        return truncate(name, TARGET_NAME_MAX);
    }

    private static String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max);
    }
}
