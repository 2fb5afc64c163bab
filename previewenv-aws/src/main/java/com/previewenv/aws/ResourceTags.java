package com.previewenv.aws;

/**
 * Tag keys put on every resource created for an environment.
 */
final class ResourceTags {

    static final String ENVIRONMENT = "virtual-env-id";
    static final String SERVICE = "service-id";
    static final String COMMIT = "commit-ref";

    private ResourceTags() {
    }
}
