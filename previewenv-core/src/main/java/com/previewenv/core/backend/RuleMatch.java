package com.previewenv.core.backend;

/**
 * Compound match condition of a listener rule: header value AND path pattern.
 */
public record RuleMatch(
    String headerName,
    String headerValue,
    String pathPattern
) {
    public static final String ENVIRONMENT_HEADER = "x-virtual-env-id";

    public static RuleMatch forEnvironment(String environmentId, String pathPattern) {
        return new RuleMatch(ENVIRONMENT_HEADER, environmentId, pathPattern);
    }
}
