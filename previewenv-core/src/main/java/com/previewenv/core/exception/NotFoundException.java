package com.previewenv.core.exception;

/**
 * Thrown when an environment or routing entry is not found.
 */
public class NotFoundException extends PreviewEnvException {

    public static final String ERROR_CODE = "NOT_FOUND";

    public NotFoundException(String entityType, String entityId) {
        super(ERROR_CODE, String.format(
            "%s not found: %s",
            entityType, entityId
        ));
    }
}
