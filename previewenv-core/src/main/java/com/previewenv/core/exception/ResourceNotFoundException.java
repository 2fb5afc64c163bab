package com.previewenv.core.exception;

/**
 * A backend resource referenced by a handle no longer exists.
 * Teardown treats this as success.
 */
public class ResourceNotFoundException extends PreviewEnvException {

    public static final String ERROR_CODE = "RESOURCE_NOT_FOUND";

    public ResourceNotFoundException(String resourceType, String ref, Throwable cause) {
        super(ERROR_CODE, String.format("%s not found: %s", resourceType, ref), cause);
    }

    public ResourceNotFoundException(String resourceType, String ref) {
        super(ERROR_CODE, String.format("%s not found: %s", resourceType, ref));
    }
}
