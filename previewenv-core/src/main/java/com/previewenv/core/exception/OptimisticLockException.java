package com.previewenv.core.exception;

/**
 * Thrown when a conditional write finds the record at a different version.
 */
public class OptimisticLockException extends PreviewEnvException {

    public static final String ERROR_CODE = "OPTIMISTIC_LOCK_CONFLICT";

    public OptimisticLockException(String entityType, String entityId, long expectedVersion) {
        super(ERROR_CODE, String.format(
            "Optimistic lock conflict on %s[%s]: expected version %d",
            entityType, entityId, expectedVersion
        ));
    }
}
