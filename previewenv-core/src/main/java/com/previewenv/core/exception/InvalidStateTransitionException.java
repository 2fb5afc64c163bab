package com.previewenv.core.exception;

import com.previewenv.core.model.EnvironmentStatus;

/**
 * Thrown when an operation requires an environment state it is not in.
 */
public class InvalidStateTransitionException extends PreviewEnvException {

    public static final String ERROR_CODE = "INVALID_STATE_TRANSITION";

    public InvalidStateTransitionException(String environmentId, EnvironmentStatus current, EnvironmentStatus target) {
        super(ERROR_CODE, String.format(
            "Cannot transition environment %s from %s to %s",
            environmentId, current, target
        ));
    }

    public InvalidStateTransitionException(String environmentId, EnvironmentStatus current, String operation) {
        super(ERROR_CODE, String.format(
            "Cannot %s environment %s in state %s",
            operation, environmentId, current
        ));
    }
}
