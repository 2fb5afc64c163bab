package com.previewenv.core.exception;

/**
 * Thrown when a lifecycle action is missing required fields.
 */
public class InvalidActionException extends PreviewEnvException {

    public static final String ERROR_CODE = "INVALID_ACTION";

    public InvalidActionException(String message) {
        super(ERROR_CODE, message);
    }
}
