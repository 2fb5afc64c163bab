package com.previewenv.core.exception;

/**
 * Thrown at startup for configuration the controller cannot run with.
 */
public class InvalidConfigurationException extends PreviewEnvException {

    public static final String ERROR_CODE = "INVALID_CONFIGURATION";

    public InvalidConfigurationException(String message) {
        super(ERROR_CODE, message);
    }
}
