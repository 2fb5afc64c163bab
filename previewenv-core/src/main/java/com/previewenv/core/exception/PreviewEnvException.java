package com.previewenv.core.exception;

/**
 * Base exception for all preview environment errors.
 */
public class PreviewEnvException extends RuntimeException {

    private final String errorCode;

    public PreviewEnvException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public PreviewEnvException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
