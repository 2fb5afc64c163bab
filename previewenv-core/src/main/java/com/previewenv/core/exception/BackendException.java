package com.previewenv.core.exception;

/**
 * A compute, load balancer or registry call failed.
 * Usually transient (timeout, throttling); never retried within the same action.
 */
public class BackendException extends PreviewEnvException {

    public static final String ERROR_CODE = "BACKEND_ERROR";

    public BackendException(String operation, String message, Throwable cause) {
        super(ERROR_CODE, operation + " failed: " + message, cause);
    }

    public BackendException(String operation, String message) {
        super(ERROR_CODE, operation + " failed: " + message);
    }
}
