package com.previewenv.core.exception;

/**
 * A critical provisioning step failed and aborted its service.
 * The error code of the underlying failure is kept so capacity exhaustion
 * stays distinguishable from backend faults.
 */
public class StepFailedException extends PreviewEnvException {

    public static final String ERROR_CODE = "STEP_FAILED";

    private final String step;

    public StepFailedException(String step, Throwable cause) {
        super(causeCode(cause), step + ": " + cause.getMessage(), cause);
        this.step = step;
    }

    public String getStep() {
        return step;
    }

    private static String causeCode(Throwable cause) {
        return cause instanceof PreviewEnvException pe ? pe.getErrorCode() : ERROR_CODE;
    }
}
