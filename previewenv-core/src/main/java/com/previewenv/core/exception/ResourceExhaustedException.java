package com.previewenv.core.exception;

import com.previewenv.core.model.PriorityRange;

/**
 * Thrown when every priority in a routing domain's range is taken.
 * Signals that the concurrent environment capacity has been reached.
 */
public class ResourceExhaustedException extends PreviewEnvException {

    public static final String ERROR_CODE = "RESOURCE_EXHAUSTED";

    public ResourceExhaustedException(String routingDomain, PriorityRange range) {
        super(ERROR_CODE, String.format(
            "No available routing priorities in %s %s - maximum concurrent environments reached",
            routingDomain, range
        ));
    }
}
