package com.previewenv.engine.step;

public enum StepOutcome {
    SUCCEEDED,
    /** The resource was already gone. Counts as success for teardown. */
    ALREADY_ABSENT,
    FAILED
}
