package com.previewenv.engine.step;

import com.previewenv.core.exception.StepFailedException;

/**
 * Outcome of one backend step.
 *
 * @param step     step name, used in logs and metrics
 * @param critical whether a failure aborts the owning service
 * @param outcome  what happened
 * @param value    value produced on success, null otherwise
 * @param error    failure cause, null unless FAILED
 */
public record StepResult<T>(
    String step,
    boolean critical,
    StepOutcome outcome,
    T value,
    RuntimeException error
) {
    public static <T> StepResult<T> succeeded(String step, boolean critical, T value) {
        return new StepResult<>(step, critical, StepOutcome.SUCCEEDED, value, null);
    }

    public static <T> StepResult<T> alreadyAbsent(String step, boolean critical) {
        return new StepResult<>(step, critical, StepOutcome.ALREADY_ABSENT, null, null);
    }

    public static <T> StepResult<T> failed(String step, boolean critical, RuntimeException error) {
        return new StepResult<>(step, critical, StepOutcome.FAILED, null, error);
    }

    /**
     * True unless the step failed.
     */
    public boolean isSuccess() {
        return outcome != StepOutcome.FAILED;
    }

    /**
     * Value of a successful step.
     *
     * @throws StepFailedException if the step failed
     */
    public T orThrow() {
        if (outcome == StepOutcome.FAILED) {
            throw new StepFailedException(step, error);
        }
        return value;
    }
}
