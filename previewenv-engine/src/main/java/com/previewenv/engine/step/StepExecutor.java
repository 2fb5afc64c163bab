package com.previewenv.engine.step;

import com.previewenv.core.exception.ResourceNotFoundException;
import com.previewenv.engine.metrics.EnvironmentMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Runs backend calls as tagged steps.
 *
 * Critical steps abort their service on failure. Best-effort steps never
 * throw; their failures are logged and counted the same way at every call site.
 * For best-effort steps an adapter reporting the resource as already gone
 * yields ALREADY_ABSENT.
 */
public class StepExecutor {

    private static final Logger log = LoggerFactory.getLogger(StepExecutor.class);

    private final EnvironmentMetrics metrics;

    public StepExecutor(EnvironmentMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * Run a step whose failure aborts the owning service.
     *
     * @throws com.previewenv.core.exception.StepFailedException wrapping the cause
     */
    public <T> T critical(String step, Supplier<T> action) {
        return execute(step, true, action).orThrow();
    }

    /**
     * Run a step whose failure is logged and otherwise ignored.
     */
    public <T> StepResult<T> bestEffort(String step, Supplier<T> action) {
        return execute(step, false, action);
    }

    public StepResult<Void> bestEffort(String step, Runnable action) {
        return execute(step, false, () -> {
            action.run();
            return null;
        });
    }

    public <T> StepResult<T> execute(String step, boolean critical, Supplier<T> action) {
        try {
            T value = action.get();
            log.debug("Step {} succeeded", step);
            return StepResult.succeeded(step, critical, value);
        } catch (ResourceNotFoundException e) {
            if (critical) {
                // a provisioning step has nothing to produce without its resource
                metrics.stepFailed(step, true);
                log.warn("Critical step {} failed: {}", step, e.getMessage());
                return StepResult.failed(step, true, e);
            }
            log.info("Step {}: {} (already absent)", step, e.getMessage());
            return StepResult.alreadyAbsent(step, false);
        } catch (RuntimeException e) {
            metrics.stepFailed(step, critical);
            if (critical) {
                log.warn("Critical step {} failed: {}", step, e.getMessage());
            } else {
                log.warn("Non-critical step {} failed, continuing: {}", step, e.getMessage());
            }
            return StepResult.failed(step, critical, e);
        }
    }
}
