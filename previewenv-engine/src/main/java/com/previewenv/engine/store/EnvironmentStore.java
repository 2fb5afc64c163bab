package com.previewenv.engine.store;

import com.previewenv.core.exception.OptimisticLockException;
import com.previewenv.core.model.Environment;
import com.previewenv.core.model.EnvironmentStatus;
import com.previewenv.core.model.ServiceState;
import com.previewenv.core.repository.EnvironmentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Read-modify-write access to environment records.
 *
 * Every write is conditional on the version that was read. On a conflict the
 * record is re-read and the change re-applied, so a change function must be a
 * pure function of the record it is given.
 */
public class EnvironmentStore {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentStore.class);

    static final int MAX_ATTEMPTS = 5;

    private final EnvironmentRepository repository;
    private final Clock clock;

    public EnvironmentStore(EnvironmentRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    public Optional<Environment> find(String environmentId) {
        return repository.findById(environmentId);
    }

    /**
     * Insert a brand-new record.
     *
     * @return false if some other action created the record first
     */
    public boolean create(Environment environment) {
        return repository.insert(environment);
    }

    /**
     * Overwrite {@code previous} with {@code fresh}, provided nobody wrote in between.
     *
     * @throws OptimisticLockException if the stored record moved past {@code previous}
     */
    public Environment replace(Environment previous, Environment fresh) {
        Environment next = fresh.toBuilder()
            .version(previous.version() + 1)
            .updatedAt(clock.instant())
            .build();
        repository.update(next);
        return next;
    }

    /**
     * Apply a change to the current record and store it conditionally.
     * Returning the same instance from {@code change} skips the write.
     *
     * @return the stored record, or empty if no record exists
     * @throws OptimisticLockException if every attempt lost a race
     */
    public Optional<Environment> mutate(String environmentId, UnaryOperator<Environment> change) {
        OptimisticLockException lastConflict = null;
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            Optional<Environment> current = repository.findById(environmentId);
            if (current.isEmpty()) {
                return Optional.empty();
            }
            Environment changed = change.apply(current.get());
            if (changed == current.get()) {
                return current;
            }
            Environment next = changed.toBuilder()
                .version(current.get().version())
                .incrementVersion()
                .updatedAt(clock.instant())
                .build();
            try {
                repository.update(next);
                return Optional.of(next);
            } catch (OptimisticLockException e) {
                lastConflict = e;
                log.debug("Conflict writing environment {} (attempt {}), retrying", environmentId, attempt);
            }
        }
        throw lastConflict;
    }

    /**
     * Move the record to {@code target} and apply {@code alsoApply} in the same write.
     *
     * A transition the state machine rejects means a concurrent action already
     * moved the record on; the write is skipped and the current record returned.
     * Callers compare the returned status with {@code target}.
     */
    public Optional<Environment> transition(String environmentId, EnvironmentStatus target,
                                            UnaryOperator<Environment> alsoApply) {
        return mutate(environmentId, env -> {
            if (!env.status().canTransitionTo(target)) {
                log.info("Transition of {} from {} to {} superseded, skipping",
                    environmentId, env.status(), target);
                return env;
            }
            return alsoApply.apply(env.withStatus(target));
        });
    }

    public Optional<Environment> transition(String environmentId, EnvironmentStatus target) {
        return transition(environmentId, target, UnaryOperator.identity());
    }

    /**
     * Replace one service's state. A missing service starts from PENDING.
     */
    public Optional<Environment> updateService(String environmentId, String serviceId,
                                               UnaryOperator<ServiceState> change) {
        return mutate(environmentId, env -> {
            ServiceState current = env.service(serviceId);
            ServiceState base = current != null ? current : ServiceState.pending(serviceId);
            return env.withService(change.apply(base));
        });
    }

    /**
     * Unconditionally mark the record FAILED with a diagnostic.
     */
    public Optional<Environment> forceFailed(String environmentId, String error) {
        return mutate(environmentId, env -> env.toBuilder()
            .status(EnvironmentStatus.FAILED)
            .lastError(error)
            .build());
    }
}
