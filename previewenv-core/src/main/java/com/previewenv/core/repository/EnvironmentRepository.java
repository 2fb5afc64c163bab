package com.previewenv.core.repository;

import com.previewenv.core.model.Environment;
import com.previewenv.core.model.EnvironmentStatus;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repository for Environment persistence.
 * All writes are conditional; no caller ever holds a lock on a record.
 */
public interface EnvironmentRepository {

    /**
     * Insert a new environment if no record exists for its id.
     *
     * @param environment The environment to insert
     * @return true if inserted, false if a record with the same id already exists
     */
    boolean insert(Environment environment);

    /**
     * Replace an existing environment if it is still at the previous version.
     * The given environment carries the new version, the stored one must be at
     * {@code environment.version() - 1}.
     *
     * @param environment The environment to write
     * @throws com.previewenv.core.exception.OptimisticLockException if the stored version differs
     *         or the record no longer exists
     */
    void update(Environment environment);

    /**
     * Find an environment by ID.
     */
    Optional<Environment> findById(String environmentId);

    /**
     * Find environments in one of the given states whose expiry is before the cutoff.
     *
     * @param statuses States to match
     * @param cutoff Exclusive upper bound for expiresAt
     * @param limit Maximum number of results
     * @return Matching environments, earliest expiry first
     */
    List<Environment> findExpiringBefore(Collection<EnvironmentStatus> statuses, Instant cutoff, int limit);

    /**
     * Find environments, optionally filtered by state.
     *
     * @param status State to match, or null for all
     * @param limit Maximum number of results
     * @return Environments, most recently updated first
     */
    List<Environment> findAll(EnvironmentStatus status, int limit);

    /**
     * Count environments per state.
     */
    Map<EnvironmentStatus, Long> countByStatus();

    /**
     * Delete DESTROYED environments last updated before the given time.
     * Used for retention.
     *
     * @return Number of deleted records
     */
    int deleteDestroyedBefore(Instant updatedBefore);
}
