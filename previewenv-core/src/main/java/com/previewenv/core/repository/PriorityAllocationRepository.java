package com.previewenv.core.repository;

import com.previewenv.core.model.PriorityAllocation;
import java.time.Instant;
import java.util.List;

/**
 * Repository for PriorityAllocation persistence.
 * Uniqueness of (routingDomain, priority) rests entirely on {@link #tryCreate}.
 */
public interface PriorityAllocationRepository {

    /**
     * Atomically create the allocation if its key is free.
     *
     * @param allocation The allocation to create
     * @return true if created, false if the key is already taken
     */
    boolean tryCreate(PriorityAllocation allocation);

    /**
     * All allocations currently held in a routing domain.
     */
    List<PriorityAllocation> findByDomain(String routingDomain);

    /**
     * Allocations in a routing domain owned by an environment.
     */
    List<PriorityAllocation> findByEnvironment(String routingDomain, String environmentId);

    /**
     * Delete an allocation. Deleting a missing allocation is not an error.
     *
     * @return true if a row was removed
     */
    boolean delete(String routingDomain, int priority);

    /**
     * Delete an allocation only while the given environment still owns it.
     *
     * @return true if a row was removed
     */
    boolean deleteIfOwned(String routingDomain, int priority, String environmentId);

    /**
     * Refresh expiresAt on every allocation an environment owns in the domain.
     *
     * @return Number of allocations updated
     */
    int updateExpiry(String routingDomain, String environmentId, Instant expiresAt);

    /**
     * Delete allocations that expired before the given time.
     *
     * @return Number of deleted allocations
     */
    int deleteExpiredBefore(Instant expiredBefore);
}
