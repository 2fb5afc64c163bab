package com.previewenv.core.repository;

import com.previewenv.core.model.RoutingEntry;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for RoutingEntry persistence.
 */
public interface RoutingEntryRepository {

    /**
     * Insert or replace the entry for (environmentId, serviceId).
     */
    void save(RoutingEntry entry);

    Optional<RoutingEntry> find(String environmentId, String serviceId);

    List<RoutingEntry> findByEnvironment(String environmentId);

    /**
     * Refresh the expiry mirror on every entry of an environment.
     *
     * @return Number of entries updated
     */
    int updateExpiry(String environmentId, Instant expiresAt);

    /**
     * Delete one entry. Deleting a missing entry is not an error.
     */
    void delete(String environmentId, String serviceId);

    /**
     * Delete every entry of an environment.
     *
     * @return Number of deleted entries
     */
    int deleteByEnvironment(String environmentId);
}
