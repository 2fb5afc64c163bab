package com.previewenv.engine.persistence;

import com.previewenv.core.model.RoutingEntry;
import com.previewenv.core.repository.RoutingEntryRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of RoutingEntryRepository.
 */
@Repository
@ConditionalOnProperty(name = "previewenv.store.mode", havingValue = "memory")
public class InMemoryRoutingEntryRepository implements RoutingEntryRepository {

    private final Map<String, RoutingEntry> entries = new ConcurrentHashMap<>();

    @Override
    public void save(RoutingEntry entry) {
        entries.put(key(entry.environmentId(), entry.serviceId()), entry);
    }

    @Override
    public Optional<RoutingEntry> find(String environmentId, String serviceId) {
        return Optional.ofNullable(entries.get(key(environmentId, serviceId)));
    }

    @Override
    public List<RoutingEntry> findByEnvironment(String environmentId) {
        return entries.values().stream()
            .filter(e -> e.environmentId().equals(environmentId))
            .sorted(Comparator.comparing(RoutingEntry::serviceId))
            .collect(Collectors.toList());
    }

    @Override
    public int updateExpiry(String environmentId, Instant expiresAt) {
        int updated = 0;
        for (RoutingEntry entry : findByEnvironment(environmentId)) {
            if (entries.computeIfPresent(key(environmentId, entry.serviceId()),
                    (k, current) -> current.withExpiresAt(expiresAt)) != null) {
                updated++;
            }
        }
        return updated;
    }

    @Override
    public void delete(String environmentId, String serviceId) {
        entries.remove(key(environmentId, serviceId));
    }

    @Override
    public int deleteByEnvironment(String environmentId) {
        int deleted = 0;
        for (RoutingEntry entry : findByEnvironment(environmentId)) {
            if (entries.remove(key(environmentId, entry.serviceId())) != null) {
                deleted++;
            }
        }
        return deleted;
    }

    private static String key(String environmentId, String serviceId) {
        return environmentId + "/" + serviceId;
    }
}
