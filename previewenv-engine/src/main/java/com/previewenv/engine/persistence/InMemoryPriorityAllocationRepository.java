package com.previewenv.engine.persistence;

import com.previewenv.core.model.PriorityAllocation;
import com.previewenv.core.repository.PriorityAllocationRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * In-memory implementation of PriorityAllocationRepository.
 * {@link #tryCreate} is a putIfAbsent, the map's own compare-and-set.
 */
@Repository
@ConditionalOnProperty(name = "previewenv.store.mode", havingValue = "memory")
public class InMemoryPriorityAllocationRepository implements PriorityAllocationRepository {

    private final Map<String, PriorityAllocation> allocations = new ConcurrentHashMap<>();

    @Override
    public boolean tryCreate(PriorityAllocation allocation) {
        return allocations.putIfAbsent(allocation.key(), allocation) == null;
    }

    @Override
    public List<PriorityAllocation> findByDomain(String routingDomain) {
        return allocations.values().stream()
            .filter(a -> a.routingDomain().equals(routingDomain))
            .sorted(Comparator.comparingInt(PriorityAllocation::priority))
            .collect(Collectors.toList());
    }

    @Override
    public List<PriorityAllocation> findByEnvironment(String routingDomain, String environmentId) {
        return findByDomain(routingDomain).stream()
            .filter(a -> a.isOwnedBy(environmentId))
            .collect(Collectors.toList());
    }

    @Override
    public boolean delete(String routingDomain, int priority) {
        return allocations.remove(PriorityAllocation.key(routingDomain, priority)) != null;
    }

    @Override
    public boolean deleteIfOwned(String routingDomain, int priority, String environmentId) {
        AtomicBoolean removed = new AtomicBoolean(false);
        allocations.computeIfPresent(PriorityAllocation.key(routingDomain, priority), (k, current) -> {
            if (!current.isOwnedBy(environmentId)) {
                return current;
            }
            removed.set(true);
            return null;
        });
        return removed.get();
    }

    @Override
    public int updateExpiry(String routingDomain, String environmentId, Instant expiresAt) {
        int updated = 0;
        for (PriorityAllocation allocation : findByEnvironment(routingDomain, environmentId)) {
            PriorityAllocation result = allocations.computeIfPresent(allocation.key(), (k, current) ->
                current.isOwnedBy(environmentId)
                    ? new PriorityAllocation(current.routingDomain(), current.priority(),
                        current.environmentId(), current.serviceId(), current.allocatedAt(), expiresAt)
                    : current);
            if (result != null && result.isOwnedBy(environmentId)) {
                updated++;
            }
        }
        return updated;
    }

    @Override
    public int deleteExpiredBefore(Instant expiredBefore) {
        int deleted = 0;
        for (PriorityAllocation allocation : List.copyOf(allocations.values())) {
            if (allocation.expiresAt() != null
                    && allocation.expiresAt().isBefore(expiredBefore)
                    && allocations.remove(allocation.key(), allocation)) {
                deleted++;
            }
        }
        return deleted;
    }
}
