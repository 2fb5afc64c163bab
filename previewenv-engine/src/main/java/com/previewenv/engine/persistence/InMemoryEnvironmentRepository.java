package com.previewenv.engine.persistence;

import com.previewenv.core.exception.OptimisticLockException;
import com.previewenv.core.model.Environment;
import com.previewenv.core.model.EnvironmentStatus;
import com.previewenv.core.repository.EnvironmentRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * In-memory implementation of EnvironmentRepository.
 * Conditional writes are compare-and-set operations on the map, so the
 * version semantics match the JDBC implementation.
 */
@Repository
@ConditionalOnProperty(name = "previewenv.store.mode", havingValue = "memory")
public class InMemoryEnvironmentRepository implements EnvironmentRepository {

    private final Map<String, Environment> environments = new ConcurrentHashMap<>();

    @Override
    public boolean insert(Environment environment) {
        return environments.putIfAbsent(environment.environmentId(), environment) == null;
    }

    @Override
    public void update(Environment environment) {
        long expected = environment.version() - 1;
        AtomicBoolean applied = new AtomicBoolean(false);
        environments.computeIfPresent(environment.environmentId(), (id, current) -> {
            if (current.version() != expected) {
                return current;
            }
            applied.set(true);
            return environment;
        });
        if (!applied.get()) {
            throw new OptimisticLockException("Environment", environment.environmentId(), expected);
        }
    }

    @Override
    public Optional<Environment> findById(String environmentId) {
        return Optional.ofNullable(environments.get(environmentId));
    }

    @Override
    public List<Environment> findExpiringBefore(Collection<EnvironmentStatus> statuses, Instant cutoff, int limit) {
        return environments.values().stream()
            .filter(e -> statuses.contains(e.status()))
            .filter(e -> e.expiresAt() != null && e.expiresAt().isBefore(cutoff))
            .sorted(Comparator.comparing(Environment::expiresAt))
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public List<Environment> findAll(EnvironmentStatus status, int limit) {
        return environments.values().stream()
            .filter(e -> status == null || e.status() == status)
            .sorted(Comparator.comparing(Environment::updatedAt).reversed())
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public Map<EnvironmentStatus, Long> countByStatus() {
        return environments.values().stream()
            .collect(Collectors.groupingBy(Environment::status,
                () -> new EnumMap<>(EnvironmentStatus.class), Collectors.counting()));
    }

    @Override
    public int deleteDestroyedBefore(Instant updatedBefore) {
        int deleted = 0;
        for (Environment env : List.copyOf(environments.values())) {
            if (env.status() == EnvironmentStatus.DESTROYED
                    && env.updatedAt().isBefore(updatedBefore)
                    && environments.remove(env.environmentId(), env)) {
                deleted++;
            }
        }
        return deleted;
    }
}
