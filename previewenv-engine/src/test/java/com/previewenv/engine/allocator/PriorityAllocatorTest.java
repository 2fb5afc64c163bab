package com.previewenv.engine.allocator;

import com.previewenv.core.exception.ResourceExhaustedException;
import com.previewenv.core.model.PriorityAllocation;
import com.previewenv.core.model.PriorityRange;
import com.previewenv.core.test.TimeController;
import com.previewenv.engine.persistence.InMemoryPriorityAllocationRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.*;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;

class PriorityAllocatorTest {

    private static final String DOMAIN = "listener/app/preview/443";

    private TimeController time;
    private InMemoryPriorityAllocationRepository repository;
    private Instant expiresAt;

    @BeforeEach
    void setUp() {
        time = new TimeController(Instant.parse("2024-01-15T10:00:00Z"));
        repository = new InMemoryPriorityAllocationRepository();
        expiresAt = time.instant().plus(Duration.ofHours(24));
    }

    @Test
    @DisplayName("Allocates the lowest free priority")
    void allocatesLowestFree() {
        PriorityAllocator allocator = new PriorityAllocator(repository, new PriorityRange(5, 10), time);

        assertThat(allocator.allocate(DOMAIN, "pr-1", "web", expiresAt)).isEqualTo(5);
        assertThat(allocator.allocate(DOMAIN, "pr-1", "api", expiresAt)).isEqualTo(6);
        assertThat(repository.findByEnvironment(DOMAIN, "pr-1"))
            .extracting(PriorityAllocation::serviceId)
            .containsExactlyInAnyOrder("web", "api");
    }

    @Test
    @DisplayName("Concurrent allocations over a range of N return N distinct priorities")
    void concurrentAllocationsAreDistinct() throws Exception {
        int n = 20;
        PriorityAllocator allocator = new PriorityAllocator(repository, new PriorityRange(1, n), time);
        ExecutorService executor = Executors.newFixedThreadPool(n);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Integer>> futures = IntStream.range(0, n)
                .mapToObj(i -> executor.submit(() -> {
                    start.await();
                    return allocator.allocate(DOMAIN, "pr-" + i, "web", expiresAt);
                }))
                .collect(Collectors.toList());
            start.countDown();

            Set<Integer> priorities = new java.util.HashSet<>();
            for (Future<Integer> future : futures) {
                priorities.add(future.get(10, TimeUnit.SECONDS));
            }
            assertThat(priorities).hasSize(n);
            assertThat(priorities).allMatch(p -> p >= 1 && p <= n);
        } finally {
            executor.shutdownNow();
        }

        assertThatThrownBy(() -> allocator.allocate(DOMAIN, "pr-overflow", "web", expiresAt))
            .isInstanceOf(ResourceExhaustedException.class)
            .hasMessageContaining("maximum concurrent environments reached");
    }

    @Test
    @DisplayName("A lost race moves on to the next candidate")
    void lostRaceMovesToNextCandidate() {
        // a stale view of the domain: priority 1 is taken but the scan does not see it
        InMemoryPriorityAllocationRepository stale = new InMemoryPriorityAllocationRepository() {
            @Override
            public List<PriorityAllocation> findByDomain(String routingDomain) {
                return List.of();
            }
        };
        stale.tryCreate(new PriorityAllocation(DOMAIN, 1, "pr-other", "web", time.instant(), expiresAt));
        PriorityAllocator allocator = new PriorityAllocator(stale, new PriorityRange(1, 3), time);

        assertThat(allocator.allocate(DOMAIN, "pr-1", "web", expiresAt)).isEqualTo(2);
    }

    @Test
    @DisplayName("A released priority is reused")
    void releasedPriorityIsReused() {
        PriorityAllocator allocator = new PriorityAllocator(repository, new PriorityRange(1, 2), time);
        int first = allocator.allocate(DOMAIN, "pr-1", "web", expiresAt);
        allocator.allocate(DOMAIN, "pr-2", "web", expiresAt);

        allocator.release(DOMAIN, first);
        allocator.release(DOMAIN, first);

        assertThat(allocator.allocate(DOMAIN, "pr-3", "web", expiresAt)).isEqualTo(first);
    }

    @Test
    @DisplayName("Owner-checked release leaves a priority held by another environment alone")
    void ownerCheckedRelease() {
        PriorityAllocator allocator = new PriorityAllocator(repository, new PriorityRange(1, 5), time);
        int priority = allocator.allocate(DOMAIN, "pr-1", "web", expiresAt);

        assertThat(allocator.release(DOMAIN, priority, "pr-2")).isFalse();
        assertThat(repository.findByDomain(DOMAIN)).hasSize(1);

        assertThat(allocator.release(DOMAIN, priority, "pr-1")).isTrue();
        assertThat(repository.findByDomain(DOMAIN)).isEmpty();
    }

    @Test
    @DisplayName("releaseAll frees only the environment's own priorities")
    void releaseAllOwnedByEnvironment() {
        PriorityAllocator allocator = new PriorityAllocator(repository, new PriorityRange(1, 5), time);
        allocator.allocate(DOMAIN, "pr-1", "web", expiresAt);
        allocator.allocate(DOMAIN, "pr-1", "api", expiresAt);
        allocator.allocate(DOMAIN, "pr-2", "web", expiresAt);

        assertThat(allocator.releaseAll(DOMAIN, "pr-1")).isEqualTo(2);
        assertThat(repository.findByDomain(DOMAIN))
            .extracting(PriorityAllocation::environmentId)
            .containsExactly("pr-2");
    }

    @Test
    @DisplayName("Domains are independent")
    void domainsAreIndependent() {
        PriorityAllocator allocator = new PriorityAllocator(repository, new PriorityRange(1, 1), time);
        allocator.allocate(DOMAIN, "pr-1", "web", expiresAt);

        assertThat(allocator.allocate("listener/other", "pr-2", "web", expiresAt)).isEqualTo(1);
    }

    @Test
    @DisplayName("Usage reports warning at 70% and critical at 90%")
    void usageLevels() {
        PriorityAllocator allocator = new PriorityAllocator(repository, new PriorityRange(1, 10), time);
        for (int i = 0; i < 6; i++) {
            allocator.allocate(DOMAIN, "pr-" + i, "web", expiresAt);
        }
        assertThat(allocator.usage(DOMAIN).isWarning()).isFalse();

        allocator.allocate(DOMAIN, "pr-6", "web", expiresAt);
        CapacityUsage warning = allocator.usage(DOMAIN);
        assertThat(warning.isWarning()).isTrue();
        assertThat(warning.isCritical()).isFalse();
        assertThat(warning.percentage()).isEqualTo(70);

        allocator.allocate(DOMAIN, "pr-7", "web", expiresAt);
        allocator.allocate(DOMAIN, "pr-8", "web", expiresAt);
        CapacityUsage critical = allocator.usage(DOMAIN);
        assertThat(critical.isCritical()).isTrue();
        assertThat(critical.available()).isEqualTo(1);
    }

    @Test
    @DisplayName("Extending moves the expiry of every allocation the environment owns")
    void extendMovesExpiry() {
        PriorityAllocator allocator = new PriorityAllocator(repository, new PriorityRange(1, 5), time);
        allocator.allocate(DOMAIN, "pr-1", "web", expiresAt);
        allocator.allocate(DOMAIN, "pr-1", "api", expiresAt);
        Instant later = expiresAt.plus(Duration.ofHours(24));

        assertThat(allocator.extend(DOMAIN, "pr-1", later)).isEqualTo(2);
        assertThat(repository.findByEnvironment(DOMAIN, "pr-1"))
            .extracting(PriorityAllocation::expiresAt)
            .containsOnly(later);
    }
}
