package com.previewenv.engine.allocator;

import com.previewenv.core.exception.ResourceExhaustedException;
import com.previewenv.core.model.PriorityAllocation;
import com.previewenv.core.model.PriorityRange;
import com.previewenv.core.repository.PriorityAllocationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Claims and releases routing priorities.
 *
 * The in-use set is read fresh on every call and never cached. The read is
 * racy by construction; correctness comes from the conditional create, which
 * lets exactly one caller win each (domain, priority) key. A caller that
 * loses a key moves on to the next candidate instead of retrying it.
 */
public class PriorityAllocator {

    private static final Logger log = LoggerFactory.getLogger(PriorityAllocator.class);

    private final PriorityAllocationRepository repository;
    private final PriorityRange range;
    private final Clock clock;

    public PriorityAllocator(PriorityAllocationRepository repository, PriorityRange range, Clock clock) {
        this.repository = repository;
        this.range = range;
        this.clock = clock;
    }

    /**
     * Allocate the lowest free priority in the range.
     *
     * @return the committed priority
     * @throws ResourceExhaustedException if no candidate could be committed after a full scan
     */
    public int allocate(String routingDomain, String environmentId, String serviceId, Instant expiresAt) {
        Set<Integer> inUse = repository.findByDomain(routingDomain).stream()
            .map(PriorityAllocation::priority)
            .collect(Collectors.toSet());

        Instant now = clock.instant();
        int lostRaces = 0;
        for (int candidate = range.start(); candidate <= range.end(); candidate++) {
            if (inUse.contains(candidate)) {
                continue;
            }
            PriorityAllocation allocation = new PriorityAllocation(
                routingDomain, candidate, environmentId, serviceId, now, expiresAt);
            if (repository.tryCreate(allocation)) {
                log.info("Allocated priority {} in {} to {}/{}",
                    candidate, routingDomain, environmentId, serviceId);
                return candidate;
            }
            lostRaces++;
            log.debug("Lost race for priority {} in {}, trying next candidate", candidate, routingDomain);
        }

        log.error("No priority available in {} {} ({} in use, {} lost races)",
            routingDomain, range, inUse.size(), lostRaces);
        throw new ResourceExhaustedException(routingDomain, range);
    }

    /**
     * Unconditional, idempotent release.
     */
    public void release(String routingDomain, int priority) {
        boolean removed = repository.delete(routingDomain, priority);
        log.info("Released priority {} in {}{}", priority, routingDomain, removed ? "" : " (already free)");
    }

    /**
     * Release only while the environment still owns the slot, so a priority
     * that was freed and re-allocated to someone else is left alone.
     *
     * @return true if the allocation was removed
     */
    public boolean release(String routingDomain, int priority, String environmentId) {
        boolean removed = repository.deleteIfOwned(routingDomain, priority, environmentId);
        if (removed) {
            log.info("Released priority {} in {} held by {}", priority, routingDomain, environmentId);
        } else {
            log.debug("Priority {} in {} not held by {}, nothing to release", priority, routingDomain, environmentId);
        }
        return removed;
    }

    /**
     * Release every allocation an environment still owns in the domain.
     *
     * @return number of allocations released
     */
    public int releaseAll(String routingDomain, String environmentId) {
        int released = 0;
        for (PriorityAllocation allocation : repository.findByEnvironment(routingDomain, environmentId)) {
            if (repository.deleteIfOwned(routingDomain, allocation.priority(), environmentId)) {
                released++;
            }
        }
        if (released > 0) {
            log.info("Released {} lingering priorities in {} held by {}", released, routingDomain, environmentId);
        }
        return released;
    }

    /**
     * Move the expiry of an environment's allocations along with the environment.
     */
    public int extend(String routingDomain, String environmentId, Instant expiresAt) {
        return repository.updateExpiry(routingDomain, environmentId, expiresAt);
    }

    public CapacityUsage usage(String routingDomain) {
        int used = (int) repository.findByDomain(routingDomain).stream()
            .filter(a -> range.contains(a.priority()))
            .count();
        return new CapacityUsage(routingDomain, used, range.size());
    }

    public PriorityRange getRange() {
        return range;
    }
}
