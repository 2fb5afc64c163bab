package com.previewenv.core.model;

import org.junit.jupiter.api.Test;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class RoutingEntryTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");
    private static final Instant EXPIRES = NOW.plusSeconds(3600);

    @Test
    void from_shouldCopyHandlesAndPriority() {
        ServiceState state = ServiceState.pending("web").toBuilder()
            .ruleRef("rule-1")
            .targetRef("tg-1")
            .computeServiceRef("svc-1")
            .priority(7)
            .build();

        RoutingEntry entry = RoutingEntry.from("pr-1", state, EXPIRES, NOW);

        assertEquals("pr-1", entry.environmentId());
        assertEquals("web", entry.serviceId());
        assertEquals("rule-1", entry.ruleRef());
        assertEquals("tg-1", entry.targetRef());
        assertNull(entry.registryRef());
        assertEquals(7, entry.priority());
        assertEquals(EXPIRES, entry.expiresAt());
    }

    @Test
    void from_shouldRejectServiceWithoutPriority() {
        ServiceState released = ServiceState.pending("web").toBuilder()
            .ruleRef("rule-1")
            .computeServiceRef("svc-1")
            .build();

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> RoutingEntry.from("pr-1", released, EXPIRES, NOW));
        assertTrue(e.getMessage().contains("web"));
    }
}
