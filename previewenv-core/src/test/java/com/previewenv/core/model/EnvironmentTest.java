package com.previewenv.core.model;

import org.junit.jupiter.api.Test;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class EnvironmentTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

    private LifecycleAction createAction() {
        return new LifecycleAction(ActionType.CREATE, "pr-42", "org/web-app", "feature/login",
            "abc123", PrMetadata.of(42, "https://github.com/org/web-app/pull/42"), null);
    }

    @Test
    void create_shouldStartInCreatingWithExpiry() {
        Environment env = Environment.create(createAction(), "https://pr-42.preview.example.com",
            NOW, Duration.ofHours(24));

        assertEquals("pr-42", env.environmentId());
        assertEquals(EnvironmentStatus.CREATING, env.status());
        assertEquals(NOW.plus(Duration.ofHours(24)), env.expiresAt());
        assertEquals(0L, env.version());
        assertTrue(env.services().isEmpty());
        assertNull(env.lastError());
    }

    @Test
    void withService_shouldAddAndReplaceWithoutTouchingVersion() {
        Environment env = Environment.create(createAction(), "https://pr-42.preview.example.com",
            NOW, Duration.ofHours(24));

        Environment withPending = env.withService(ServiceState.pending("web-app"));
        Environment withActive = withPending.withService(
            withPending.service("web-app").withStatus(ServiceStatus.ACTIVE));

        assertEquals(1, withActive.services().size());
        assertEquals(ServiceStatus.ACTIVE, withActive.service("web-app").status());
        assertEquals(ServiceStatus.PENDING, withPending.service("web-app").status());
        assertEquals(0L, withActive.version());
    }

    @Test
    void services_shouldBeImmutable() {
        Environment env = Environment.create(createAction(), "https://pr-42.preview.example.com",
            NOW, Duration.ofHours(24)).withService(ServiceState.pending("web-app"));

        assertThrows(UnsupportedOperationException.class,
            () -> env.services().put("api", ServiceState.pending("api")));
    }

    @Test
    void isExpired_shouldCompareAgainstExpiresAt() {
        Environment env = Environment.create(createAction(), "https://pr-42.preview.example.com",
            NOW, Duration.ofHours(1));

        assertFalse(env.isExpired(NOW));
        assertFalse(env.isExpired(NOW.plus(Duration.ofHours(1))));
        assertTrue(env.isExpired(NOW.plus(Duration.ofHours(1)).plusSeconds(1)));
    }

    @Test
    void builder_incrementVersion_shouldBumpByOne() {
        Environment env = Environment.create(createAction(), "https://pr-42.preview.example.com",
            NOW, Duration.ofHours(24));

        Environment next = env.toBuilder().status(EnvironmentStatus.ACTIVE).incrementVersion().build();

        assertEquals(1L, next.version());
        assertEquals(EnvironmentStatus.ACTIVE, next.status());
        assertEquals(env.createdAt(), next.createdAt());
    }

    @Test
    void serviceState_holdsResources_shouldTrackAnyHandle() {
        ServiceState pending = ServiceState.pending("api");
        assertFalse(pending.holdsResources());

        assertTrue(pending.toBuilder().priority(7).build().holdsResources());
        assertTrue(pending.toBuilder().targetRef("tg-1").build().holdsResources());

        ServiceState failed = pending.toBuilder().templateRef("td-1").build()
            .withFailure("BACKEND_ERROR", "createTarget failed");
        assertEquals(ServiceStatus.FAILED, failed.status());
        assertEquals("td-1", failed.templateRef());
        assertEquals("BACKEND_ERROR", failed.errorCode());
        assertFalse(failed.holdsResources()); // templates are never reclaimed
    }
}
