package com.previewenv.engine.store;

import com.previewenv.core.exception.OptimisticLockException;
import com.previewenv.core.model.*;
import com.previewenv.core.test.TimeController;
import com.previewenv.engine.persistence.InMemoryEnvironmentRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class EnvironmentStoreTest {

    private TimeController time;
    private InMemoryEnvironmentRepository repository;
    private EnvironmentStore store;

    @BeforeEach
    void setUp() {
        time = new TimeController(Instant.parse("2024-01-15T10:00:00Z"));
        repository = new InMemoryEnvironmentRepository();
        store = new EnvironmentStore(repository, time);
    }

    private Environment insert(EnvironmentStatus status) {
        LifecycleAction action = new LifecycleAction(ActionType.CREATE, "pr-7", "acme/shop", "main",
            "sha-1", PrMetadata.of(7, "https://example.com/pull/7"), null);
        Environment environment = Environment.create(action, "https://pr-7.preview.example.com",
            time.instant(), Duration.ofHours(24)).withStatus(status);
        assertThat(store.create(environment)).isTrue();
        return environment;
    }

    @Test
    @DisplayName("create is create-if-absent")
    void createIsConditional() {
        Environment environment = insert(EnvironmentStatus.CREATING);

        assertThat(store.create(environment.withStatus(EnvironmentStatus.ACTIVE))).isFalse();
        assertThat(store.find("pr-7")).get().extracting(Environment::status).isEqualTo(EnvironmentStatus.CREATING);
    }

    @Test
    @DisplayName("mutate bumps the version and stamps updatedAt")
    void mutateBumpsVersion() {
        insert(EnvironmentStatus.CREATING);
        time.advanceMinutes(5);

        Environment updated = store.mutate("pr-7", env -> env.withStatus(EnvironmentStatus.ACTIVE)).orElseThrow();

        assertThat(updated.version()).isEqualTo(1);
        assertThat(updated.updatedAt()).isEqualTo(time.instant());
        assertThat(repository.findById("pr-7")).contains(updated);
    }

    @Test
    @DisplayName("mutate skips the write when the change returns the same record")
    void mutateSkipsNoChange() {
        insert(EnvironmentStatus.ACTIVE);

        Environment result = store.mutate("pr-7", env -> env).orElseThrow();

        assertThat(result.version()).isZero();
    }

    @Test
    @DisplayName("mutate of a missing record is empty")
    void mutateMissing() {
        assertThat(store.mutate("pr-404", env -> env.withStatus(EnvironmentStatus.ACTIVE))).isEmpty();
    }

    @Test
    @DisplayName("A conflicting write is re-read and the change re-applied, losing nothing")
    void conflictIsRetried() {
        insert(EnvironmentStatus.ACTIVE);
        AtomicInteger calls = new AtomicInteger();

        Environment result = store.mutate("pr-7", env -> {
            if (calls.incrementAndGet() == 1) {
                // another writer gets in between our read and our write
                Environment concurrent = env.toBuilder().lastError("concurrent").incrementVersion().build();
                repository.update(concurrent);
            }
            return env.toBuilder().commitRef("sha-2").build();
        }).orElseThrow();

        assertThat(calls.get()).isEqualTo(2);
        assertThat(result.version()).isEqualTo(2);
        assertThat(result.commitRef()).isEqualTo("sha-2");
        assertThat(result.lastError()).isEqualTo("concurrent");
    }

    @Test
    @DisplayName("mutate gives up after a bounded number of conflicts")
    void conflictsAreBounded() {
        insert(EnvironmentStatus.ACTIVE);
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> store.mutate("pr-7", env -> {
            calls.incrementAndGet();
            repository.update(env.toBuilder().incrementVersion().build());
            return env.toBuilder().commitRef("sha-2").build();
        })).isInstanceOf(OptimisticLockException.class);

        assertThat(calls.get()).isEqualTo(EnvironmentStore.MAX_ATTEMPTS);
    }

    @Test
    @DisplayName("A transition the state machine rejects is skipped as superseded")
    void rejectedTransitionIsSuperseded() {
        insert(EnvironmentStatus.DESTROYED);

        Optional<Environment> result = store.transition("pr-7", EnvironmentStatus.ACTIVE,
            env -> env.toBuilder().lastError("should not be written").build());

        assertThat(result).get().satisfies(env -> {
            assertThat(env.status()).isEqualTo(EnvironmentStatus.DESTROYED);
            assertThat(env.version()).isZero();
            assertThat(env.lastError()).isNull();
        });
    }

    @Test
    @DisplayName("An allowed transition applies the extra change in the same write")
    void allowedTransitionAppliesChange() {
        insert(EnvironmentStatus.ACTIVE);
        Instant later = time.instant().plus(Duration.ofHours(30));

        Environment result = store.transition("pr-7", EnvironmentStatus.UPDATING,
            env -> env.toBuilder().expiresAt(later).build()).orElseThrow();

        assertThat(result.status()).isEqualTo(EnvironmentStatus.UPDATING);
        assertThat(result.expiresAt()).isEqualTo(later);
        assertThat(result.version()).isEqualTo(1);
    }

    @Test
    @DisplayName("updateService starts a missing service from PENDING")
    void updateServiceStartsFromPending() {
        insert(EnvironmentStatus.CREATING);

        Environment result = store.updateService("pr-7", "web",
            s -> s.toBuilder().targetRef("tg-1").build()).orElseThrow();

        assertThat(result.service("web").status()).isEqualTo(ServiceStatus.PENDING);
        assertThat(result.service("web").targetRef()).isEqualTo("tg-1");
    }

    @Test
    @DisplayName("forceFailed applies from any state")
    void forceFailedAlwaysApplies() {
        insert(EnvironmentStatus.DESTROYING);

        Environment result = store.forceFailed("pr-7", "boom").orElseThrow();

        assertThat(result.status()).isEqualTo(EnvironmentStatus.FAILED);
        assertThat(result.lastError()).isEqualTo("boom");
    }

    @Test
    @DisplayName("replace fails when the record moved on")
    void replaceIsConditional() {
        Environment original = insert(EnvironmentStatus.FAILED);
        store.mutate("pr-7", env -> env.toBuilder().lastError("moved").build());

        assertThatThrownBy(() -> store.replace(original, original.withStatus(EnvironmentStatus.CREATING)))
            .isInstanceOf(OptimisticLockException.class);
    }
}
