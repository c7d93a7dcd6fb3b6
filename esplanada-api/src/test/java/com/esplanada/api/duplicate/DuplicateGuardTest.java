package com.esplanada.api.duplicate;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class DuplicateGuardTest {

    private static final Instant T0 = Instant.parse("2025-03-01T00:00:00Z");
    private static final Duration COOLDOWN = Duration.ofHours(24);

    private final ExecutorService executor = Executors.newFixedThreadPool(2);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private DuplicateGuard guard(ActiveRatingLookup lookup) {
        return new DuplicateGuard(lookup, executor, COOLDOWN, Duration.ofMillis(200));
    }

    @Test
    void noActiveRatingIsNew() {
        DuplicateResolution resolution = guard((identity, subject) -> Optional.empty())
                .resolve("identity-abc", "S1", T0);
        assertThat(resolution.status()).isEqualTo(DuplicateResolution.Status.NEW);
        assertThat(resolution.permitsWrite()).isTrue();
    }

    @Test
    void withinCooldownIsDeniedWithRemainingWait() {
        UUID existing = UUID.randomUUID();
        DuplicateGuard guard = guard((identity, subject) -> Optional.of(new ActiveRating(existing, 5, T0)));

        DuplicateResolution resolution = guard.resolve("identity-abc", "S1", T0.plus(Duration.ofHours(1)));

        assertThat(resolution.status()).isEqualTo(DuplicateResolution.Status.DENIED);
        assertThat(resolution.retryAfter()).isEqualTo(Duration.ofHours(23));
        assertThat(resolution.permitsWrite()).isFalse();
    }

    @Test
    void cooldownBoundaryAllowsUpdate() {
        UUID existing = UUID.randomUUID();
        DuplicateGuard guard = guard((identity, subject) -> Optional.of(new ActiveRating(existing, 5, T0)));

        assertThat(guard.resolve("identity-abc", "S1", T0.plus(COOLDOWN).minusMillis(1)).status())
                .isEqualTo(DuplicateResolution.Status.DENIED);

        DuplicateResolution atBoundary = guard.resolve("identity-abc", "S1", T0.plus(COOLDOWN));
        assertThat(atBoundary.status()).isEqualTo(DuplicateResolution.Status.UPDATE_ALLOWED);
        assertThat(atBoundary.existingId()).isEqualTo(existing);
        assertThat(atBoundary.previousScore()).isEqualTo(5);
    }

    @Test
    void slowLookupFailsClosed() {
        DuplicateGuard guard = guard((identity, subject) -> {
            try {
                Thread.sleep(2_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return Optional.empty();
        });

        assertThat(guard.resolve("identity-abc", "S1", T0).status())
                .isEqualTo(DuplicateResolution.Status.UNAVAILABLE);
    }

    @Test
    void timedOutLookupIsInterrupted() throws InterruptedException {
        CountDownLatch interrupted = new CountDownLatch(1);
        DuplicateGuard guard = guard((identity, subject) -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                Thread.currentThread().interrupt();
            }
            return Optional.empty();
        });

        assertThat(guard.resolve("identity-abc", "S1", T0).status())
                .isEqualTo(DuplicateResolution.Status.UNAVAILABLE);
        assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void lookupErrorFailsClosed() {
        DuplicateGuard guard = guard((identity, subject) -> {
            throw new IllegalStateException("database down");
        });

        assertThat(guard.resolve("identity-abc", "S1", T0).status())
                .isEqualTo(DuplicateResolution.Status.UNAVAILABLE);
    }
}
