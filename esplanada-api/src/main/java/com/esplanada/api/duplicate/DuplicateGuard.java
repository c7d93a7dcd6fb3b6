package com.esplanada.api.duplicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Enforces at most one active rating per identity and subject.
 *
 * A repeat submission is denied until the cooldown since the previous write has elapsed, and is then
 * allowed as an in-place update of the existing record. The lookup is bounded by a timeout; a timeout
 * or storage error fails closed, and a timed out lookup is interrupted.
 */
@Service
public class DuplicateGuard {

    private static final Logger log = LoggerFactory.getLogger(DuplicateGuard.class);

    private final ActiveRatingLookup lookup;
    private final ExecutorService executor;
    private final Duration cooldown;
    private final Duration lookupTimeout;

    public DuplicateGuard(
            ActiveRatingLookup lookup,
            @Qualifier("lookupExecutor") ExecutorService executor,
            @Value("${esplanada.duplicate.cooldown:PT24H}") Duration cooldown,
            @Value("${esplanada.duplicate.lookup-timeout:PT0.5S}") Duration lookupTimeout) {
        this.lookup = Objects.requireNonNull(lookup, "Lookup cannot be null");
        this.executor = Objects.requireNonNull(executor, "Executor cannot be null");
        this.cooldown = cooldown;
        this.lookupTimeout = lookupTimeout;
    }

    public DuplicateResolution resolve(String identityDigest, String subjectId, Instant now) {
        Objects.requireNonNull(identityDigest, "Identity cannot be null");
        Objects.requireNonNull(subjectId, "Subject ID cannot be null");
        Objects.requireNonNull(now, "Time cannot be null");

        Future<Optional<ActiveRating>> pending = executor.submit(() -> lookup.findActive(identityDigest, subjectId));
        Optional<ActiveRating> existing;
        try {
            existing = pending.get(lookupTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.cancel(true);
            log.error("Duplicate lookup for subject {} timed out after {}ms", subjectId, lookupTimeout.toMillis());
            return DuplicateResolution.unavailable();
        } catch (ExecutionException e) {
            log.error("Duplicate lookup for subject {} failed", subjectId, e.getCause());
            return DuplicateResolution.unavailable();
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            return DuplicateResolution.unavailable();
        }

        if (existing.isEmpty()) {
            return DuplicateResolution.newRating();
        }

        ActiveRating active = existing.get();
        Duration elapsed = Duration.between(active.acceptedAt(), now);
        if (elapsed.compareTo(cooldown) >= 0) {
            return DuplicateResolution.updateAllowed(active.recordId(), active.score());
        }
        return DuplicateResolution.denied(active.recordId(), cooldown.minus(elapsed));
    }
}
