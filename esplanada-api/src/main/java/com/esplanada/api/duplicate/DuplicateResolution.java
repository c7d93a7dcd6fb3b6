package com.esplanada.api.duplicate;

import java.time.Duration;
import java.util.UUID;

/**
 * Result of checking an (identity, subject) pair for an active rating.
 */
public record DuplicateResolution(
        Status status,
        UUID existingId,
        Integer previousScore,
        Duration retryAfter
) {
    public enum Status {
        NEW,
        UPDATE_ALLOWED,
        DENIED,
        UNAVAILABLE
    }

    public static DuplicateResolution newRating() {
        return new DuplicateResolution(Status.NEW, null, null, null);
    }

    public static DuplicateResolution updateAllowed(UUID existingId, int previousScore) {
        return new DuplicateResolution(Status.UPDATE_ALLOWED, existingId, previousScore, null);
    }

    public static DuplicateResolution denied(UUID existingId, Duration retryAfter) {
        return new DuplicateResolution(Status.DENIED, existingId, null, retryAfter);
    }

    public static DuplicateResolution unavailable() {
        return new DuplicateResolution(Status.UNAVAILABLE, null, null, null);
    }

    /**
     * True when a submission may proceed, either as a new rating or as an update.
     */
    public boolean permitsWrite() {
        return status == Status.NEW || status == Status.UPDATE_ALLOWED;
    }
}
