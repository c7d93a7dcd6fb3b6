package com.esplanada.api.validation;

import java.time.Duration;
import java.util.Objects;

/**
 * Typed reason a submission was not accepted.
 */
public record Rejection(ErrorKind kind, String message, Duration retryAfter) {

    static final String SUSPICIOUS_MESSAGE = "Submission could not be accepted.";
    static final String IDENTITY_MESSAGE = "Could not identify this device. Please try again.";
    static final String STORAGE_MESSAGE = "Service temporarily unavailable. Please try again.";

    public Rejection {
        Objects.requireNonNull(kind, "Kind cannot be null");
    }

    public static Rejection invalidFormat(String message) {
        return new Rejection(ErrorKind.INVALID_FORMAT, message, null);
    }

    public static Rejection rateLimited(String message, Duration retryAfter) {
        return new Rejection(ErrorKind.RATE_LIMITED, message, retryAfter);
    }

    public static Rejection duplicateActive(Duration retryAfter) {
        long hours = Math.max(1, (retryAfter.toMinutes() + 59) / 60);
        return new Rejection(ErrorKind.DUPLICATE_ACTIVE,
                "You already rated this restaurant. You can update your rating in " + hours + " hour(s).",
                retryAfter);
    }

    public static Rejection suspiciousActivity() {
        return new Rejection(ErrorKind.SUSPICIOUS_ACTIVITY, SUSPICIOUS_MESSAGE, null);
    }

    public static Rejection identityUnavailable() {
        return new Rejection(ErrorKind.IDENTITY_UNAVAILABLE, IDENTITY_MESSAGE, null);
    }

    public static Rejection storageFailure() {
        return new Rejection(ErrorKind.STORAGE_FAILURE, STORAGE_MESSAGE, null);
    }

    /**
     * Retry-After in whole seconds, rounded up, or null.
     */
    public Long retryAfterSeconds() {
        if (retryAfter == null) {
            return null;
        }
        long seconds = retryAfter.getSeconds() + (retryAfter.getNano() > 0 ? 1 : 0);
        return Math.max(1, seconds);
    }
}
