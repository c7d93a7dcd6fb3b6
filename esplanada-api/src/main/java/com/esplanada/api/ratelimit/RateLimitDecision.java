package com.esplanada.api.ratelimit;

import java.time.Duration;

/**
 * Outcome of a limiter check. Either allowed with the remaining quota, or denied with the time
 * to wait before a retry can succeed.
 */
public record RateLimitDecision(
        boolean allowed,
        int remaining,
        Duration retryAfter,
        String message
) {
    public static RateLimitDecision allow(int remaining) {
        return new RateLimitDecision(true, remaining, Duration.ZERO, null);
    }

    public static RateLimitDecision deny(Duration retryAfter, String message) {
        Duration wait = retryAfter.isNegative() || retryAfter.isZero() ? Duration.ofSeconds(1) : retryAfter;
        return new RateLimitDecision(false, 0, wait, message);
    }
}
