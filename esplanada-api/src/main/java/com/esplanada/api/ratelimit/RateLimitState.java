package com.esplanada.api.ratelimit;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Sliding-window state of one limiter key. Every method except the lock accessors
 * must be called while holding the key's lock.
 */
final class RateLimitState {

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<Instant> eventTimes = new ArrayDeque<>();
    private Instant blockedUntil;
    private Instant lastActivity;
    private boolean retired;

    RateLimitState(Instant created) {
        this.lastActivity = created;
    }

    boolean tryLock(Duration timeout) throws InterruptedException {
        return lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    void unlock() {
        lock.unlock();
    }

    boolean isRetired() {
        return retired;
    }

    void retire() {
        retired = true;
    }

    /**
     * Drops events at or before {@code now - window}.
     */
    void evictExpired(Instant now, Duration window) {
        Instant cutoff = now.minus(window);
        while (!eventTimes.isEmpty() && !eventTimes.peekFirst().isAfter(cutoff)) {
            eventTimes.pollFirst();
        }
        if (eventTimes.isEmpty() && blockedUntil != null && !now.isBefore(blockedUntil)) {
            blockedUntil = null;
        }
    }

    /**
     * A full window earns a block only once: events recorded before the last block started
     * were already punished.
     */
    boolean saturationAlreadyBlocked() {
        Instant oldest = eventTimes.peekFirst();
        return blockedUntil != null && oldest != null && oldest.isBefore(blockedUntil);
    }

    int count() {
        return eventTimes.size();
    }

    void record(Instant now) {
        eventTimes.addLast(now);
        lastActivity = now;
    }

    void block(Instant until) {
        blockedUntil = until;
        lastActivity = until;
    }

    boolean isBlocked(Instant now) {
        return blockedUntil != null && now.isBefore(blockedUntil);
    }

    Instant blockedUntil() {
        return blockedUntil;
    }

    /**
     * Time until the oldest in-window event leaves the window.
     */
    Duration untilOldestExpires(Instant now, Duration window) {
        Instant oldest = eventTimes.peekFirst();
        if (oldest == null) {
            return Duration.ZERO;
        }
        Duration wait = Duration.between(now, oldest.plus(window));
        return wait.isNegative() ? Duration.ZERO : wait;
    }

    Duration untilUnblocked(Instant now) {
        if (blockedUntil == null) {
            return Duration.ZERO;
        }
        Duration wait = Duration.between(now, blockedUntil);
        return wait.isNegative() ? Duration.ZERO : wait;
    }

    /**
     * True once the key holds no events and no active block, and has been idle for longer than the window.
     */
    boolean isStale(Instant now, Duration window) {
        return eventTimes.isEmpty() && !isBlocked(now)
                && lastActivity.plus(window).isBefore(now);
    }
}
