package com.esplanada.api.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Sliding-window submission limiter with a per-identity counter and a global counter per action.
 *
 * Exceeding a ceiling blocks the key for a fixed duration. Window and block expiry are evaluated
 * lazily at check time; idle keys are swept opportunistically. Each key is guarded by its own lock,
 * acquired with a bounded wait. A lock timeout is a denial.
 */
@Service
public class SubmissionRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(SubmissionRateLimiter.class);

    static final String GLOBAL_KEY = "*";
    private static final int SWEEP_INTERVAL = 256;

    private final Map<ActionType, Limits> limits;
    private final Duration window;
    private final Duration blockDuration;
    private final Duration lockTimeout;

    private final Map<String, RateLimitState> states = new ConcurrentHashMap<>();
    private final AtomicLong checks = new AtomicLong();

    @Autowired
    public SubmissionRateLimiter(
            Environment environment,
            @Value("${esplanada.rate-limit.window:PT1H}") Duration window,
            @Value("${esplanada.rate-limit.block-duration:PT5M}") Duration blockDuration,
            @Value("${esplanada.rate-limit.lock-timeout:PT0.25S}") Duration lockTimeout) {
        this(limitsFrom(environment), window, blockDuration, lockTimeout);
    }

    public SubmissionRateLimiter(Map<ActionType, Limits> limits, Duration window,
                                 Duration blockDuration, Duration lockTimeout) {
        this.limits = new EnumMap<>(ActionType.class);
        for (ActionType type : ActionType.values()) {
            this.limits.put(type, limits.getOrDefault(type, Limits.defaultsFor(type)));
        }
        this.window = Objects.requireNonNull(window, "Window cannot be null");
        this.blockDuration = Objects.requireNonNull(blockDuration, "Block duration cannot be null");
        this.lockTimeout = Objects.requireNonNull(lockTimeout, "Lock timeout cannot be null");
    }

    /**
     * Limiter with the built-in ceilings, a one hour window and a five minute block.
     */
    public static SubmissionRateLimiter withDefaults() {
        return new SubmissionRateLimiter(Map.of(), Duration.ofHours(1), Duration.ofMinutes(5),
                Duration.ofMillis(250));
    }

    private static Map<ActionType, Limits> limitsFrom(Environment environment) {
        Map<ActionType, Limits> configured = new EnumMap<>(ActionType.class);
        for (ActionType type : ActionType.values()) {
            String prefix = "esplanada.rate-limit." + type.propertyKey();
            configured.put(type, new Limits(
                    environment.getProperty(prefix + ".per-identity", Integer.class, type.defaultPerIdentity()),
                    environment.getProperty(prefix + ".global", Integer.class, type.defaultGlobal())));
        }
        return configured;
    }

    // ==================== Check and record ====================

    /**
     * Checks both the identity and the global counter and, when both allow it, records the event
     * on both. A denial leaves the counters untouched.
     */
    public RateLimitDecision checkAndRecord(String identity, ActionType actionType, Instant now) {
        Objects.requireNonNull(identity, "Identity cannot be null");
        Objects.requireNonNull(actionType, "Action type cannot be null");
        Objects.requireNonNull(now, "Time cannot be null");
        sweepOccasionally(now);

        Limits limit = limits.get(actionType);
        RateLimitState own = lockState(keyOf(identity, actionType), now);
        if (own == null) {
            return lockTimeout(actionType);
        }
        try {
            RateLimitState global = lockState(keyOf(GLOBAL_KEY, actionType), now);
            if (global == null) {
                return lockTimeout(actionType);
            }
            try {
                own.evictExpired(now, window);
                global.evictExpired(now, window);

                RateLimitDecision ownDenial = denialFor(own, limit.perIdentity(), now);
                if (ownDenial != null) {
                    log.warn("Rate limit reached for {} on {}: retry after {}s",
                            mask(identity), actionType, ownDenial.retryAfter().toSeconds());
                    return ownDenial;
                }
                RateLimitDecision globalDenial = denialFor(global, limit.global(), now);
                if (globalDenial != null) {
                    log.warn("Global rate limit reached on {}: retry after {}s",
                            actionType, globalDenial.retryAfter().toSeconds());
                    return globalDenial;
                }

                own.record(now);
                global.record(now);
                return RateLimitDecision.allow(limit.perIdentity() - own.count());
            } finally {
                global.unlock();
            }
        } finally {
            own.unlock();
        }
    }

    private RateLimitDecision denialFor(RateLimitState state, int ceiling, Instant now) {
        boolean full = state.count() >= ceiling;
        if (!state.isBlocked(now) && !full) {
            return null;
        }
        if (full && !state.isBlocked(now) && !state.saturationAlreadyBlocked()) {
            state.block(now.plus(blockDuration));
        }
        Duration wait = retryAfter(state, full, now);
        return RateLimitDecision.deny(wait, "Too many submissions. Wait " + wait.toSeconds() + " seconds.");
    }

    /**
     * The longer of the remaining block and, while the window is full, the time until its oldest event expires.
     */
    private Duration retryAfter(RateLimitState state, boolean windowFull, Instant now) {
        Duration blockRemaining = state.untilUnblocked(now);
        Duration windowRemaining = windowFull ? state.untilOldestExpires(now, window) : Duration.ZERO;
        return blockRemaining.compareTo(windowRemaining) >= 0 ? blockRemaining : windowRemaining;
    }

    private RateLimitDecision lockTimeout(ActionType actionType) {
        log.warn("Rate limiter lock not acquired within {}ms for {}", lockTimeout.toMillis(), actionType);
        return RateLimitDecision.deny(Duration.ofSeconds(1), "Service busy. Try again shortly.");
    }

    // ==================== Monitoring ====================

    /**
     * Remaining identity quota in the current window, without recording anything.
     */
    public int remaining(String identity, ActionType actionType, Instant now) {
        RateLimitStatus status = status(identity, actionType, now);
        return status.blocked() ? 0 : Math.max(0, status.limit() - status.count());
    }

    public RateLimitStatus status(String identity, ActionType actionType, Instant now) {
        Objects.requireNonNull(identity, "Identity cannot be null");
        Objects.requireNonNull(actionType, "Action type cannot be null");
        Limits limit = limits.get(actionType);
        RateLimitState own = lockState(keyOf(identity, actionType), now);
        if (own == null) {
            return new RateLimitStatus(actionType, limit.perIdentity(), limit.perIdentity(), true, null);
        }
        try {
            own.evictExpired(now, window);
            boolean blocked = own.isBlocked(now);
            return new RateLimitStatus(actionType, own.count(), limit.perIdentity(), blocked,
                    blocked ? own.blockedUntil() : null);
        } finally {
            own.unlock();
        }
    }

    /**
     * Resets every counter held for an identity. A caller already waiting on a removed key's lock
     * sees it retired and starts over on a fresh state.
     */
    public void clear(String identity) {
        Objects.requireNonNull(identity, "Identity cannot be null");
        for (ActionType type : ActionType.values()) {
            String key = keyOf(identity, type);
            RateLimitState state = states.get(key);
            if (state == null) {
                continue;
            }
            try {
                if (!state.tryLock(lockTimeout)) {
                    log.warn("Rate limit key for {} on {} busy; not cleared", mask(identity), type);
                    continue;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            try {
                state.retire();
                states.remove(key, state);
            } finally {
                state.unlock();
            }
        }
    }

    public Limits limitsFor(ActionType actionType) {
        return limits.get(actionType);
    }

    int trackedKeys() {
        return states.size();
    }

    // ==================== Key state ====================

    private RateLimitState lockState(String key, Instant now) {
        while (true) {
            RateLimitState state = states.computeIfAbsent(key, k -> new RateLimitState(now));
            try {
                if (!state.tryLock(lockTimeout)) {
                    return null;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return null;
            }
            if (!state.isRetired()) {
                return state;
            }
            state.unlock();
        }
    }

    private void sweepOccasionally(Instant now) {
        if (checks.incrementAndGet() % SWEEP_INTERVAL != 0) {
            return;
        }
        int removed = 0;
        for (Map.Entry<String, RateLimitState> entry : states.entrySet()) {
            RateLimitState state = entry.getValue();
            try {
                if (!state.tryLock(Duration.ZERO)) {
                    continue;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            try {
                state.evictExpired(now, window);
                if (state.isStale(now, window)) {
                    state.retire();
                    states.remove(entry.getKey(), state);
                    removed++;
                }
            } finally {
                state.unlock();
            }
        }
        if (removed > 0) {
            log.debug("Evicted {} idle rate limit keys", removed);
        }
    }

    private static String keyOf(String identity, ActionType actionType) {
        return actionType.name() + ":" + identity;
    }

    private static String mask(String identity) {
        return identity.length() <= 10 ? identity : identity.substring(0, 10) + "...";
    }

    /**
     * Ceilings for one action type.
     */
    public record Limits(int perIdentity, int global) {
        public Limits {
            if (perIdentity < 1 || global < 1) {
                throw new IllegalArgumentException("Limits must be positive");
            }
        }

        static Limits defaultsFor(ActionType type) {
            return new Limits(type.defaultPerIdentity(), type.defaultGlobal());
        }
    }

    /**
     * Snapshot of one identity's counter for monitoring.
     */
    public record RateLimitStatus(
            ActionType actionType,
            int count,
            int limit,
            boolean blocked,
            Instant blockedUntil
    ) {}
}
