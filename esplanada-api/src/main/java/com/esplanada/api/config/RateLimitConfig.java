package com.esplanada.api.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Per-client HTTP request throttling using Bucket4j.
 * Sits in front of the domain limiter and only dampens raw request floods.
 *
 * Buckets live in a bounded Caffeine cache and expire once a client has been idle; an expired
 * bucket comes back full, which is no looser than a bucket left to refill.
 */
@Configuration
public class RateLimitConfig {

    private final Cache<String, Bucket> buckets;
    private final int defaultPerMinute;
    private final int writePerMinute;
    private final int readPerMinute;

    @Autowired
    public RateLimitConfig(
            @Value("${esplanada.http-throttle.default-per-minute:100}") int defaultPerMinute,
            @Value("${esplanada.http-throttle.write-per-minute:30}") int writePerMinute,
            @Value("${esplanada.http-throttle.read-per-minute:500}") int readPerMinute,
            @Value("${esplanada.http-throttle.idle-expiry:PT10M}") Duration idleExpiry,
            @Value("${esplanada.http-throttle.max-clients:100000}") long maxClients) {
        if (idleExpiry.compareTo(Duration.ofMinutes(1)) < 0) {
            throw new IllegalArgumentException("Idle expiry must cover at least one refill period");
        }
        this.defaultPerMinute = defaultPerMinute;
        this.writePerMinute = writePerMinute;
        this.readPerMinute = readPerMinute;
        this.buckets = Caffeine.newBuilder()
                .expireAfterAccess(idleExpiry)
                .maximumSize(maxClients)
                .build();
    }

    /**
     * Default bucket per client.
     */
    public Bucket resolveBucket(String clientId) {
        return buckets.get(clientId, key -> perMinute(defaultPerMinute));
    }

    /**
     * Bucket for writes (rating submission, registration, retraction).
     */
    public Bucket resolveWriteBucket(String clientId) {
        return buckets.get(clientId + ":write", key -> perMinute(writePerMinute));
    }

    /**
     * Bucket for statistics reads.
     */
    public Bucket resolveReadBucket(String clientId) {
        return buckets.get(clientId + ":read", key -> perMinute(readPerMinute));
    }

    long trackedBuckets() {
        buckets.cleanUp();
        return buckets.estimatedSize();
    }

    private static Bucket perMinute(int capacity) {
        Bandwidth limit = Bandwidth.classic(capacity, Refill.greedy(capacity, Duration.ofMinutes(1)));
        return Bucket.builder().addLimit(limit).build();
    }
}
