package com.esplanada.client.identity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Derives a stable pseudonymous identity from independently optional weak signals.
 *
 * <p>Successful readings are concatenated in collector-name order and hashed with SHA-256.
 * When every collector fails, a minimal fallback (user agent, screen size, timestamp) is hashed
 * and the identity is marked {@link IdentityConfidence#LOW}. Generation never throws; complete
 * failure is reported through {@link FingerprintResult#unavailable(String)}.
 */
public class IdentityFingerprintGenerator {

    private static final Logger log = LoggerFactory.getLogger(IdentityFingerprintGenerator.class);

    public static final Duration DEFAULT_VALIDITY = Duration.ofDays(30);

    private final List<SignalCollector> collectors;
    private final Clock clock;
    private final Duration validity;

    public IdentityFingerprintGenerator() {
        this(defaultCollectors(), Clock.systemUTC(), DEFAULT_VALIDITY);
    }

    public IdentityFingerprintGenerator(List<SignalCollector> collectors, Clock clock, Duration validity) {
        Objects.requireNonNull(collectors, "Collectors cannot be null");
        this.collectors = collectors.stream()
                .sorted(Comparator.comparing(SignalCollector::name))
                .toList();
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.validity = Objects.requireNonNull(validity, "Validity cannot be null");
    }

    public static List<SignalCollector> defaultCollectors() {
        return List.of(
                new NavigatorSignalCollector(),
                new RenderingSignalCollector(),
                new AudioSignalCollector()
        );
    }

    /**
     * Generates an identity from the reported signals.
     *
     * @param signals raw client signals, may be null
     * @return generation result, never null
     */
    public FingerprintResult generate(ClientSignals signals) {
        try {
            List<String> parts = new ArrayList<>();
            List<String> collected = new ArrayList<>();
            for (SignalCollector collector : collectors) {
                SignalReading reading = safeCollect(collector, signals);
                if (reading.ok()) {
                    parts.add(reading.name() + "=" + reading.value());
                    collected.add(reading.name());
                } else {
                    log.debug("Signal {} unavailable: {}", collector.name(), reading.failureReason());
                }
            }

            Instant now = clock.instant();
            if (!parts.isEmpty()) {
                String digest = Digests.sha256(String.join(";", parts));
                return FingerprintResult.success(
                        new ClientIdentity(digest, IdentityConfidence.STANDARD, now, now.plus(validity), null),
                        collected);
            }

            return fallback(signals, now);
        } catch (RuntimeException e) {
            log.warn("Identity generation failed: {}", e.getMessage());
            return FingerprintResult.unavailable("identity generation failed");
        }
    }

    private FingerprintResult fallback(ClientSignals signals, Instant now) {
        String userAgent = signals != null ? signals.userAgent() : null;
        String screen = signals != null ? signals.screenSize() : null;
        if ((userAgent == null || userAgent.isBlank()) && screen == null) {
            log.warn("No identity signal could be collected, fallback included");
            return FingerprintResult.unavailable("no client signals available");
        }

        Instant stamp = signals.observedAt() != null ? signals.observedAt() : now;
        String basic = String.join("|",
                "ua=" + (userAgent == null ? "" : userAgent),
                "screen=" + (screen == null ? "" : screen),
                "ts=" + stamp.toEpochMilli());
        log.info("Using fallback fingerprint with low confidence");
        return FingerprintResult.success(
                new ClientIdentity(Digests.sha256(basic), IdentityConfidence.LOW, now, now.plus(validity), null),
                List.of("fallback"));
    }

    private SignalReading safeCollect(SignalCollector collector, ClientSignals signals) {
        try {
            SignalReading reading = collector.collect(signals);
            return reading != null ? reading : SignalReading.failed(collector.name(), "no reading");
        } catch (RuntimeException e) {
            return SignalReading.failed(collector.name(), e.getMessage());
        }
    }
}
