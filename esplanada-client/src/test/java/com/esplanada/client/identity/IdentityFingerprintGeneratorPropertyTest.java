package com.esplanada.client.identity;

import net.jqwik.api.*;
import net.jqwik.api.constraints.AlphaChars;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.StringLength;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Property-based tests for identity fingerprint generation.
 */
class IdentityFingerprintGeneratorPropertyTest {

    private static final Instant START = Instant.parse("2026-01-10T12:00:00Z");

    private IdentityFingerprintGenerator generator(MutableClock clock) {
        return new IdentityFingerprintGenerator(
                IdentityFingerprintGenerator.defaultCollectors(), clock, Duration.ofDays(30));
    }

    @Property(tries = 100)
    void sameSignals_produceSameDigest(
            @ForAll @StringLength(min = 1, max = 30) String platform,
            @ForAll @IntRange(min = 320, max = 4000) int width,
            @ForAll @IntRange(min = 240, max = 3000) int height) {
        MutableClock clock = new MutableClock(START);
        IdentityFingerprintGenerator generator = generator(clock);
        ClientSignals signals = new ClientSignals(platform, "pt-BR", "America/Sao_Paulo",
                width, height, 24, 2.0, "data:image/png;base64,AAAA", List.of(0.1, 0.2), "Mozilla/5.0", START);

        FingerprintResult first = generator.generate(signals);
        clock.advance(Duration.ofDays(3));
        FingerprintResult second = generator.generate(signals);

        assertThat(first.available()).isTrue();
        assertThat(second.identity().digest()).isEqualTo(first.identity().digest());
        assertThat(first.identity().confidence()).isEqualTo(IdentityConfidence.STANDARD);
    }

    @Property(tries = 50)
    void digest_neverContainsRawSignal(@ForAll @AlphaChars @StringLength(min = 8, max = 40) String platform) {
        IdentityFingerprintGenerator generator = generator(new MutableClock(START));
        ClientSignals signals = new ClientSignals(platform, null, null, null, null, null, null,
                null, List.of(), null, null);

        ClientIdentity identity = generator.generate(signals).identity();

        assertThat(identity.digest()).hasSize(64).matches("[0-9a-f]{64}");
        assertThat(identity.digest()).doesNotContain(platform);
    }

    @Example
    void differentRenderingOutput_changesDigest() {
        IdentityFingerprintGenerator generator = generator(new MutableClock(START));
        ClientSignals a = new ClientSignals("Linux x86_64", "en-US", "UTC", 1920, 1080, 24, 1.0,
                "data:image/png;base64,AAAA", List.of(), null, null);
        ClientSignals b = new ClientSignals("Linux x86_64", "en-US", "UTC", 1920, 1080, 24, 1.0,
                "data:image/png;base64,BBBB", List.of(), null, null);

        assertThat(generator.generate(a).identity().digest())
                .isNotEqualTo(generator.generate(b).identity().digest());
    }

    @Example
    void partialFailure_usesSucceedingSignalsOnly() {
        IdentityFingerprintGenerator generator = generator(new MutableClock(START));
        ClientSignals signals = new ClientSignals(null, null, null, null, null, null, null,
                null, List.of(0.5, 0.25), null, null);

        FingerprintResult result = generator.generate(signals);

        assertThat(result.available()).isTrue();
        assertThat(result.collectedSignals()).containsExactly(AudioSignalCollector.NAME);
        assertThat(result.identity().isLowConfidence()).isFalse();
    }

    @Example
    void missingAudioBin_isReadAsNaN() {
        List<Double> samples = Arrays.asList(0.5, null, 0.25);
        ClientSignals signals = new ClientSignals(null, null, null, null, null, null, null,
                null, samples, null, null);

        SignalReading reading = new AudioSignalCollector().collect(signals);
        FingerprintResult result = generator(new MutableClock(START)).generate(signals);

        assertThat(signals.audioSamples()).containsExactly(0.5, null, 0.25);
        assertThat(reading.ok()).isTrue();
        assertThat(reading.value()).isEqualTo(Digests.sha256("0.5,NaN,0.25"));
        assertThat(result.available()).isTrue();
        assertThat(result.collectedSignals()).containsExactly(AudioSignalCollector.NAME);
    }

    @Example
    void failingCollector_doesNotPropagate() {
        SignalCollector broken = new SignalCollector() {
            @Override
            public String name() {
                return "broken";
            }

            @Override
            public SignalReading collect(ClientSignals signals) {
                throw new UnsupportedOperationException("API unsupported");
            }
        };
        IdentityFingerprintGenerator generator = new IdentityFingerprintGenerator(
                List.of(broken, new NavigatorSignalCollector()), new MutableClock(START), Duration.ofDays(30));
        ClientSignals signals = new ClientSignals("MacIntel", null, null, null, null, null, null,
                null, List.of(), null, null);

        FingerprintResult result = generator.generate(signals);

        assertThat(result.available()).isTrue();
        assertThat(result.collectedSignals()).containsExactly(NavigatorSignalCollector.NAME);
    }

    @Example
    void allCollectorsFailing_fallsBackWithLowConfidence() {
        IdentityFingerprintGenerator generator = generator(new MutableClock(START));
        ClientSignals signals = new ClientSignals(null, null, null, null, null, null, null,
                null, List.of(), "Mozilla/5.0 (X11; Linux x86_64)", START);

        FingerprintResult result = generator.generate(signals);

        assertThat(result.available()).isTrue();
        assertThat(result.identity().confidence()).isEqualTo(IdentityConfidence.LOW);
        assertThat(result.collectedSignals()).containsExactly("fallback");
    }

    @Example
    void noSignalsAtAll_isUnavailable() {
        IdentityFingerprintGenerator generator = generator(new MutableClock(START));

        assertThat(generator.generate(null).available()).isFalse();
        assertThat(generator.generate(new ClientSignals(null, null, null, null, null, null, null,
                null, null, null, null)).available()).isFalse();
    }

    @Example
    void identityExpiresAfterValidityWindow() {
        MutableClock clock = new MutableClock(START);
        ClientIdentity identity = generator(clock).generate(new ClientSignals("Win32", null, null,
                null, null, null, null, null, List.of(), null, null)).identity();

        assertThat(identity.expiresAt()).isEqualTo(START.plus(Duration.ofDays(30)));
        assertThat(identity.isExpired(START.plus(Duration.ofDays(29)))).isFalse();
        assertThat(identity.isExpired(START.plus(Duration.ofDays(30)))).isTrue();
    }
}
