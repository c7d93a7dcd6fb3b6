package com.esplanada.client.identity;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClientIdentityManagerTest {

    private static final Instant START = Instant.parse("2026-03-01T08:00:00Z");

    private MutableClock clock;
    private InMemoryIdentityStore store;
    private AtomicReference<ClientSignals> signals;
    private AtomicInteger collections;
    private ClientIdentityManager manager;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        store = new InMemoryIdentityStore();
        signals = new AtomicReference<>(new ClientSignals("Linux armv8l", "pt-BR", "America/Sao_Paulo",
                412, 915, 24, 2.625, "data:image/png;base64,CANVAS", List.of(0.01, 0.02), "Mozilla/5.0", null));
        collections = new AtomicInteger();
        IdentityFingerprintGenerator generator = new IdentityFingerprintGenerator(
                IdentityFingerprintGenerator.defaultCollectors(), clock, Duration.ofDays(30));
        manager = new ClientIdentityManager(generator, store, () -> {
            collections.incrementAndGet();
            return signals.get();
        }, clock);
    }

    @Test
    void getClientIdentity_isIdempotentWithinValidity() {
        ClientIdentity first = manager.getClientIdentity();
        clock.advance(Duration.ofDays(10));
        ClientIdentity second = manager.getClientIdentity();

        assertThat(second).isEqualTo(first);
        assertThat(collections.get()).isEqualTo(1);
    }

    @Test
    void expiredIdentity_isRegeneratedKeepingDisplayName() {
        manager.assignDisplayName("Ana Maria");
        ClientIdentity before = store.load();

        clock.advance(Duration.ofDays(31));
        ClientIdentity after = manager.getClientIdentity();

        assertThat(after.issuedAt()).isAfter(before.issuedAt());
        assertThat(after.displayName()).isEqualTo("Ana Maria");
        assertThat(after.digest()).isEqualTo(before.digest());
    }

    @Test
    void invalidDisplayName_isRejected() {
        assertThatThrownBy(() -> manager.assignDisplayName("R2-D2 <script>"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> manager.assignDisplayName(""))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void checkDisplayName_trimsAcceptedNames() {
        assertThat(ClientIdentityManager.checkDisplayName("  João d'Ávila ")).isEqualTo("João d'Ávila");
        assertThatThrownBy(() -> ClientIdentityManager.checkDisplayName(null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ClientIdentityManager.checkDisplayName("a".repeat(51)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void totalFailure_raisesIdentityUnavailable() {
        signals.set(null);

        assertThatThrownBy(() -> manager.getClientIdentity())
                .isInstanceOf(IdentityUnavailableException.class);
        assertThat(store.load()).isNull();
    }
}
