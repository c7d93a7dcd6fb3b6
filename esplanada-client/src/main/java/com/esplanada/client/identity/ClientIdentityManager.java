package com.esplanada.client.identity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Owns the identity lifecycle on the client device.
 *
 * <p>The identity is generated on first use, kept for its validity window and regenerated on
 * expiry. A display name chosen by the user survives regeneration.
 */
public class ClientIdentityManager {

    private static final Logger log = LoggerFactory.getLogger(ClientIdentityManager.class);

    private static final Pattern DISPLAY_NAME = Pattern.compile("^[\\p{L}\\s\\-']{1,50}$");

    private final IdentityFingerprintGenerator generator;
    private final IdentityStore store;
    private final Supplier<ClientSignals> signalSource;
    private final Clock clock;

    public ClientIdentityManager(
            IdentityFingerprintGenerator generator,
            IdentityStore store,
            Supplier<ClientSignals> signalSource,
            Clock clock) {
        this.generator = Objects.requireNonNull(generator, "Generator cannot be null");
        this.store = Objects.requireNonNull(store, "Store cannot be null");
        this.signalSource = Objects.requireNonNull(signalSource, "Signal source cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    /**
     * Returns the current identity, creating or renewing it when needed.
     *
     * @throws IdentityUnavailableException if no identity can be derived
     */
    public synchronized ClientIdentity getClientIdentity() {
        ClientIdentity stored = store.load();
        if (stored != null && !stored.isExpired(clock.instant())) {
            return stored;
        }

        FingerprintResult result = generator.generate(signalSource.get());
        if (!result.available()) {
            throw new IdentityUnavailableException(result.failureReason());
        }

        ClientIdentity fresh = result.identity();
        if (stored != null && stored.displayName() != null) {
            fresh = fresh.withDisplayName(stored.displayName());
            log.info("Identity expired, regenerated with preserved display name");
        }
        store.save(fresh);
        return fresh;
    }

    /**
     * Stores a user-supplied display name on the current identity.
     */
    public synchronized ClientIdentity assignDisplayName(String displayName) {
        ClientIdentity named = getClientIdentity().withDisplayName(checkDisplayName(displayName));
        store.save(named);
        return named;
    }

    /**
     * Trims a display name and checks it against the allowed characters.
     *
     * @throws IllegalArgumentException if the name is missing or not 1-50 letters, spaces, hyphens or apostrophes
     */
    public static String checkDisplayName(String displayName) {
        if (displayName == null || !DISPLAY_NAME.matcher(displayName.trim()).matches()) {
            throw new IllegalArgumentException("Display name must be 1-50 letters, spaces, hyphens or apostrophes");
        }
        return displayName.trim();
    }
}
