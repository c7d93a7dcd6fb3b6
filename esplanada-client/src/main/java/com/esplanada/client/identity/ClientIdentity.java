package com.esplanada.client.identity;

import java.time.Instant;
import java.util.Objects;

/**
 * Pseudonymous client identity.
 * The digest is one-way; none of the raw signals can be recovered from it.
 */
public record ClientIdentity(
        String digest,
        IdentityConfidence confidence,
        Instant issuedAt,
        Instant expiresAt,
        String displayName
) {
    public ClientIdentity {
        Objects.requireNonNull(digest, "Digest cannot be null");
        Objects.requireNonNull(confidence, "Confidence cannot be null");
        Objects.requireNonNull(issuedAt, "Issued-at cannot be null");
        Objects.requireNonNull(expiresAt, "Expires-at cannot be null");
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public boolean isLowConfidence() {
        return confidence == IdentityConfidence.LOW;
    }

    public ClientIdentity withDisplayName(String name) {
        return new ClientIdentity(digest, confidence, issuedAt, expiresAt, name);
    }
}
