package com.esplanada.client.identity;

import java.util.List;

/**
 * Result of identity generation.
 * Either carries an identity or explicitly reports that no identity could be derived.
 */
public record FingerprintResult(
        boolean available,
        ClientIdentity identity,
        List<String> collectedSignals,
        String failureReason
) {
    public FingerprintResult {
        collectedSignals = collectedSignals != null ? List.copyOf(collectedSignals) : List.of();
    }

    public static FingerprintResult success(ClientIdentity identity, List<String> collectedSignals) {
        return new FingerprintResult(true, identity, collectedSignals, null);
    }

    public static FingerprintResult unavailable(String reason) {
        return new FingerprintResult(false, null, List.of(), reason);
    }
}
