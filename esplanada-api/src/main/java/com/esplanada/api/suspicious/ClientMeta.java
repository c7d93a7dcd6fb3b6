package com.esplanada.api.suspicious;

/**
 * Request metadata used by the heuristics and stored with security events.
 */
public record ClientMeta(String userAgent, String remoteAddress) {

    public static ClientMeta unknown() {
        return new ClientMeta(null, null);
    }
}
