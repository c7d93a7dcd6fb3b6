package com.esplanada.client.identity;

/**
 * How much the identity digest can be trusted to be stable for one client.
 */
public enum IdentityConfidence {
    STANDARD,   // At least one fingerprint collector succeeded
    LOW         // Minimal fallback signal set, includes a timestamp
}
