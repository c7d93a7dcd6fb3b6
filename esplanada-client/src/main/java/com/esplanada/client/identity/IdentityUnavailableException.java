package com.esplanada.client.identity;

/**
 * Thrown when no identity can be derived from any signal, fallback included.
 */
public class IdentityUnavailableException extends RuntimeException {

    public IdentityUnavailableException(String message) {
        super(message);
    }
}
