package com.esplanada.api.validation;

import org.springframework.http.HttpStatus;

/**
 * Rejection taxonomy with the HTTP status each kind maps to.
 */
public enum ErrorKind {
    INVALID_FORMAT("RATING_400", HttpStatus.BAD_REQUEST),
    RATE_LIMITED("RATING_429", HttpStatus.TOO_MANY_REQUESTS),
    DUPLICATE_ACTIVE("RATING_409", HttpStatus.CONFLICT),
    SUSPICIOUS_ACTIVITY("RATING_403", HttpStatus.FORBIDDEN),
    IDENTITY_UNAVAILABLE("IDENTITY_503", HttpStatus.SERVICE_UNAVAILABLE),
    STORAGE_FAILURE("STORAGE_503", HttpStatus.SERVICE_UNAVAILABLE);

    private final String code;
    private final HttpStatus status;

    ErrorKind(String code, HttpStatus status) {
        this.code = code;
        this.status = status;
    }

    public String code() {
        return code;
    }

    public HttpStatus status() {
        return status;
    }

    /**
     * Kinds whose response carries a Retry-After header.
     */
    public boolean isRetryable() {
        return this == RATE_LIMITED || this == DUPLICATE_ACTIVE;
    }
}
