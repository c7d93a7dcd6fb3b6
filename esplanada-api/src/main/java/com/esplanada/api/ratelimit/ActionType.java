package com.esplanada.api.ratelimit;

/**
 * Actions subject to sliding-window limits, with their default per-identity and global ceilings
 * per window.
 */
public enum ActionType {
    RATING_SUBMISSION(10, 100),
    SUBJECT_CREATION(3, 30),
    PHOTO_UPLOAD(20, 200),
    REPORT_SUBMISSION(5, 50),
    COMMENT_SUBMISSION(15, 150);

    private final int defaultPerIdentity;
    private final int defaultGlobal;

    ActionType(int defaultPerIdentity, int defaultGlobal) {
        this.defaultPerIdentity = defaultPerIdentity;
        this.defaultGlobal = defaultGlobal;
    }

    public int defaultPerIdentity() {
        return defaultPerIdentity;
    }

    public int defaultGlobal() {
        return defaultGlobal;
    }

    /**
     * Property key segment, e.g. {@code rating-submission}.
     */
    public String propertyKey() {
        return name().toLowerCase().replace('_', '-');
    }
}
