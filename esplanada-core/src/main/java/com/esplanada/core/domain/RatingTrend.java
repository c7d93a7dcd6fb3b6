package com.esplanada.core.domain;

/**
 * Direction of recent ratings compared to the all-time mean.
 */
public enum RatingTrend {
    IMPROVING,
    DECLINING,
    STABLE,
    INSUFFICIENT_DATA
}
