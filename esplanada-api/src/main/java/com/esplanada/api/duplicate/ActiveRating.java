package com.esplanada.api.duplicate;

import java.time.Instant;
import java.util.UUID;

/**
 * The currently counted rating of an (identity, subject) pair.
 */
public record ActiveRating(UUID recordId, int score, Instant acceptedAt) {}
