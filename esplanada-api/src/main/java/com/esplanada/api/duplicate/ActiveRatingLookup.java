package com.esplanada.api.duplicate;

import java.util.Optional;

/**
 * Finds the active rating an identity holds for a subject.
 */
@FunctionalInterface
public interface ActiveRatingLookup {

    Optional<ActiveRating> findActive(String identityDigest, String subjectId);
}
