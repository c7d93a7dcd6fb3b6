package com.esplanada.api.rating;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A rating as submitted by a client, before validation. Any field may be missing or out of range.
 */
public record RatingSubmission(
        String subjectId,
        String identity,
        Integer score,
        String comment,
        List<String> photoRefs,
        Instant submittedAt
) {
    public RatingSubmission {
        // null entries are kept for the format check to reject
        photoRefs = photoRefs == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(photoRefs));
    }
}
