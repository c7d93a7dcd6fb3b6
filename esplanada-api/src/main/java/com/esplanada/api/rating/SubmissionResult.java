package com.esplanada.api.rating;

import com.esplanada.api.aggregation.SubjectStatistics;
import com.esplanada.api.validation.Rejection;
import com.esplanada.api.validation.ValidationOutcome.Operation;
import com.esplanada.core.domain.RatingRecord;

/**
 * Outcome of a rating submission: the stored record with fresh statistics, or a rejection.
 */
public record SubmissionResult(
        boolean accepted,
        RatingRecord record,
        Operation operation,
        SubjectStatistics statistics,
        Rejection rejection
) {
    public static SubmissionResult accepted(RatingRecord record, Operation operation, SubjectStatistics statistics) {
        return new SubmissionResult(true, record, operation, statistics, null);
    }

    public static SubmissionResult rejected(Rejection rejection) {
        return new SubmissionResult(false, null, null, null, rejection);
    }
}
