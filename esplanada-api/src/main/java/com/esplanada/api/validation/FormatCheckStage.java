package com.esplanada.api.validation;

import com.esplanada.api.rating.RatingSubmission;
import com.esplanada.core.domain.RatingRecord;
import com.esplanada.core.domain.Subject;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Field constraints. Runs before any stage that touches limiter or guard state.
 */
public class FormatCheckStage implements ValidationStage {

    static final int MIN_IDENTITY_LENGTH = 10;
    static final int MAX_IDENTITY_LENGTH = 200;
    static final int MAX_SUBJECT_ID_LENGTH = 100;
    static final int MAX_PHOTO_REF_LENGTH = 500;

    private final Function<String, Optional<Subject>> subjectLookup;

    public FormatCheckStage(Function<String, Optional<Subject>> subjectLookup) {
        this.subjectLookup = Objects.requireNonNull(subjectLookup, "Subject lookup cannot be null");
    }

    @Override
    public String name() {
        return "FormatCheck";
    }

    @Override
    public Optional<Rejection> check(ValidationContext context) {
        RatingSubmission submission = context.submission();

        String identity = submission.identity();
        if (identity == null || identity.isBlank()) {
            return Optional.of(Rejection.identityUnavailable());
        }
        if (identity.length() < MIN_IDENTITY_LENGTH || identity.length() > MAX_IDENTITY_LENGTH) {
            return Optional.of(Rejection.invalidFormat("Client identity is malformed"));
        }

        Integer score = submission.score();
        if (score == null || score < 1 || score > 5) {
            return Optional.of(Rejection.invalidFormat("Score must be an integer between 1 and 5"));
        }

        String subjectId = submission.subjectId();
        if (subjectId == null || subjectId.isBlank() || subjectId.length() > MAX_SUBJECT_ID_LENGTH) {
            return Optional.of(Rejection.invalidFormat("Restaurant ID must be 1-100 characters"));
        }

        String comment = submission.comment();
        if (comment != null && comment.length() > RatingRecord.MAX_COMMENT_LENGTH) {
            return Optional.of(Rejection.invalidFormat("Comment is too long (maximum 500 characters)"));
        }

        if (submission.photoRefs().size() > RatingRecord.MAX_PHOTO_REFS) {
            return Optional.of(Rejection.invalidFormat("At most 2 photos per rating"));
        }
        for (String ref : submission.photoRefs()) {
            if (ref == null || ref.isBlank() || ref.length() > MAX_PHOTO_REF_LENGTH) {
                return Optional.of(Rejection.invalidFormat("Photo reference is malformed"));
            }
        }

        Optional<Subject> subject = subjectLookup.apply(subjectId);
        if (subject.isEmpty()) {
            return Optional.of(Rejection.invalidFormat("Unknown restaurant: " + subjectId));
        }
        context.setSubject(subject.get());
        return Optional.empty();
    }
}
