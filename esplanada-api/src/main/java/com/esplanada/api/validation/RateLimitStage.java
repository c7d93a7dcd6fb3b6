package com.esplanada.api.validation;

import com.esplanada.api.ratelimit.ActionType;
import com.esplanada.api.ratelimit.RateLimitDecision;
import com.esplanada.api.ratelimit.SubmissionRateLimiter;

import java.util.Optional;

/**
 * Rating quota, plus the comment quota when the submission carries a comment. The comment quota is
 * checked first so a comment denial leaves the rating counter untouched.
 */
public class RateLimitStage implements ValidationStage {

    private final SubmissionRateLimiter rateLimiter;

    public RateLimitStage(SubmissionRateLimiter rateLimiter) {
        this.rateLimiter = rateLimiter;
    }

    @Override
    public String name() {
        return "RateLimit";
    }

    @Override
    public Optional<Rejection> check(ValidationContext context) {
        String comment = context.submission().comment();
        if (comment != null && !comment.isBlank()) {
            Optional<Rejection> commentDenial = checkAndRecord(context, ActionType.COMMENT_SUBMISSION);
            if (commentDenial.isPresent()) {
                return commentDenial;
            }
        }
        return checkAndRecord(context, ActionType.RATING_SUBMISSION);
    }

    private Optional<Rejection> checkAndRecord(ValidationContext context, ActionType actionType) {
        RateLimitDecision decision = rateLimiter.checkAndRecord(
                context.submission().identity(), actionType, context.now());
        if (decision.allowed()) {
            return Optional.empty();
        }
        return Optional.of(Rejection.rateLimited(decision.message(), decision.retryAfter()));
    }
}
