package com.esplanada.api.validation;

import com.esplanada.api.rating.RatingSubmission;
import com.esplanada.api.ratelimit.ActionType;
import com.esplanada.api.ratelimit.SubmissionRateLimiter;
import com.esplanada.api.suspicious.ClientMeta;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class RateLimitStageTest {

    private static final Instant T0 = Instant.parse("2025-03-01T12:00:00Z");
    private static final String IDENTITY = "identity-abc";

    private final SubmissionRateLimiter limiter = new SubmissionRateLimiter(
            Map.of(ActionType.RATING_SUBMISSION, new SubmissionRateLimiter.Limits(100, 1000),
                    ActionType.COMMENT_SUBMISSION, new SubmissionRateLimiter.Limits(2, 1000)),
            Duration.ofHours(1), Duration.ofMinutes(5), Duration.ofMillis(250));

    private final RateLimitStage stage = new RateLimitStage(limiter);

    private Optional<Rejection> check(String comment, Instant at) {
        RatingSubmission submission = new RatingSubmission("S1", IDENTITY, 4, comment, null, null);
        return stage.check(new ValidationContext(submission, ClientMeta.unknown(), at));
    }

    private int ratingCount(Instant at) {
        return limiter.status(IDENTITY, ActionType.RATING_SUBMISSION, at).count();
    }

    @Test
    void commentQuotaDeniesBeforeRatingQuotaIsSpent() {
        assertThat(check("Lovely terrace", T0)).isEmpty();
        assertThat(check("Slow service today", T0.plusSeconds(1))).isEmpty();

        Optional<Rejection> third = check("Still slow", T0.plusSeconds(2));

        assertThat(third).get().extracting(Rejection::kind).isEqualTo(ErrorKind.RATE_LIMITED);
        assertThat(third.get().retryAfterSeconds()).isPositive();
        assertThat(ratingCount(T0.plusSeconds(2))).isEqualTo(2);
    }

    @Test
    void ratingWithoutCommentIgnoresCommentQuota() {
        check("first", T0);
        check("second", T0.plusSeconds(1));

        assertThat(check(null, T0.plusSeconds(2))).isEmpty();
        assertThat(check("   ", T0.plusSeconds(3))).isEmpty();
        assertThat(ratingCount(T0.plusSeconds(3))).isEqualTo(4);
        assertThat(limiter.status(IDENTITY, ActionType.COMMENT_SUBMISSION, T0.plusSeconds(3)).count()).isEqualTo(2);
    }
}
