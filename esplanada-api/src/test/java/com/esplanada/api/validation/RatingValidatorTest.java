package com.esplanada.api.validation;

import com.esplanada.api.duplicate.DuplicateGuard;
import com.esplanada.api.duplicate.DuplicateResolution;
import com.esplanada.api.rating.RatingSubmission;
import com.esplanada.api.ratelimit.ActionType;
import com.esplanada.api.ratelimit.SubmissionRateLimiter;
import com.esplanada.api.suspicious.ClientMeta;
import com.esplanada.api.suspicious.SuspicionVerdict;
import com.esplanada.core.domain.SecurityEvent.EventType;
import com.esplanada.core.domain.Subject;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Pipeline ordering and bookkeeping, using small stage implementations.
 */
class RatingValidatorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-03-01T12:00:00Z"), ZoneOffset.UTC);

    private final List<String> visited = new ArrayList<>();

    private ValidationStage stage(String name, Function<ValidationContext, Optional<Rejection>> check) {
        return new ValidationStage() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public Optional<Rejection> check(ValidationContext context) {
                visited.add(name);
                return check.apply(context);
            }
        };
    }

    private ValidationStage passing(String name) {
        return stage(name, c -> Optional.empty());
    }

    private static RatingSubmission submission() {
        return new RatingSubmission("S1", "identity-abc", 4, null, null, null);
    }

    @Test
    void stopsAtFirstRejection() {
        RatingValidator validator = new RatingValidator(List.of(
                passing("FormatCheck"),
                stage("RateLimit", c -> Optional.of(Rejection.rateLimited("slow down", Duration.ofMinutes(5)))),
                passing("DuplicateResolve")), CLOCK);

        ValidationOutcome outcome = validator.validate(submission(), ClientMeta.unknown());

        assertThat(outcome.accepted()).isFalse();
        assertThat(outcome.rejectedBy()).isEqualTo("RateLimit");
        assertThat(outcome.rejection().retryAfterSeconds()).isEqualTo(300L);
        assertThat(visited).containsExactly("FormatCheck", "RateLimit");
    }

    @Test
    void acceptedUpdateCarriesResolution() {
        UUID existing = UUID.randomUUID();
        RatingValidator validator = new RatingValidator(List.of(
                stage("DuplicateResolve", c -> {
                    c.setResolution(DuplicateResolution.updateAllowed(existing, 5));
                    return Optional.empty();
                })), CLOCK);

        ValidationOutcome outcome = validator.validate(submission(), null);

        assertThat(outcome.accepted()).isTrue();
        assertThat(outcome.operation()).isEqualTo(ValidationOutcome.Operation.UPDATE_IN_PLACE);
        assertThat(outcome.resolution().existingId()).isEqualTo(existing);
    }

    @Test
    void stageExceptionBecomesStorageFailure() {
        RatingValidator validator = new RatingValidator(List.of(
                stage("DuplicateResolve", c -> {
                    throw new IllegalStateException("connection reset");
                })), CLOCK);

        ValidationOutcome outcome = validator.validate(submission(), null);

        assertThat(outcome.accepted()).isFalse();
        assertThat(outcome.rejection().kind()).isEqualTo(ErrorKind.STORAGE_FAILURE);
    }

    @Test
    void historyKeepsLastHundredAttempts() {
        RatingValidator validator = new RatingValidator(List.of(
                stage("FormatCheck", c -> c.submission().score() > 5
                        ? Optional.of(Rejection.invalidFormat("bad score"))
                        : Optional.of(Rejection.suspiciousActivity()))), CLOCK);

        for (int i = 0; i < 150; i++) {
            validator.validate(new RatingSubmission("S1", "identity-abc", 6, null, null, null), null);
        }
        for (int i = 0; i < 30; i++) {
            validator.validate(submission(), null);
        }

        RatingValidator.ValidationStats stats = validator.validationStats();
        assertThat(stats.total()).isEqualTo(100);
        assertThat(stats.accepted()).isZero();
        assertThat(stats.rejectionsByKind())
                .containsEntry(ErrorKind.INVALID_FORMAT, 70L)
                .containsEntry(ErrorKind.SUSPICIOUS_ACTIVITY, 30L);
    }

    @Test
    void outOfRangeScoreLeavesLimiterAndGuardUntouched() {
        Instant now = CLOCK.instant();
        SubmissionRateLimiter limiter = SubmissionRateLimiter.withDefaults();
        AtomicInteger lookups = new AtomicInteger();
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            DuplicateGuard guard = new DuplicateGuard((identity, subject) -> {
                lookups.incrementAndGet();
                return Optional.empty();
            }, executor, Duration.ofHours(24), Duration.ofSeconds(2));
            Subject subject = Subject.create("S1", "Tasca do Largo", now.minusSeconds(3600));
            RatingValidator validator = new RatingValidator(List.of(
                    new FormatCheckStage(id -> "S1".equals(id) ? Optional.of(subject) : Optional.empty()),
                    new RateLimitStage(limiter),
                    new DuplicateResolveStage(guard)), CLOCK);

            for (int score : new int[] {0, 6}) {
                ValidationOutcome outcome = validator.validate(
                        new RatingSubmission("S1", "identity-abc", score, "tasty", null, null), null);
                assertThat(outcome.rejectedBy()).isEqualTo("FormatCheck");
                assertThat(outcome.rejection().kind()).isEqualTo(ErrorKind.INVALID_FORMAT);
            }
            assertThat(limiter.status("identity-abc", ActionType.RATING_SUBMISSION, now).count()).isZero();
            assertThat(limiter.status("identity-abc", ActionType.COMMENT_SUBMISSION, now).count()).isZero();
            assertThat(lookups).hasValue(0);

            assertThat(validator.validate(submission(), null).accepted()).isTrue();
            assertThat(limiter.status("identity-abc", ActionType.RATING_SUBMISSION, now).count()).isEqualTo(1);
            assertThat(lookups).hasValue(1);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void flaggedRejectionCarriesVerdict() {
        RatingValidator validator = new RatingValidator(List.of(
                stage("SuspiciousActivity", c -> {
                    c.setSuspicion(SuspicionVerdict.flag(EventType.RAPID_SUBMISSION, "too fast"));
                    return Optional.of(Rejection.suspiciousActivity());
                })), CLOCK);

        ValidationOutcome outcome = validator.validate(submission(), null);

        assertThat(outcome.flagged()).isTrue();
        assertThat(outcome.suspicion().eventType()).isEqualTo(EventType.RAPID_SUBMISSION);
    }

    @Test
    void ordinaryRejectionIsNotFlagged() {
        RatingValidator validator = new RatingValidator(List.of(
                stage("FormatCheck", c -> Optional.of(Rejection.invalidFormat("bad")))), CLOCK);

        assertThat(validator.validate(submission(), null).flagged()).isFalse();
    }
}
