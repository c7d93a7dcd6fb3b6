package com.esplanada.api.validation;

import com.esplanada.api.duplicate.DuplicateGuard;
import com.esplanada.api.rating.RatingSubmission;
import com.esplanada.api.ratelimit.SubmissionRateLimiter;
import com.esplanada.api.suspicious.ClientMeta;
import com.esplanada.api.suspicious.SuspiciousActivityDetector;
import com.esplanada.core.repository.SubjectRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs a submission through the ordered validation stages and stops at the first rejection.
 *
 * Order: FormatCheck, RateLimit, DuplicateResolve, SuspiciousActivity, BusinessRules.
 * Field errors are caught before the limiter or guard is touched.
 */
@Service
public class RatingValidator {

    private static final Logger log = LoggerFactory.getLogger(RatingValidator.class);

    static final int HISTORY_SIZE = 100;

    private final List<ValidationStage> stages;
    private final Clock clock;
    private final Deque<ValidationRecord> history = new ArrayDeque<>();

    @Autowired
    public RatingValidator(
            SubjectRepository subjectRepository,
            SubmissionRateLimiter rateLimiter,
            DuplicateGuard duplicateGuard,
            SuspiciousActivityDetector detector,
            Clock clock) {
        this(List.of(
                new FormatCheckStage(subjectRepository::findById),
                new RateLimitStage(rateLimiter),
                new DuplicateResolveStage(duplicateGuard),
                new SuspiciousActivityStage(detector),
                new BusinessRulesStage()), clock);
    }

    RatingValidator(List<ValidationStage> stages, Clock clock) {
        this.stages = List.copyOf(stages);
        this.clock = clock;
    }

    public ValidationOutcome validate(RatingSubmission submission, ClientMeta meta) {
        Objects.requireNonNull(submission, "Submission cannot be null");
        Instant now = clock.instant();
        ValidationContext context = new ValidationContext(submission, meta, now);

        for (ValidationStage stage : stages) {
            Optional<Rejection> rejection;
            try {
                rejection = stage.check(context);
            } catch (RuntimeException e) {
                log.error("Validation stage {} failed for subject {}", stage.name(), submission.subjectId(), e);
                rejection = Optional.of(Rejection.storageFailure());
            }
            if (rejection.isPresent()) {
                log.warn("Rating for {} rejected at {}: {} ({})", submission.subjectId(), stage.name(),
                        rejection.get().kind(), rejection.get().message());
                remember(new ValidationRecord(now, submission.subjectId(), false, rejection.get().kind(), stage.name()));
                return ValidationOutcome.reject(stage.name(), rejection.get(), context.suspicion());
            }
        }

        ValidationOutcome outcome = ValidationOutcome.accept(context.resolution());
        log.info("Rating for {} passed validation as {}", submission.subjectId(), outcome.operation());
        remember(new ValidationRecord(now, submission.subjectId(), true, null, null));
        return outcome;
    }

    public List<String> stageNames() {
        return stages.stream().map(ValidationStage::name).toList();
    }

    // ==================== History ====================

    private void remember(ValidationRecord record) {
        synchronized (history) {
            history.addLast(record);
            while (history.size() > HISTORY_SIZE) {
                history.removeFirst();
            }
        }
    }

    /**
     * Aggregates over the most recent validation attempts.
     */
    public ValidationStats validationStats() {
        List<ValidationRecord> recent;
        synchronized (history) {
            recent = List.copyOf(history);
        }
        long accepted = recent.stream().filter(ValidationRecord::accepted).count();
        Map<ErrorKind, Long> byKind = new EnumMap<>(ErrorKind.class);
        for (ValidationRecord record : recent) {
            if (!record.accepted()) {
                byKind.merge(record.kind(), 1L, Long::sum);
            }
        }
        double rate = recent.isEmpty() ? 0.0 : (double) accepted / recent.size();
        return new ValidationStats(recent.size(), accepted, recent.size() - accepted, rate, byKind);
    }

    public record ValidationRecord(
            Instant at,
            String subjectId,
            boolean accepted,
            ErrorKind kind,
            String stage
    ) {}

    public record ValidationStats(
            long total,
            long accepted,
            long rejected,
            double acceptanceRate,
            Map<ErrorKind, Long> rejectionsByKind
    ) {}
}
