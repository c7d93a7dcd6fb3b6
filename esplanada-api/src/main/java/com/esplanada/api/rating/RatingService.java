package com.esplanada.api.rating;

import com.esplanada.api.aggregation.AggregationEngine;
import com.esplanada.api.aggregation.SubjectStatistics;
import com.esplanada.api.broadcast.UpdateBroadcaster;
import com.esplanada.api.duplicate.DuplicateGuard;
import com.esplanada.api.duplicate.DuplicateResolution;
import com.esplanada.api.suspicious.ClientMeta;
import com.esplanada.api.suspicious.SuspiciousActivityDetector;
import com.esplanada.api.validation.RatingValidator;
import com.esplanada.api.validation.Rejection;
import com.esplanada.api.validation.ValidationOutcome;
import com.esplanada.api.validation.ValidationOutcome.Operation;
import com.esplanada.core.domain.RatingRecord;
import com.esplanada.core.repository.RatingRecordRepository;
import com.esplanada.core.repository.SubjectRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Accepts, updates and retracts ratings.
 *
 * Validation, the storage write and the statistics update for one subject run inside that subject's
 * critical section, so the duplicate check cannot be raced. Security events are recorded and
 * subscribers notified after the section is left.
 */
@Service
public class RatingService {

    private static final Logger log = LoggerFactory.getLogger(RatingService.class);

    private static final int LOCK_STRIPES = 256;

    private final RatingValidator validator;
    private final DuplicateGuard duplicateGuard;
    private final SuspiciousActivityDetector detector;
    private final AggregationEngine aggregationEngine;
    private final UpdateBroadcaster broadcaster;
    private final RatingRecordRepository ratingRecordRepository;
    private final SubjectRepository subjectRepository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final Duration subjectLockTimeout;
    private final int storageRetries;

    private final ReentrantLock[] subjectLocks = new ReentrantLock[LOCK_STRIPES];

    public RatingService(
            RatingValidator validator,
            DuplicateGuard duplicateGuard,
            SuspiciousActivityDetector detector,
            AggregationEngine aggregationEngine,
            UpdateBroadcaster broadcaster,
            RatingRecordRepository ratingRecordRepository,
            SubjectRepository subjectRepository,
            TransactionTemplate transactionTemplate,
            Clock clock,
            @Value("${esplanada.rating.subject-lock-timeout:PT2S}") Duration subjectLockTimeout,
            @Value("${esplanada.rating.storage-retries:2}") int storageRetries) {
        this.validator = validator;
        this.duplicateGuard = duplicateGuard;
        this.detector = detector;
        this.aggregationEngine = aggregationEngine;
        this.broadcaster = broadcaster;
        this.ratingRecordRepository = ratingRecordRepository;
        this.subjectRepository = subjectRepository;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
        this.subjectLockTimeout = subjectLockTimeout;
        this.storageRetries = storageRetries;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            subjectLocks[i] = new ReentrantLock();
        }
    }

    // ==================== Submission ====================

    public SubmissionResult submitRating(RatingSubmission submission, ClientMeta meta) {
        Objects.requireNonNull(submission, "Submission cannot be null");

        ReentrantLock lock = lockFor(submission.subjectId());
        if (!acquire(lock)) {
            log.error("Subject {} busy; lock not acquired within {}ms",
                    submission.subjectId(), subjectLockTimeout.toMillis());
            return SubmissionResult.rejected(Rejection.storageFailure());
        }

        ValidationOutcome outcome;
        SubmissionResult result;
        try {
            outcome = validator.validate(submission, meta);
            result = outcome.accepted()
                    ? store(submission, outcome)
                    : SubmissionResult.rejected(outcome.rejection());
        } finally {
            lock.unlock();
        }

        if (outcome.flagged()) {
            detector.report(outcome.suspicion(), submission, meta);
        }
        if (result.accepted()) {
            broadcaster.publish(submission.subjectId(), result.statistics());
        }
        return result;
    }

    private SubmissionResult store(RatingSubmission submission, ValidationOutcome outcome) {
        Instant acceptedAt = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        Instant submittedAt = submission.submittedAt() != null
                ? submission.submittedAt().truncatedTo(ChronoUnit.MILLIS)
                : acceptedAt;
        DuplicateResolution resolution = outcome.resolution();

        RatingRecord stored;
        try {
            stored = withStorageRetry(() -> transactionTemplate.execute(status ->
                    outcome.operation() == Operation.UPDATE_IN_PLACE
                            ? updateInPlace(resolution.existingId(), submission, submittedAt, acceptedAt)
                            : create(submission, submittedAt, acceptedAt)));
        } catch (DataAccessException e) {
            log.error("Storing rating for {} failed after {} retries", submission.subjectId(), storageRetries, e);
            return SubmissionResult.rejected(Rejection.storageFailure());
        }

        Integer previousScore = outcome.operation() == Operation.UPDATE_IN_PLACE ? resolution.previousScore() : null;
        SubjectStatistics statistics = aggregationEngine.apply(
                stored.getSubjectId(), stored.getId(), stored.getRevision(), stored.getScore(), previousScore,
                stored.getAcceptedAt());

        log.info("Rating {} for {} accepted as {} (revision {}); count={}, mean={}",
                stored.getId(), stored.getSubjectId(), outcome.operation(), stored.getRevision(),
                statistics.count(), statistics.mean());
        return SubmissionResult.accepted(stored, outcome.operation(), statistics);
    }

    private RatingRecord create(RatingSubmission submission, Instant submittedAt, Instant acceptedAt) {
        RatingRecord record = RatingRecord.create(
                submission.subjectId(),
                submission.identity(),
                submission.score(),
                normalizeComment(submission.comment()),
                submission.photoRefs(),
                submittedAt,
                acceptedAt);
        return ratingRecordRepository.saveAndFlush(record);
    }

    private RatingRecord updateInPlace(UUID existingId, RatingSubmission submission,
                                       Instant submittedAt, Instant acceptedAt) {
        RatingRecord record = ratingRecordRepository.findById(existingId)
                .orElseThrow(() -> new RatingNotFoundException("Rating not found: " + existingId));
        record.replaceWith(submission.score(), normalizeComment(submission.comment()),
                submission.photoRefs(), submittedAt, acceptedAt);
        return ratingRecordRepository.saveAndFlush(record);
    }

    private static String normalizeComment(String comment) {
        if (comment == null) {
            return null;
        }
        String trimmed = comment.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private <T> T withStorageRetry(Supplier<T> write) {
        DataAccessException last = null;
        for (int attempt = 0; attempt <= storageRetries; attempt++) {
            try {
                return write.get();
            } catch (DataAccessException e) {
                last = e;
                log.warn("Storage write attempt {} failed: {}", attempt + 1, e.getMessage());
            }
        }
        throw last;
    }

    // ==================== Pre-check ====================

    /**
     * Whether a submission by this identity would currently pass the duplicate check.
     */
    public boolean canRate(String identity, String subjectId) {
        Objects.requireNonNull(identity, "Identity cannot be null");
        Objects.requireNonNull(subjectId, "Subject ID cannot be null");
        return duplicateGuard.resolve(identity, subjectId, clock.instant()).permitsWrite();
    }

    // ==================== Retraction ====================

    /**
     * Withdraws a rating. Retracting an already retracted rating returns the current statistics.
     */
    public SubjectStatistics retract(UUID recordId) {
        Objects.requireNonNull(recordId, "Record ID cannot be null");
        RatingRecord record = ratingRecordRepository.findById(recordId)
                .orElseThrow(() -> new RatingNotFoundException("Rating not found: " + recordId));
        String subjectId = record.getSubjectId();

        ReentrantLock lock = lockFor(subjectId);
        if (!acquire(lock)) {
            throw new SubjectBusyException("Subject busy: " + subjectId);
        }
        SubjectStatistics statistics;
        try {
            RatingRecord retracted = withStorageRetry(() -> transactionTemplate.execute(status -> {
                RatingRecord current = ratingRecordRepository.findById(recordId)
                        .orElseThrow(() -> new RatingNotFoundException("Rating not found: " + recordId));
                if (current.isActive()) {
                    current.retract();
                    return ratingRecordRepository.saveAndFlush(current);
                }
                return current;
            }));
            statistics = aggregationEngine.retract(subjectId, retracted.getId(), retracted.getScore());
            log.info("Rating {} for {} retracted; count={}", recordId, subjectId, statistics.count());
        } finally {
            lock.unlock();
        }
        broadcaster.publish(subjectId, statistics);
        return statistics;
    }

    // ==================== Statistics ====================

    public SubjectStatistics statistics(String subjectId) {
        requireSubject(subjectId);
        return aggregationEngine.statistics(subjectId);
    }

    /**
     * Recomputes a subject's statistics from its stored ratings.
     */
    public SubjectStatistics rebuildStatistics(String subjectId) {
        requireSubject(subjectId);
        ReentrantLock lock = lockFor(subjectId);
        if (!acquire(lock)) {
            throw new SubjectBusyException("Subject busy: " + subjectId);
        }
        SubjectStatistics statistics;
        try {
            statistics = aggregationEngine.rebuild(subjectId);
        } finally {
            lock.unlock();
        }
        broadcaster.publish(subjectId, statistics);
        return statistics;
    }

    private void requireSubject(String subjectId) {
        if (subjectId == null || !subjectRepository.existsById(subjectId)) {
            throw new SubjectNotFoundException("Restaurant not found: " + subjectId);
        }
    }

    // ==================== Locking ====================

    private ReentrantLock lockFor(String subjectId) {
        int hash = subjectId == null ? 0 : subjectId.hashCode();
        return subjectLocks[Math.floorMod(hash, LOCK_STRIPES)];
    }

    private boolean acquire(ReentrantLock lock) {
        try {
            return lock.tryLock(subjectLockTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public static class SubjectBusyException extends RuntimeException {
        public SubjectBusyException(String message) { super(message); }
    }
}
