package com.esplanada.api.suspicious;

import com.esplanada.api.rating.RatingSubmission;
import com.esplanada.core.domain.SecurityEvent.EventType;
import com.esplanada.core.domain.Subject;
import com.esplanada.core.repository.SubjectRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Heuristic classifier for automated or abusive submissions.
 *
 * Flags automation markers in the user agent, submissions arriving less than the minimum interval
 * after the same identity's previous one, and votes timed within a second of the subject's creation.
 * {@link #assess} only classifies; a flag reaches the {@link SecurityEventLog} through {@link #report},
 * which the rating pipeline calls once the subject lock is released.
 */
@Service
public class SuspiciousActivityDetector {

    private static final Pattern AUTOMATION_MARKERS = Pattern.compile(
            "bot|crawler|spider|scraper|automated|headless|phantom|selenium|webdriver|puppeteer|playwright",
            Pattern.CASE_INSENSITIVE);

    private static final Duration PRE_SEED_WINDOW = Duration.ofSeconds(1);
    private static final Duration HISTORY_TTL = Duration.ofMinutes(10);
    private static final int SWEEP_THRESHOLD = 10_000;

    private final SubjectRepository subjectRepository;
    private final SecurityEventLog securityEventLog;
    private final Clock clock;
    private final Duration minInterval;

    // identity -> time of its last evaluated submission
    private final Map<String, Instant> lastSubmission = new ConcurrentHashMap<>();

    public SuspiciousActivityDetector(
            SubjectRepository subjectRepository,
            SecurityEventLog securityEventLog,
            Clock clock,
            @Value("${esplanada.suspicious.min-interval:PT1S}") Duration minInterval) {
        this.subjectRepository = subjectRepository;
        this.securityEventLog = securityEventLog;
        this.clock = clock;
        this.minInterval = minInterval;
    }

    /**
     * Assesses a submission and records a flag immediately.
     */
    public SuspicionVerdict evaluate(RatingSubmission submission, ClientMeta meta) {
        Objects.requireNonNull(submission, "Submission cannot be null");
        Optional<Instant> subjectCreatedAt = subjectRepository.findById(submission.subjectId())
                .map(Subject::getCreatedAt);
        SuspicionVerdict verdict = assess(submission, meta, subjectCreatedAt.orElse(null));
        report(verdict, submission, meta);
        return verdict;
    }

    /**
     * Classifies with an already known subject creation time (null if unknown). Nothing is recorded.
     */
    public SuspicionVerdict assess(RatingSubmission submission, ClientMeta meta, Instant subjectCreatedAt) {
        Objects.requireNonNull(submission, "Submission cannot be null");
        ClientMeta clientMeta = meta != null ? meta : ClientMeta.unknown();
        Instant now = clock.instant();

        SuspicionVerdict verdict = classify(submission, clientMeta, subjectCreatedAt, now);
        if (submission.identity() != null) {
            lastSubmission.put(submission.identity(), now);
            sweepIfLarge(now);
        }
        return verdict;
    }

    /**
     * Writes a flagged verdict to the security event log; an allowed verdict is ignored.
     */
    public void report(SuspicionVerdict verdict, RatingSubmission submission, ClientMeta meta) {
        if (verdict == null || !verdict.flagged()) {
            return;
        }
        securityEventLog.record(verdict.eventType(), verdict.reason(),
                submission.subjectId(), submission.identity(), meta != null ? meta : ClientMeta.unknown());
    }

    private SuspicionVerdict classify(RatingSubmission submission, ClientMeta meta,
                                      Instant subjectCreatedAt, Instant now) {
        String userAgent = meta.userAgent();
        if (userAgent != null && AUTOMATION_MARKERS.matcher(userAgent).find()) {
            return SuspicionVerdict.flag(EventType.SUSPICIOUS_USER_AGENT, "Automation marker in user agent");
        }

        if (submission.identity() != null) {
            Instant previous = lastSubmission.get(submission.identity());
            if (previous != null && Duration.between(previous, now).compareTo(minInterval) < 0) {
                return SuspicionVerdict.flag(EventType.RAPID_SUBMISSION,
                        "Submission " + Duration.between(previous, now).toMillis() + "ms after previous");
            }
        }

        if (subjectCreatedAt != null) {
            Instant submittedAt = submission.submittedAt() != null ? submission.submittedAt() : now;
            Duration sinceCreation = Duration.between(subjectCreatedAt, submittedAt).abs();
            if (sinceCreation.compareTo(PRE_SEED_WINDOW) < 0) {
                return SuspicionVerdict.flag(EventType.PRE_SEEDED_VOTE,
                        "Vote within " + sinceCreation.toMillis() + "ms of subject creation");
            }
        }
        return SuspicionVerdict.allow();
    }

    private void sweepIfLarge(Instant now) {
        if (lastSubmission.size() < SWEEP_THRESHOLD) {
            return;
        }
        Instant cutoff = now.minus(HISTORY_TTL);
        lastSubmission.values().removeIf(t -> t.isBefore(cutoff));
    }
}
