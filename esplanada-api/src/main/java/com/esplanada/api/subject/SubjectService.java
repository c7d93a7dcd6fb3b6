package com.esplanada.api.subject;

import com.esplanada.api.ratelimit.ActionType;
import com.esplanada.api.ratelimit.RateLimitDecision;
import com.esplanada.api.ratelimit.SubmissionRateLimiter;
import com.esplanada.api.rating.SubjectNotFoundException;
import com.esplanada.core.domain.Subject;
import com.esplanada.core.repository.SubjectRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.UUID;

/**
 * Registers the restaurants ratings are attached to.
 */
@Service
public class SubjectService {

    private static final Logger log = LoggerFactory.getLogger(SubjectService.class);

    private final SubjectRepository subjectRepository;
    private final SubmissionRateLimiter rateLimiter;
    private final Clock clock;

    public SubjectService(SubjectRepository subjectRepository, SubmissionRateLimiter rateLimiter, Clock clock) {
        this.subjectRepository = subjectRepository;
        this.rateLimiter = rateLimiter;
        this.clock = clock;
    }

    /**
     * Registers a subject on behalf of a requester, subject to the creation limit.
     *
     * @param id optional; generated when null
     */
    @Transactional
    public RegistrationResult register(String requesterKey, String id, String name) {
        Objects.requireNonNull(requesterKey, "Requester cannot be null");
        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);

        String subjectId = id != null && !id.isBlank() ? id.trim() : UUID.randomUUID().toString();
        if (subjectRepository.existsById(subjectId)) {
            throw new SubjectAlreadyExistsException("Restaurant already exists: " + subjectId);
        }
        Subject subject = Subject.create(subjectId, name, now);

        RateLimitDecision decision = rateLimiter.checkAndRecord(requesterKey, ActionType.SUBJECT_CREATION, now);
        if (!decision.allowed()) {
            return RegistrationResult.limited(decision);
        }

        Subject saved = subjectRepository.save(subject);
        log.info("Registered restaurant {} ({})", saved.getId(), saved.getName());
        return RegistrationResult.created(saved);
    }

    public Subject getSubject(String id) {
        return subjectRepository.findById(id)
                .orElseThrow(() -> new SubjectNotFoundException("Restaurant not found: " + id));
    }

    public record RegistrationResult(boolean created, Subject subject, RateLimitDecision limit) {
        static RegistrationResult created(Subject subject) {
            return new RegistrationResult(true, subject, null);
        }

        static RegistrationResult limited(RateLimitDecision decision) {
            return new RegistrationResult(false, null, decision);
        }
    }
}
