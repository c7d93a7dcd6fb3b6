package com.esplanada.api.suspicious;

import com.esplanada.api.broadcast.UpdateBroadcaster;
import com.esplanada.core.domain.SecurityEvent;
import com.esplanada.core.domain.SecurityEvent.EventType;
import com.esplanada.core.repository.SecurityEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.EnumMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Append-only security event log with hash chaining.
 *
 * Each event is logged at WARN, persisted with the hash of its predecessor, and published to
 * audit subscribers. Persistence failures are logged and never propagate into the rating pipeline.
 */
@Service
public class SecurityEventLog {

    private static final Logger log = LoggerFactory.getLogger(SecurityEventLog.class);

    static final String GENESIS = "GENESIS";
    private static final int IDENTITY_PREFIX_LENGTH = 10;

    private final SecurityEventRepository repository;
    private final UpdateBroadcaster broadcaster;
    private final Clock clock;

    public SecurityEventLog(SecurityEventRepository repository, UpdateBroadcaster broadcaster, Clock clock) {
        this.repository = repository;
        this.broadcaster = broadcaster;
        this.clock = clock;
    }

    /**
     * Appends an event. Returns the stored event, or the unsaved one if storage failed.
     */
    public synchronized SecurityEvent record(
            EventType eventType,
            String reason,
            String subjectId,
            String identity,
            ClientMeta meta) {
        Objects.requireNonNull(eventType, "Event type cannot be null");
        Objects.requireNonNull(reason, "Reason cannot be null");
        ClientMeta clientMeta = meta != null ? meta : ClientMeta.unknown();
        String identityPrefix = maskIdentity(identity);

        log.warn("Security event {}: {} (subject={}, identity={}, userAgent={})",
                eventType, reason, subjectId, identityPrefix, clientMeta.userAgent());

        Instant occurredAt = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        SecurityEvent event;
        try {
            SecurityEvent previous = repository.findTopByOrderBySequenceNumberDesc().orElse(null);
            long sequence = previous != null ? previous.getSequenceNumber() + 1 : 1;
            String previousHash = previous != null ? previous.getEventHash() : GENESIS;

            event = SecurityEvent.create(sequence, eventType, reason, subjectId, identityPrefix,
                    clientMeta.userAgent(), occurredAt, previousHash);
            event.setEventHash(computeHash(event));
            event = repository.save(event);
        } catch (DataAccessException e) {
            log.error("Failed to persist security event {} for subject {}", eventType, subjectId, e);
            event = SecurityEvent.create(0, eventType, reason, subjectId, identityPrefix,
                    clientMeta.userAgent(), occurredAt, null);
        }

        broadcaster.publishSecurityEvent(event);
        return event;
    }

    /**
     * Walks the whole chain and checks every hash and every link.
     */
    public ChainVerificationResult verifyChain() {
        List<SecurityEvent> events = repository.findAllByOrderBySequenceNumberAsc();
        String expectedPrevious = GENESIS;
        for (SecurityEvent event : events) {
            if (!expectedPrevious.equals(event.getPreviousEventHash())) {
                return new ChainVerificationResult(false, events.size(), event.getSequenceNumber(), "Broken link");
            }
            if (!computeHash(event).equals(event.getEventHash())) {
                return new ChainVerificationResult(false, events.size(), event.getSequenceNumber(), "Hash mismatch");
            }
            expectedPrevious = event.getEventHash();
        }
        return new ChainVerificationResult(true, events.size(), null, null);
    }

    public Page<SecurityEvent> recent(Pageable pageable) {
        return repository.findAllByOrderBySequenceNumberDesc(pageable);
    }

    public List<SecurityEvent> forSubject(String subjectId) {
        return repository.findBySubjectIdOrderBySequenceNumberAsc(subjectId);
    }

    public Map<EventType, Long> countsByType() {
        Map<EventType, Long> counts = new EnumMap<>(EventType.class);
        for (EventType type : EventType.values()) {
            counts.put(type, repository.countByEventType(type));
        }
        return counts;
    }

    static String maskIdentity(String identity) {
        if (identity == null || identity.isEmpty()) {
            return null;
        }
        return identity.length() <= IDENTITY_PREFIX_LENGTH
                ? identity
                : identity.substring(0, IDENTITY_PREFIX_LENGTH);
    }

    private String computeHash(SecurityEvent event) {
        String data = String.join("|",
                String.valueOf(event.getSequenceNumber()),
                event.getEventType().name(),
                event.getReason(),
                String.valueOf(event.getSubjectId()),
                String.valueOf(event.getIdentityPrefix()),
                String.valueOf(event.getUserAgent()),
                event.getOccurredAt().toString(),
                String.valueOf(event.getPreviousEventHash()));
        return sha256(data);
    }

    private String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public record ChainVerificationResult(
            boolean valid,
            int eventCount,
            Long firstInvalidSequence,
            String problem
    ) {}
}
