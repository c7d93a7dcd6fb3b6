package com.esplanada.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only security event for later audit.
 * Events form a hash chain ordered by sequence number.
 */
@Entity
@Table(name = "security_events", indexes = {
    @Index(name = "idx_security_subject", columnList = "subject_id"),
    @Index(name = "idx_security_occurred", columnList = "occurred_at"),
    @Index(name = "idx_security_sequence", columnList = "sequence_number", unique = true)
})
public class SecurityEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "sequence_number", nullable = false)
    private long sequenceNumber;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 40)
    private EventType eventType;

    @NotNull
    @Column(nullable = false, length = 300)
    private String reason;

    @Column(name = "subject_id", length = 100)
    private String subjectId;

    @Column(name = "identity_prefix", length = 16)
    private String identityPrefix;

    @Column(name = "user_agent", length = 500)
    private String userAgent;

    @NotNull
    @Column(name = "occurred_at", nullable = false)
    private Instant occurredAt;

    @Column(name = "previous_event_hash", length = 64)
    private String previousEventHash;

    @Column(name = "event_hash", length = 64)
    private String eventHash;

    public enum EventType {
        SUSPICIOUS_USER_AGENT,
        RAPID_SUBMISSION,
        PRE_SEEDED_VOTE,
        DUPLICATE_CHECK_ERROR,
        VALIDATION_ERROR
    }

    protected SecurityEvent() {}

    public static SecurityEvent create(
            long sequenceNumber,
            EventType eventType,
            String reason,
            String subjectId,
            String identityPrefix,
            String userAgent,
            Instant occurredAt,
            String previousEventHash) {
        SecurityEvent event = new SecurityEvent();
        event.sequenceNumber = sequenceNumber;
        event.eventType = eventType;
        event.reason = reason;
        event.subjectId = subjectId;
        event.identityPrefix = identityPrefix;
        event.userAgent = userAgent != null && userAgent.length() > 500 ? userAgent.substring(0, 500) : userAgent;
        event.occurredAt = occurredAt;
        event.previousEventHash = previousEventHash;
        return event;
    }

    // Getters
    public UUID getId() { return id; }
    public long getSequenceNumber() { return sequenceNumber; }
    public EventType getEventType() { return eventType; }
    public String getReason() { return reason; }
    public String getSubjectId() { return subjectId; }
    public String getIdentityPrefix() { return identityPrefix; }
    public String getUserAgent() { return userAgent; }
    public Instant getOccurredAt() { return occurredAt; }
    public String getPreviousEventHash() { return previousEventHash; }
    public String getEventHash() { return eventHash; }

    public void setEventHash(String hash) { this.eventHash = hash; }
}
