package com.esplanada.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Accepted rating for a subject.
 *
 * At most one record per (identity, subject) is active. The {@code active_key} column holds
 * {@code identity|subject} while the record is active and null once it is retracted, so the unique
 * constraint only applies to active records.
 */
@Entity
@Table(name = "rating_records",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_rating_active_key", columnNames = "active_key")
    },
    indexes = {
        @Index(name = "idx_rating_subject", columnList = "subject_id"),
        @Index(name = "idx_rating_identity_subject", columnList = "identity_digest, subject_id")
    })
public class RatingRecord {

    public static final int MAX_COMMENT_LENGTH = 500;
    public static final int MAX_PHOTO_REFS = 2;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "subject_id", nullable = false, length = 100)
    private String subjectId;

    @NotNull
    @Column(name = "identity_digest", nullable = false, length = 200)
    private String identityDigest;

    @Min(1)
    @Max(5)
    @Column(nullable = false)
    private int score;

    @Column(length = MAX_COMMENT_LENGTH)
    private String comment;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "rating_photo_refs", joinColumns = @JoinColumn(name = "rating_id"))
    @OrderColumn(name = "photo_position")
    @Column(name = "photo_ref", nullable = false, length = 500)
    private List<String> photoRefs = new ArrayList<>();

    @NotNull
    @Column(name = "submitted_at", nullable = false)
    private Instant submittedAt;

    @NotNull
    @Column(name = "accepted_at", nullable = false)
    private Instant acceptedAt;

    @Column(nullable = false)
    private int revision;

    @Column(nullable = false)
    private boolean active;

    @Column(name = "active_key", length = 301)
    private String activeKey;

    @Version
    private Long version;

    protected RatingRecord() {}

    /**
     * Creates a new active record.
     */
    public static RatingRecord create(
            String subjectId,
            String identityDigest,
            int score,
            String comment,
            List<String> photoRefs,
            Instant submittedAt,
            Instant acceptedAt) {
        if (subjectId == null || subjectId.isBlank()) {
            throw new IllegalArgumentException("Subject ID cannot be null or blank");
        }
        if (identityDigest == null || identityDigest.isBlank()) {
            throw new IllegalArgumentException("Identity cannot be null or blank");
        }
        RatingRecord record = new RatingRecord();
        record.subjectId = subjectId;
        record.identityDigest = identityDigest;
        record.score = score;
        record.comment = comment;
        record.photoRefs = photoRefs != null ? new ArrayList<>(photoRefs) : new ArrayList<>();
        record.submittedAt = submittedAt;
        record.acceptedAt = acceptedAt;
        record.revision = 1;
        record.active = true;
        record.activeKey = activeKeyOf(identityDigest, subjectId);
        return record;
    }

    public static String activeKeyOf(String identityDigest, String subjectId) {
        return identityDigest + "|" + subjectId;
    }

    /**
     * Replaces the rating in place. Same id, next revision.
     */
    public void replaceWith(int newScore, String newComment, List<String> newPhotoRefs,
                            Instant newSubmittedAt, Instant newAcceptedAt) {
        if (!active) {
            throw new IllegalStateException("Cannot update a retracted rating");
        }
        this.score = newScore;
        this.comment = newComment;
        this.photoRefs.clear();
        if (newPhotoRefs != null) {
            this.photoRefs.addAll(newPhotoRefs);
        }
        this.submittedAt = newSubmittedAt;
        this.acceptedAt = newAcceptedAt;
        this.revision++;
    }

    /**
     * Withdraws the record from statistics and frees the (identity, subject) slot.
     */
    public void retract() {
        if (!active) {
            throw new IllegalStateException("Rating already retracted");
        }
        this.active = false;
        this.activeKey = null;
    }

    // Getters
    public UUID getId() { return id; }
    public String getSubjectId() { return subjectId; }
    public String getIdentityDigest() { return identityDigest; }
    public int getScore() { return score; }
    public String getComment() { return comment; }
    public List<String> getPhotoRefs() { return List.copyOf(photoRefs); }
    public Instant getSubmittedAt() { return submittedAt; }
    public Instant getAcceptedAt() { return acceptedAt; }
    public int getRevision() { return revision; }
    public boolean isActive() { return active; }
    public String getActiveKey() { return activeKey; }
    public Long getVersion() { return version; }
}
