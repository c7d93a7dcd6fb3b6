package com.esplanada.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Persisted cache of a subject's statistics.
 * Always rebuildable from the active rating records; never a source of truth.
 */
@Entity
@Table(name = "subject_statistics")
public class SubjectStatisticsSnapshot {

    @Id
    @Column(name = "subject_id", length = 100)
    private String subjectId;

    @Column(name = "rating_count", nullable = false)
    private long count;

    @NotNull
    @Column(nullable = false, precision = 3, scale = 1)
    private BigDecimal mean;

    @NotNull
    @Column(name = "weighted_average", nullable = false, precision = 3, scale = 1)
    private BigDecimal weightedAverage;

    @Column(name = "count_1", nullable = false)
    private long count1;

    @Column(name = "count_2", nullable = false)
    private long count2;

    @Column(name = "count_3", nullable = false)
    private long count3;

    @Column(name = "count_4", nullable = false)
    private long count4;

    @Column(name = "count_5", nullable = false)
    private long count5;

    @NotNull
    @Column(name = "standard_deviation", nullable = false, precision = 4, scale = 2)
    private BigDecimal standardDeviation;

    @NotNull
    @Column(nullable = false, precision = 3, scale = 1)
    private BigDecimal median;

    @Column(name = "mode_score", nullable = false)
    private int mode;

    @NotNull
    @Column(nullable = false, precision = 3, scale = 2)
    private BigDecimal confidence;

    @NotNull
    @Column(nullable = false, precision = 3, scale = 2)
    private BigDecimal consistency;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RatingTrend trend;

    @NotNull
    @Column(name = "last_updated", nullable = false)
    private Instant lastUpdated;

    protected SubjectStatisticsSnapshot() {}

    public static SubjectStatisticsSnapshot forSubject(String subjectId) {
        SubjectStatisticsSnapshot snapshot = new SubjectStatisticsSnapshot();
        snapshot.subjectId = subjectId;
        snapshot.mean = BigDecimal.ZERO;
        snapshot.weightedAverage = BigDecimal.ZERO;
        snapshot.standardDeviation = BigDecimal.ZERO;
        snapshot.median = BigDecimal.ZERO;
        snapshot.confidence = BigDecimal.ZERO;
        snapshot.consistency = BigDecimal.ZERO;
        snapshot.trend = RatingTrend.INSUFFICIENT_DATA;
        snapshot.lastUpdated = Instant.EPOCH;
        return snapshot;
    }

    /**
     * Overwrites every derived value.
     *
     * @param distribution counts for scores 1..5, index 0 holds score 1
     */
    public void overwrite(long count, BigDecimal mean, BigDecimal weightedAverage, long[] distribution,
                          BigDecimal standardDeviation,
                          BigDecimal median, int mode, BigDecimal confidence, BigDecimal consistency,
                          RatingTrend trend, Instant lastUpdated) {
        if (distribution == null || distribution.length != 5) {
            throw new IllegalArgumentException("Distribution must have exactly 5 buckets");
        }
        this.count = count;
        this.mean = mean;
        this.weightedAverage = weightedAverage;
        this.count1 = distribution[0];
        this.count2 = distribution[1];
        this.count3 = distribution[2];
        this.count4 = distribution[3];
        this.count5 = distribution[4];
        this.standardDeviation = standardDeviation;
        this.median = median;
        this.mode = mode;
        this.confidence = confidence;
        this.consistency = consistency;
        this.trend = trend;
        this.lastUpdated = lastUpdated;
    }

    public long[] getDistribution() {
        return new long[] {count1, count2, count3, count4, count5};
    }

    // Getters
    public String getSubjectId() { return subjectId; }
    public long getCount() { return count; }
    public BigDecimal getMean() { return mean; }
    public BigDecimal getWeightedAverage() { return weightedAverage; }
    public BigDecimal getStandardDeviation() { return standardDeviation; }
    public BigDecimal getMedian() { return median; }
    public int getMode() { return mode; }
    public BigDecimal getConfidence() { return confidence; }
    public BigDecimal getConsistency() { return consistency; }
    public RatingTrend getTrend() { return trend; }
    public Instant getLastUpdated() { return lastUpdated; }
}
