package com.esplanada.api.aggregation;

import com.esplanada.core.domain.RatingTrend;
import com.esplanada.core.domain.SubjectStatisticsSnapshot;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Full statistics snapshot of one subject. Consumers treat each instance as a replacement,
 * never as a delta.
 */
public record SubjectStatistics(
        String subjectId,
        long count,
        BigDecimal mean,
        BigDecimal weightedAverage,
        Map<Integer, Long> distribution,
        BigDecimal standardDeviation,
        BigDecimal median,
        int mode,
        BigDecimal confidence,
        BigDecimal consistency,
        RatingTrend trend,
        Instant lastUpdated
) {
    public SubjectStatistics {
        distribution = Collections.unmodifiableMap(new LinkedHashMap<>(distribution));
    }

    public static SubjectStatistics empty(String subjectId, Instant now) {
        return new SubjectStatistics(subjectId, 0, BigDecimal.ZERO.setScale(1), BigDecimal.ZERO.setScale(1),
                histogramOf(new long[5]),
                BigDecimal.ZERO.setScale(2), BigDecimal.ZERO.setScale(1), 0,
                BigDecimal.ZERO.setScale(2), BigDecimal.ZERO.setScale(2), RatingTrend.INSUFFICIENT_DATA, now);
    }

    public static SubjectStatistics fromSnapshot(SubjectStatisticsSnapshot snapshot) {
        return new SubjectStatistics(
                snapshot.getSubjectId(),
                snapshot.getCount(),
                snapshot.getMean(),
                snapshot.getWeightedAverage(),
                histogramOf(snapshot.getDistribution()),
                snapshot.getStandardDeviation(),
                snapshot.getMedian(),
                snapshot.getMode(),
                snapshot.getConfidence(),
                snapshot.getConsistency(),
                snapshot.getTrend(),
                snapshot.getLastUpdated());
    }

    static Map<Integer, Long> histogramOf(long[] buckets) {
        Map<Integer, Long> histogram = new LinkedHashMap<>();
        for (int score = 1; score <= 5; score++) {
            histogram.put(score, buckets[score - 1]);
        }
        return histogram;
    }

    public long[] distributionArray() {
        long[] buckets = new long[5];
        for (int score = 1; score <= 5; score++) {
            buckets[score - 1] = distribution.getOrDefault(score, 0L);
        }
        return buckets;
    }

    /**
     * Same statistics ignoring the time they were computed. The weighted average depends on that time
     * and is compared as well, so both sides must be computed at the same instant.
     */
    public boolean sameValuesAs(SubjectStatistics other) {
        return other != null
                && subjectId.equals(other.subjectId)
                && count == other.count
                && mean.compareTo(other.mean) == 0
                && weightedAverage.compareTo(other.weightedAverage) == 0
                && distribution.equals(other.distribution)
                && standardDeviation.compareTo(other.standardDeviation) == 0
                && median.compareTo(other.median) == 0
                && mode == other.mode
                && confidence.compareTo(other.confidence) == 0
                && consistency.compareTo(other.consistency) == 0
                && trend == other.trend;
    }
}
