package com.esplanada.api.aggregation;

import com.esplanada.core.domain.RatingTrend;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Incremental statistics of one subject.
 *
 * Sums are exact integers so an incrementally maintained instance always equals one rebuilt from
 * scratch. Scores are also kept per record in commit order; an update moves the record to the end.
 * The recency-weighted average halves a rating's weight every {@code WEIGHT_HALF_LIFE} of age.
 * Not thread-safe; {@link AggregationEngine} serializes access per subject.
 */
final class RunningStatistics {

    private static final MathContext SQRT_PRECISION = new MathContext(24);
    private static final BigDecimal TWO = BigDecimal.valueOf(2);
    private static final int CONFIDENCE_SATURATION = 20;
    private static final Duration WEIGHT_HALF_LIFE = Duration.ofDays(30);

    private final String subjectId;
    private final int exactThreshold;
    private final int trendWindow;
    private final BigDecimal trendMargin;

    private long count;
    private long sum;
    private long sumOfSquares;
    private final long[] histogram = new long[5];
    private final LinkedHashMap<UUID, Integer> scoresInCommitOrder = new LinkedHashMap<>();
    private final Map<UUID, Integer> appliedRevisions = new HashMap<>();
    private final Map<UUID, Instant> ratedAt = new HashMap<>();

    RunningStatistics(String subjectId, int exactThreshold, int trendWindow, BigDecimal trendMargin) {
        this.subjectId = subjectId;
        this.exactThreshold = exactThreshold;
        this.trendWindow = trendWindow;
        this.trendMargin = trendMargin;
    }

    /**
     * Counts a record at a revision. Returns false when this revision (or a later one) was already counted.
     */
    boolean apply(UUID recordId, int revision, int score, Instant acceptedAt) {
        checkScore(score);
        if (acceptedAt == null) {
            throw new IllegalArgumentException("Accepted time cannot be null");
        }
        Integer applied = appliedRevisions.get(recordId);
        if (applied != null && applied >= revision) {
            return false;
        }
        Integer previous = scoresInCommitOrder.remove(recordId);
        if (previous != null) {
            uncount(previous);
        }
        count(score);
        scoresInCommitOrder.put(recordId, score);
        ratedAt.put(recordId, acceptedAt);
        appliedRevisions.put(recordId, revision);
        return true;
    }

    /**
     * Removes a record. Returns the score it held, or null if it was not counted.
     */
    Integer retract(UUID recordId) {
        ratedAt.remove(recordId);
        Integer previous = scoresInCommitOrder.remove(recordId);
        if (previous != null) {
            uncount(previous);
        }
        return previous;
    }

    boolean contains(UUID recordId) {
        return scoresInCommitOrder.containsKey(recordId);
    }

    Integer scoreOf(UUID recordId) {
        return scoresInCommitOrder.get(recordId);
    }

    long count() {
        return count;
    }

    private void count(int score) {
        count++;
        sum += score;
        sumOfSquares += (long) score * score;
        histogram[score - 1]++;
    }

    private void uncount(int score) {
        count--;
        sum -= score;
        sumOfSquares -= (long) score * score;
        histogram[score - 1]--;
    }

    private static void checkScore(int score) {
        if (score < 1 || score > 5) {
            throw new IllegalArgumentException("Score must be between 1 and 5: " + score);
        }
    }

    // ==================== Snapshot ====================

    SubjectStatistics snapshot(Instant now) {
        if (count == 0) {
            return SubjectStatistics.empty(subjectId, now);
        }
        BigDecimal n = BigDecimal.valueOf(count);
        BigDecimal mean = BigDecimal.valueOf(sum).divide(n, 1, RoundingMode.HALF_UP);

        // population variance = (n * sumSq - sum^2) / n^2
        BigDecimal varianceNumerator = BigDecimal.valueOf(count)
                .multiply(BigDecimal.valueOf(sumOfSquares))
                .subtract(BigDecimal.valueOf(sum).multiply(BigDecimal.valueOf(sum)));
        BigDecimal deviation = varianceNumerator.signum() <= 0
                ? BigDecimal.ZERO
                : varianceNumerator.sqrt(SQRT_PRECISION).divide(n, SQRT_PRECISION);

        BigDecimal consistency = BigDecimal.ONE.subtract(deviation.divide(TWO, SQRT_PRECISION))
                .max(BigDecimal.ZERO)
                .setScale(2, RoundingMode.HALF_UP);
        BigDecimal confidence = BigDecimal.valueOf(Math.min(count, CONFIDENCE_SATURATION))
                .divide(BigDecimal.valueOf(CONFIDENCE_SATURATION), 2, RoundingMode.HALF_UP);

        return new SubjectStatistics(
                subjectId,
                count,
                mean,
                weightedAverage(now),
                SubjectStatistics.histogramOf(histogram),
                deviation.setScale(2, RoundingMode.HALF_UP),
                count < exactThreshold ? exactMedian() : histogramMedian(),
                count < exactThreshold ? exactMode() : histogramMode(),
                confidence,
                consistency,
                trend(),
                now);
    }

    /**
     * Mean with weight {@code 0.5^(age / half-life)}. Ages are taken relative to the youngest rating,
     * which leaves the ratios unchanged and keeps the total weight at least one.
     */
    private BigDecimal weightedAverage(Instant now) {
        long youngestAge = Long.MAX_VALUE;
        for (Instant at : ratedAt.values()) {
            youngestAge = Math.min(youngestAge, ageMillis(at, now));
        }
        double halfLife = WEIGHT_HALF_LIFE.toMillis();
        double weightedSum = 0;
        double totalWeight = 0;
        for (Map.Entry<UUID, Integer> entry : scoresInCommitOrder.entrySet()) {
            long age = ageMillis(ratedAt.get(entry.getKey()), now);
            double weight = Math.pow(0.5, (age - youngestAge) / halfLife);
            weightedSum += entry.getValue() * weight;
            totalWeight += weight;
        }
        return BigDecimal.valueOf(weightedSum / totalWeight).setScale(1, RoundingMode.HALF_UP);
    }

    // future timestamps count as age zero
    private static long ageMillis(Instant at, Instant now) {
        return Math.max(0, Duration.between(at, now).toMillis());
    }

    private BigDecimal exactMedian() {
        int[] sorted = scoresInCommitOrder.values().stream().mapToInt(Integer::intValue).toArray();
        Arrays.sort(sorted);
        int middle = sorted.length / 2;
        int doubled = sorted.length % 2 == 1 ? 2 * sorted[middle] : sorted[middle - 1] + sorted[middle];
        return BigDecimal.valueOf(doubled).divide(TWO, 1, RoundingMode.HALF_UP);
    }

    private int exactMode() {
        int[] frequencies = new int[5];
        for (int score : scoresInCommitOrder.values()) {
            frequencies[score - 1]++;
        }
        int mode = 1;
        for (int score = 2; score <= 5; score++) {
            if (frequencies[score - 1] > frequencies[mode - 1]) {
                mode = score;
            }
        }
        return mode;
    }

    /**
     * Median read off the histogram; exact for integer scores.
     */
    private BigDecimal histogramMedian() {
        long lowerRank = (count - 1) / 2;
        long upperRank = count / 2;
        return BigDecimal.valueOf(scoreAtRank(lowerRank) + scoreAtRank(upperRank))
                .divide(TWO, 1, RoundingMode.HALF_UP);
    }

    private int scoreAtRank(long rank) {
        long seen = 0;
        for (int score = 1; score <= 5; score++) {
            seen += histogram[score - 1];
            if (rank < seen) {
                return score;
            }
        }
        return 5;
    }

    private int histogramMode() {
        int mode = 1;
        for (int score = 2; score <= 5; score++) {
            if (histogram[score - 1] > histogram[mode - 1]) {
                mode = score;
            }
        }
        return mode;
    }

    /**
     * Mean of the most recent ratings against the all-time mean.
     */
    private RatingTrend trend() {
        if (count < 2) {
            return RatingTrend.INSUFFICIENT_DATA;
        }
        List<Integer> recent = mostRecent(trendWindow);
        long recentSum = 0;
        for (int score : recent) {
            recentSum += score;
        }
        BigDecimal recentMean = BigDecimal.valueOf(recentSum)
                .divide(BigDecimal.valueOf(recent.size()), SQRT_PRECISION);
        BigDecimal overallMean = BigDecimal.valueOf(sum).divide(BigDecimal.valueOf(count), SQRT_PRECISION);
        BigDecimal difference = recentMean.subtract(overallMean);
        if (difference.compareTo(trendMargin) > 0) {
            return RatingTrend.IMPROVING;
        }
        if (difference.compareTo(trendMargin.negate()) < 0) {
            return RatingTrend.DECLINING;
        }
        return RatingTrend.STABLE;
    }

    private List<Integer> mostRecent(int limit) {
        int skip = Math.max(0, scoresInCommitOrder.size() - limit);
        List<Integer> recent = new ArrayList<>(Math.min(limit, scoresInCommitOrder.size()));
        Iterator<Integer> it = scoresInCommitOrder.values().iterator();
        for (int i = 0; it.hasNext(); i++) {
            Integer score = it.next();
            if (i >= skip) {
                recent.add(score);
            }
        }
        return recent;
    }
}
