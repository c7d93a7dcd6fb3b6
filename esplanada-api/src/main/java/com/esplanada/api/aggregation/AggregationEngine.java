package com.esplanada.api.aggregation;

import com.esplanada.core.domain.RatingRecord;
import com.esplanada.core.domain.SubjectStatisticsSnapshot;
import com.esplanada.core.repository.RatingRecordRepository;
import com.esplanada.core.repository.SubjectStatisticsSnapshotRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maintains per-subject statistics incrementally as ratings are committed.
 *
 * The in-memory view is authoritative for reads. On a miss it is rebuilt from the active rating
 * records. Every change is written through to the {@code subject_statistics} cache table.
 */
@Service
public class AggregationEngine {

    private static final Logger log = LoggerFactory.getLogger(AggregationEngine.class);

    private final RatingRecordRepository ratingRecordRepository;
    private final SubjectStatisticsSnapshotRepository snapshotRepository;
    private final Clock clock;
    private final int exactThreshold;
    private final int trendWindow;
    private final BigDecimal trendMargin;

    private final Map<String, RunningStatistics> subjects = new ConcurrentHashMap<>();

    public AggregationEngine(
            RatingRecordRepository ratingRecordRepository,
            SubjectStatisticsSnapshotRepository snapshotRepository,
            Clock clock,
            @Value("${esplanada.aggregation.exact-threshold:200}") int exactThreshold,
            @Value("${esplanada.aggregation.trend-window:10}") int trendWindow,
            @Value("${esplanada.aggregation.trend-margin:0.5}") BigDecimal trendMargin) {
        this.ratingRecordRepository = ratingRecordRepository;
        this.snapshotRepository = snapshotRepository;
        this.clock = clock;
        this.exactThreshold = exactThreshold;
        this.trendWindow = trendWindow;
        this.trendMargin = trendMargin;
    }

    // ==================== Updates ====================

    /**
     * Counts a committed record. For an in-place update, {@code previousScore} is the score being replaced.
     * Applying a (record, revision) pair that was already applied changes nothing.
     */
    public SubjectStatistics apply(String subjectId, UUID recordId, int revision, int newScore,
                                   Integer previousScore, Instant acceptedAt) {
        Objects.requireNonNull(subjectId, "Subject ID cannot be null");
        Objects.requireNonNull(recordId, "Record ID cannot be null");

        RunningStatistics running = runningFor(subjectId);
        SubjectStatistics statistics;
        synchronized (running) {
            Integer tracked = running.scoreOf(recordId);
            if (previousScore != null && tracked != null && !tracked.equals(previousScore)) {
                log.warn("Record {} counted with score {} but update replaces {}", recordId, tracked, previousScore);
            }
            boolean changed = running.apply(recordId, revision, newScore, acceptedAt);
            statistics = running.snapshot(clock.instant());
            if (!changed) {
                log.debug("Record {} revision {} already applied to {}", recordId, revision, subjectId);
                return statistics;
            }
        }
        persist(statistics);
        return statistics;
    }

    /**
     * Removes a withdrawn record from the statistics.
     */
    public SubjectStatistics retract(String subjectId, UUID recordId, int score) {
        Objects.requireNonNull(subjectId, "Subject ID cannot be null");
        Objects.requireNonNull(recordId, "Record ID cannot be null");

        RunningStatistics running = runningFor(subjectId);
        SubjectStatistics statistics;
        synchronized (running) {
            Integer removed = running.retract(recordId);
            if (removed != null && removed != score) {
                log.warn("Retracted record {} held score {} not {}", recordId, removed, score);
            }
            statistics = running.snapshot(clock.instant());
        }
        persist(statistics);
        return statistics;
    }

    /**
     * Recomputes a subject from its source records, replacing the in-memory view.
     */
    public SubjectStatistics rebuild(String subjectId, List<RatingRecord> records) {
        Objects.requireNonNull(subjectId, "Subject ID cannot be null");
        RunningStatistics fresh = fromRecords(subjectId, records);
        SubjectStatistics statistics;
        synchronized (fresh) {
            statistics = fresh.snapshot(clock.instant());
        }
        subjects.put(subjectId, fresh);
        persist(statistics);
        log.info("Rebuilt statistics for {}: {} ratings, mean {}", subjectId, statistics.count(), statistics.mean());
        return statistics;
    }

    /**
     * Recomputes a subject from storage.
     */
    public SubjectStatistics rebuild(String subjectId) {
        return rebuild(subjectId, loadActive(subjectId));
    }

    // ==================== Reads ====================

    public SubjectStatistics statistics(String subjectId) {
        Objects.requireNonNull(subjectId, "Subject ID cannot be null");
        RunningStatistics running = runningFor(subjectId);
        synchronized (running) {
            return running.snapshot(clock.instant());
        }
    }

    /**
     * Last persisted snapshot, if any. May lag the in-memory view after a failed write.
     */
    public SubjectStatistics cachedSnapshot(String subjectId) {
        return snapshotRepository.findById(subjectId)
                .map(SubjectStatistics::fromSnapshot)
                .orElse(null);
    }

    /**
     * Drops the in-memory view; the next read rebuilds it from storage.
     */
    public void evict(String subjectId) {
        subjects.remove(subjectId);
    }

    // ==================== Internals ====================

    private RunningStatistics runningFor(String subjectId) {
        return subjects.computeIfAbsent(subjectId, id -> fromRecords(id, loadActive(id)));
    }

    private List<RatingRecord> loadActive(String subjectId) {
        return ratingRecordRepository.findBySubjectIdAndActiveTrueOrderByAcceptedAtAscIdAsc(subjectId);
    }

    private RunningStatistics fromRecords(String subjectId, List<RatingRecord> records) {
        RunningStatistics running = new RunningStatistics(subjectId, exactThreshold, trendWindow, trendMargin);
        for (RatingRecord record : records) {
            if (record.isActive() && subjectId.equals(record.getSubjectId())) {
                running.apply(record.getId(), record.getRevision(), record.getScore(), record.getAcceptedAt());
            }
        }
        return running;
    }

    private void persist(SubjectStatistics statistics) {
        try {
            SubjectStatisticsSnapshot snapshot = snapshotRepository.findById(statistics.subjectId())
                    .orElseGet(() -> SubjectStatisticsSnapshot.forSubject(statistics.subjectId()));
            snapshot.overwrite(
                    statistics.count(),
                    statistics.mean(),
                    statistics.weightedAverage(),
                    statistics.distributionArray(),
                    statistics.standardDeviation(),
                    statistics.median(),
                    statistics.mode(),
                    statistics.confidence(),
                    statistics.consistency(),
                    statistics.trend(),
                    statistics.lastUpdated());
            snapshotRepository.save(snapshot);
        } catch (DataAccessException e) {
            // the cache row is rebuildable; the in-memory view stays correct
            log.error("Failed to persist statistics snapshot for {}", statistics.subjectId(), e);
        }
    }
}
