package com.esplanada.api.broadcast;

import com.esplanada.api.aggregation.SubjectStatistics;

/**
 * Receives full statistics snapshots after a subject changes.
 * Spring beans implementing this interface are subscribed automatically.
 */
@FunctionalInterface
public interface StatisticsListener {

    void onStatisticsChanged(String subjectId, SubjectStatistics statistics);
}
