package com.esplanada.core.repository;

import com.esplanada.core.domain.SubjectStatisticsSnapshot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for the statistics cache.
 */
@Repository
public interface SubjectStatisticsSnapshotRepository extends JpaRepository<SubjectStatisticsSnapshot, String> {
}
