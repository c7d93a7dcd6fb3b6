package com.esplanada.core.repository;

import com.esplanada.core.domain.RatingRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for accepted ratings.
 */
@Repository
public interface RatingRecordRepository extends JpaRepository<RatingRecord, UUID> {

    /**
     * Find the active record for an (identity, subject) pair.
     */
    Optional<RatingRecord> findByActiveKey(String activeKey);

    /**
     * Active records of a subject in commit order (used to rebuild statistics).
     */
    List<RatingRecord> findBySubjectIdAndActiveTrueOrderByAcceptedAtAscIdAsc(String subjectId);

    long countBySubjectIdAndActiveTrue(String subjectId);

    /**
     * Count active records held by one identity for one subject.
     */
    @Query("SELECT COUNT(r) FROM RatingRecord r WHERE r.identityDigest = :identity "
            + "AND r.subjectId = :subjectId AND r.active = true")
    long countActive(@Param("identity") String identityDigest, @Param("subjectId") String subjectId);
}
