package com.esplanada.core.repository;

import com.esplanada.core.domain.SecurityEvent;
import com.esplanada.core.domain.SecurityEvent.EventType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for security events.
 * Append-only: no update operations are exposed.
 */
@Repository
public interface SecurityEventRepository extends JpaRepository<SecurityEvent, UUID> {

    /**
     * Get the most recent event (for hash chaining).
     */
    Optional<SecurityEvent> findTopByOrderBySequenceNumberDesc();

    Page<SecurityEvent> findAllByOrderBySequenceNumberDesc(Pageable pageable);

    List<SecurityEvent> findBySubjectIdOrderBySequenceNumberAsc(String subjectId);

    List<SecurityEvent> findAllByOrderBySequenceNumberAsc();

    long countByEventType(EventType eventType);
}
