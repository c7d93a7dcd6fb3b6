package com.esplanada.api.suspicious;

import com.esplanada.core.domain.SecurityEvent;
import com.esplanada.core.domain.SecurityEvent.EventType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST API for reviewing flagged submissions.
 */
@RestController
@RequestMapping("/api/v1/security-events")
public class SecurityEventController {

    private static final int MAX_PAGE_SIZE = 200;

    private final SecurityEventLog securityEventLog;

    public SecurityEventController(SecurityEventLog securityEventLog) {
        this.securityEventLog = securityEventLog;
    }

    /**
     * Most recent events first.
     * GET /api/v1/security-events
     */
    @GetMapping
    public ResponseEntity<Page<SecurityEvent>> recent(
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {
        PageRequest pageable = PageRequest.of(Math.max(0, page), Math.min(Math.max(1, size), MAX_PAGE_SIZE));
        return ResponseEntity.ok(securityEventLog.recent(pageable));
    }

    /**
     * GET /api/v1/security-events/subject/{subjectId}
     */
    @GetMapping("/subject/{subjectId}")
    public ResponseEntity<List<SecurityEvent>> forSubject(@PathVariable String subjectId) {
        return ResponseEntity.ok(securityEventLog.forSubject(subjectId));
    }

    /**
     * GET /api/v1/security-events/counts
     */
    @GetMapping("/counts")
    public ResponseEntity<Map<EventType, Long>> counts() {
        return ResponseEntity.ok(securityEventLog.countsByType());
    }

    /**
     * Walk the hash chain.
     * POST /api/v1/security-events/verify
     */
    @PostMapping("/verify")
    public ResponseEntity<SecurityEventLog.ChainVerificationResult> verify() {
        return ResponseEntity.ok(securityEventLog.verifyChain());
    }
}
