package com.esplanada.api.subject;

import com.esplanada.api.aggregation.SubjectStatistics;
import com.esplanada.api.broadcast.StatisticsStreamRegistry;
import com.esplanada.api.rating.RatingService;
import com.esplanada.api.rating.SubjectNotFoundException;
import com.esplanada.core.domain.Subject;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Instant;

/**
 * REST API for restaurants and their statistics.
 */
@RestController
@RequestMapping("/api/v1/subjects")
public class SubjectController {

    private final SubjectService subjectService;
    private final RatingService ratingService;
    private final StatisticsStreamRegistry streamRegistry;

    public SubjectController(SubjectService subjectService, RatingService ratingService,
                             StatisticsStreamRegistry streamRegistry) {
        this.subjectService = subjectService;
        this.ratingService = ratingService;
        this.streamRegistry = streamRegistry;
    }

    /**
     * Register a restaurant.
     * POST /api/v1/subjects
     */
    @PostMapping
    public ResponseEntity<?> register(
            @RequestHeader(value = "X-Client-Identity", required = false) String identity,
            @Valid @RequestBody SubjectRequest request,
            HttpServletRequest servletRequest) {
        String requester = identity != null && !identity.isBlank()
                ? identity
                : "addr:" + servletRequest.getRemoteAddr();
        SubjectService.RegistrationResult result = subjectService.register(requester, request.id(), request.name());
        if (!result.created()) {
            long retryAfter = Math.max(1, result.limit().retryAfter().toSeconds());
            return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                    .header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfter))
                    .body(new ErrorResponse("SUBJECT_429", result.limit().message()));
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(SubjectView.of(result.subject()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<SubjectView> getSubject(@PathVariable String id) {
        return ResponseEntity.ok(SubjectView.of(subjectService.getSubject(id)));
    }

    /**
     * Current statistics.
     * GET /api/v1/subjects/{id}/statistics
     */
    @GetMapping("/{id}/statistics")
    public ResponseEntity<SubjectStatistics> statistics(@PathVariable String id) {
        return ResponseEntity.ok(ratingService.statistics(id));
    }

    /**
     * Recompute statistics from stored ratings.
     * POST /api/v1/subjects/{id}/statistics/rebuild
     */
    @PostMapping("/{id}/statistics/rebuild")
    public ResponseEntity<SubjectStatistics> rebuild(@PathVariable String id) {
        return ResponseEntity.ok(ratingService.rebuildStatistics(id));
    }

    /**
     * Live statistics snapshots as Server-Sent Events.
     * GET /api/v1/subjects/{id}/statistics/stream
     */
    @GetMapping(value = "/{id}/statistics/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@PathVariable String id) {
        subjectService.getSubject(id);
        return streamRegistry.open(id);
    }

    // Request/Response DTOs
    public record SubjectRequest(
            @Size(max = 100) String id,
            @NotBlank @Size(max = 200) String name
    ) {}

    public record SubjectView(String id, String name, Instant createdAt) {
        static SubjectView of(Subject subject) {
            return new SubjectView(subject.getId(), subject.getName(), subject.getCreatedAt());
        }
    }

    // Exception handlers
    @ExceptionHandler(SubjectNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(SubjectNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("SUBJECT_404", e.getMessage()));
    }

    @ExceptionHandler(SubjectAlreadyExistsException.class)
    public ResponseEntity<ErrorResponse> handleExists(SubjectAlreadyExistsException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ErrorResponse("SUBJECT_409", e.getMessage()));
    }

    @ExceptionHandler(RatingService.SubjectBusyException.class)
    public ResponseEntity<ErrorResponse> handleBusy(RatingService.SubjectBusyException e) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorResponse("STORAGE_503", e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalid(MethodArgumentNotValidException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("SUBJECT_400", "Invalid restaurant: " + e.getBindingResult().getFieldErrorCount() + " field error(s)"));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadRequest(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("SUBJECT_400", e.getMessage()));
    }

    public record ErrorResponse(String code, String message) {}
}
