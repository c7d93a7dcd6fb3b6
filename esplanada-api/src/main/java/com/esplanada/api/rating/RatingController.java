package com.esplanada.api.rating;

import com.esplanada.api.aggregation.SubjectStatistics;
import com.esplanada.api.suspicious.ClientMeta;
import com.esplanada.api.validation.ErrorKind;
import com.esplanada.api.validation.RatingValidator;
import com.esplanada.api.validation.Rejection;
import com.esplanada.api.validation.ValidationOutcome.Operation;
import com.esplanada.core.domain.RatingRecord;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * REST API for rating submission and moderation.
 */
@RestController
@RequestMapping("/api/v1/ratings")
public class RatingController {

    static final String IDENTITY_HEADER = "X-Client-Identity";

    private final RatingService ratingService;
    private final RatingValidator ratingValidator;

    public RatingController(RatingService ratingService, RatingValidator ratingValidator) {
        this.ratingService = ratingService;
        this.ratingValidator = ratingValidator;
    }

    /**
     * Submit or update a rating.
     * POST /api/v1/ratings
     */
    @PostMapping
    public ResponseEntity<?> submitRating(
            @RequestHeader(value = IDENTITY_HEADER, required = false) String identity,
            @RequestHeader(value = HttpHeaders.USER_AGENT, required = false) String userAgent,
            @RequestBody RatingRequest request,
            HttpServletRequest servletRequest) {

        RatingSubmission submission = new RatingSubmission(
                request.subjectId(),
                identity,
                request.score(),
                request.comment(),
                request.photoRefs(),
                request.submittedAt());
        SubmissionResult result = ratingService.submitRating(
                submission, new ClientMeta(userAgent, servletRequest.getRemoteAddr()));

        if (result.accepted()) {
            return ResponseEntity.status(HttpStatus.CREATED)
                    .body(new SubmissionResponse(RatingView.of(result.record()), result.operation(), result.statistics()));
        }
        return rejectionResponse(result.rejection());
    }

    /**
     * Cheap pre-check used to enable the rating form.
     * GET /api/v1/ratings/can-rate?subjectId=
     */
    @GetMapping("/can-rate")
    public ResponseEntity<?> canRate(
            @RequestHeader(value = IDENTITY_HEADER, required = false) String identity,
            @RequestParam String subjectId) {
        if (identity == null || identity.isBlank()) {
            return rejectionResponse(Rejection.identityUnavailable());
        }
        return ResponseEntity.ok(new CanRateResponse(subjectId, ratingService.canRate(identity, subjectId)));
    }

    /**
     * Retract a rating (moderation).
     * DELETE /api/v1/ratings/{id}
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<SubjectStatistics> retract(@PathVariable UUID id) {
        return ResponseEntity.ok(ratingService.retract(id));
    }

    /**
     * Outcome counts over the most recent validation attempts.
     * GET /api/v1/ratings/validation-stats
     */
    @GetMapping("/validation-stats")
    public ResponseEntity<RatingValidator.ValidationStats> validationStats() {
        return ResponseEntity.ok(ratingValidator.validationStats());
    }

    static ResponseEntity<RejectionResponse> rejectionResponse(Rejection rejection) {
        ErrorKind kind = rejection.kind();
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(kind.status());
        Long retryAfter = kind.isRetryable() ? rejection.retryAfterSeconds() : null;
        if (retryAfter != null) {
            builder.header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfter));
        }
        return builder.body(new RejectionResponse(kind, kind.code(), rejection.message(), retryAfter));
    }

    // Request/Response DTOs
    public record RatingRequest(
            String subjectId,
            Integer score,
            String comment,
            List<String> photoRefs,
            Instant submittedAt
    ) {}

    public record RatingView(
            UUID id,
            String subjectId,
            int score,
            String comment,
            List<String> photoRefs,
            Instant submittedAt,
            Instant acceptedAt,
            int revision
    ) {
        static RatingView of(RatingRecord record) {
            return new RatingView(record.getId(), record.getSubjectId(), record.getScore(), record.getComment(),
                    record.getPhotoRefs(), record.getSubmittedAt(), record.getAcceptedAt(), record.getRevision());
        }
    }

    public record SubmissionResponse(RatingView accepted, Operation operation, SubjectStatistics statistics) {}

    public record CanRateResponse(String subjectId, boolean canRate) {}

    public record RejectionResponse(ErrorKind kind, String code, String message, Long retryAfterSeconds) {}

    // Exception handlers
    @ExceptionHandler(RatingNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(RatingNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("RATING_404", e.getMessage()));
    }

    @ExceptionHandler(RatingService.SubjectBusyException.class)
    public ResponseEntity<ErrorResponse> handleBusy(RatingService.SubjectBusyException e) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorResponse("STORAGE_503", e.getMessage()));
    }

    /**
     * Unreadable bodies, including a fractional or non-numeric score, are format rejections.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<RejectionResponse> handleUnreadable(HttpMessageNotReadableException e) {
        return rejectionResponse(Rejection.invalidFormat("Malformed rating request: score must be an integer"));
    }

    @ExceptionHandler({IllegalArgumentException.class, NullPointerException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(RuntimeException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("RATING_400", e.getMessage()));
    }

    public record ErrorResponse(String code, String message) {}
}
