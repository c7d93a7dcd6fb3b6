package com.esplanada.api.identity;

import com.esplanada.client.identity.ClientIdentity;
import com.esplanada.client.identity.ClientIdentityManager;
import com.esplanada.client.identity.ClientSignals;
import com.esplanada.client.identity.FingerprintResult;
import com.esplanada.client.identity.IdentityConfidence;
import com.esplanada.client.identity.IdentityFingerprintGenerator;
import com.esplanada.client.identity.IdentityUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Derives a pseudonymous client identity from posted browser signals.
 * Stateless: storing and renewing the identity stays on the device.
 */
@RestController
@RequestMapping("/api/v1/identity")
public class IdentityController {

    private static final Logger log = LoggerFactory.getLogger(IdentityController.class);

    private final IdentityFingerprintGenerator generator;
    private final Clock clock;

    public IdentityController(IdentityFingerprintGenerator generator, Clock clock) {
        this.generator = generator;
        this.clock = clock;
    }

    /**
     * POST /api/v1/identity
     */
    @PostMapping
    public ResponseEntity<IdentityResponse> identify(
            @RequestHeader(value = HttpHeaders.USER_AGENT, required = false) String userAgent,
            @RequestBody SignalsRequest request) {
        ClientSignals signals = request.toSignals(userAgent, clock.instant());
        FingerprintResult result = generator.generate(signals);
        if (!result.available()) {
            throw new IdentityUnavailableException(result.failureReason());
        }

        ClientIdentity identity = result.identity();
        if (request.displayName() != null && !request.displayName().isBlank()) {
            identity = identity.withDisplayName(ClientIdentityManager.checkDisplayName(request.displayName()));
        }
        log.debug("Identity derived from {} with {} confidence", result.collectedSignals(), identity.confidence());
        return ResponseEntity.ok(IdentityResponse.of(identity));
    }

    // Request/Response DTOs
    public record SignalsRequest(
            String platform,
            String language,
            String timezone,
            Integer screenWidth,
            Integer screenHeight,
            Integer colorDepth,
            Double pixelRatio,
            String renderingSample,
            List<Double> audioSamples,
            String userAgent,
            String displayName
    ) {
        ClientSignals toSignals(String headerUserAgent, Instant observedAt) {
            return new ClientSignals(platform, language, timezone, screenWidth, screenHeight, colorDepth,
                    pixelRatio, renderingSample, audioSamples,
                    userAgent != null ? userAgent : headerUserAgent, observedAt);
        }
    }

    public record IdentityResponse(
            String digest,
            IdentityConfidence confidence,
            Instant issuedAt,
            Instant expiresAt,
            String displayName
    ) {
        static IdentityResponse of(ClientIdentity identity) {
            return new IdentityResponse(identity.digest(), identity.confidence(), identity.issuedAt(),
                    identity.expiresAt(), identity.displayName());
        }
    }

    // Exception handlers
    @ExceptionHandler(IdentityUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleUnavailable(IdentityUnavailableException e) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorResponse("IDENTITY_503", "Could not identify this device. Please try again."));
    }

    @ExceptionHandler({IllegalArgumentException.class, NullPointerException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(RuntimeException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("IDENTITY_400", e.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("IDENTITY_400", "Malformed signals request"));
    }

    public record ErrorResponse(String code, String message) {}
}
