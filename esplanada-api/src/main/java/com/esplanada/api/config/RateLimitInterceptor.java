package com.esplanada.api.config;

import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Throttles API requests per client; answers 429 when a bucket is empty.
 */
@Component
public class RateLimitInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(RateLimitInterceptor.class);

    private final RateLimitConfig rateLimitConfig;

    public RateLimitInterceptor(RateLimitConfig rateLimitConfig) {
        this.rateLimitConfig = rateLimitConfig;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response,
                             Object handler) throws Exception {

        String clientId = resolveClientId(request);
        Bucket bucket = selectBucket(request, clientId);

        ConsumptionProbe probe = bucket.tryConsumeAndReturnRemaining(1);

        if (probe.isConsumed()) {
            response.addHeader("X-Rate-Limit-Remaining",
                String.valueOf(probe.getRemainingTokens()));
            return true;
        }

        long waitForRefill = Math.max(1, probe.getNanosToWaitForRefill() / 1_000_000_000);
        log.warn("HTTP throttle hit for client {} on {} {}", clientId, request.getMethod(), request.getRequestURI());
        response.addHeader("X-Rate-Limit-Retry-After-Seconds", String.valueOf(waitForRefill));
        response.addHeader("Retry-After", String.valueOf(waitForRefill));
        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write("{\"code\":\"HTTP_429\",\"message\":\"Too many requests. Retry after "
            + waitForRefill + " seconds.\"}");
        return false;
    }

    private String resolveClientId(HttpServletRequest request) {
        String identity = request.getHeader("X-Client-Identity");
        if (identity != null && !identity.isBlank()) {
            return identity;
        }

        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null) {
            return forwarded.split(",")[0].trim();
        }

        return request.getRemoteAddr();
    }

    private Bucket selectBucket(HttpServletRequest request, String clientId) {
        String path = request.getRequestURI();
        String method = request.getMethod();

        if ("POST".equals(method) || "DELETE".equals(method)) {
            return rateLimitConfig.resolveWriteBucket(clientId);
        }

        if ("GET".equals(method) && path.contains("/statistics")) {
            return rateLimitConfig.resolveReadBucket(clientId);
        }

        return rateLimitConfig.resolveBucket(clientId);
    }
}
