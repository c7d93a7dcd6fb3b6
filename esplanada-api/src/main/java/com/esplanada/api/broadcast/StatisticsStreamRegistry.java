package com.esplanada.api.broadcast;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Bridges broadcaster subscriptions to Server-Sent Event streams.
 */
@Component
public class StatisticsStreamRegistry {

    private static final Logger log = LoggerFactory.getLogger(StatisticsStreamRegistry.class);

    static final String EVENT_NAME = "statistics";

    private final UpdateBroadcaster broadcaster;
    private final long timeoutMillis;

    public StatisticsStreamRegistry(
            UpdateBroadcaster broadcaster,
            @Value("${esplanada.broadcast.stream-timeout-ms:1800000}") long timeoutMillis) {
        this.broadcaster = broadcaster;
        this.timeoutMillis = timeoutMillis;
    }

    /**
     * Opens a stream that receives every snapshot published for the subject until the client disconnects.
     */
    public SseEmitter open(String subjectId) {
        SseEmitter emitter = new SseEmitter(timeoutMillis);
        AtomicReference<String> subscriptionId = new AtomicReference<>();
        subscriptionId.set(broadcaster.subscribe(subjectId, (id, statistics) -> {
            try {
                emitter.send(SseEmitter.event()
                        .name(EVENT_NAME)
                        .data(statistics, MediaType.APPLICATION_JSON));
            } catch (IOException | IllegalStateException e) {
                log.debug("Statistics stream for {} closed: {}", id, e.getMessage());
                broadcaster.unsubscribe(subscriptionId.get());
                emitter.completeWithError(e);
            }
        }));
        Runnable cleanup = () -> broadcaster.unsubscribe(subscriptionId.get());
        emitter.onCompletion(cleanup);
        emitter.onTimeout(cleanup);
        emitter.onError(e -> cleanup.run());
        return emitter;
    }
}
