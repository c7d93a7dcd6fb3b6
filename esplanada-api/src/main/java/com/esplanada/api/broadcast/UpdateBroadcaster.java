package com.esplanada.api.broadcast;

import com.esplanada.api.aggregation.SubjectStatistics;
import com.esplanada.core.domain.SecurityEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fans statistics and security events out to subscribers on a worker pool.
 *
 * Publishing never blocks the caller. A failing subscriber is logged and does not affect other
 * subscribers or the rating that triggered the publish.
 */
@Service
public class UpdateBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(UpdateBroadcaster.class);

    private final ExecutorService executor;
    private final CopyOnWriteArrayList<Subscription> statisticsSubscriptions = new CopyOnWriteArrayList<>();
    private final CopyOnWriteArrayList<SecurityEventListener> securityListeners = new CopyOnWriteArrayList<>();
    private final Map<String, Subscription> subscriptionById = new ConcurrentHashMap<>();

    @Autowired
    public UpdateBroadcaster(
            @Qualifier("broadcastExecutor") ExecutorService executor,
            ObjectProvider<StatisticsListener> statisticsListeners,
            ObjectProvider<SecurityEventListener> securityEventListeners) {
        this.executor = executor;
        statisticsListeners.orderedStream().forEach(listener -> subscribe(null, listener));
        securityEventListeners.orderedStream().forEach(securityListeners::add);
    }

    /**
     * Broadcaster with no initial subscribers.
     */
    public UpdateBroadcaster(ExecutorService executor) {
        this.executor = executor;
    }

    /**
     * Delivers a snapshot to every subscriber of the subject and to every global subscriber.
     */
    public void publish(String subjectId, SubjectStatistics statistics) {
        if (subjectId == null || statistics == null) {
            return;
        }
        for (Subscription sub : statisticsSubscriptions) {
            if (sub.subjectId() != null && !sub.subjectId().equals(subjectId)) {
                continue;
            }
            dispatch(() -> sub.listener().onStatisticsChanged(subjectId, statistics),
                    "statistics subscriber " + sub.id());
        }
    }

    public void publishSecurityEvent(SecurityEvent event) {
        if (event == null) {
            return;
        }
        for (SecurityEventListener listener : securityListeners) {
            dispatch(() -> listener.onSecurityEvent(event), "security subscriber");
        }
    }

    /**
     * Subscribes to one subject, or to every subject when {@code subjectId} is null.
     *
     * @return subscription ID
     */
    public String subscribe(String subjectId, StatisticsListener listener) {
        String subscriptionId = UUID.randomUUID().toString();
        Subscription subscription = new Subscription(subscriptionId, subjectId, listener);
        statisticsSubscriptions.add(subscription);
        subscriptionById.put(subscriptionId, subscription);
        return subscriptionId;
    }

    public void unsubscribe(String subscriptionId) {
        Subscription subscription = subscriptionById.remove(subscriptionId);
        if (subscription != null) {
            statisticsSubscriptions.remove(subscription);
        }
    }

    public void addSecurityEventListener(SecurityEventListener listener) {
        securityListeners.add(listener);
    }

    public void removeSecurityEventListener(SecurityEventListener listener) {
        securityListeners.remove(listener);
    }

    public int getSubscriberCount(String subjectId) {
        return (int) statisticsSubscriptions.stream()
                .filter(s -> s.subjectId() == null || s.subjectId().equals(subjectId))
                .count();
    }

    private void dispatch(Runnable delivery, String target) {
        try {
            executor.submit(() -> {
                try {
                    delivery.run();
                } catch (Exception e) {
                    log.error("Delivery to {} failed", target, e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.error("Broadcast executor rejected delivery to {}", target, e);
        }
    }

    private record Subscription(
            String id,
            String subjectId,
            StatisticsListener listener
    ) {}
}
