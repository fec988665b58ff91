package com.z254.butterfly.hermes.events;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Event channel connecting the routing and delegation components to interested observers.
 * Provides:
 * - Fire-and-forget publication that never blocks the publisher
 * - Subscription to all events or a single event type
 * - A bounded history of recent events for polling readers
 */
@Service
@Slf4j
public class CoordinationEventBus {

    private static final int DEFAULT_HISTORY_SIZE = 500;

    private final Sinks.Many<CoordinationEvent> sink;

    private final Deque<CoordinationEvent> history;
    private final int maxHistory;

    private final Map<CoordinationEventType, AtomicLong> publishedByType;
    private final AtomicLong dropped = new AtomicLong();

    public CoordinationEventBus() {
        this(DEFAULT_HISTORY_SIZE);
    }

    public CoordinationEventBus(int maxHistory) {
        this.sink = Sinks.many().multicast().directBestEffort();
        this.history = new ArrayDeque<>();
        this.maxHistory = maxHistory;
        this.publishedByType = new EnumMap<>(CoordinationEventType.class);
        for (CoordinationEventType type : CoordinationEventType.values()) {
            publishedByType.put(type, new AtomicLong());
        }
        log.info("Initialized CoordinationEventBus");
    }

    /**
     * Publish an event to all current subscribers.
     *
     * @param event The event to publish
     */
    public void publish(CoordinationEvent event) {
        if (event == null) {
            return;
        }
        synchronized (history) {
            history.addLast(event);
            while (history.size() > maxHistory) {
                history.removeFirst();
            }
        }
        publishedByType.get(event.getType()).incrementAndGet();

        Sinks.EmitResult result;
        synchronized (sink) {
            result = sink.tryEmitNext(event);
        }
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            dropped.incrementAndGet();
            log.debug("Event {} not delivered to all subscribers: {}", event.getType(), result);
        }
        log.debug("Event published: {} for {} by {}", event.getType(), event.getSubjectId(), event.getSource());
    }

    public void publish(CoordinationEventType type, String source, String subjectId, Map<String, Object> attributes) {
        publish(CoordinationEvent.of(type, source, subjectId, attributes));
    }

    /**
     * Subscribe to every event.
     */
    public Flux<CoordinationEvent> subscribe() {
        return sink.asFlux();
    }

    /**
     * Subscribe to events of one type.
     */
    public Flux<CoordinationEvent> subscribe(CoordinationEventType type) {
        return sink.asFlux().filter(event -> event.getType() == type);
    }

    /**
     * Most recent events, oldest first.
     *
     * @param limit Maximum number of events to return
     */
    public List<CoordinationEvent> recentEvents(int limit) {
        synchronized (history) {
            List<CoordinationEvent> all = new ArrayList<>(history);
            int from = Math.max(0, all.size() - Math.max(limit, 0));
            return new ArrayList<>(all.subList(from, all.size()));
        }
    }

    /**
     * Get statistics about the event bus.
     */
    public Map<String, Object> getStats() {
        Map<String, Object> stats = new HashMap<>();
        Map<String, Long> byType = new HashMap<>();
        publishedByType.forEach((type, count) -> {
            if (count.get() > 0) {
                byType.put(type.name(), count.get());
            }
        });
        stats.put("publishedByType", byType);
        stats.put("subscribers", sink.currentSubscriberCount());
        stats.put("dropped", dropped.get());
        synchronized (history) {
            stats.put("retainedEvents", history.size());
        }
        return stats;
    }

    @PreDestroy
    public void shutdown() {
        synchronized (sink) {
            sink.tryEmitComplete();
        }
        log.info("CoordinationEventBus shut down");
    }
}
