package com.z254.butterfly.hermes.routing;

import com.z254.butterfly.hermes.config.HermesProperties;
import com.z254.butterfly.hermes.config.ResilienceConfig;
import com.z254.butterfly.hermes.domain.model.CircuitBreakerState;
import com.z254.butterfly.hermes.domain.model.CircuitState;
import com.z254.butterfly.hermes.events.CoordinationEventBus;
import com.z254.butterfly.hermes.events.CoordinationEventType;
import com.z254.butterfly.hermes.transport.MessageTransport;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * One Resilience4j circuit breaker per routed server.
 * <p>
 * Resilience4j decides closed to open (threshold consecutive failures), half-open to closed (trial success)
 * and half-open to open (trial failure). The open to half-open transition is driven here by the cool-down
 * measured on the injected clock, so it happens on the first read after the cool-down regardless of traffic.
 * <p>
 * Each breaker takes the threshold and cool-down configured when it is created.
 */
@Component
@Slf4j
public class ServerCircuitBreakers {

    private static final String SOURCE = "message_router";

    private final CircuitBreakerRegistry registry;
    private final Clock clock;
    private final CoordinationEventBus eventBus;
    private final HermesProperties hermesProperties;
    private final Map<String, Tracker> trackers = new ConcurrentHashMap<>();

    public ServerCircuitBreakers(CircuitBreakerRegistry registry, Clock clock,
                                 CoordinationEventBus eventBus, HermesProperties hermesProperties) {
        this.registry = registry;
        this.clock = clock;
        this.eventBus = eventBus;
        this.hermesProperties = hermesProperties;
    }

    /**
     * Create the breaker for a server if it does not exist yet.
     */
    public void register(String serverId) {
        trackers.computeIfAbsent(serverId, this::createTracker);
    }

    public void remove(String serverId) {
        Tracker tracker = trackers.remove(serverId);
        if (tracker != null) {
            registry.remove(serverId);
            log.debug("Removed circuit breaker for {}", serverId);
        }
    }

    /**
     * Current state, applying the cool-down transition first.
     */
    public CircuitState state(String serverId) {
        Tracker tracker = trackers.get(serverId);
        if (tracker == null) {
            return CircuitState.CLOSED;
        }
        synchronized (tracker) {
            refresh(tracker);
            return map(tracker.breaker.getState());
        }
    }

    public boolean isOpen(String serverId) {
        return state(serverId) == CircuitState.OPEN;
    }

    /**
     * Ask permission to deliver to a server. Denied while open, and in half-open once the trial call is taken.
     */
    public boolean tryAcquire(String serverId) {
        Tracker tracker = trackers.computeIfAbsent(serverId, this::createTracker);
        synchronized (tracker) {
            refresh(tracker);
            return tracker.breaker.tryAcquirePermission();
        }
    }

    /**
     * Give back a permission that was acquired but not used for a delivery.
     */
    public void release(String serverId) {
        Tracker tracker = trackers.get(serverId);
        if (tracker != null) {
            tracker.breaker.releasePermission();
        }
    }

    public void recordSuccess(String serverId, Duration latency) {
        Tracker tracker = trackers.get(serverId);
        if (tracker == null) {
            return;
        }
        synchronized (tracker) {
            tracker.failureCount = 0;
            tracker.breaker.onSuccess(latency.toNanos(), TimeUnit.NANOSECONDS);
        }
    }

    public void recordFailure(String serverId, Duration latency, Throwable error) {
        Tracker tracker = trackers.get(serverId);
        if (tracker == null) {
            return;
        }
        Throwable cause = error != null ? error
                : new MessageTransport.TransportException("Delivery to " + serverId + " failed");
        synchronized (tracker) {
            tracker.failureCount++;
            tracker.lastFailure = clock.instant();
            tracker.breaker.onError(latency.toNanos(), TimeUnit.NANOSECONDS, cause);
        }
    }

    /**
     * Apply pending cool-down transitions to every breaker.
     */
    public void refreshAll() {
        trackers.values().forEach(tracker -> {
            synchronized (tracker) {
                refresh(tracker);
            }
        });
    }

    public CircuitBreakerState snapshot(String serverId) {
        Tracker tracker = trackers.get(serverId);
        if (tracker == null) {
            return CircuitBreakerState.builder().serverId(serverId).state(CircuitState.CLOSED).build();
        }
        synchronized (tracker) {
            refresh(tracker);
            return toState(serverId, tracker);
        }
    }

    public Map<String, CircuitBreakerState> snapshots() {
        Map<String, CircuitBreakerState> result = new LinkedHashMap<>();
        trackers.keySet().stream().sorted().forEach(id -> result.put(id, snapshot(id)));
        return result;
    }

    // --------------------------------------------------------------------------------------------
    // Internal helpers
    // --------------------------------------------------------------------------------------------

    private Tracker createTracker(String serverId) {
        HermesProperties.RoutingProperties routing = hermesProperties.getRouting();
        CircuitBreaker breaker = registry.circuitBreaker(serverId, ResilienceConfig.serverBreakerConfig(routing));
        Tracker tracker = new Tracker(breaker, routing.getCircuitBreakerCoolDown());
        breaker.getEventPublisher().onStateTransition(event -> {
            CircuitBreaker.State to = event.getStateTransition().getToState();
            if (to == CircuitBreaker.State.OPEN) {
                tracker.openedAt = clock.instant();
            } else if (to == CircuitBreaker.State.CLOSED) {
                tracker.failureCount = 0;
                tracker.openedAt = null;
            }
            CircuitState from = map(event.getStateTransition().getFromState());
            CircuitState state = map(to);
            log.info("Circuit breaker for {} transitioned {} -> {}", serverId, from, state);
            eventBus.publish(CoordinationEventType.CIRCUIT_STATE_CHANGED, SOURCE, serverId,
                    Map.of("from", from.name(), "to", state.name()));
        });
        log.debug("Created circuit breaker for {}", serverId);
        return tracker;
    }

    private void refresh(Tracker tracker) {
        if (tracker.breaker.getState() != CircuitBreaker.State.OPEN || tracker.openedAt == null) {
            return;
        }
        Instant reopenAt = tracker.openedAt.plus(tracker.coolDown);
        if (!clock.instant().isBefore(reopenAt)) {
            tracker.breaker.transitionToHalfOpenState();
        }
    }

    private CircuitBreakerState toState(String serverId, Tracker tracker) {
        return CircuitBreakerState.builder()
                .serverId(serverId)
                .state(map(tracker.breaker.getState()))
                .failureCount(tracker.failureCount)
                .lastFailure(tracker.lastFailure)
                .openedAt(tracker.openedAt)
                .build();
    }

    private static CircuitState map(CircuitBreaker.State state) {
        return switch (state) {
            case OPEN, FORCED_OPEN -> CircuitState.OPEN;
            case HALF_OPEN -> CircuitState.HALF_OPEN;
            default -> CircuitState.CLOSED;
        };
    }

    private static final class Tracker {
        private final CircuitBreaker breaker;
        private final Duration coolDown;
        private int failureCount;
        private Instant lastFailure;
        private Instant openedAt;

        private Tracker(CircuitBreaker breaker, Duration coolDown) {
            this.breaker = breaker;
            this.coolDown = coolDown;
        }
    }
}
