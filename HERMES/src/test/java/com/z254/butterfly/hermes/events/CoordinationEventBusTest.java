package com.z254.butterfly.hermes.events;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for CoordinationEventBus.
 */
class CoordinationEventBusTest {

    private CoordinationEventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new CoordinationEventBus(3);
    }

    @AfterEach
    void tearDown() {
        eventBus.shutdown();
    }

    @Test
    void shouldDeliverEventsToSubscribersOfTheirType() {
        StepVerifier.create(eventBus.subscribe(CoordinationEventType.FAILOVER).take(1))
                .then(() -> {
                    eventBus.publish(CoordinationEventType.AGENT_REGISTERED, "test", "a1", Map.of());
                    eventBus.publish(CoordinationEventType.FAILOVER, "test", "s1", Map.of("to", "s2"));
                })
                .assertNext(event -> {
                    assertThat(event.getType()).isEqualTo(CoordinationEventType.FAILOVER);
                    assertThat(event.getSubjectId()).isEqualTo("s1");
                    assertThat(event.getAttributes()).containsEntry("to", "s2");
                    assertThat(event.getEventId()).isNotBlank();
                })
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void shouldDeliverEveryEventToUnfilteredSubscribers() {
        StepVerifier.create(eventBus.subscribe().take(2))
                .then(() -> {
                    eventBus.publish(CoordinationEventType.TASK_ASSIGNED, "test", "t1", null);
                    eventBus.publish(CoordinationEventType.TASK_TIMEOUT, "test", "t1", null);
                })
                .expectNextMatches(event -> event.getType() == CoordinationEventType.TASK_ASSIGNED)
                .expectNextMatches(event -> event.getType() == CoordinationEventType.TASK_TIMEOUT
                        && event.getAttributes().isEmpty())
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void shouldKeepBoundedHistoryOldestFirst() {
        // Given
        for (int i = 1; i <= 5; i++) {
            eventBus.publish(CoordinationEventType.TASK_ASSIGNED, "test", "t" + i, Map.of());
        }

        // When
        List<CoordinationEvent> recent = eventBus.recentEvents(10);

        // Then
        assertThat(recent).extracting(CoordinationEvent::getSubjectId).containsExactly("t3", "t4", "t5");
        assertThat(eventBus.recentEvents(2)).extracting(CoordinationEvent::getSubjectId).containsExactly("t4", "t5");
        assertThat(eventBus.recentEvents(0)).isEmpty();
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldCountPublishedEventsByType() {
        // Given
        eventBus.publish(CoordinationEventType.FAILOVER, "test", "s1", Map.of());
        eventBus.publish(CoordinationEventType.FAILOVER, "test", "s2", Map.of());
        eventBus.publish(CoordinationEventType.AGENT_REGISTERED, "test", "a1", Map.of());
        eventBus.publish(null);

        // When
        Map<String, Object> stats = eventBus.getStats();

        // Then
        assertThat((Map<String, Long>) stats.get("publishedByType"))
                .containsEntry("FAILOVER", 2L)
                .containsEntry("AGENT_REGISTERED", 1L)
                .doesNotContainKey("TASK_TIMEOUT");
        assertThat(stats).containsEntry("retainedEvents", 3).containsEntry("dropped", 0L);
    }
}
