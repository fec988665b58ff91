package com.z254.butterfly.hermes.routing;

import com.z254.butterfly.hermes.config.HermesProperties;
import com.z254.butterfly.hermes.config.ResilienceConfig;
import com.z254.butterfly.hermes.domain.model.CircuitBreakerState;
import com.z254.butterfly.hermes.domain.model.CircuitState;
import com.z254.butterfly.hermes.events.CoordinationEvent;
import com.z254.butterfly.hermes.events.CoordinationEventBus;
import com.z254.butterfly.hermes.events.CoordinationEventType;
import com.z254.butterfly.hermes.support.MutableClock;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for ServerCircuitBreakers.
 */
class ServerCircuitBreakersTest {

    private static final String SERVER = "server-1";

    private HermesProperties properties;
    private MutableClock clock;
    private CoordinationEventBus eventBus;
    private ServerCircuitBreakers breakers;

    @BeforeEach
    void setUp() {
        properties = new HermesProperties();
        properties.getRouting().setCircuitBreakerThreshold(3);
        properties.getRouting().setCircuitBreakerCoolDown(Duration.ofSeconds(30));

        clock = new MutableClock();
        eventBus = new CoordinationEventBus();
        breakers = new ServerCircuitBreakers(
                CircuitBreakerRegistry.of(ResilienceConfig.serverBreakerConfig(properties.getRouting())),
                clock, eventBus, properties);
        breakers.register(SERVER);
    }

    @Test
    void shouldOpenAfterThresholdConsecutiveFailures() {
        // When
        fail(2);

        // Then
        assertThat(breakers.state(SERVER)).isEqualTo(CircuitState.CLOSED);

        // When
        fail(1);

        // Then
        assertThat(breakers.state(SERVER)).isEqualTo(CircuitState.OPEN);
        assertThat(breakers.tryAcquire(SERVER)).isFalse();

        CircuitBreakerState snapshot = breakers.snapshot(SERVER);
        assertThat(snapshot.getFailureCount()).isEqualTo(3);
        assertThat(snapshot.getOpenedAt()).isEqualTo(clock.instant());
    }

    @Test
    void shouldResetFailureCountOnSuccess() {
        // Given
        fail(2);

        // When
        breakers.recordSuccess(SERVER, Duration.ofMillis(5));
        fail(2);

        // Then
        assertThat(breakers.state(SERVER)).isEqualTo(CircuitState.CLOSED);
        assertThat(breakers.snapshot(SERVER).getFailureCount()).isEqualTo(2);
    }

    @Test
    void shouldMoveToHalfOpenAfterCoolDownAndAllowOneTrial() {
        // Given
        fail(3);
        clock.advance(Duration.ofSeconds(29));
        assertThat(breakers.state(SERVER)).isEqualTo(CircuitState.OPEN);

        // When
        clock.advance(Duration.ofSeconds(1));

        // Then
        assertThat(breakers.state(SERVER)).isEqualTo(CircuitState.HALF_OPEN);
        assertThat(breakers.tryAcquire(SERVER)).isTrue();
        assertThat(breakers.tryAcquire(SERVER)).isFalse();
    }

    @Test
    void shouldCloseWhenTrialSucceeds() {
        // Given
        fail(3);
        clock.advance(Duration.ofSeconds(30));
        assertThat(breakers.tryAcquire(SERVER)).isTrue();

        // When
        breakers.recordSuccess(SERVER, Duration.ofMillis(5));

        // Then
        assertThat(breakers.state(SERVER)).isEqualTo(CircuitState.CLOSED);
        assertThat(breakers.snapshot(SERVER).getFailureCount()).isZero();
        assertThat(breakers.tryAcquire(SERVER)).isTrue();
    }

    @Test
    void shouldReopenWhenTrialFails() {
        // Given
        fail(3);
        clock.advance(Duration.ofSeconds(30));
        assertThat(breakers.tryAcquire(SERVER)).isTrue();

        // When
        fail(1);

        // Then
        assertThat(breakers.state(SERVER)).isEqualTo(CircuitState.OPEN);
        assertThat(breakers.snapshot(SERVER).getOpenedAt()).isEqualTo(clock.instant());
    }

    @Test
    void shouldPublishStateChanges() {
        // When
        fail(3);

        // Then
        List<CoordinationEvent> events = eventBus.recentEvents(10);
        assertThat(events).hasSize(1);
        assertThat(events.get(0).getType()).isEqualTo(CoordinationEventType.CIRCUIT_STATE_CHANGED);
        assertThat(events.get(0).getSubjectId()).isEqualTo(SERVER);
        assertThat(events.get(0).getAttributes()).containsEntry("from", "CLOSED").containsEntry("to", "OPEN");
    }

    @Test
    void shouldReportClosedForUnknownServer() {
        assertThat(breakers.state("unknown")).isEqualTo(CircuitState.CLOSED);
        assertThat(breakers.snapshot("unknown").getState()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void shouldForgetRemovedServer() {
        // Given
        fail(3);

        // When
        breakers.remove(SERVER);

        // Then
        assertThat(breakers.snapshots()).doesNotContainKey(SERVER);
        assertThat(breakers.state(SERVER)).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void shouldApplyUpdatedRoutingConfigurationToBreakersCreatedAfterwards() {
        // Given
        HermesProperties.RoutingProperties updated = new HermesProperties.RoutingProperties();
        updated.setCircuitBreakerThreshold(1);
        updated.setCircuitBreakerCoolDown(Duration.ofSeconds(1));
        properties.setRouting(updated);

        // When
        breakers.register("server-2");
        breakers.recordFailure("server-2", Duration.ofMillis(5), new RuntimeException("boom"));
        fail(1);

        // Then
        assertThat(breakers.state("server-2")).isEqualTo(CircuitState.OPEN);
        assertThat(breakers.state(SERVER)).isEqualTo(CircuitState.CLOSED);

        // When
        clock.advance(Duration.ofSeconds(1));

        // Then
        assertThat(breakers.state("server-2")).isEqualTo(CircuitState.HALF_OPEN);
    }

    private void fail(int times) {
        for (int i = 0; i < times; i++) {
            breakers.recordFailure(SERVER, Duration.ofMillis(5), new RuntimeException("boom"));
        }
    }
}
