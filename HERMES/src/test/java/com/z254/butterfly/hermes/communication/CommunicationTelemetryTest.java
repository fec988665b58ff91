package com.z254.butterfly.hermes.communication;

import com.z254.butterfly.hermes.config.HermesProperties;
import com.z254.butterfly.hermes.domain.model.MessageType;
import com.z254.butterfly.hermes.events.CoordinationEvent;
import com.z254.butterfly.hermes.events.CoordinationEventBus;
import com.z254.butterfly.hermes.events.CoordinationEventType;
import com.z254.butterfly.hermes.observability.HermesMetrics;
import com.z254.butterfly.hermes.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for CommunicationTelemetry.
 */
class CommunicationTelemetryTest {

    private HermesProperties properties;
    private CoordinationEventBus eventBus;
    private SimpleMeterRegistry meterRegistry;
    private CommunicationTelemetry telemetry;

    @BeforeEach
    void setUp() {
        properties = new HermesProperties();
        properties.getPerformance().setMaxLatency(50);
        properties.getPerformance().setErrorRateAlertThreshold(0.25);
        properties.getPerformance().setLatencySampleSize(20);
        eventBus = new CoordinationEventBus();
        meterRegistry = new SimpleMeterRegistry();
        telemetry = new CommunicationTelemetry(properties, new HermesMetrics(meterRegistry), eventBus, new MutableClock());
    }

    @Test
    void shouldSummariseDispatchLatencies() {
        // Given
        for (int latency = 1; latency <= 20; latency++) {
            telemetry.recordDispatch(MessageType.COMMAND, Duration.ofMillis(latency), true);
        }

        // When
        CommunicationTelemetry.TelemetryReport report = telemetry.report();

        // Then
        assertThat(report.getTotalDispatches()).isEqualTo(20);
        assertThat(report.getErrors()).isZero();
        assertThat(report.getAverageLatency()).isCloseTo(10.5, within(0.001));
        assertThat(report.getP95Latency()).isEqualTo(19);
        assertThat(report.getMaxLatency()).isEqualTo(20);
        assertThat(report.getRecentAlerts()).isEmpty();
    }

    @Test
    void shouldAlertWhenLatencyBudgetIsExceeded() {
        // When
        telemetry.recordDispatch(MessageType.REQUEST, Duration.ofMillis(80), true);

        // Then
        List<CommunicationTelemetry.PerformanceAlert> alerts = telemetry.report().getRecentAlerts();
        assertThat(alerts).hasSize(1);
        assertThat(alerts.get(0).getKind()).isEqualTo(CommunicationTelemetry.PerformanceAlert.Kind.LATENCY);
        assertThat(alerts.get(0).getMessage()).isEqualTo("REQUEST dispatch took 80ms, budget is 50ms");
        assertThat(alertEvents()).extracting(CoordinationEvent::getSubjectId).containsExactly("LATENCY");
    }

    @Test
    void shouldAlertOnceWhileErrorRateStaysHigh() {
        // Given
        telemetry.recordDispatch(MessageType.COMMAND, Duration.ofMillis(1), true);
        telemetry.recordDispatch(MessageType.COMMAND, Duration.ofMillis(1), true);
        telemetry.recordDispatch(MessageType.COMMAND, Duration.ofMillis(1), true);

        // When
        telemetry.recordError(MessageType.COMMAND, Duration.ofMillis(1), new IllegalStateException("boom"));
        telemetry.recordError(MessageType.COMMAND, Duration.ofMillis(1), new IllegalStateException("boom"));
        telemetry.recordError(MessageType.COMMAND, Duration.ofMillis(1), new IllegalStateException("boom"));

        // Then
        assertThat(telemetry.errorRate()).isEqualTo(0.5);
        assertThat(alertEvents()).extracting(CoordinationEvent::getSubjectId).containsExactly("ERROR_RATE");
    }

    @Test
    void shouldAlertAgainAfterErrorRateRecovered() {
        // Given
        telemetry.recordDispatch(MessageType.COMMAND, Duration.ofMillis(1), false);
        for (int i = 0; i < 4; i++) {
            telemetry.recordDispatch(MessageType.COMMAND, Duration.ofMillis(1), true);
        }
        assertThat(telemetry.errorRate()).isEqualTo(0.2);

        // When
        telemetry.recordDispatch(MessageType.COMMAND, Duration.ofMillis(1), false);

        // Then
        assertThat(alertEvents()).extracting(CoordinationEvent::getSubjectId)
                .containsExactly("ERROR_RATE", "ERROR_RATE");
    }

    @Test
    void shouldRecordDispatchMeters() {
        // When
        telemetry.recordDispatch(MessageType.EVENT, Duration.ofMillis(5), true);
        telemetry.recordDispatch(MessageType.EVENT, Duration.ofMillis(5), false);

        // Then
        assertThat(meterRegistry.getMeters()).isNotEmpty();
        assertThat(meterRegistry.find("hermes.dispatch.errors").counter()).isNotNull();
        assertThat(meterRegistry.find("hermes.dispatch.errors").counter().count()).isEqualTo(1.0);
    }

    @Test
    void shouldStartOverAfterReset() {
        // Given
        telemetry.recordDispatch(MessageType.COMMAND, Duration.ofMillis(90), false);

        // When
        telemetry.reset();

        // Then
        CommunicationTelemetry.TelemetryReport report = telemetry.report();
        assertThat(report.getTotalDispatches()).isZero();
        assertThat(report.getErrorRate()).isZero();
        assertThat(report.getRecentAlerts()).isEmpty();
        assertThat(report.getP95Latency()).isZero();
    }

    private List<CoordinationEvent> alertEvents() {
        return eventBus.recentEvents(100).stream()
                .filter(event -> event.getType() == CoordinationEventType.PERFORMANCE_ALERT)
                .toList();
    }
}
