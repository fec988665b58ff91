package com.z254.butterfly.hermes.communication;

import com.z254.butterfly.hermes.config.HermesProperties;
import com.z254.butterfly.hermes.domain.model.MessageType;
import com.z254.butterfly.hermes.events.CoordinationEventBus;
import com.z254.butterfly.hermes.events.CoordinationEventType;
import com.z254.butterfly.hermes.observability.HermesMetrics;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Latency and error bookkeeping for communication-service dispatches.
 * Keeps a sliding window of recent latencies for percentiles and raises performance alerts
 * when the latency budget or the error-rate threshold is exceeded.
 */
@Component
@Slf4j
public class CommunicationTelemetry {

    private static final String SOURCE = "communication_service";
    private static final int MAX_ALERTS = 100;

    private final HermesProperties hermesProperties;
    private final HermesMetrics metrics;
    private final CoordinationEventBus eventBus;
    private final Clock clock;

    private final Deque<Long> latencies = new ArrayDeque<>();
    private final Deque<PerformanceAlert> alerts = new ArrayDeque<>();
    private long dispatches;
    private long errors;
    private long totalLatency;
    private boolean errorRateAlertActive;

    public CommunicationTelemetry(HermesProperties hermesProperties, HermesMetrics metrics,
                                  CoordinationEventBus eventBus, Clock clock) {
        this.hermesProperties = hermesProperties;
        this.metrics = metrics;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    /**
     * Record a finished dispatch.
     *
     * @param success false when the handling component reported a failure
     */
    public void recordDispatch(MessageType type, Duration latency, boolean success) {
        long latencyMs = latency.toMillis();
        long budget = hermesProperties.getPerformance().getMaxLatency();
        PerformanceAlert latencyAlert = null;
        PerformanceAlert errorAlert;

        synchronized (this) {
            dispatches++;
            totalLatency += latencyMs;
            latencies.addLast(latencyMs);
            while (latencies.size() > Math.max(1, hermesProperties.getPerformance().getLatencySampleSize())) {
                latencies.removeFirst();
            }
            if (!success) {
                errors++;
            }
            if (latencyMs > budget) {
                latencyAlert = addAlert(PerformanceAlert.Kind.LATENCY,
                        String.format("%s dispatch took %dms, budget is %dms", type, latencyMs, budget),
                        latencyMs, budget);
            }
            errorAlert = checkErrorRate();
        }

        metrics.recordDispatch(type.name(), latency);
        if (!success) {
            metrics.recordDispatchError(type.name());
        }
        publish(latencyAlert);
        publish(errorAlert);
    }

    /**
     * Record a dispatch that ended with an exception.
     */
    public void recordError(MessageType type, Duration latency, Throwable error) {
        log.debug("Dispatch of {} message failed: {}", type, error.getMessage());
        recordDispatch(type, latency, false);
    }

    public synchronized double errorRate() {
        return dispatches == 0 ? 0.0 : (double) errors / dispatches;
    }

    public synchronized TelemetryReport report() {
        List<Long> sorted = new ArrayList<>(latencies);
        sorted.sort(Long::compare);
        return TelemetryReport.builder()
                .totalDispatches(dispatches)
                .errors(errors)
                .errorRate(errorRate())
                .averageLatency(dispatches == 0 ? 0.0 : (double) totalLatency / dispatches)
                .p95Latency(percentile(sorted, 95))
                .maxLatency(sorted.isEmpty() ? 0 : sorted.get(sorted.size() - 1))
                .recentAlerts(new ArrayList<>(alerts))
                .build();
    }

    public synchronized void reset() {
        latencies.clear();
        alerts.clear();
        dispatches = 0;
        errors = 0;
        totalLatency = 0;
        errorRateAlertActive = false;
    }

    // --------------------------------------------------------------------------------------------
    // Internal helpers
    // --------------------------------------------------------------------------------------------

    /**
     * Alerts once when the error rate crosses the threshold, and again only after it recovered.
     */
    private PerformanceAlert checkErrorRate() {
        double threshold = hermesProperties.getPerformance().getErrorRateAlertThreshold();
        double rate = errorRate();
        if (rate > threshold && !errorRateAlertActive) {
            errorRateAlertActive = true;
            return addAlert(PerformanceAlert.Kind.ERROR_RATE,
                    String.format("Dispatch error rate %.1f%% exceeds %.1f%%", rate * 100, threshold * 100),
                    rate, threshold);
        }
        if (rate <= threshold) {
            errorRateAlertActive = false;
        }
        return null;
    }

    private PerformanceAlert addAlert(PerformanceAlert.Kind kind, String message, double value, double threshold) {
        PerformanceAlert alert = PerformanceAlert.builder()
                .kind(kind)
                .message(message)
                .value(value)
                .threshold(threshold)
                .timestamp(clock.instant())
                .build();
        alerts.addLast(alert);
        while (alerts.size() > MAX_ALERTS) {
            alerts.removeFirst();
        }
        return alert;
    }

    private void publish(PerformanceAlert alert) {
        if (alert == null) {
            return;
        }
        log.warn("Performance alert: {}", alert.getMessage());
        eventBus.publish(CoordinationEventType.PERFORMANCE_ALERT, SOURCE, alert.getKind().name(),
                Map.of("message", alert.getMessage(), "value", alert.getValue(), "threshold", alert.getThreshold()));
    }

    private static long percentile(List<Long> sorted, int percentile) {
        if (sorted.isEmpty()) {
            return 0;
        }
        int index = (int) Math.ceil(percentile / 100.0 * sorted.size()) - 1;
        return sorted.get(Math.max(0, Math.min(index, sorted.size() - 1)));
    }

    @Value
    @Builder
    public static class PerformanceAlert {

        public enum Kind { LATENCY, ERROR_RATE }

        Kind kind;
        String message;
        double value;
        double threshold;
        Instant timestamp;
    }

    @Value
    @Builder
    public static class TelemetryReport {
        long totalDispatches;
        long errors;
        /**
         * Failed dispatches over all dispatches, 0..1.
         */
        double errorRate;
        double averageLatency;
        long p95Latency;
        long maxLatency;
        List<PerformanceAlert> recentAlerts;
    }
}
