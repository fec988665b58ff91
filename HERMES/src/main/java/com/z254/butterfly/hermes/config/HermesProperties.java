package com.z254.butterfly.hermes.config;

import com.z254.butterfly.hermes.domain.model.RoutingStrategy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for HERMES service.
 */
@Data
@Component
@ConfigurationProperties(prefix = "hermes")
public class HermesProperties {

    private RoutingProperties routing = new RoutingProperties();
    private PerformanceProperties performance = new PerformanceProperties();
    private DelegationProperties delegation = new DelegationProperties();
    private OrchestrationProperties orchestration = new OrchestrationProperties();
    private TransportProperties transport = new TransportProperties();

    @Data
    public static class RoutingProperties {
        private RoutingStrategy strategy = RoutingStrategy.PERFORMANCE;
        private int circuitBreakerThreshold = 5;
        private Duration circuitBreakerCoolDown = Duration.ofSeconds(30);
        private Duration healthCheckInterval = Duration.ofSeconds(30);
        private boolean failoverEnabled = true;
        private Duration deliveryTimeout = Duration.ofSeconds(5);
        private double emaAlpha = 0.1;
        private long degradedResponseTimeMs = 1000;
    }

    @Data
    public static class PerformanceProperties {
        private long maxLatency = 50; // ms
        private long throughputTarget = 10000; // messages per second
        private double deliveryReliability = 99.9; // percent
        private double errorRateAlertThreshold = 0.05;
        private int latencySampleSize = 1000;
    }

    @Data
    public static class DelegationProperties {
        private int maxConcurrentSubAgents = 15;
        private int maxConcurrentTasks = 1000; // per delegation request
        private Duration taskTimeout = Duration.ofMinutes(5);
        private Duration heartbeatInterval = Duration.ofSeconds(30);
        private Duration progressPollInterval = Duration.ofSeconds(1);
        private int assumedAgentCapacity = 10;
        private Duration completedTaskRetention = Duration.ofMinutes(10);
    }

    @Data
    public static class OrchestrationProperties {
        private boolean subAgentDelegationEnabled = true;
        private boolean waveCoordinationEnabled = false;
        private boolean personaChainsEnabled = false;
        private boolean qualityGatesEnabled = false;
    }

    @Data
    public static class TransportProperties {
        private String type = "in-process"; // in-process, http
        private HttpProperties http = new HttpProperties();

        @Data
        public static class HttpProperties {
            private String inboundPath = "/api/v1/messages/inbound";
            private String healthPath = "/actuator/health";
        }
    }
}
