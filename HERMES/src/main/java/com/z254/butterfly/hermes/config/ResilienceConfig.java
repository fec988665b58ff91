package com.z254.butterfly.hermes.config;

import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.micrometer.tagged.TaggedCircuitBreakerMetrics;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Circuit breaker and clock configuration for HERMES routing.
 */
@Configuration
public class ResilienceConfig {

    @Bean
    public Clock hermesClock() {
        return Clock.systemUTC();
    }

    /**
     * Registry of per-server circuit breakers. A breaker opens once the last
     * {@code circuitBreakerThreshold} deliveries to a server all failed.
     */
    @Bean
    public CircuitBreakerRegistry serverCircuitBreakerRegistry(HermesProperties hermesProperties) {
        return CircuitBreakerRegistry.of(serverBreakerConfig(hermesProperties.getRouting()));
    }

    @Bean
    public TaggedCircuitBreakerMetrics serverCircuitBreakerMetrics(CircuitBreakerRegistry serverCircuitBreakerRegistry) {
        return TaggedCircuitBreakerMetrics.ofCircuitBreakerRegistry(serverCircuitBreakerRegistry);
    }

    public static CircuitBreakerConfig serverBreakerConfig(HermesProperties.RoutingProperties routing) {
        int threshold = Math.max(1, routing.getCircuitBreakerThreshold());
        return CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(threshold)
                .minimumNumberOfCalls(threshold)
                .failureRateThreshold(100.0f)
                .permittedNumberOfCallsInHalfOpenState(1)
                .waitDurationInOpenState(routing.getCircuitBreakerCoolDown())
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .build();
    }
}
