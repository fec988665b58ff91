package com.z254.butterfly.hermes.health;

import com.z254.butterfly.hermes.communication.CommunicationService;
import com.z254.butterfly.hermes.domain.model.ComponentHealth;
import com.z254.butterfly.hermes.domain.model.HealthState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Health indicator for HERMES service.
 * Reports router, coordinator and telemetry health as aggregated by the communication service.
 */
@Component
@Slf4j
public class HermesHealthIndicator implements ReactiveHealthIndicator {

    static final Status DEGRADED = new Status("DEGRADED", "One or more components are degraded");

    private final CommunicationService communicationService;

    public HermesHealthIndicator(CommunicationService communicationService) {
        this.communicationService = communicationService;
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromCallable(communicationService::getSystemHealth)
                .map(systemHealth -> {
                    Health.Builder builder = Health.status(toStatus(systemHealth.getOverall()));
                    for (ComponentHealth component : systemHealth.getComponents()) {
                        builder.withDetail(component.getName(), component.getStatus().name());
                    }
                    return builder.build();
                })
                .onErrorResume(e -> {
                    log.error("Health check failed", e);
                    return Mono.just(Health.down()
                            .withDetail("error", e.getMessage())
                            .build());
                });
    }

    static Status toStatus(HealthState state) {
        return switch (state) {
            case HEALTHY -> Status.UP;
            case DEGRADED -> DEGRADED;
            case UNHEALTHY -> Status.DOWN;
        };
    }
}
