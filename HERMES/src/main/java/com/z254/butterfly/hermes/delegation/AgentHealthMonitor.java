package com.z254.butterfly.hermes.delegation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic liveness sweep over the sub-agent pool.
 */
@Component
@Slf4j
public class AgentHealthMonitor {

    private final SubAgentCoordinator coordinator;

    public AgentHealthMonitor(SubAgentCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @Scheduled(fixedDelayString = "${hermes.delegation.heartbeat-interval:PT30S}")
    public void sweep() {
        try {
            coordinator.runHealthSweep();
        } catch (RuntimeException e) {
            log.error("Sub-agent health sweep failed", e);
        }
    }
}
