package com.z254.butterfly.hermes.routing;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic health probe of every server in the routing table.
 * Uses the same update path as inline routing, so breaker and table state never diverge.
 */
@Component
@Slf4j
public class ServerHealthMonitor {

    private final MessageRouter router;

    public ServerHealthMonitor(MessageRouter router) {
        this.router = router;
    }

    @Scheduled(fixedDelayString = "${hermes.routing.health-check-interval:PT30S}")
    public void checkServers() {
        router.checkAllServers()
                .subscribe(
                        statuses -> log.debug("Health check completed for {} servers", statuses.size()),
                        error -> log.error("Server health check failed", error));
    }
}
