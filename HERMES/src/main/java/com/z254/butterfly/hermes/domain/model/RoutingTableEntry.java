package com.z254.butterfly.hermes.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Routing record for a single server.
 * Owned by the routing table; callers only ever see copies.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RoutingTableEntry {

    private String serverId;

    @Builder.Default
    private List<String> endpoints = new ArrayList<>();

    @Builder.Default
    private Set<String> capabilities = new LinkedHashSet<>();

    @Builder.Default
    private HealthStatus health = new HealthStatus();

    /**
     * Reported load, 0..100.
     */
    private double load;

    @Builder.Default
    private ServerPerformance performance = new ServerPerformance();

    private Instant lastUpdated;

    public HealthState healthState() {
        return health != null && health.getStatus() != null ? health.getStatus() : HealthState.HEALTHY;
    }

    public boolean isUnhealthy() {
        return healthState() == HealthState.UNHEALTHY;
    }

    public boolean sharesCapabilityWith(RoutingTableEntry other) {
        if (capabilities == null || other.getCapabilities() == null) {
            return false;
        }
        return other.getCapabilities().stream().anyMatch(capabilities::contains);
    }

    /**
     * Detached copy safe to hand out to readers.
     */
    public RoutingTableEntry copy() {
        return toBuilder()
                .endpoints(endpoints != null ? new ArrayList<>(endpoints) : new ArrayList<>())
                .capabilities(capabilities != null ? new LinkedHashSet<>(capabilities) : new LinkedHashSet<>())
                .health(health != null ? health.toBuilder().build() : new HealthStatus())
                .performance(performance != null ? performance.toBuilder().build() : new ServerPerformance())
                .build();
    }
}
