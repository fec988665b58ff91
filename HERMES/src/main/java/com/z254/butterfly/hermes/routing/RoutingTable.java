package com.z254.butterfly.hermes.routing;

import com.z254.butterfly.hermes.domain.model.HealthState;
import com.z254.butterfly.hermes.domain.model.HealthStatus;
import com.z254.butterfly.hermes.domain.model.RoutingTableEntry;
import com.z254.butterfly.hermes.domain.model.RoutingTableUpdate;
import com.z254.butterfly.hermes.domain.model.ServerPerformance;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Server id to routing record index.
 * All mutation goes through the synchronized methods below so that routing outcomes and
 * periodic health checks never race each other; readers get detached copies in insertion order.
 */
@Component
public class RoutingTable {

    private final Map<String, RoutingTableEntry> entries = new LinkedHashMap<>();
    private final Clock clock;

    public RoutingTable(Clock clock) {
        this.clock = clock;
    }

    /**
     * Insert or replace a server record.
     */
    public synchronized void put(RoutingTableEntry entry) {
        RoutingTableEntry stored = entry.copy();
        if (stored.getHealth() == null || stored.getHealth().getStatus() == null) {
            stored.setHealth(HealthStatus.builder().status(HealthState.HEALTHY).build());
        }
        if (stored.getPerformance() == null) {
            stored.setPerformance(new ServerPerformance());
        }
        stored.setLastUpdated(clock.instant());
        entries.put(stored.getServerId(), stored);
    }

    /**
     * Apply the non-null fields of an update to an existing record.
     *
     * @return false when the server is unknown
     */
    public synchronized boolean merge(RoutingTableUpdate update) {
        RoutingTableEntry existing = entries.get(update.getServerId());
        if (existing == null) {
            return false;
        }
        if (update.getEndpoints() != null) {
            existing.setEndpoints(new ArrayList<>(update.getEndpoints()));
        }
        if (update.getCapabilities() != null) {
            existing.setCapabilities(new LinkedHashSet<>(update.getCapabilities()));
        }
        if (update.getLoad() != null) {
            existing.setLoad(Math.max(0, Math.min(100, update.getLoad())));
        }
        if (update.getHealth() != null) {
            existing.getHealth().setStatus(update.getHealth());
            existing.getHealth().setLastCheck(clock.instant());
        }
        existing.setLastUpdated(clock.instant());
        return true;
    }

    public synchronized boolean remove(String serverId) {
        return entries.remove(serverId) != null;
    }

    public synchronized Optional<RoutingTableEntry> get(String serverId) {
        RoutingTableEntry entry = serverId != null ? entries.get(serverId) : null;
        return Optional.ofNullable(entry).map(RoutingTableEntry::copy);
    }

    public synchronized boolean contains(String serverId) {
        return entries.containsKey(serverId);
    }

    public synchronized List<RoutingTableEntry> snapshot() {
        List<RoutingTableEntry> copies = new ArrayList<>(entries.size());
        entries.values().forEach(entry -> copies.add(entry.copy()));
        return copies;
    }

    public synchronized List<String> serverIds() {
        return new ArrayList<>(entries.keySet());
    }

    public synchronized int size() {
        return entries.size();
    }

    /**
     * Blend a delivery outcome into the server's moving averages.
     *
     * @param latencyMs Observed delivery latency
     * @param success   Whether the delivery succeeded
     * @param alpha     Smoothing factor of the exponential moving average
     */
    public synchronized void recordDelivery(String serverId, long latencyMs, boolean success, double alpha) {
        RoutingTableEntry entry = entries.get(serverId);
        if (entry == null) {
            return;
        }
        ServerPerformance performance = entry.getPerformance();
        performance.setAverageLatency(alpha * latencyMs + (1 - alpha) * performance.getAverageLatency());
        performance.setSuccessRate(alpha * (success ? 100.0 : 0.0) + (1 - alpha) * performance.getSuccessRate());
        performance.setDeliveries(performance.getDeliveries() + 1);
        if (!success) {
            performance.setFailures(performance.getFailures() + 1);
        }
        entry.setLastUpdated(clock.instant());
    }

    /**
     * Store the result of a health probe.
     *
     * @return The previous health state, or null when the server is unknown
     */
    public synchronized HealthState applyHealth(String serverId, HealthStatus health) {
        RoutingTableEntry entry = entries.get(serverId);
        if (entry == null) {
            return null;
        }
        HealthState previous = entry.healthState();
        entry.setHealth(health.toBuilder().build());
        entry.setLastUpdated(clock.instant());
        return previous;
    }
}
