package com.z254.butterfly.hermes.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Set;

/**
 * Change request applied to the routing table.
 * For {@link Action#UPDATE} only the non-null fields are applied.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoutingTableUpdate {

    public enum Action { ADD, UPDATE, REMOVE }

    private Action action;

    private String serverId;

    private List<String> endpoints;

    private Set<String> capabilities;

    /**
     * Reported load, 0..100.
     */
    private Double load;

    private HealthState health;

    public static RoutingTableUpdate add(String serverId, List<String> endpoints, Set<String> capabilities) {
        return RoutingTableUpdate.builder()
                .action(Action.ADD)
                .serverId(serverId)
                .endpoints(endpoints)
                .capabilities(capabilities)
                .build();
    }

    public static RoutingTableUpdate load(String serverId, double load) {
        return RoutingTableUpdate.builder().action(Action.UPDATE).serverId(serverId).load(load).build();
    }

    public static RoutingTableUpdate remove(String serverId) {
        return RoutingTableUpdate.builder().action(Action.REMOVE).serverId(serverId).build();
    }

    /**
     * Full routing record described by an {@link Action#ADD} update.
     */
    public RoutingTableEntry toEntry() {
        RoutingTableEntry entry = RoutingTableEntry.builder()
                .serverId(serverId)
                .load(load != null ? clampLoad(load) : 0)
                .build();
        if (endpoints != null) {
            entry.getEndpoints().addAll(endpoints);
        }
        if (capabilities != null) {
            entry.getCapabilities().addAll(capabilities);
        }
        if (health != null) {
            entry.getHealth().setStatus(health);
        }
        return entry;
    }

    static double clampLoad(double load) {
        return Math.max(0, Math.min(100, load));
    }
}
