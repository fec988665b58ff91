package com.z254.butterfly.hermes.routing;

import com.z254.butterfly.hermes.domain.model.*;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Core interface for point-to-point and broadcast message routing.
 * Provides route computation, load balancing, circuit breaking and failover across servers.
 */
public interface MessageRouter {

    // --------------------------------------------------------------------------------------------
    // Routing
    // --------------------------------------------------------------------------------------------

    /**
     * Route a message to its target server, failing over when the target's circuit is open.
     * Routing failures are reported in the result; the returned Mono never errors.
     *
     * @param message The message to deliver
     * @return The routing result
     */
    Mono<RoutingResult> routeMessage(BaseMessage message);

    /**
     * Deliver a copy of a message to each target independently.
     *
     * @param message The message to broadcast
     * @param targets Target servers, or null/empty for every server in the routing table
     * @return Broadcast summary, successful when at least one delivery succeeded
     */
    Mono<BroadcastResult> broadcastMessage(BaseMessage message, List<String> targets);

    /**
     * Compute the route a message would take, without delivering it.
     *
     * @param message The message
     * @return The route, or a {@link RoutingException} when no usable server exists
     */
    Mono<Route> calculateOptimalRoute(BaseMessage message);

    // --------------------------------------------------------------------------------------------
    // Server selection
    // --------------------------------------------------------------------------------------------

    /**
     * Select a server satisfying the given criteria.
     *
     * @return The selected server, or a {@link NoAvailableServerException}
     */
    Mono<RoutingTableEntry> selectTargetServer(SelectionCriteria criteria);

    /**
     * Pick a server for a message using the configured load-balancing strategy.
     */
    Mono<LoadBalancingResult> balanceLoad(BaseMessage message);

    /**
     * Find a healthy server sharing a capability with a failed one and record the failure.
     *
     * @param serverId The failed server
     * @return Failover outcome, unsuccessful when no alternative exists
     */
    FailoverResult handleServerFailure(String serverId);

    // --------------------------------------------------------------------------------------------
    // Health and routing table
    // --------------------------------------------------------------------------------------------

    /**
     * Probe a server and store the resulting health classification.
     */
    Mono<HealthStatus> checkServerHealth(String serverId);

    /**
     * Probe every server in the routing table.
     *
     * @return Health per server id
     */
    Mono<Map<String, HealthStatus>> checkAllServers();

    void updateRoutingTable(List<RoutingTableUpdate> updates);

    List<RoutingTableEntry> getRoutingTable();

    RoutingMetrics getRoutingMetrics();

    Map<String, CircuitBreakerState> getCircuitBreakerStates();

    /**
     * Raised internally when no usable route exists; converted to a failed {@link RoutingResult}
     * by {@link #routeMessage}.
     */
    class RoutingException extends RuntimeException {
        private final String serverId;

        public RoutingException(String message, String serverId) {
            super(message);
            this.serverId = serverId;
        }

        public String getServerId() {
            return serverId;
        }
    }

    class NoAvailableServerException extends RuntimeException {
        public NoAvailableServerException(String message) {
            super(message);
        }
    }
}
