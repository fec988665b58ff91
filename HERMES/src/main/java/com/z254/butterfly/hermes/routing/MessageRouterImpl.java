package com.z254.butterfly.hermes.routing;

import com.z254.butterfly.hermes.config.HermesProperties;
import com.z254.butterfly.hermes.domain.model.*;
import com.z254.butterfly.hermes.events.CoordinationEventBus;
import com.z254.butterfly.hermes.events.CoordinationEventType;
import com.z254.butterfly.hermes.observability.HermesMetrics;
import com.z254.butterfly.hermes.routing.balancing.LoadBalancingStrategy;
import com.z254.butterfly.hermes.transport.MessageTransport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Implementation of the MessageRouter interface.
 * Routes through a pluggable {@link MessageTransport}, guarding every server with a circuit breaker.
 */
@Service
@Slf4j
public class MessageRouterImpl implements MessageRouter {

    public static final String ANY_TARGET = "*";
    public static final String CAPABILITY_HINT = "capability";

    private static final String SOURCE = "message_router";

    private final RoutingTable routingTable;
    private final ServerCircuitBreakers circuitBreakers;
    private final MessageTransport transport;
    private final Map<RoutingStrategy, LoadBalancingStrategy> strategies;
    private final HermesProperties hermesProperties;
    private final HermesMetrics metrics;
    private final CoordinationEventBus eventBus;
    private final Clock clock;

    // Aggregate statistics
    private final AtomicLong totalMessages = new AtomicLong();
    private final AtomicLong finishedMessages = new AtomicLong();
    private final AtomicLong successfulMessages = new AtomicLong();
    private final AtomicLong failoverCount = new AtomicLong();
    private final Map<String, AtomicLong> deliveriesByServer = new ConcurrentHashMap<>();
    private double routingLatency;
    private double rollingSuccessRate = 100.0;

    public MessageRouterImpl(
            RoutingTable routingTable,
            ServerCircuitBreakers circuitBreakers,
            MessageTransport transport,
            List<LoadBalancingStrategy> strategies,
            HermesProperties hermesProperties,
            HermesMetrics metrics,
            CoordinationEventBus eventBus,
            Clock clock) {
        this.routingTable = routingTable;
        this.circuitBreakers = circuitBreakers;
        this.transport = transport;
        this.hermesProperties = hermesProperties;
        this.metrics = metrics;
        this.eventBus = eventBus;
        this.clock = clock;

        this.strategies = new EnumMap<>(RoutingStrategy.class);
        strategies.forEach(strategy -> this.strategies.put(strategy.getStrategy(), strategy));
        log.info("Initialized MessageRouter with {} transport and {} load-balancing strategies",
                transport.name(), this.strategies.size());
    }

    // --------------------------------------------------------------------------------------------
    // Routing
    // --------------------------------------------------------------------------------------------

    @Override
    public Mono<RoutingResult> routeMessage(BaseMessage message) {
        return Mono.defer(() -> {
            long messageNumber = totalMessages.incrementAndGet();
            long startNanos = System.nanoTime();
            List<String> path = new ArrayList<>();

            return Mono.fromCallable(() -> resolveTarget(message, path, messageNumber))
                    .flatMap(target -> deliver(message, target, path, startNanos))
                    .onErrorResume(error -> {
                        long latency = elapsed(startNanos).toMillis();
                        recordAggregate(false, latency);
                        String serverId = error instanceof RoutingException
                                ? ((RoutingException) error).getServerId()
                                : message.target();
                        log.warn("Routing of message {} failed: {}", message.messageId(), error.getMessage());
                        return Mono.just(RoutingResult.failure(message.messageId(), serverId,
                                List.copyOf(path), latency, error.getMessage()));
                    });
        });
    }

    @Override
    public Mono<BroadcastResult> broadcastMessage(BaseMessage message, List<String> targets) {
        return Mono.defer(() -> {
            List<String> recipients = targets == null || targets.isEmpty()
                    ? routingTable.serverIds()
                    : new ArrayList<>(new LinkedHashSet<>(targets));

            if (recipients.isEmpty()) {
                return Mono.just(BroadcastResult.builder()
                        .success(false)
                        .deliveredCount(0)
                        .failedTargets(List.of())
                        .averageLatency(0)
                        .results(List.of())
                        .build());
            }

            log.debug("Broadcasting message {} to {} targets", message.messageId(), recipients.size());

            return Flux.fromIterable(recipients)
                    .flatMap(recipient -> routeMessage(message.withTarget(recipient))
                            .map(result -> new Delivery(recipient, result)))
                    .collectList()
                    .map(deliveries -> {
                        List<String> failed = new ArrayList<>();
                        List<RoutingResult> results = new ArrayList<>();
                        long totalLatency = 0;
                        int delivered = 0;
                        for (Delivery delivery : deliveries) {
                            results.add(delivery.result());
                            totalLatency += delivery.result().getLatency();
                            if (delivery.result().isSuccess()) {
                                delivered++;
                            } else {
                                failed.add(delivery.recipient());
                            }
                        }
                        failed.sort(Comparator.comparingInt(recipients::indexOf));
                        return BroadcastResult.builder()
                                .success(delivered > 0)
                                .deliveredCount(delivered)
                                .failedTargets(failed)
                                .averageLatency((double) totalLatency / deliveries.size())
                                .results(results)
                                .build();
                    });
        });
    }

    @Override
    public Mono<Route> calculateOptimalRoute(BaseMessage message) {
        return Mono.fromCallable(() -> {
            String targetId = primaryTarget(message, totalMessages.get());
            return computeRoute(targetId, message.priority(), new ArrayList<>());
        });
    }

    // --------------------------------------------------------------------------------------------
    // Server selection
    // --------------------------------------------------------------------------------------------

    @Override
    public Mono<RoutingTableEntry> selectTargetServer(SelectionCriteria criteria) {
        return Mono.fromCallable(() -> {
            Set<String> required = criteria.getRequiredCapabilities() != null
                    ? criteria.getRequiredCapabilities() : Set.of();
            Set<String> excluded = criteria.getExcludeServers() != null
                    ? criteria.getExcludeServers() : Set.of();

            List<RoutingTableEntry> candidates = routingTable.snapshot().stream()
                    .filter(entry -> !entry.isUnhealthy())
                    .filter(entry -> !excluded.contains(entry.getServerId()))
                    .filter(entry -> entry.getCapabilities().containsAll(required))
                    .filter(entry -> !circuitBreakers.isOpen(entry.getServerId()))
                    .toList();

            if (candidates.isEmpty()) {
                throw new NoAvailableServerException("No available servers match the criteria");
            }

            Comparator<RoutingTableEntry> order;
            if (criteria.isPrioritizeLatency()) {
                order = Comparator.comparingDouble(entry -> entry.getPerformance().getAverageLatency());
            } else if (criteria.isPrioritizeReliability()) {
                order = Comparator.comparingDouble(entry -> -entry.getPerformance().getSuccessRate());
            } else {
                order = Comparator.comparingDouble(RoutingTableEntry::getLoad);
            }
            return candidates.stream().min(order).orElseThrow();
        });
    }

    @Override
    public Mono<LoadBalancingResult> balanceLoad(BaseMessage message) {
        return Mono.fromCallable(() -> chooseByStrategy(message, totalMessages.get()));
    }

    @Override
    public FailoverResult handleServerFailure(String serverId) {
        Optional<RoutingTableEntry> failed = routingTable.get(serverId);
        if (failed.isEmpty()) {
            return FailoverResult.builder()
                    .success(false)
                    .originalTarget(serverId)
                    .reason("No routing entry found for server: " + serverId)
                    .build();
        }

        circuitBreakers.recordFailure(serverId, Duration.ZERO,
                new MessageTransport.TransportException("Server " + serverId + " reported as failed"));

        if (!hermesProperties.getRouting().isFailoverEnabled()) {
            return FailoverResult.builder()
                    .success(false)
                    .originalTarget(serverId)
                    .reason("Failover is disabled")
                    .build();
        }

        List<RoutingTableEntry> candidates = failoverCandidates(failed.get(), MessagePriority.NORMAL, List.of(serverId));
        if (candidates.isEmpty()) {
            log.warn("No failover target available for server {}", serverId);
            return FailoverResult.builder()
                    .success(false)
                    .originalTarget(serverId)
                    .reason("No healthy server shares a capability with " + serverId)
                    .build();
        }

        String failoverTarget = candidates.get(0).getServerId();
        recordFailover(serverId, failoverTarget, "server_failure");
        return FailoverResult.builder()
                .success(true)
                .originalTarget(serverId)
                .failoverTarget(failoverTarget)
                .reason("Capability-compatible healthy server found")
                .build();
    }

    // --------------------------------------------------------------------------------------------
    // Health and routing table
    // --------------------------------------------------------------------------------------------

    @Override
    public Mono<HealthStatus> checkServerHealth(String serverId) {
        return Mono.defer(() -> {
            Optional<RoutingTableEntry> entry = routingTable.get(serverId);
            if (entry.isEmpty()) {
                return Mono.error(new RoutingException("No routing entry found for server: " + serverId, serverId));
            }
            double errorRate = (100.0 - entry.get().getPerformance().getSuccessRate()) / 100.0;
            long threshold = hermesProperties.getRouting().getDegradedResponseTimeMs();
            long startNanos = System.nanoTime();

            return transport.probe(entry.get())
                    .timeout(hermesProperties.getRouting().getDeliveryTimeout())
                    .then(Mono.fromCallable(() -> {
                        long responseTime = elapsed(startNanos).toMillis();
                        return HealthStatus.builder()
                                .status(responseTime < threshold ? HealthState.HEALTHY : HealthState.DEGRADED)
                                .responseTime(responseTime)
                                .errorRate(errorRate)
                                .lastCheck(clock.instant())
                                .build();
                    }))
                    .onErrorResume(error -> Mono.just(HealthStatus.builder()
                            .status(HealthState.UNHEALTHY)
                            .responseTime(elapsed(startNanos).toMillis())
                            .errorRate(errorRate)
                            .error(error.getMessage())
                            .lastCheck(clock.instant())
                            .build()))
                    .doOnNext(health -> applyHealth(serverId, health));
        });
    }

    @Override
    public Mono<Map<String, HealthStatus>> checkAllServers() {
        return Flux.fromIterable(routingTable.serverIds())
                .flatMap(serverId -> checkServerHealth(serverId)
                        .map(health -> Map.entry(serverId, health))
                        .onErrorResume(RoutingException.class, e -> Mono.empty()))
                .collectMap(Map.Entry::getKey, Map.Entry::getValue)
                .doOnNext(results -> circuitBreakers.refreshAll());
    }

    @Override
    public void updateRoutingTable(List<RoutingTableUpdate> updates) {
        for (RoutingTableUpdate update : updates) {
            if (update == null || update.getAction() == null) {
                throw new IllegalArgumentException("Routing table update requires an action");
            }
            if (update.getServerId() == null || update.getServerId().isBlank()) {
                throw new IllegalArgumentException("Routing table update requires a server id");
            }
        }

        for (RoutingTableUpdate update : updates) {
            String serverId = update.getServerId();
            switch (update.getAction()) {
                case ADD -> {
                    routingTable.put(update.toEntry());
                    circuitBreakers.register(serverId);
                    log.info("Added server {} to routing table", serverId);
                }
                case UPDATE -> {
                    if (!routingTable.merge(update)) {
                        log.warn("Ignoring routing table update for unknown server {}", serverId);
                        continue;
                    }
                    log.debug("Updated routing entry for {}", serverId);
                }
                case REMOVE -> {
                    routingTable.remove(serverId);
                    circuitBreakers.remove(serverId);
                    deliveriesByServer.remove(serverId);
                    log.info("Removed server {} from routing table", serverId);
                }
            }
            eventBus.publish(CoordinationEventType.ROUTING_TABLE_UPDATED, SOURCE, serverId,
                    Map.of("action", update.getAction().name()));
        }
    }

    @Override
    public List<RoutingTableEntry> getRoutingTable() {
        return routingTable.snapshot();
    }

    @Override
    public RoutingMetrics getRoutingMetrics() {

        Map<String, Long> loadBalance = new TreeMap<>();
        deliveriesByServer.forEach((serverId, count) -> loadBalance.put(serverId, count.get()));

        Map<String, CircuitState> breakerStates = new LinkedHashMap<>();
        circuitBreakers.snapshots().forEach((serverId, state) -> breakerStates.put(serverId, state.getState()));

        double latency;
        double successRate;
        synchronized (this) {
            latency = routingLatency;
            successRate = rollingSuccessRate;
        }

        return RoutingMetrics.builder()
                .totalMessages(totalMessages.get())
                .successfulMessages(successfulMessages.get())
                .routingLatency(latency)
                .successRate(successRate)
                .failoverCount(failoverCount.get())
                .loadBalance(loadBalance)
                .circuitBreakerStates(breakerStates)
                .build();
    }

    @Override
    public Map<String, CircuitBreakerState> getCircuitBreakerStates() {
        return circuitBreakers.snapshots();
    }

    // --------------------------------------------------------------------------------------------
    // Internal helpers
    // --------------------------------------------------------------------------------------------

    private Target resolveTarget(BaseMessage message, List<String> path, long messageNumber) {
        String primary = primaryTarget(message, messageNumber);
        Route route = computeRoute(primary, message.priority(), path);
        return admit(route.getTargetServer(), message.priority(), path);
    }

    private String primaryTarget(BaseMessage message, long messageNumber) {
        String target = message.target();
        if (target != null && !target.isBlank() && !ANY_TARGET.equals(target)) {
            return target;
        }
        try {
            return chooseByStrategy(message, messageNumber).getSelectedServer();
        } catch (NoAvailableServerException e) {
            throw new RoutingException(e.getMessage(), null);
        }
    }

    /**
     * Resolve a route, moving to the cheapest capability-compatible alternative while the target is unhealthy.
     */
    private Route computeRoute(String targetId, MessagePriority priority, List<String> path) {
        RoutingTableEntry entry = routingTable.get(targetId)
                .orElseThrow(() -> new RoutingException("No routing entry found for server: " + targetId, targetId));
        path.add(targetId);

        if (entry.isUnhealthy()) {
            List<RoutingTableEntry> alternatives = failoverCandidates(entry, priority, path);
            if (alternatives.isEmpty()) {
                throw new RoutingException("Target server " + targetId + " is unhealthy and no alternative found",
                        targetId);
            }
            String alternative = alternatives.get(0).getServerId();
            log.debug("Server {} is unhealthy, routing to alternative {}", targetId, alternative);
            return computeRoute(alternative, priority, path);
        }
        return toRoute(entry, priority, path);
    }

    /**
     * Pass the circuit breaker of the chosen server, or fail over once to a compatible server.
     */
    private Target admit(String serverId, MessagePriority priority, List<String> path) {
        if (circuitBreakers.tryAcquire(serverId)) {
            Optional<RoutingTableEntry> entry = routingTable.get(serverId);
            if (entry.isEmpty()) {
                circuitBreakers.release(serverId);
                throw new RoutingException("No routing entry found for server: " + serverId, serverId);
            }
            return new Target(entry.get(), false);
        }

        if (!hermesProperties.getRouting().isFailoverEnabled()) {
            throw new RoutingException("Circuit breaker open for " + serverId + " and failover is disabled", serverId);
        }

        RoutingTableEntry failed = requireEntry(serverId);
        for (RoutingTableEntry candidate : failoverCandidates(failed, priority, path)) {
            if (circuitBreakers.tryAcquire(candidate.getServerId())) {
                path.add(candidate.getServerId());
                recordFailover(serverId, candidate.getServerId(), "circuit_open");
                return new Target(candidate, true);
            }
        }
        throw new RoutingException("Circuit breaker open for " + serverId + " and no failover available", serverId);
    }

    private RoutingTableEntry requireEntry(String serverId) {
        return routingTable.get(serverId)
                .orElseThrow(() -> new RoutingException("No routing entry found for server: " + serverId, serverId));
    }

    /**
     * Healthy servers sharing a capability with {@code failed} whose breaker is not open, cheapest first.
     */
    private List<RoutingTableEntry> failoverCandidates(RoutingTableEntry failed, MessagePriority priority,
                                                      Collection<String> excluded) {
        return routingTable.snapshot().stream()
                .filter(entry -> !entry.getServerId().equals(failed.getServerId()))
                .filter(entry -> !excluded.contains(entry.getServerId()))
                .filter(entry -> entry.healthState() == HealthState.HEALTHY)
                .filter(entry -> entry.sharesCapabilityWith(failed))
                .filter(entry -> !circuitBreakers.isOpen(entry.getServerId()))
                .sorted(Comparator.comparingDouble(entry -> cost(entry, priority)))
                .toList();
    }

    private LoadBalancingResult chooseByStrategy(BaseMessage message, long messageCount) {
        String capability = message.routingHint(CAPABILITY_HINT);
        List<RoutingTableEntry> candidates = routingTable.snapshot().stream()
                .filter(entry -> !entry.isUnhealthy())
                .filter(entry -> capability == null || entry.getCapabilities().contains(capability))
                .filter(entry -> !circuitBreakers.isOpen(entry.getServerId()))
                .toList();

        RoutingStrategy strategy = hermesProperties.getRouting().getStrategy();
        LoadBalancingStrategy balancer = strategies.get(strategy);
        if (balancer == null) {
            throw new IllegalStateException("No load-balancing strategy registered for " + strategy);
        }

        RoutingTableEntry selected = balancer.select(candidates, messageCount)
                .orElseThrow(() -> new NoAvailableServerException("No available servers for load balancing"));

        Map<String, Double> distribution = new LinkedHashMap<>();
        candidates.forEach(entry -> distribution.put(entry.getServerId(), entry.getLoad()));

        return LoadBalancingResult.builder()
                .selectedServer(selected.getServerId())
                .loadDistribution(distribution)
                .strategy(strategy)
                .build();
    }

    private Mono<RoutingResult> deliver(BaseMessage message, Target target, List<String> path, long startNanos) {
        String serverId = target.entry().getServerId();
        long deliveryStart = System.nanoTime();
        Duration timeout = hermesProperties.getRouting().getDeliveryTimeout();

        return transport.deliver(message, target.entry())
                .timeout(timeout)
                .switchIfEmpty(Mono.fromCallable(() -> DeliveryReceipt.builder()
                        .serverId(serverId)
                        .messageId(message.messageId())
                        .deliveredAt(clock.instant())
                        .build()))
                .map(receipt -> {
                    recordOutcome(serverId, elapsed(deliveryStart), true, null);
                    log.debug("Delivered message {} to {} via {}", message.messageId(), serverId, path);
                    return RoutingResult.builder()
                            .success(true)
                            .messageId(message.messageId())
                            .targetServer(serverId)
                            .routingPath(List.copyOf(path))
                            .latency(elapsed(startNanos).toMillis())
                            .failedOver(target.failedOver())
                            .response(receipt.getResponse())
                            .build();
                })
                .onErrorResume(error -> {
                    recordOutcome(serverId, elapsed(deliveryStart), false, error);
                    String reason = error instanceof TimeoutException
                            ? "Delivery to " + serverId + " timed out after " + timeout.toMillis() + "ms"
                            : "Delivery to " + serverId + " failed: " + error.getMessage();
                    log.warn("Message {}: {}", message.messageId(), reason);
                    return Mono.just(RoutingResult.builder()
                            .success(false)
                            .messageId(message.messageId())
                            .targetServer(serverId)
                            .routingPath(List.copyOf(path))
                            .latency(elapsed(startNanos).toMillis())
                            .failedOver(target.failedOver())
                            .error(reason)
                            .build());
                });
    }

    private void recordOutcome(String serverId, Duration latency, boolean success, Throwable error) {
        routingTable.recordDelivery(serverId, latency.toMillis(), success, hermesProperties.getRouting().getEmaAlpha());
        if (success) {
            circuitBreakers.recordSuccess(serverId, latency);
            deliveriesByServer.computeIfAbsent(serverId, id -> new AtomicLong()).incrementAndGet();
        } else {
            circuitBreakers.recordFailure(serverId, latency, error);
        }
        metrics.recordDelivery(serverId, latency, success);
        recordAggregate(success, latency.toMillis());
    }

    private void recordAggregate(boolean success, long latencyMs) {
        long finished = finishedMessages.incrementAndGet();
        if (success) {
            successfulMessages.incrementAndGet();
        }
        double alpha = hermesProperties.getRouting().getEmaAlpha();
        double outcome = success ? 100.0 : 0.0;
        synchronized (this) {
            routingLatency = finished == 1 ? latencyMs : (routingLatency + latencyMs) / 2.0;
            rollingSuccessRate = finished == 1 ? outcome : alpha * outcome + (1 - alpha) * rollingSuccessRate;
        }
    }

    private void recordFailover(String failedServer, String failoverTarget, String reason) {
        failoverCount.incrementAndGet();
        metrics.recordFailover();
        log.warn("Failing over from {} to {} ({})", failedServer, failoverTarget, reason);
        eventBus.publish(CoordinationEventType.FAILOVER, SOURCE, failedServer,
                Map.of("failoverTarget", failoverTarget, "reason", reason));
    }

    private void applyHealth(String serverId, HealthStatus health) {
        HealthState previous = routingTable.applyHealth(serverId, health);
        circuitBreakers.state(serverId);
        if (previous != null && previous != health.getStatus()) {
            log.info("Server {} health changed {} -> {} ({}ms)", serverId, previous, health.getStatus(),
                    health.getResponseTime());
            eventBus.publish(CoordinationEventType.SERVER_HEALTH_CHANGED, SOURCE, serverId,
                    Map.of("from", previous.name(), "to", health.getStatus().name()));
        }
    }

    private Route toRoute(RoutingTableEntry entry, MessagePriority priority, List<String> path) {
        double averageLatency = entry.getPerformance().getAverageLatency();
        return Route.builder()
                .targetServer(entry.getServerId())
                .path(List.copyOf(path))
                .estimatedLatency(averageLatency * priority.latencyFactor() * (1 + entry.getLoad() / 100.0))
                .reliability(reliability(entry))
                .cost(cost(entry, priority))
                .build();
    }

    static double reliability(RoutingTableEntry entry) {
        double reliability = entry.getPerformance().getSuccessRate() / 100.0;
        return switch (entry.healthState()) {
            case DEGRADED -> reliability * 0.8;
            case UNHEALTHY -> 0.0;
            default -> reliability;
        };
    }

    static double cost(RoutingTableEntry entry, MessagePriority priority) {
        return entry.getPerformance().getAverageLatency() + entry.getLoad() * 10 + priority.costPenalty();
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private record Target(RoutingTableEntry entry, boolean failedOver) {
    }

    private record Delivery(String recipient, RoutingResult result) {
    }
}
