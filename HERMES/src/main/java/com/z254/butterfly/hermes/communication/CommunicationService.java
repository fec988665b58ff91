package com.z254.butterfly.hermes.communication;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.butterfly.hermes.config.HermesProperties;
import com.z254.butterfly.hermes.delegation.SubAgentCoordinator;
import com.z254.butterfly.hermes.domain.model.*;
import com.z254.butterfly.hermes.events.CoordinationEventBus;
import com.z254.butterfly.hermes.routing.MessageRouter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point for inter-server communication.
 * Classifies each message by type and hands it to the router, the sub-agent coordinator or an
 * enabled external coordinator, recording latency and errors for every dispatch.
 */
@Service
@Slf4j
public class CommunicationService implements SmartLifecycle {

    public static final String DELEGATE_TASKS = "delegate_tasks";
    public static final String ASSIGN_TASK = "assign_task";
    public static final String REGISTER_AGENT = "register_agent";
    public static final String AGENT_HEARTBEAT = "agent_heartbeat";
    public static final String REPORT_TASK_RESULT = "report_task_result";

    static final double ROUTER_HEALTHY_SUCCESS_RATE = 95.0;
    static final double TELEMETRY_HEALTHY_ERROR_RATE = 0.05;

    private final MessageRouter router;
    private final SubAgentCoordinator coordinator;
    private final List<ExternalCoordinator> externalCoordinators;
    private final MessageValidator messageValidator;
    private final CommunicationTelemetry telemetry;
    private final CoordinationEventBus eventBus;
    private final HermesProperties hermesProperties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private volatile boolean running;

    public CommunicationService(
            MessageRouter router,
            SubAgentCoordinator coordinator,
            List<ExternalCoordinator> externalCoordinators,
            MessageValidator messageValidator,
            CommunicationTelemetry telemetry,
            CoordinationEventBus eventBus,
            HermesProperties hermesProperties,
            ObjectMapper objectMapper,
            Clock clock) {
        this.router = router;
        this.coordinator = coordinator;
        this.externalCoordinators = externalCoordinators;
        this.messageValidator = messageValidator;
        this.telemetry = telemetry;
        this.eventBus = eventBus;
        this.hermesProperties = hermesProperties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    // --------------------------------------------------------------------------------------------
    // Lifecycle
    // --------------------------------------------------------------------------------------------

    @Override
    public void start() {
        if (running) {
            throw new IllegalStateException("Communication service is already running");
        }
        validateConfiguration(hermesProperties);
        running = true;
        log.info("Communication service started (sub-agent delegation: {}, external coordinators: {})",
                hermesProperties.getOrchestration().isSubAgentDelegationEnabled(), externalCoordinators.size());
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        running = false;
        log.info("Communication service stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    // --------------------------------------------------------------------------------------------
    // Messaging
    // --------------------------------------------------------------------------------------------

    /**
     * Validate and dispatch a message by its type.
     *
     * @return The dispatch result; errors when the service is stopped, the message is malformed,
     * the addressed feature is disabled or the handling component fails
     */
    public Mono<DispatchResult> sendMessage(BaseMessage message) {
        return Mono.defer(() -> {
            requireRunning();
            messageValidator.validate(message);

            MessageHeader header = message.getHeader();
            long startNanos = System.nanoTime();
            log.debug("Dispatching {} message {} ({})", header.getMessageType(), header.getMessageId(), header.getOperation());

            return Mono.defer(() -> dispatch(message))
                    .map(handled -> {
                        Duration latency = Duration.ofNanos(System.nanoTime() - startNanos);
                        boolean success = isSuccess(handled.body());
                        telemetry.recordDispatch(header.getMessageType(), latency, success);
                        return DispatchResult.builder()
                                .messageId(header.getMessageId())
                                .messageType(header.getMessageType())
                                .operation(header.getOperation())
                                .handler(handled.handler())
                                .success(success)
                                .latency(latency.toMillis())
                                .body(handled.body())
                                .build();
                    })
                    .doOnError(error -> telemetry.recordError(header.getMessageType(),
                            Duration.ofNanos(System.nanoTime() - startNanos), error));
        });
    }

    public Mono<BroadcastResult> broadcastMessage(BaseMessage message, List<String> targets) {
        return Mono.defer(() -> {
            requireRunning();
            messageValidator.validate(message);
            return router.broadcastMessage(message, targets);
        });
    }

    public Mono<DelegationResult> delegateTasks(DelegationRequest request) {
        return Mono.defer(() -> {
            requireRunning();
            requireDelegationEnabled();
            return coordinator.delegateTasks(request);
        });
    }

    public SubAgent registerAgent(SubAgent agent) {
        requireRunning();
        requireDelegationEnabled();
        return coordinator.registerAgent(agent);
    }

    public void agentHeartbeat(String agentId) {
        requireRunning();
        coordinator.agentHeartbeat(agentId);
    }

    // --------------------------------------------------------------------------------------------
    // Health, metrics and configuration
    // --------------------------------------------------------------------------------------------

    /**
     * Health of each component; the overall state is the worst of them.
     */
    public SystemHealth getSystemHealth() {
        List<ComponentHealth> components = new ArrayList<>();
        components.add(ComponentHealth.builder()
                .name("communication_service")
                .status(running ? HealthState.HEALTHY : HealthState.UNHEALTHY)
                .details(Map.of("running", running))
                .build());
        components.add(routerHealth());
        components.add(coordinatorHealth());
        components.add(telemetryHealth());

        HealthState overall = HealthState.HEALTHY;
        for (ComponentHealth component : components) {
            overall = overall.worst(component.getStatus());
        }
        return SystemHealth.builder()
                .overall(overall)
                .components(components)
                .timestamp(clock.instant())
                .build();
    }

    public Map<String, Object> getMetrics() {
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("routing", router.getRoutingMetrics());
        metrics.put("coordination", coordinator.getCoordinationMetrics());
        metrics.put("telemetry", telemetry.report());
        metrics.put("events", eventBus.getStats());
        return metrics;
    }

    /**
     * Validate a complete configuration and make it the active one.
     * Components read the configuration on each use; breaker thresholds apply to breakers created afterwards.
     *
     * @throws InvalidConfigurationException when the candidate is invalid; nothing is applied then
     */
    public void updateConfiguration(HermesProperties candidate) {
        validateConfiguration(candidate);
        hermesProperties.setRouting(candidate.getRouting());
        hermesProperties.setPerformance(candidate.getPerformance());
        hermesProperties.setDelegation(candidate.getDelegation());
        hermesProperties.setOrchestration(candidate.getOrchestration());
        hermesProperties.setTransport(candidate.getTransport());
        log.info("Communication configuration updated");
    }

    /**
     * @throws InvalidConfigurationException naming the first invalid setting
     */
    public static void validateConfiguration(HermesProperties properties) {
        HermesProperties.PerformanceProperties performance = properties.getPerformance();
        HermesProperties.RoutingProperties routing = properties.getRouting();
        HermesProperties.DelegationProperties delegation = properties.getDelegation();

        if (performance.getMaxLatency() <= 0) {
            throw new InvalidConfigurationException("Invalid max latency configuration");
        }
        if (performance.getThroughputTarget() <= 0) {
            throw new InvalidConfigurationException("Invalid throughput target configuration");
        }
        if (performance.getDeliveryReliability() < 0 || performance.getDeliveryReliability() > 100) {
            throw new InvalidConfigurationException("Invalid delivery reliability configuration");
        }
        if (delegation.getMaxConcurrentSubAgents() <= 0) {
            throw new InvalidConfigurationException("Invalid max concurrent sub-agents configuration");
        }
        if (delegation.getMaxConcurrentTasks() <= 0) {
            throw new InvalidConfigurationException("Invalid max concurrent tasks configuration");
        }
        if (routing.getCircuitBreakerThreshold() <= 0) {
            throw new InvalidConfigurationException("Invalid circuit breaker threshold configuration");
        }
        requirePositive(routing.getHealthCheckInterval(), "health check interval");
        requirePositive(routing.getCircuitBreakerCoolDown(), "circuit breaker cool-down");
        requirePositive(routing.getDeliveryTimeout(), "delivery timeout");
        requirePositive(delegation.getHeartbeatInterval(), "heartbeat interval");
        requirePositive(delegation.getTaskTimeout(), "task timeout");
        requirePositive(delegation.getProgressPollInterval(), "progress poll interval");
    }

    // --------------------------------------------------------------------------------------------
    // Dispatch
    // --------------------------------------------------------------------------------------------

    private Mono<Handled> dispatch(BaseMessage message) {
        HermesProperties.OrchestrationProperties orchestration = hermesProperties.getOrchestration();
        return switch (message.getHeader().getMessageType()) {
            case SUB_AGENT_DELEGATION -> orchestration.isSubAgentDelegationEnabled()
                    ? handleSubAgentMessage(message)
                    : Mono.error(new FeatureDisabledException("Sub-agent coordination is not enabled"));
            case WAVE_COORDINATION -> orchestration.isWaveCoordinationEnabled()
                    ? handleExternal(message)
                    : Mono.error(new FeatureDisabledException("Wave coordination is not enabled"));
            case PERSONA_CHAIN -> orchestration.isPersonaChainsEnabled()
                    ? handleExternal(message)
                    : Mono.error(new FeatureDisabledException("Persona chain coordination is not enabled"));
            case QUALITY_GATE -> orchestration.isQualityGatesEnabled()
                    ? handleExternal(message)
                    : Mono.error(new FeatureDisabledException("Quality gates are not enabled"));
            default -> route(message);
        };
    }

    private Mono<Handled> handleSubAgentMessage(BaseMessage message) {
        String operation = message.getHeader().getOperation();
        DispatchResult.Handler handler = DispatchResult.Handler.SUB_AGENT_COORDINATOR;

        return switch (operation) {
            case DELEGATE_TASKS -> coordinator.delegateTasks(payload(message, DelegationRequest.class))
                    .map(result -> new Handled(handler, result));
            case ASSIGN_TASK -> coordinator.assignTask(payload(message, SubAgentTask.class))
                    .map(execution -> new Handled(handler, execution));
            case REGISTER_AGENT -> Mono.fromCallable(() -> coordinator.registerAgent(payload(message, SubAgent.class)))
                    .map(agent -> new Handled(handler, agent));
            case AGENT_HEARTBEAT -> Mono.fromCallable(() -> {
                Object agentId = message.data().get("agentId");
                if (agentId == null) {
                    throw new MessageValidator.InvalidMessageException("Heartbeat is missing agentId");
                }
                coordinator.agentHeartbeat(agentId.toString());
                return new Handled(handler, Map.of("agentId", agentId.toString(), "acknowledged", true));
            });
            case REPORT_TASK_RESULT -> Mono.fromCallable(() -> {
                TaskResultReport report = payload(message, TaskResultReport.class);
                if (report.getTaskId() == null) {
                    throw new MessageValidator.InvalidMessageException("Task result is missing taskId");
                }
                boolean accepted = coordinator.completeTask(report.getAgentId(), report.getTaskId(), report.toOutcome());
                return new Handled(handler, Map.of("taskId", report.getTaskId(), "accepted", accepted));
            });
            default -> route(message);
        };
    }

    private Mono<Handled> handleExternal(BaseMessage message) {
        MessageType type = message.getHeader().getMessageType();
        return externalCoordinators.stream()
                .filter(candidate -> candidate.supports(type))
                .findFirst()
                .map(candidate -> candidate.handle(message)
                        .map(body -> new Handled(DispatchResult.Handler.EXTERNAL_COORDINATOR, body)))
                .orElseGet(() -> Mono.error(new FeatureDisabledException("No coordinator registered for " + type)));
    }

    private Mono<Handled> route(BaseMessage message) {
        return router.routeMessage(message)
                .map(result -> new Handled(DispatchResult.Handler.ROUTER, result));
    }

    private <T> T payload(BaseMessage message, Class<T> type) {
        try {
            return objectMapper.convertValue(message.data(), type);
        } catch (IllegalArgumentException e) {
            throw new MessageValidator.InvalidMessageException(
                    "Invalid payload for operation " + message.getHeader().getOperation() + ": " + e.getMessage(), e);
        }
    }

    private static boolean isSuccess(Object body) {
        if (body instanceof RoutingResult) {
            return ((RoutingResult) body).isSuccess();
        }
        if (body instanceof DelegationResult) {
            return ((DelegationResult) body).isSuccess();
        }
        if (body instanceof TaskExecution) {
            return !((TaskExecution) body).getStatus().isUnsuccessful();
        }
        return true;
    }

    // --------------------------------------------------------------------------------------------
    // Internal helpers
    // --------------------------------------------------------------------------------------------

    private ComponentHealth routerHealth() {
        try {
            RoutingMetrics metrics = router.getRoutingMetrics();
            long openCircuits = metrics.getCircuitBreakerStates().values().stream()
                    .filter(state -> state == CircuitState.OPEN)
                    .count();
            boolean healthy = metrics.getSuccessRate() > ROUTER_HEALTHY_SUCCESS_RATE && openCircuits == 0;
            return ComponentHealth.builder()
                    .name("message_router")
                    .status(healthy ? HealthState.HEALTHY : HealthState.DEGRADED)
                    .details(Map.of(
                            "successRate", metrics.getSuccessRate(),
                            "totalMessages", metrics.getTotalMessages(),
                            "openCircuits", openCircuits))
                    .build();
        } catch (RuntimeException e) {
            return unhealthy("message_router", e);
        }
    }

    private ComponentHealth coordinatorHealth() {
        try {
            List<AgentHealthStatus> agents = coordinator.getAgentHealth(null);
            List<String> unhealthyAgents = agents.stream()
                    .filter(agent -> !agent.isHealthy())
                    .map(AgentHealthStatus::getAgentId)
                    .toList();
            CoordinationMetrics metrics = coordinator.getCoordinationMetrics();
            return ComponentHealth.builder()
                    .name("sub_agent_coordinator")
                    .status(unhealthyAgents.isEmpty() ? HealthState.HEALTHY : HealthState.DEGRADED)
                    .details(Map.of(
                            "registeredAgents", metrics.getRegisteredAgents(),
                            "unhealthyAgents", unhealthyAgents,
                            "systemLoad", metrics.getSystemLoad(),
                            "activeDelegations", metrics.getActiveDelegations()))
                    .build();
        } catch (RuntimeException e) {
            return unhealthy("sub_agent_coordinator", e);
        }
    }

    private ComponentHealth telemetryHealth() {
        CommunicationTelemetry.TelemetryReport report = telemetry.report();
        return ComponentHealth.builder()
                .name("communication_telemetry")
                .status(report.getErrorRate() > TELEMETRY_HEALTHY_ERROR_RATE ? HealthState.DEGRADED : HealthState.HEALTHY)
                .details(Map.of(
                        "errorRate", report.getErrorRate(),
                        "p95Latency", report.getP95Latency(),
                        "totalDispatches", report.getTotalDispatches()))
                .build();
    }

    private ComponentHealth unhealthy(String name, RuntimeException e) {
        log.error("Health check of {} failed", name, e);
        return ComponentHealth.builder()
                .name(name)
                .status(HealthState.UNHEALTHY)
                .details(Map.of("error", String.valueOf(e.getMessage())))
                .build();
    }

    private void requireRunning() {
        if (!running) {
            throw new IllegalStateException("Communication service is not running");
        }
    }

    private void requireDelegationEnabled() {
        if (!hermesProperties.getOrchestration().isSubAgentDelegationEnabled()) {
            throw new FeatureDisabledException("Sub-agent coordination is not enabled");
        }
    }

    private static void requirePositive(Duration duration, String name) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            throw new InvalidConfigurationException("Invalid " + name + " configuration");
        }
    }

    private record Handled(DispatchResult.Handler handler, Object body) {
    }

    // --------------------------------------------------------------------------------------------
    // Exceptions
    // --------------------------------------------------------------------------------------------

    public static class InvalidConfigurationException extends RuntimeException {
        public InvalidConfigurationException(String message) {
            super(message);
        }
    }

    /**
     * Raised for messages addressed to an orchestration feature that is switched off.
     */
    public static class FeatureDisabledException extends RuntimeException {
        public FeatureDisabledException(String message) {
            super(message);
        }
    }
}
