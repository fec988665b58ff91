package com.z254.butterfly.hermes.communication;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.z254.butterfly.hermes.config.HermesProperties;
import com.z254.butterfly.hermes.delegation.SubAgentCoordinator;
import com.z254.butterfly.hermes.domain.model.*;
import com.z254.butterfly.hermes.events.CoordinationEventBus;
import com.z254.butterfly.hermes.observability.HermesMetrics;
import com.z254.butterfly.hermes.routing.MessageRouter;
import com.z254.butterfly.hermes.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for CommunicationService.
 */
@ExtendWith(MockitoExtension.class)
class CommunicationServiceTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    @Mock
    private MessageRouter router;

    @Mock
    private SubAgentCoordinator coordinator;

    private HermesProperties properties;
    private CommunicationTelemetry telemetry;
    private CoordinationEventBus eventBus;
    private MutableClock clock;
    private ObjectMapper objectMapper;
    private CommunicationService service;

    @BeforeEach
    void setUp() {
        properties = new HermesProperties();
        clock = new MutableClock();
        eventBus = new CoordinationEventBus();
        telemetry = new CommunicationTelemetry(properties, new HermesMetrics(new SimpleMeterRegistry()), eventBus, clock);
        objectMapper = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
        service = serviceWith(List.of());
        service.start();
    }

    // --------------------------------------------------------------------------------------------
    // Lifecycle and validation
    // --------------------------------------------------------------------------------------------

    @Test
    void shouldRejectMessagesWhileStopped() {
        // Given
        service.stop();

        // Then
        assertThat(service.isRunning()).isFalse();
        StepVerifier.create(service.sendMessage(message("s1", "process", MessageType.COMMAND, Map.of())))
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(IllegalStateException.class)
                        .hasMessage("Communication service is not running"))
                .verify();
        verifyNoInteractions(router);
    }

    @Test
    void shouldRefuseSecondStart() {
        assertThatThrownBy(() -> service.start())
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Communication service is already running");
    }

    @Test
    void shouldRejectMalformedMessageBeforeDispatch() {
        // Given
        BaseMessage message = message("s1", " ", MessageType.COMMAND, Map.of());

        // Then
        StepVerifier.create(service.sendMessage(message))
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(MessageValidator.InvalidMessageException.class)
                        .hasMessage("Message is missing operation"))
                .verify();
        verifyNoInteractions(router);
    }

    // --------------------------------------------------------------------------------------------
    // Routing
    // --------------------------------------------------------------------------------------------

    @Test
    void shouldRoutePlainMessagesThroughRouter() {
        // Given
        BaseMessage message = message("s1", "process", MessageType.COMMAND, Map.of("value", 1));
        when(router.routeMessage(message)).thenReturn(Mono.just(routed(message, true)));

        // When
        DispatchResult result = service.sendMessage(message).block(TIMEOUT);

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getHandler()).isEqualTo(DispatchResult.Handler.ROUTER);
        assertThat(result.getMessageId()).isEqualTo(message.messageId());
        assertThat(result.getBody()).isInstanceOf(RoutingResult.class);
        assertThat(telemetry.report().getTotalDispatches()).isEqualTo(1);
        assertThat(telemetry.report().getErrors()).isZero();
    }

    @Test
    void shouldCountFailedRoutingAsDispatchError() {
        // Given
        BaseMessage message = message("s1", "process", MessageType.EVENT, Map.of());
        when(router.routeMessage(message)).thenReturn(Mono.just(routed(message, false)));

        // When
        DispatchResult result = service.sendMessage(message).block(TIMEOUT);

        // Then
        assertThat(result.isSuccess()).isFalse();
        assertThat(telemetry.errorRate()).isEqualTo(1.0);
    }

    @Test
    void shouldBroadcastThroughRouter() {
        // Given
        BaseMessage message = message("*", "notify", MessageType.BROADCAST, Map.of());
        BroadcastResult broadcast = BroadcastResult.builder()
                .success(true)
                .deliveredCount(2)
                .failedTargets(List.of())
                .results(List.of())
                .build();
        when(router.broadcastMessage(eq(message), anyList())).thenReturn(Mono.just(broadcast));

        // When
        BroadcastResult result = service.broadcastMessage(message, List.of("s1", "s2")).block(TIMEOUT);

        // Then
        assertThat(result.getDeliveredCount()).isEqualTo(2);
    }

    // --------------------------------------------------------------------------------------------
    // Sub-agent messages
    // --------------------------------------------------------------------------------------------

    @Test
    void shouldRegisterAgentFromMessagePayload() {
        // Given
        when(coordinator.registerAgent(any())).thenAnswer(invocation -> invocation.getArgument(0));
        BaseMessage message = message("hermes", CommunicationService.REGISTER_AGENT, MessageType.SUB_AGENT_DELEGATION,
                Map.of("agentId", "a1", "serverId", "s1", "capabilities", List.of("analyze"), "maxConcurrentTasks", 2));

        // When
        DispatchResult result = service.sendMessage(message).block(TIMEOUT);

        // Then
        assertThat(result.getHandler()).isEqualTo(DispatchResult.Handler.SUB_AGENT_COORDINATOR);
        ArgumentCaptor<SubAgent> captor = ArgumentCaptor.forClass(SubAgent.class);
        verify(coordinator).registerAgent(captor.capture());
        assertThat(captor.getValue().getAgentId()).isEqualTo("a1");
        assertThat(captor.getValue().getCapabilities()).containsExactly("analyze");
        assertThat(captor.getValue().getMaxConcurrentTasks()).isEqualTo(2);
        verifyNoInteractions(router);
    }

    @Test
    void shouldDelegateTasksFromMessagePayload() {
        // Given
        when(coordinator.delegateTasks(any())).thenReturn(Mono.just(DelegationResult.builder()
                .delegationId("d1")
                .success(true)
                .build()));
        BaseMessage message = message("hermes", CommunicationService.DELEGATE_TASKS, MessageType.SUB_AGENT_DELEGATION,
                Map.of("delegationId", "d1",
                        "strategy", "sequential",
                        "tasks", List.of(Map.of("taskId", "t1", "operation", "analyze"))));

        // When
        DispatchResult result = service.sendMessage(message).block(TIMEOUT);

        // Then
        assertThat(result.isSuccess()).isTrue();
        ArgumentCaptor<DelegationRequest> captor = ArgumentCaptor.forClass(DelegationRequest.class);
        verify(coordinator).delegateTasks(captor.capture());
        DelegationRequest request = captor.getValue();
        assertThat(request.getStrategy()).isEqualTo(DelegationStrategyType.SEQUENTIAL);
        assertThat(request.getTasks()).extracting(SubAgentTask::getOperation).containsExactly("analyze");
    }

    @Test
    void shouldMarkUnsuccessfulTaskAssignmentAsFailedDispatch() {
        // Given
        when(coordinator.assignTask(any())).thenReturn(Mono.just(TaskExecution.builder()
                .taskId("t1")
                .agentId("")
                .status(TaskStatus.FAILED)
                .error("No suitable agent found for task t1 (operation: analyze)")
                .build()));
        BaseMessage message = message("hermes", CommunicationService.ASSIGN_TASK, MessageType.SUB_AGENT_DELEGATION,
                Map.of("taskId", "t1", "operation", "analyze"));

        // When
        DispatchResult result = service.sendMessage(message).block(TIMEOUT);

        // Then
        assertThat(result.isSuccess()).isFalse();
        assertThat(telemetry.report().getErrors()).isEqualTo(1);
    }

    @Test
    void shouldAcknowledgeHeartbeat() {
        // Given
        BaseMessage message = message("hermes", CommunicationService.AGENT_HEARTBEAT, MessageType.SUB_AGENT_DELEGATION,
                Map.of("agentId", "a1"));

        // When
        DispatchResult result = service.sendMessage(message).block(TIMEOUT);

        // Then
        verify(coordinator).agentHeartbeat("a1");
        assertThat(result.getBody()).isEqualTo(Map.of("agentId", "a1", "acknowledged", true));
    }

    @Test
    void shouldRejectHeartbeatWithoutAgentAndRecordError() {
        // Given
        BaseMessage message = message("hermes", CommunicationService.AGENT_HEARTBEAT, MessageType.SUB_AGENT_DELEGATION,
                Map.of());

        // Then
        StepVerifier.create(service.sendMessage(message))
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(MessageValidator.InvalidMessageException.class)
                        .hasMessage("Heartbeat is missing agentId"))
                .verify();
        assertThat(telemetry.report().getErrors()).isEqualTo(1);
        verifyNoInteractions(coordinator);
    }

    @Test
    void shouldPassReportedTaskResultToCoordinator() {
        // Given
        when(coordinator.completeTask(eq("a1"), eq("t1"), any())).thenReturn(true);
        BaseMessage message = message("agent-server", CommunicationService.REPORT_TASK_RESULT,
                MessageType.SUB_AGENT_DELEGATION,
                Map.of("agentId", "a1", "taskId", "t1", "success", true, "result", Map.of("answer", 42)));

        // When
        DispatchResult result = service.sendMessage(message).block(TIMEOUT);

        // Then
        assertThat(result.getBody()).isEqualTo(Map.of("taskId", "t1", "accepted", true));
        ArgumentCaptor<TaskOutcome> captor = ArgumentCaptor.forClass(TaskOutcome.class);
        verify(coordinator).completeTask(eq("a1"), eq("t1"), captor.capture());
        assertThat(captor.getValue().isSuccess()).isTrue();
        assertThat(captor.getValue().getResult()).containsEntry("answer", 42);
    }

    @Test
    void shouldRouteUnknownSubAgentOperations() {
        // Given
        BaseMessage message = message("s1", "custom_operation", MessageType.SUB_AGENT_DELEGATION, Map.of());
        when(router.routeMessage(message)).thenReturn(Mono.just(routed(message, true)));

        // When
        DispatchResult result = service.sendMessage(message).block(TIMEOUT);

        // Then
        assertThat(result.getHandler()).isEqualTo(DispatchResult.Handler.ROUTER);
        verifyNoInteractions(coordinator);
    }

    // --------------------------------------------------------------------------------------------
    // Orchestration features
    // --------------------------------------------------------------------------------------------

    @Test
    void shouldRejectSubAgentMessagesWhenDelegationIsDisabled() {
        // Given
        properties.getOrchestration().setSubAgentDelegationEnabled(false);
        BaseMessage message = message("hermes", CommunicationService.AGENT_HEARTBEAT, MessageType.SUB_AGENT_DELEGATION,
                Map.of("agentId", "a1"));

        // Then
        StepVerifier.create(service.sendMessage(message))
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(CommunicationService.FeatureDisabledException.class)
                        .hasMessage("Sub-agent coordination is not enabled"))
                .verify();
        assertThatThrownBy(() -> service.registerAgent(SubAgent.builder().agentId("a1").build()))
                .isInstanceOf(CommunicationService.FeatureDisabledException.class);
        verifyNoInteractions(coordinator);
    }

    @Test
    void shouldRejectDisabledOrchestrationFeatures() {
        expectDisabled(MessageType.WAVE_COORDINATION, "Wave coordination is not enabled");
        expectDisabled(MessageType.PERSONA_CHAIN, "Persona chain coordination is not enabled");
        expectDisabled(MessageType.QUALITY_GATE, "Quality gates are not enabled");
    }

    @Test
    void shouldRequireCoordinatorForEnabledFeature() {
        // Given
        properties.getOrchestration().setWaveCoordinationEnabled(true);

        // Then
        expectDisabled(MessageType.WAVE_COORDINATION, "No coordinator registered for WAVE_COORDINATION");
    }

    @Test
    void shouldHandOffToExternalCoordinator() {
        // Given
        properties.getOrchestration().setQualityGatesEnabled(true);
        ExternalCoordinator qualityGates = new ExternalCoordinator() {
            @Override
            public String name() {
                return "quality-gates";
            }

            @Override
            public boolean supports(MessageType messageType) {
                return messageType == MessageType.QUALITY_GATE;
            }

            @Override
            public Mono<Object> handle(BaseMessage message) {
                return Mono.just(Map.of("gate", "passed"));
            }
        };
        CommunicationService withGates = serviceWith(List.of(qualityGates));
        withGates.start();

        // When
        DispatchResult result = withGates.sendMessage(
                message("hermes", "evaluate", MessageType.QUALITY_GATE, Map.of())).block(TIMEOUT);

        // Then
        assertThat(result.getHandler()).isEqualTo(DispatchResult.Handler.EXTERNAL_COORDINATOR);
        assertThat(result.getBody()).isEqualTo(Map.of("gate", "passed"));
        verifyNoInteractions(router);
    }

    // --------------------------------------------------------------------------------------------
    // Health, metrics and configuration
    // --------------------------------------------------------------------------------------------

    @Test
    void shouldReportHealthyWhenAllComponentsAreHealthy() {
        // Given
        when(router.getRoutingMetrics()).thenReturn(routingMetrics(99.0, Map.of("s1", CircuitState.CLOSED)));
        stubHealthyCoordinator();

        // When
        SystemHealth health = service.getSystemHealth();

        // Then
        assertThat(health.getOverall()).isEqualTo(HealthState.HEALTHY);
        assertThat(health.getComponents()).extracting(ComponentHealth::getName)
                .containsExactly("communication_service", "message_router", "sub_agent_coordinator",
                        "communication_telemetry");
        assertThat(health.getTimestamp()).isEqualTo(clock.instant());
    }

    @Test
    void shouldDegradeWhenCircuitIsOpen() {
        // Given
        when(router.getRoutingMetrics()).thenReturn(routingMetrics(99.0, Map.of("s1", CircuitState.OPEN)));
        stubHealthyCoordinator();

        // When
        SystemHealth health = service.getSystemHealth();

        // Then
        assertThat(health.getOverall()).isEqualTo(HealthState.DEGRADED);
        assertThat(component(health, "message_router").getDetails()).containsEntry("openCircuits", 1L);
    }

    @Test
    void shouldDegradeWhenAgentsReportIssues() {
        // Given
        when(router.getRoutingMetrics()).thenReturn(routingMetrics(100.0, Map.of()));
        when(coordinator.getAgentHealth(null)).thenReturn(List.of(AgentHealthStatus.builder()
                .agentId("a1")
                .status(AgentStatus.OFFLINE)
                .issues(List.of("Missed heartbeat"))
                .build()));
        when(coordinator.getCoordinationMetrics()).thenReturn(CoordinationMetrics.builder().registeredAgents(1).build());

        // When
        SystemHealth health = service.getSystemHealth();

        // Then
        assertThat(health.getOverall()).isEqualTo(HealthState.DEGRADED);
        assertThat(component(health, "sub_agent_coordinator").getDetails())
                .containsEntry("unhealthyAgents", List.of("a1"));
    }

    @Test
    void shouldReportUnhealthyWhenStoppedOrComponentFails() {
        // Given
        service.stop();
        when(router.getRoutingMetrics()).thenThrow(new IllegalStateException("router down"));
        stubHealthyCoordinator();

        // When
        SystemHealth health = service.getSystemHealth();

        // Then
        assertThat(health.getOverall()).isEqualTo(HealthState.UNHEALTHY);
        assertThat(component(health, "communication_service").getStatus()).isEqualTo(HealthState.UNHEALTHY);
        assertThat(component(health, "message_router").getDetails()).containsEntry("error", "router down");
    }

    @Test
    void shouldCollectMetricsFromAllComponents() {
        // Given
        when(router.getRoutingMetrics()).thenReturn(routingMetrics(100.0, Map.of()));
        when(coordinator.getCoordinationMetrics()).thenReturn(CoordinationMetrics.builder().build());

        // When
        Map<String, Object> metrics = service.getMetrics();

        // Then
        assertThat(metrics).containsOnlyKeys("routing", "coordination", "telemetry", "events");
        assertThat(metrics.get("telemetry")).isInstanceOf(CommunicationTelemetry.TelemetryReport.class);
    }

    @Test
    void shouldApplyValidConfiguration() {
        // Given
        HermesProperties candidate = new HermesProperties();
        candidate.getRouting().setCircuitBreakerThreshold(7);
        candidate.getPerformance().setMaxLatency(100);

        // When
        service.updateConfiguration(candidate);

        // Then
        assertThat(properties.getRouting().getCircuitBreakerThreshold()).isEqualTo(7);
        assertThat(properties.getPerformance().getMaxLatency()).isEqualTo(100);
    }

    @Test
    void shouldRejectInvalidConfigurationWithoutApplyingIt() {
        // Given
        HermesProperties candidate = new HermesProperties();
        candidate.getRouting().setCircuitBreakerThreshold(7);
        candidate.getPerformance().setMaxLatency(0);

        // Then
        assertThatThrownBy(() -> service.updateConfiguration(candidate))
                .isInstanceOf(CommunicationService.InvalidConfigurationException.class)
                .hasMessage("Invalid max latency configuration");
        assertThat(properties.getRouting().getCircuitBreakerThreshold()).isEqualTo(5);
    }

    @Test
    void shouldNameTheFirstInvalidSetting() {
        // Given
        HermesProperties reliability = new HermesProperties();
        reliability.getPerformance().setDeliveryReliability(101);
        HermesProperties heartbeat = new HermesProperties();
        heartbeat.getDelegation().setHeartbeatInterval(Duration.ZERO);

        // Then
        assertThatThrownBy(() -> CommunicationService.validateConfiguration(reliability))
                .hasMessage("Invalid delivery reliability configuration");
        assertThatThrownBy(() -> CommunicationService.validateConfiguration(heartbeat))
                .hasMessage("Invalid heartbeat interval configuration");
    }

    // --------------------------------------------------------------------------------------------
    // Helpers
    // --------------------------------------------------------------------------------------------

    private CommunicationService serviceWith(List<ExternalCoordinator> externalCoordinators) {
        return new CommunicationService(router, coordinator, externalCoordinators, new MessageValidator(),
                telemetry, eventBus, properties, objectMapper, clock);
    }

    private void expectDisabled(MessageType type, String expectedMessage) {
        StepVerifier.create(service.sendMessage(message("hermes", "coordinate", type, Map.of())))
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(CommunicationService.FeatureDisabledException.class)
                        .hasMessage(expectedMessage))
                .verify();
    }

    private void stubHealthyCoordinator() {
        when(coordinator.getAgentHealth(null)).thenReturn(List.of(AgentHealthStatus.builder()
                .agentId("a1")
                .status(AgentStatus.AVAILABLE)
                .issues(List.of())
                .build()));
        when(coordinator.getCoordinationMetrics()).thenReturn(CoordinationMetrics.builder().registeredAgents(1).build());
    }

    private static ComponentHealth component(SystemHealth health, String name) {
        return health.getComponents().stream()
                .filter(component -> component.getName().equals(name))
                .findFirst()
                .orElseThrow();
    }

    private static RoutingMetrics routingMetrics(double successRate, Map<String, CircuitState> circuits) {
        return RoutingMetrics.builder()
                .totalMessages(10)
                .successRate(successRate)
                .loadBalance(Map.of())
                .circuitBreakerStates(circuits)
                .build();
    }

    private static RoutingResult routed(BaseMessage message, boolean success) {
        return success
                ? RoutingResult.builder()
                        .success(true)
                        .messageId(message.messageId())
                        .targetServer(message.target())
                        .routingPath(List.of(message.target()))
                        .build()
                : RoutingResult.failure(message.messageId(), message.target(), List.of(), 0, "Delivery failed");
    }

    private static BaseMessage message(String target, String operation, MessageType type, Map<String, Object> data) {
        return BaseMessage.create("client", target, operation, type, data);
    }
}
