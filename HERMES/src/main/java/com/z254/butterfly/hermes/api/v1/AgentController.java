package com.z254.butterfly.hermes.api.v1;

import com.z254.butterfly.hermes.api.dto.AgentRegistrationRequest;
import com.z254.butterfly.hermes.communication.CommunicationService;
import com.z254.butterfly.hermes.delegation.SubAgentCoordinator;
import com.z254.butterfly.hermes.domain.model.AgentHealthStatus;
import com.z254.butterfly.hermes.domain.model.SubAgent;
import com.z254.butterfly.hermes.domain.model.TaskResultReport;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * REST controller for sub-agent management.
 */
@RestController
@RequestMapping("/api/v1/agents")
@Tag(name = "Agents", description = "Sub-agent registration, liveness and results")
@Slf4j
public class AgentController {

    private final CommunicationService communicationService;
    private final SubAgentCoordinator coordinator;

    public AgentController(CommunicationService communicationService, SubAgentCoordinator coordinator) {
        this.communicationService = communicationService;
        this.coordinator = coordinator;
    }

    @PostMapping
    @Operation(summary = "Register agent", description = "Register a sub-agent as available")
    @ApiResponse(responseCode = "201", description = "Agent registered")
    @ApiResponse(responseCode = "400", description = "Invalid agent or pool full")
    public Mono<ResponseEntity<SubAgent>> register(@Valid @RequestBody AgentRegistrationRequest request) {
        log.info("Registering agent: {} on server {}", request.getAgentId(), request.getServerId());

        return Mono.fromCallable(() -> communicationService.registerAgent(request.toAgent()))
                .map(agent -> ResponseEntity.status(HttpStatus.CREATED).body(agent))
                .onErrorMap(ApiErrors::toResponseStatus);
    }

    @GetMapping
    @Operation(summary = "List agents")
    public Flux<SubAgent> list() {
        return Flux.defer(() -> Flux.fromIterable(coordinator.getAgents()));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Unregister agent", description = "Reassign the agent's in-flight tasks, then remove it")
    @ApiResponse(responseCode = "204", description = "Agent removed")
    @ApiResponse(responseCode = "404", description = "Agent not found")
    public Mono<ResponseEntity<Void>> unregister(@Parameter(description = "Agent ID") @PathVariable String id) {
        log.info("Unregistering agent: {}", id);

        return coordinator.unregisterAgent(id)
                .then(Mono.just(ResponseEntity.noContent().<Void>build()))
                .onErrorMap(ApiErrors::toResponseStatus);
    }

    @PostMapping("/{id}/heartbeat")
    @Operation(summary = "Agent heartbeat")
    @ApiResponse(responseCode = "204", description = "Heartbeat recorded")
    @ApiResponse(responseCode = "404", description = "Agent not found")
    public Mono<ResponseEntity<Void>> heartbeat(@PathVariable String id) {
        return Mono.fromRunnable(() -> communicationService.agentHeartbeat(id))
                .then(Mono.just(ResponseEntity.noContent().<Void>build()))
                .onErrorMap(ApiErrors::toResponseStatus);
    }

    @PostMapping("/{id}/tasks/{taskId}/result")
    @Operation(summary = "Report task result", description = "Complete or fail a task held by the agent")
    @ApiResponse(responseCode = "200", description = "Result accepted")
    @ApiResponse(responseCode = "409", description = "Result ignored: task not held by this agent or already finished")
    public Mono<ResponseEntity<Map<String, Object>>> reportResult(
            @PathVariable String id,
            @PathVariable String taskId,
            @RequestBody TaskResultReport report) {

        return Mono.fromCallable(() -> coordinator.completeTask(id, taskId, report.toOutcome()))
                .map(accepted -> {
                    Map<String, Object> body = Map.of("taskId", taskId, "accepted", accepted);
                    return accepted
                            ? ResponseEntity.ok(body)
                            : ResponseEntity.status(HttpStatus.CONFLICT).body(body);
                });
    }

    @GetMapping("/health")
    @Operation(summary = "Agent health", description = "Health issues of one agent or of all agents")
    public Mono<List<AgentHealthStatus>> health(@RequestParam(required = false) String agentId) {
        return Mono.fromCallable(() -> coordinator.getAgentHealth(agentId))
                .onErrorMap(ApiErrors::toResponseStatus);
    }
}
