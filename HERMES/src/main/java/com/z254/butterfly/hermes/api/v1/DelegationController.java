package com.z254.butterfly.hermes.api.v1;

import com.z254.butterfly.hermes.communication.CommunicationService;
import com.z254.butterfly.hermes.delegation.SubAgentCoordinator;
import com.z254.butterfly.hermes.domain.model.*;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * REST controller for task delegation.
 */
@RestController
@RequestMapping("/api/v1/delegations")
@Tag(name = "Delegations", description = "Sub-agent task delegation")
@Slf4j
public class DelegationController {

    private final CommunicationService communicationService;
    private final SubAgentCoordinator coordinator;

    public DelegationController(CommunicationService communicationService, SubAgentCoordinator coordinator) {
        this.communicationService = communicationService;
        this.coordinator = coordinator;
    }

    @PostMapping
    @Operation(summary = "Delegate tasks", description = "Run a delegation and wait for its aggregated result")
    @ApiResponse(responseCode = "200", description = "Delegation finished; partial failures are reported in the body")
    @ApiResponse(responseCode = "400", description = "Invalid delegation request")
    public Mono<ResponseEntity<DelegationResult>> delegate(@RequestBody DelegationRequest request) {
        log.info("Delegation requested: {} with {} tasks", request.getDelegationId(),
                request.getTasks() != null ? request.getTasks().size() : 0);

        return communicationService.delegateTasks(request)
                .map(ResponseEntity::ok)
                .onErrorMap(ApiErrors::toResponseStatus);
    }

    @PostMapping("/{id}/cancel")
    @Operation(summary = "Cancel delegation", description = "Cancel the in-flight tasks of a running delegation")
    @ApiResponse(responseCode = "204", description = "Delegation cancelled")
    @ApiResponse(responseCode = "404", description = "No such running delegation")
    public Mono<ResponseEntity<Void>> cancel(@Parameter(description = "Delegation ID") @PathVariable String id) {
        return Mono.fromCallable(() -> coordinator.cancelDelegation(id))
                .map(cancelled -> cancelled
                        ? ResponseEntity.noContent().<Void>build()
                        : ResponseEntity.notFound().<Void>build());
    }

    @PostMapping("/tasks")
    @Operation(summary = "Assign task", description = "Assign a single task to the best matching agent")
    public Mono<ResponseEntity<TaskExecution>> assignTask(@RequestBody SubAgentTask task) {
        return coordinator.assignTask(task)
                .map(ResponseEntity::ok);
    }

    @GetMapping("/tasks/{taskId}")
    @Operation(summary = "Task progress", description = "Current execution state of a task")
    @ApiResponse(responseCode = "404", description = "Unknown task")
    public Mono<ResponseEntity<TaskExecution>> taskProgress(@PathVariable String taskId) {
        return coordinator.monitorTaskProgress(taskId)
                .map(ResponseEntity::ok)
                .onErrorMap(ApiErrors::toResponseStatus);
    }

    @PostMapping("/balance")
    @Operation(summary = "Suggest assignments", description = "Least loaded capable agent per task, without reserving")
    public Mono<List<AgentAssignment>> balance(@RequestBody List<SubAgentTask> tasks) {
        return Mono.fromCallable(() -> coordinator.balanceLoad(tasks));
    }

    @GetMapping("/metrics")
    @Operation(summary = "Coordination metrics")
    public Mono<CoordinationMetrics> metrics() {
        return Mono.fromCallable(coordinator::getCoordinationMetrics);
    }

    @GetMapping("/scaling")
    @Operation(summary = "Scaling recommendation", description = "Recommend an agent pool size for the given demand")
    public Mono<ScalingDecision> scaling(@RequestParam(defaultValue = "0") int demand) {
        return Mono.fromCallable(() -> coordinator.scaleAgents(demand));
    }

    @GetMapping("/optimizations")
    @Operation(summary = "Optimization suggestions")
    public Mono<List<OptimizationSuggestion>> optimizations() {
        return Mono.fromCallable(coordinator::optimizePerformance);
    }
}
