package com.z254.butterfly.hermes.delegation;

import com.z254.butterfly.hermes.config.HermesProperties;
import com.z254.butterfly.hermes.delegation.strategy.DelegationStrategyExecutor;
import com.z254.butterfly.hermes.delegation.strategy.TaskDispatcher;
import com.z254.butterfly.hermes.domain.model.*;
import com.z254.butterfly.hermes.events.CoordinationEventBus;
import com.z254.butterfly.hermes.events.CoordinationEventType;
import com.z254.butterfly.hermes.observability.HermesMetrics;
import com.z254.butterfly.hermes.resource.ResourceUtilizationProbe;
import com.z254.butterfly.hermes.routing.MessageRouter;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SignalType;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Implementation of the SubAgentCoordinator interface.
 * Tracks every task by id; each task entry is mutated only while holding its monitor, and the
 * execution it exposes is replaced rather than modified so readers never see a partial update.
 */
@Service
@Slf4j
public class SubAgentCoordinatorImpl implements SubAgentCoordinator {

    public static final String EXECUTE_TASK_OPERATION = "execute_task";
    public static final String TASK_HINT = "sub_agent_task";

    private static final String SOURCE = "sub_agent_coordinator";

    static final double HIGH_LOAD = 0.9;
    static final double HIGH_ERROR_RATE = 0.1;
    static final double SCALE_UP_UTILIZATION = 0.8;
    static final double SCALE_DOWN_UTILIZATION = 0.3;
    static final double LOAD_IMBALANCE = 0.3;
    static final double LOW_EFFICIENCY = 70.0;

    private final AgentRegistry registry;
    private final MessageRouter router;
    private final ResultAggregator aggregator;
    private final Map<DelegationStrategyType, DelegationStrategyExecutor> strategies;
    private final HermesProperties hermesProperties;
    private final HermesMetrics metrics;
    private final CoordinationEventBus eventBus;
    private final ResourceUtilizationProbe resourceProbe;
    private final Clock clock;

    private final Map<String, TrackedTask> tasks = new ConcurrentHashMap<>();
    private final Map<String, DelegationScope> activeDelegations = new ConcurrentHashMap<>();
    private final Map<String, List<String>> reportedIssues = new ConcurrentHashMap<>();

    private final AtomicLong tasksAssigned = new AtomicLong();
    private final AtomicLong tasksCompleted = new AtomicLong();
    private final AtomicLong tasksFailed = new AtomicLong();
    private final AtomicLong tasksTimedOut = new AtomicLong();
    private final AtomicLong delegationsCompleted = new AtomicLong();
    private final AtomicLong delegationsFailed = new AtomicLong();

    public SubAgentCoordinatorImpl(
            AgentRegistry registry,
            MessageRouter router,
            ResultAggregator aggregator,
            List<DelegationStrategyExecutor> strategies,
            HermesProperties hermesProperties,
            HermesMetrics metrics,
            CoordinationEventBus eventBus,
            ResourceUtilizationProbe resourceProbe,
            Clock clock) {
        this.registry = registry;
        this.router = router;
        this.aggregator = aggregator;
        this.hermesProperties = hermesProperties;
        this.metrics = metrics;
        this.eventBus = eventBus;
        this.resourceProbe = resourceProbe;
        this.clock = clock;

        this.strategies = new EnumMap<>(DelegationStrategyType.class);
        strategies.forEach(strategy -> this.strategies.put(strategy.getStrategy(), strategy));
        log.info("Initialized SubAgentCoordinator with {} delegation strategies", this.strategies.size());
    }

    // --------------------------------------------------------------------------------------------
    // Agent Management
    // --------------------------------------------------------------------------------------------

    @Override
    public SubAgent registerAgent(SubAgent agent) {
        validateAgent(agent);
        int maxAgents = hermesProperties.getDelegation().getMaxConcurrentSubAgents();

        SubAgent stored;
        synchronized (registry) {
            if (!registry.contains(agent.getAgentId()) && registry.size() >= maxAgents) {
                throw new AgentValidationException("Maximum number of sub-agents (" + maxAgents + ") reached");
            }
            stored = registry.register(agent, clock.instant());
        }
        updateGauges();

        log.info("Registered sub-agent {} on server {} with capabilities {}",
                stored.getAgentId(), stored.getServerId(), stored.getCapabilities());
        eventBus.publish(CoordinationEventType.AGENT_REGISTERED, SOURCE, stored.getAgentId(),
                Map.of("serverId", stored.getServerId(), "capabilities", List.copyOf(stored.getCapabilities())));
        return stored;
    }

    @Override
    public Mono<Void> unregisterAgent(String agentId) {
        return Mono.defer(() -> {
            Optional<List<String>> inFlight = registry.startDraining(agentId);
            if (inFlight.isEmpty()) {
                return Mono.error(new AgentNotFoundException(agentId));
            }
            log.info("Unregistering sub-agent {} with {} in-flight tasks", agentId, inFlight.get().size());

            return Flux.fromIterable(inFlight.get())
                    .concatMap(taskId -> reassign(taskId, agentId))
                    .then(Mono.defer(() -> removeWhenDrained(agentId)))
                    .then(Mono.fromRunnable(() -> {
                        reportedIssues.remove(agentId);
                        updateGauges();
                        log.info("Sub-agent {} unregistered", agentId);
                        eventBus.publish(CoordinationEventType.AGENT_UNREGISTERED, SOURCE, agentId,
                                Map.of("reassignedTasks", inFlight.get().size()));
                    }));
        });
    }

    /**
     * Remove a draining agent, first reassigning any task it still holds.
     */
    private Mono<Void> removeWhenDrained(String agentId) {
        List<String> leftover = registry.removeIfDrained(agentId);
        if (leftover.isEmpty()) {
            return Mono.empty();
        }
        log.warn("Sub-agent {} still holds tasks {} while draining", agentId, leftover);
        return Flux.fromIterable(leftover)
                .concatMap(taskId -> reassign(taskId, agentId)
                        .then(Mono.fromRunnable(() -> registry.release(agentId, taskId))))
                .then(Mono.defer(() -> removeWhenDrained(agentId)));
    }

    @Override
    public void agentHeartbeat(String agentId) {
        if (!registry.heartbeat(agentId, clock.instant())) {
            throw new AgentNotFoundException(agentId);
        }
        log.debug("Heartbeat from sub-agent {}", agentId);
    }

    @Override
    public List<SubAgent> getAgents() {
        return registry.snapshot();
    }

    // --------------------------------------------------------------------------------------------
    // Task Execution
    // --------------------------------------------------------------------------------------------

    @Override
    public Mono<TaskExecution> assignTask(SubAgentTask task) {
        return assign(task, null);
    }

    @Override
    public Mono<DelegationResult> delegateTasks(DelegationRequest request) {
        return Mono.defer(() -> {
            List<SubAgentTask> prepared = validateDelegation(request);
            String delegationId = request.getDelegationId();

            Instant start = clock.instant();
            Instant deadline = request.getTimeout() != null ? start.plus(request.getTimeout()) : null;
            DelegationScope scope = new DelegationScope(delegationId, deadline);
            if (activeDelegations.putIfAbsent(delegationId, scope) != null) {
                return Mono.error(new InvalidDelegationException("Delegation " + delegationId + " is already running"));
            }

            DelegationStrategyType strategyType = request.getStrategy() != null
                    ? request.getStrategy() : DelegationStrategyType.PARALLEL;
            DelegationStrategyExecutor executor = strategies.get(strategyType);
            if (executor == null) {
                activeDelegations.remove(delegationId, scope);
                return Mono.error(new InvalidDelegationException("Unsupported delegation strategy: " + strategyType));
            }

            log.info("Starting delegation {} with {} tasks using {} strategy",
                    delegationId, prepared.size(), strategyType);

            return executor.execute(prepared, scope)
                    .map(executions -> buildResult(request, strategyType, prepared.size(), executions, start))
                    .doOnNext(this::recordDelegation)
                    .doFinally(signal -> {
                        activeDelegations.remove(delegationId, scope);
                        if (signal == SignalType.CANCEL) {
                            cancelInFlight(scope, "Delegation " + delegationId + " cancelled");
                        }
                    });
        });
    }

    @Override
    public Mono<TaskExecution> monitorTaskProgress(String taskId) {
        return Mono.fromCallable(() -> refreshExecution(taskId));
    }

    @Override
    public boolean completeTask(String agentId, String taskId, TaskOutcome outcome) {
        TrackedTask tracked = tasks.get(taskId);
        if (tracked == null) {
            log.warn("Ignoring result for unknown task {}", taskId);
            return false;
        }
        synchronized (tracked) {
            applyTimeout(tracked);
            TaskExecution execution = tracked.execution;
            if (execution.getStatus() != TaskStatus.ASSIGNED && execution.getStatus() != TaskStatus.IN_PROGRESS) {
                log.warn("Ignoring late result for task {} in status {}", taskId, execution.getStatus());
                return false;
            }
            if (agentId != null && !agentId.equals(execution.getAgentId())) {
                log.warn("Ignoring result for task {} from agent {}; task is held by {}",
                        taskId, agentId, execution.getAgentId());
                return false;
            }
            TaskOutcome reported = outcome != null ? outcome : TaskOutcome.failed("Empty task outcome");
            if (reported.isSuccess()) {
                finish(tracked, TaskStatus.COMPLETED, null, reported);
            } else {
                String error = reported.getError() != null ? reported.getError() : "Agent reported failure";
                finish(tracked, TaskStatus.FAILED, error, reported);
            }
            log.debug("Task {} finished by agent {} with status {}", taskId, execution.getAgentId(),
                    tracked.execution.getStatus());
            return true;
        }
    }

    @Override
    public boolean cancelDelegation(String delegationId) {
        DelegationScope scope = activeDelegations.get(delegationId);
        if (scope == null) {
            return false;
        }
        cancelInFlight(scope, "Delegation " + delegationId + " cancelled");
        log.info("Delegation {} cancelled", delegationId);
        return true;
    }

    @Override
    public Map<String, Object> aggregateResults(List<TaskExecution> executions, AggregationRules rules) {
        return aggregator.aggregate(executions, rules);
    }

    // --------------------------------------------------------------------------------------------
    // Capacity and Health
    // --------------------------------------------------------------------------------------------

    @Override
    public ScalingDecision scaleAgents(int demand) {
        int currentAgents = registry.size();
        int activeTasks = registry.activeTaskCount();
        int capacity = currentAgents * hermesProperties.getDelegation().getAssumedAgentCapacity();
        double utilization = capacity > 0
                ? (double) activeTasks / capacity
                : (activeTasks > 0 ? 1.0 : 0.0);

        ScalingDecision decision;
        if (utilization > SCALE_UP_UTILIZATION) {
            decision = ScalingDecision.builder()
                    .action(ScalingAction.SCALE_UP)
                    .currentAgents(currentAgents)
                    .targetAgents(Math.max((int) Math.ceil(demand / 8.0), currentAgents + 1))
                    .utilization(utilization)
                    .reason(String.format("Utilization %.0f%% is above %.0f%%", utilization * 100, SCALE_UP_UTILIZATION * 100))
                    .confidence(85)
                    .estimatedImpact(25)
                    .build();
        } else if (utilization < SCALE_DOWN_UTILIZATION && currentAgents > 1) {
            decision = ScalingDecision.builder()
                    .action(ScalingAction.SCALE_DOWN)
                    .currentAgents(currentAgents)
                    .targetAgents(Math.max(1, (int) Math.floor(demand / 3.0)))
                    .utilization(utilization)
                    .reason(String.format("Utilization %.0f%% is below %.0f%%", utilization * 100, SCALE_DOWN_UTILIZATION * 100))
                    .confidence(75)
                    .estimatedImpact(15)
                    .build();
        } else {
            decision = ScalingDecision.builder()
                    .action(ScalingAction.MAINTAIN)
                    .currentAgents(currentAgents)
                    .targetAgents(currentAgents)
                    .utilization(utilization)
                    .reason(String.format("Utilization %.0f%% is within target range", utilization * 100))
                    .confidence(90)
                    .estimatedImpact(0)
                    .build();
        }

        log.info("Scaling decision for demand {}: {} ({} -> {} agents)",
                demand, decision.getAction(), currentAgents, decision.getTargetAgents());
        eventBus.publish(CoordinationEventType.SCALING_RECOMMENDED, SOURCE, decision.getAction().name(),
                Map.of("currentAgents", currentAgents,
                        "targetAgents", decision.getTargetAgents(),
                        "utilization", utilization));
        return decision;
    }

    @Override
    public List<AgentHealthStatus> getAgentHealth(String agentId) {
        Instant now = clock.instant();
        if (agentId != null) {
            SubAgent agent = registry.get(agentId).orElseThrow(() -> new AgentNotFoundException(agentId));
            return List.of(healthOf(agent, now));
        }
        return registry.snapshot().stream()
                .map(agent -> healthOf(agent, now))
                .toList();
    }

    @Override
    public List<AgentAssignment> balanceLoad(List<SubAgentTask> tasksToPlace) {
        // Projected copies, so consecutive suggestions spread over the pool
        List<SubAgent> projected = registry.snapshot();
        List<AgentAssignment> assignments = new ArrayList<>();

        for (SubAgentTask task : tasksToPlace) {
            List<SubAgent> candidates = projected.stream()
                    .filter(agent -> AgentRegistry.isEligible(agent, task.getOperation()))
                    .sorted(Comparator.comparingDouble(SubAgent::getLoad)
                            .thenComparing(Comparator.comparingDouble(
                                    (SubAgent agent) -> AgentRegistry.score(agent, task.getOperation())).reversed()))
                    .toList();

            if (candidates.isEmpty()) {
                assignments.add(AgentAssignment.builder()
                        .taskId(task.getTaskId())
                        .reason("No capable agent with spare capacity for operation " + task.getOperation())
                        .alternatives(List.of())
                        .build());
                continue;
            }

            SubAgent chosen = candidates.get(0);
            assignments.add(AgentAssignment.builder()
                    .taskId(task.getTaskId())
                    .agentId(chosen.getAgentId())
                    .reason(String.format("Least loaded capable agent (load %.0f%%)", chosen.getLoad() * 100))
                    .alternatives(candidates.stream().skip(1).limit(3).map(SubAgent::getAgentId).toList())
                    .build());
            chosen.getCurrentTasks().add(task.getTaskId() != null ? task.getTaskId() : UUID.randomUUID().toString());
        }
        return assignments;
    }

    @Override
    public List<OptimizationSuggestion> optimizePerformance() {
        List<SubAgent> agents = registry.snapshot();
        List<OptimizationSuggestion> suggestions = new ArrayList<>();

        if (agents.size() > 1) {
            double mean = agents.stream().mapToDouble(SubAgent::getLoad).average().orElse(0.0);
            double variance = agents.stream()
                    .mapToDouble(agent -> Math.pow(agent.getLoad() - mean, 2))
                    .average().orElse(0.0);
            double deviation = Math.sqrt(variance);
            if (deviation > LOAD_IMBALANCE) {
                suggestions.add(OptimizationSuggestion.builder()
                        .type(OptimizationSuggestion.Type.LOAD_REBALANCING)
                        .description(String.format("Agent load is unevenly distributed (standard deviation %.2f)", deviation))
                        .affectedAgents(agents.stream()
                                .filter(agent -> agent.getLoad() > mean)
                                .map(SubAgent::getAgentId)
                                .toList())
                        .expectedImprovement(20)
                        .build());
            }
        }

        List<String> underperforming = agents.stream()
                .filter(agent -> agent.getPerformance().getEfficiency() < LOW_EFFICIENCY
                        || agent.getPerformance().getErrorRate() > HIGH_ERROR_RATE)
                .map(SubAgent::getAgentId)
                .toList();
        if (!underperforming.isEmpty()) {
            suggestions.add(OptimizationSuggestion.builder()
                    .type(OptimizationSuggestion.Type.AGENT_PERFORMANCE)
                    .description("Agents with low efficiency or high error rate should be retrained or replaced")
                    .affectedAgents(underperforming)
                    .expectedImprovement(15)
                    .build());
        }

        double systemLoad = systemLoad();
        if (systemLoad > SCALE_UP_UTILIZATION) {
            suggestions.add(OptimizationSuggestion.builder()
                    .type(OptimizationSuggestion.Type.CAPACITY)
                    .description(String.format("System load %.0f%% leaves little headroom; add agents", systemLoad * 100))
                    .affectedAgents(List.of())
                    .expectedImprovement(25)
                    .build());
        }
        return suggestions;
    }

    @Override
    public CoordinationMetrics getCoordinationMetrics() {
        List<SubAgent> agents = registry.snapshot();
        int active = agents.stream().mapToInt(agent -> agent.getCurrentTasks().size()).sum();
        int capacity = agents.stream().mapToInt(SubAgent::getMaxConcurrentTasks).sum();
        return CoordinationMetrics.builder()
                .registeredAgents(agents.size())
                .availableAgents((int) agents.stream().filter(agent -> agent.getStatus() == AgentStatus.AVAILABLE).count())
                .activeTasks(active)
                .totalCapacity(capacity)
                .systemLoad(capacity > 0 ? (double) active / capacity : 0.0)
                .activeDelegations(activeDelegations.size())
                .tasksAssigned(tasksAssigned.get())
                .tasksCompleted(tasksCompleted.get())
                .tasksFailed(tasksFailed.get())
                .tasksTimedOut(tasksTimedOut.get())
                .delegationsCompleted(delegationsCompleted.get())
                .delegationsFailed(delegationsFailed.get())
                .build();
    }

    @Override
    public void runHealthSweep() {
        Instant now = clock.instant();
        Duration heartbeatLimit = hermesProperties.getDelegation().getHeartbeatInterval().multipliedBy(2);

        registry.markMissedHeartbeats(now, heartbeatLimit)
                .forEach(agentId -> log.warn("Sub-agent {} missed its heartbeat; marked offline", agentId));

        Set<String> known = new HashSet<>();
        for (AgentHealthStatus health : getAgentHealth(null)) {
            known.add(health.getAgentId());
            List<String> previous = reportedIssues.put(health.getAgentId(), health.getIssues());
            if (!health.isHealthy() && !health.getIssues().equals(previous)) {
                log.warn("Sub-agent {} health issues: {}", health.getAgentId(), health.getIssues());
                eventBus.publish(CoordinationEventType.AGENT_HEALTH_ISSUE, SOURCE, health.getAgentId(),
                        Map.of("issues", health.getIssues(), "load", health.getLoad()));
            }
        }
        reportedIssues.keySet().retainAll(known);

        for (TrackedTask tracked : tasks.values()) {
            synchronized (tracked) {
                applyTimeout(tracked);
            }
        }

        Duration retention = hermesProperties.getDelegation().getCompletedTaskRetention();
        int before = tasks.size();
        tasks.values().removeIf(tracked -> isExpired(tracked, now.minus(retention)));
        if (tasks.size() < before) {
            log.debug("Removed {} finished tasks past retention", before - tasks.size());
        }
    }

    @PreDestroy
    public void shutdown() {
        activeDelegations.values().forEach(scope -> cancelInFlight(scope, "Coordinator shutting down"));
        log.info("SubAgentCoordinator shut down");
    }

    // --------------------------------------------------------------------------------------------
    // Assignment and dispatch
    // --------------------------------------------------------------------------------------------

    private Mono<TaskExecution> assign(SubAgentTask task, DelegationScope scope) {
        return Mono.defer(() -> {
            SubAgentTask definition = task.getTaskId() == null || task.getTaskId().isBlank()
                    ? task.toBuilder().taskId(UUID.randomUUID().toString()).build()
                    : task;
            String taskId = definition.getTaskId();
            TrackedTask fresh = new TrackedTask(definition, scope, Set.of(), pending(definition, scope, 1));

            TrackedTask current = tasks.compute(taskId, (id, existing) ->
                    existing != null && !existing.execution.getStatus().isTerminal() ? existing : fresh);
            if (current != fresh) {
                log.warn("Task {} is already in progress", taskId);
                TaskExecution rejected = fresh.execution.toBuilder()
                        .agentId("")
                        .status(TaskStatus.FAILED)
                        .endTime(clock.instant())
                        .error("Task " + taskId + " is already in progress")
                        .build();
                return Mono.just(rejected);
            }

            if (scope != null) {
                scope.taskIds.add(taskId);
                if (scope.cancelled) {
                    synchronized (fresh) {
                        finish(fresh, TaskStatus.CANCELLED, "Delegation " + scope.delegationId + " cancelled", null);
                        return Mono.just(fresh.execution.copy());
                    }
                }
            }
            return dispatch(fresh);
        });
    }

    private Mono<TaskExecution> dispatch(TrackedTask tracked) {
        SubAgentTask task = tracked.definition;
        SubAgent agent;
        Instant now = clock.instant();

        synchronized (tracked) {
            if (tracked.execution.getStatus() != TaskStatus.PENDING) {
                return Mono.just(tracked.execution.copy());
            }
            Optional<SubAgent> reserved = registry.reserve(task, tracked.excludedAgents);
            if (reserved.isEmpty()) {
                tracked.execution = tracked.execution.toBuilder().agentId("").startTime(now).build();
                finish(tracked, TaskStatus.FAILED, "No suitable agent found for task " + task.getTaskId()
                        + " (operation: " + task.getOperation() + ")", null);
                metrics.recordTaskUnassignable();
                log.warn("No suitable agent found for task {} (operation: {})", task.getTaskId(), task.getOperation());
                return Mono.just(tracked.execution.copy());
            }
            agent = reserved.get();
            tracked.deadline = deadline(task, tracked.scope, now);
            tracked.execution = tracked.execution.toBuilder()
                    .agentId(agent.getAgentId())
                    .status(TaskStatus.ASSIGNED)
                    .startTime(now)
                    .build();
        }

        tasksAssigned.incrementAndGet();
        metrics.recordTaskAssigned();
        updateGauges();
        log.debug("Task {} assigned to agent {} on server {}", task.getTaskId(), agent.getAgentId(), agent.getServerId());
        eventBus.publish(CoordinationEventType.TASK_ASSIGNED, SOURCE, task.getTaskId(),
                Map.of("agentId", agent.getAgentId(), "attempt", tracked.execution.getAttempt()));

        return router.routeMessage(taskMessage(tracked, agent, now))
                .map(result -> onDispatched(tracked, agent, result));
    }

    private TaskExecution onDispatched(TrackedTask tracked, SubAgent agent, RoutingResult result) {
        synchronized (tracked) {
            TaskStatus status = tracked.execution.getStatus();
            if (result.isSuccess()) {
                if (status == TaskStatus.ASSIGNED) {
                    tracked.execution = tracked.execution.toBuilder().status(TaskStatus.IN_PROGRESS).build();
                }
            } else if (!status.isTerminal()) {
                log.warn("Dispatch of task {} to agent {} failed: {}",
                        tracked.definition.getTaskId(), agent.getAgentId(), result.getError());
                finish(tracked, TaskStatus.FAILED,
                        "Dispatch to agent " + agent.getAgentId() + " failed: " + result.getError(), null);
            }
            return tracked.execution.copy();
        }
    }

    private BaseMessage taskMessage(TrackedTask tracked, SubAgent agent, Instant now) {
        SubAgentTask task = tracked.definition;
        Duration timeout = Duration.between(now, tracked.deadline);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("taskId", task.getTaskId());
        data.put("agentId", agent.getAgentId());
        data.put("delegationId", tracked.scope != null ? tracked.scope.delegationId : null);
        data.put("operation", task.getOperation());
        data.put("input", task.getInput() != null ? task.getInput() : Map.of());
        data.put("timeoutMs", timeout.toMillis());
        data.put("attempt", tracked.execution.getAttempt());

        return BaseMessage.builder()
                .header(MessageHeader.builder()
                        .messageId(UUID.randomUUID().toString())
                        .correlationId(task.getTaskId())
                        .source(SOURCE)
                        .target(agent.getServerId())
                        .operation(EXECUTE_TASK_OPERATION)
                        .messageType(MessageType.SUB_AGENT_DELEGATION)
                        .priority(task.getPriority() != null ? task.getPriority() : MessagePriority.NORMAL)
                        .timestamp(now)
                        .build())
                .payload(MessagePayload.builder().data(data).build())
                .metadata(MessageMetadata.builder()
                        .ttl(timeout)
                        .routingHint(TASK_HINT, agent.getAgentId())
                        .build())
                .build();
    }

    /**
     * Cancel the current attempt of a task held by a departing agent and dispatch a new attempt
     * to another agent, or fail the task once its retries are used up.
     */
    private Mono<Void> reassign(String taskId, String fromAgent) {
        TrackedTask tracked = tasks.get(taskId);
        if (tracked == null) {
            return Mono.empty();
        }

        TrackedTask replacement;
        synchronized (tracked) {
            TaskExecution execution = tracked.execution;
            if (execution.getStatus().isTerminal() || !fromAgent.equals(execution.getAgentId())) {
                return Mono.empty();
            }
            int retriesUsed = execution.getAttempt() - 1;
            if (retriesUsed >= tracked.definition.getMaxRetries()) {
                finish(tracked, TaskStatus.FAILED, "Agent " + fromAgent + " unregistered and task "
                        + taskId + " has no retries left", null);
                log.warn("Task {} failed: agent {} unregistered and no retries left", taskId, fromAgent);
                return Mono.empty();
            }

            finish(tracked, TaskStatus.CANCELLED, "Agent " + fromAgent + " unregistered; task reassigned", null);
            Set<String> excluded = new HashSet<>(tracked.excludedAgents);
            excluded.add(fromAgent);
            SubAgentTask retry = tracked.definition.toBuilder().retries(retriesUsed + 1).build();
            replacement = new TrackedTask(retry, tracked.scope, excluded,
                    pending(retry, tracked.scope, execution.getAttempt() + 1));
            tasks.put(taskId, replacement);
        }

        log.info("Reassigning task {} from unregistered agent {}", taskId, fromAgent);
        eventBus.publish(CoordinationEventType.TASK_REASSIGNED, SOURCE, taskId,
                Map.of("fromAgent", fromAgent, "attempt", replacement.execution.getAttempt()));
        return dispatch(replacement).then();
    }

    // --------------------------------------------------------------------------------------------
    // Task state transitions
    // --------------------------------------------------------------------------------------------

    private TaskExecution refreshExecution(String taskId) {
        while (true) {
            TrackedTask tracked = tasks.get(taskId);
            if (tracked == null) {
                throw new TaskNotFoundException(taskId);
            }
            synchronized (tracked) {
                // Replaced by a reassignment while waiting for the monitor
                if (tasks.get(taskId) != tracked) {
                    continue;
                }
                applyTimeout(tracked);
                return tracked.execution.copy();
            }
        }
    }

    /**
     * Time out a non-terminal task past its deadline. This covers tasks still {@code ASSIGNED}, whose
     * dispatch never reached {@code IN_PROGRESS}, as well as tasks in progress.
     * Caller holds the monitor of {@code tracked}.
     */
    private void applyTimeout(TrackedTask tracked) {
        TaskExecution execution = tracked.execution;
        if (execution.getStatus().isTerminal() || tracked.deadline == null
                || clock.instant().isBefore(tracked.deadline)) {
            return;
        }
        long allowedMs = Duration.between(execution.getStartTime(), tracked.deadline).toMillis();
        finish(tracked, TaskStatus.TIMEOUT, "Task timeout after " + allowedMs + "ms", null);
        log.warn("Task {} on agent {} timed out after {}ms", execution.getTaskId(), execution.getAgentId(), allowedMs);
        eventBus.publish(CoordinationEventType.TASK_TIMEOUT, SOURCE, execution.getTaskId(),
                Map.of("agentId", execution.getAgentId(), "timeoutMs", allowedMs));
    }

    /**
     * Move a task to a terminal state and free its agent slot. Caller holds the monitor of {@code tracked}.
     */
    private void finish(TrackedTask tracked, TaskStatus status, String error, TaskOutcome outcome) {
        TaskExecution current = tracked.execution;
        Instant now = clock.instant();
        long durationMs = current.getStartTime() != null
                ? Math.max(0, Duration.between(current.getStartTime(), now).toMillis())
                : 0;

        TaskExecution.TaskExecutionBuilder next = current.toBuilder()
                .status(status)
                .endTime(now)
                .error(error);
        if (outcome != null) {
            TaskMetrics taskMetrics = outcome.getMetrics() != null
                    ? outcome.getMetrics().toBuilder().build()
                    : new TaskMetrics();
            if (taskMetrics.getExecutionTime() <= 0) {
                taskMetrics.setExecutionTime(durationMs);
            }
            next.result(outcome.getResult()).metrics(taskMetrics);
        }
        tracked.execution = next.build();

        String agentId = current.getAgentId();
        boolean held = agentId != null && !agentId.isEmpty();
        if (held) {
            registry.release(agentId, current.getTaskId());
        }
        double alpha = hermesProperties.getRouting().getEmaAlpha();
        switch (status) {
            case COMPLETED -> {
                tasksCompleted.incrementAndGet();
                metrics.recordTaskCompleted(Duration.ofMillis(durationMs));
                if (held) {
                    registry.recordOutcome(agentId, true, durationMs, alpha);
                }
            }
            case FAILED -> {
                tasksFailed.incrementAndGet();
                metrics.recordTaskFailed();
                if (held) {
                    registry.recordOutcome(agentId, false, durationMs, alpha);
                }
            }
            case TIMEOUT -> {
                tasksTimedOut.incrementAndGet();
                metrics.recordTaskTimeout();
                if (held) {
                    registry.recordOutcome(agentId, false, durationMs, alpha);
                }
            }
            default -> {
                // cancelled attempts say nothing about the agent
            }
        }
        updateGauges();
    }

    private void cancelInFlight(DelegationScope scope, String reason) {
        scope.cancelled = true;
        for (String taskId : scope.taskIds) {
            TrackedTask tracked = tasks.get(taskId);
            if (tracked == null) {
                continue;
            }
            synchronized (tracked) {
                if (!tracked.execution.getStatus().isTerminal()) {
                    finish(tracked, TaskStatus.CANCELLED, reason, null);
                    log.debug("Task {} cancelled: {}", taskId, reason);
                }
            }
        }
    }

    // --------------------------------------------------------------------------------------------
    // Delegation results
    // --------------------------------------------------------------------------------------------

    private List<SubAgentTask> validateDelegation(DelegationRequest request) {
        if (request == null || request.getDelegationId() == null || request.getDelegationId().isBlank()) {
            throw new InvalidDelegationException("Missing delegation ID");
        }
        if (request.getTasks() == null || request.getTasks().isEmpty()) {
            throw new InvalidDelegationException("No tasks specified");
        }
        if (request.getTasks().size() > hermesProperties.getDelegation().getMaxConcurrentTasks()) {
            throw new InvalidDelegationException("Too many tasks for current capacity");
        }

        List<SubAgentTask> prepared = new ArrayList<>(request.getTasks().size());
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < request.getTasks().size(); i++) {
            SubAgentTask task = request.getTasks().get(i);
            if (task == null) {
                throw new InvalidDelegationException("Task at index " + i + " is missing");
            }
            if (task.getOperation() == null || task.getOperation().isBlank()) {
                throw new InvalidDelegationException("Task at index " + i + " has no operation");
            }
            SubAgentTask copy = task.toBuilder()
                    .taskId(task.getTaskId() == null || task.getTaskId().isBlank()
                            ? UUID.randomUUID().toString()
                            : task.getTaskId())
                    .build();
            if (!seen.add(copy.getTaskId())) {
                throw new InvalidDelegationException("Duplicate task id " + copy.getTaskId());
            }
            TrackedTask existing = tasks.get(copy.getTaskId());
            if (existing != null && !existing.execution.getStatus().isTerminal()) {
                throw new InvalidDelegationException("Task " + copy.getTaskId() + " is already in progress");
            }
            prepared.add(copy);
        }
        return prepared;
    }

    private DelegationResult buildResult(DelegationRequest request, DelegationStrategyType strategy,
                                         int totalTasks, List<TaskExecution> executions, Instant start) {
        Instant end = clock.instant();
        int completed = (int) executions.stream().filter(e -> e.getStatus() == TaskStatus.COMPLETED).count();
        int failed = (int) executions.stream().filter(e -> e.getStatus().isUnsuccessful()).count();

        Map<String, Object> aggregated = null;
        String error = null;
        boolean success;
        try {
            aggregated = aggregator.aggregate(executions, request.getAggregation());
            success = true;
        } catch (ResultAggregator.AggregationException e) {
            success = false;
            error = e.getMessage();
        }

        return DelegationResult.builder()
                .delegationId(request.getDelegationId())
                .success(success)
                .strategy(strategy)
                .totalTasks(totalTasks)
                .completedTasks(completed)
                .failedTasks(failed)
                .skippedTasks(totalTasks - executions.size())
                .taskResults(executions)
                .aggregatedResult(aggregated)
                .error(error)
                .metrics(delegationMetrics(executions, start, end))
                .startTime(start)
                .endTime(end)
                .build();
    }

    private DelegationMetrics delegationMetrics(List<TaskExecution> executions, Instant start, Instant end) {
        List<TaskExecution> completed = executions.stream()
                .filter(e -> e.getStatus() == TaskStatus.COMPLETED)
                .toList();
        long totalExecutionTime = completed.stream()
                .map(TaskExecution::getDuration)
                .filter(Objects::nonNull)
                .mapToLong(Duration::toMillis)
                .sum();
        long wallClock = Duration.between(start, end).toMillis();

        Map<String, Integer> utilization = new LinkedHashMap<>();
        executions.stream()
                .map(TaskExecution::getAgentId)
                .filter(agentId -> agentId != null && !agentId.isEmpty())
                .forEach(agentId -> utilization.merge(agentId, 1, Integer::sum));

        return DelegationMetrics.builder()
                .totalExecutionTime(totalExecutionTime)
                .averageTaskTime(completed.isEmpty() ? 0.0 : (double) totalExecutionTime / completed.size())
                .wallClockTime(wallClock)
                .parallelEfficiency(Math.min(100.0, (double) totalExecutionTime / Math.max(wallClock, 1) * 100.0))
                .agentUtilization(utilization)
                .qualityMetrics(qualityMetrics(completed, executions))
                .resourceUtilization(resourceProbe.sample())
                .build();
    }

    private QualityMetrics qualityMetrics(List<TaskExecution> completed, List<TaskExecution> executions) {
        if (completed.isEmpty()) {
            return QualityMetrics.empty();
        }
        return QualityMetrics.builder()
                .accuracy(averagePercent(completed, TaskMetrics::getAccuracy))
                .completeness(averagePercent(completed, TaskMetrics::getCompleteness))
                .confidence(averagePercent(completed, TaskMetrics::getQualityScore))
                .consistency(aggregator.consistency(executions) * 100.0)
                .build();
    }

    private double averagePercent(List<TaskExecution> executions,
                                  java.util.function.Function<TaskMetrics, Double> field) {
        return executions.stream()
                .map(TaskExecution::getMetrics)
                .filter(Objects::nonNull)
                .map(field)
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .average()
                .orElse(0.0) * 100.0;
    }

    private void recordDelegation(DelegationResult result) {
        Duration wallClock = Duration.between(result.getStartTime(), result.getEndTime());
        metrics.recordDelegation(result.isSuccess(), result.getTotalTasks(), wallClock);

        Map<String, Object> attributes = Map.of(
                "strategy", result.getStrategy().name(),
                "completedTasks", result.getCompletedTasks(),
                "failedTasks", result.getFailedTasks(),
                "skippedTasks", result.getSkippedTasks());
        if (result.isSuccess()) {
            delegationsCompleted.incrementAndGet();
            log.info("Delegation {} completed: {}/{} tasks in {}ms", result.getDelegationId(),
                    result.getCompletedTasks(), result.getTotalTasks(), wallClock.toMillis());
            eventBus.publish(CoordinationEventType.DELEGATION_COMPLETED, SOURCE, result.getDelegationId(), attributes);
        } else {
            delegationsFailed.incrementAndGet();
            log.warn("Delegation {} failed: {}", result.getDelegationId(), result.getError());
            eventBus.publish(CoordinationEventType.DELEGATION_FAILED, SOURCE, result.getDelegationId(), attributes);
        }
    }

    // --------------------------------------------------------------------------------------------
    // Internal helpers
    // --------------------------------------------------------------------------------------------

    private void validateAgent(SubAgent agent) {
        if (agent == null || agent.getAgentId() == null || agent.getAgentId().isBlank()) {
            throw new AgentValidationException("Missing agent ID");
        }
        if (agent.getServerId() == null || agent.getServerId().isBlank()) {
            throw new AgentValidationException("Missing server ID");
        }
        if (agent.getCapabilities() == null || agent.getCapabilities().isEmpty()) {
            throw new AgentValidationException("No capabilities specified");
        }
        if (agent.getMaxConcurrentTasks() <= 0) {
            throw new AgentValidationException("maxConcurrentTasks must be positive");
        }
    }

    private AgentHealthStatus healthOf(SubAgent agent, Instant now) {
        List<String> issues = new ArrayList<>();
        if (agent.getLoad() > HIGH_LOAD) {
            issues.add("High load");
        }
        if (agent.getPerformance().getErrorRate() > HIGH_ERROR_RATE) {
            issues.add("High error rate");
        }
        Duration heartbeatLimit = hermesProperties.getDelegation().getHeartbeatInterval().multipliedBy(2);
        if (agent.getLastHeartbeat() != null
                && Duration.between(agent.getLastHeartbeat(), now).compareTo(heartbeatLimit) > 0) {
            issues.add("Missed heartbeat");
        }
        return AgentHealthStatus.builder()
                .agentId(agent.getAgentId())
                .status(agent.getStatus())
                .load(agent.getLoad())
                .errorRate(agent.getPerformance().getErrorRate())
                .lastHeartbeat(agent.getLastHeartbeat())
                .issues(List.copyOf(issues))
                .build();
    }

    private double systemLoad() {
        int capacity = registry.totalCapacity();
        return capacity > 0 ? (double) registry.activeTaskCount() / capacity : 0.0;
    }

    private Instant deadline(SubAgentTask task, DelegationScope scope, Instant start) {
        Duration timeout = task.getTimeout() != null && !task.getTimeout().isNegative() && !task.getTimeout().isZero()
                ? task.getTimeout()
                : hermesProperties.getDelegation().getTaskTimeout();
        Instant deadline = start.plus(timeout);
        if (scope != null && scope.deadline != null && scope.deadline.isBefore(deadline)) {
            return scope.deadline.isBefore(start) ? start : scope.deadline;
        }
        return deadline;
    }

    private TaskExecution pending(SubAgentTask task, DelegationScope scope, int attempt) {
        return TaskExecution.builder()
                .executionId(UUID.randomUUID().toString())
                .taskId(task.getTaskId())
                .delegationId(scope != null ? scope.delegationId : null)
                .status(TaskStatus.PENDING)
                .attempt(attempt)
                .build();
    }

    private boolean isExpired(TrackedTask tracked, Instant cutoff) {
        TaskExecution execution = tracked.execution;
        if (!execution.getStatus().isTerminal() || execution.getEndTime() == null) {
            return false;
        }
        if (tracked.scope != null && activeDelegations.get(tracked.scope.delegationId) == tracked.scope) {
            return false;
        }
        return execution.getEndTime().isBefore(cutoff);
    }

    private void updateGauges() {
        metrics.setActiveTasks(registry.activeTaskCount());
        metrics.setRegisteredAgents(registry.size());
    }

    /**
     * Current attempt of a task. {@code execution} is replaced, never modified, and only while
     * holding this object's monitor.
     */
    private static final class TrackedTask {
        final SubAgentTask definition;
        final DelegationScope scope;
        final Set<String> excludedAgents;
        volatile TaskExecution execution;
        Instant deadline;

        TrackedTask(SubAgentTask definition, DelegationScope scope, Set<String> excludedAgents,
                    TaskExecution execution) {
            this.definition = definition;
            this.scope = scope;
            this.excludedAgents = excludedAgents;
            this.execution = execution;
        }
    }

    /**
     * Coordinator operations bound to one running delegation.
     */
    private final class DelegationScope implements TaskDispatcher {
        final String delegationId;
        final Instant deadline;
        final Set<String> taskIds = ConcurrentHashMap.newKeySet();
        volatile boolean cancelled;

        DelegationScope(String delegationId, Instant deadline) {
            this.delegationId = delegationId;
            this.deadline = deadline;
        }

        @Override
        public String delegationId() {
            return delegationId;
        }

        @Override
        public Mono<TaskExecution> assign(SubAgentTask task) {
            return SubAgentCoordinatorImpl.this.assign(task, this);
        }

        @Override
        public TaskExecution refresh(String taskId) {
            return refreshExecution(taskId);
        }

        @Override
        public Duration pollInterval() {
            return hermesProperties.getDelegation().getProgressPollInterval();
        }

        @Override
        public double systemLoad() {
            return SubAgentCoordinatorImpl.this.systemLoad();
        }
    }
}
