package com.z254.butterfly.hermes.delegation;

import com.z254.butterfly.hermes.domain.model.*;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Core interface for sub-agent coordination.
 * Provides agent registration, task assignment, delegation strategies and result aggregation.
 */
public interface SubAgentCoordinator {

    // --------------------------------------------------------------------------------------------
    // Agent Management
    // --------------------------------------------------------------------------------------------

    /**
     * Register an agent as available.
     *
     * @param agent The agent; agentId, serverId and at least one capability are required
     * @return The stored agent
     * @throws AgentValidationException when required fields are missing or the pool is full
     */
    SubAgent registerAgent(SubAgent agent);

    /**
     * Reassign every in-flight task of an agent, then remove it.
     *
     * @param agentId The agent ID
     * @return Completes once the agent is removed; errors with {@link AgentNotFoundException}
     */
    Mono<Void> unregisterAgent(String agentId);

    /**
     * Record a heartbeat from an agent.
     *
     * @throws AgentNotFoundException when the agent is unknown
     */
    void agentHeartbeat(String agentId);

    List<SubAgent> getAgents();

    // --------------------------------------------------------------------------------------------
    // Task Execution
    // --------------------------------------------------------------------------------------------

    /**
     * Assign a single task to the best matching agent and dispatch it through the router.
     * Never errors: when no agent fits the execution comes back failed.
     *
     * @param task The task
     * @return The execution record
     */
    Mono<TaskExecution> assignTask(SubAgentTask task);

    /**
     * Run a delegation with its strategy and aggregate the results.
     *
     * @param request The delegation request
     * @return The delegation result; errors only with {@link InvalidDelegationException}
     */
    Mono<DelegationResult> delegateTasks(DelegationRequest request);

    /**
     * Current execution of a task, timing it out first if it is past its deadline.
     *
     * @param taskId The task ID
     * @return The execution; errors with {@link TaskNotFoundException}
     */
    Mono<TaskExecution> monitorTaskProgress(String taskId);

    /**
     * Accept the outcome an agent reports for a task.
     *
     * @param agentId Reporting agent, or null to accept from the assigned agent
     * @param taskId  The task ID
     * @param outcome The reported outcome
     * @return false when the report is ignored (unknown task, other agent, already terminal)
     */
    boolean completeTask(String agentId, String taskId, TaskOutcome outcome);

    /**
     * Cancel the in-flight tasks of a running delegation.
     *
     * @return false when no such delegation is running
     */
    boolean cancelDelegation(String delegationId);

    /**
     * Combine execution results.
     *
     * @throws ResultAggregator.AggregationException when no execution completed with a result
     */
    Map<String, Object> aggregateResults(List<TaskExecution> executions, AggregationRules rules);

    // --------------------------------------------------------------------------------------------
    // Capacity and Health
    // --------------------------------------------------------------------------------------------

    ScalingDecision scaleAgents(int demand);

    /**
     * Health of one agent, or of all agents when {@code agentId} is null.
     */
    List<AgentHealthStatus> getAgentHealth(String agentId);

    /**
     * Suggest the least loaded capable agent for each task without reserving anything.
     */
    List<AgentAssignment> balanceLoad(List<SubAgentTask> tasks);

    List<OptimizationSuggestion> optimizePerformance();

    CoordinationMetrics getCoordinationMetrics();

    /**
     * Flag unhealthy agents, take agents with missed heartbeats offline and time out overdue tasks.
     */
    void runHealthSweep();

    // --------------------------------------------------------------------------------------------
    // Exceptions
    // --------------------------------------------------------------------------------------------

    class InvalidDelegationException extends RuntimeException {
        public InvalidDelegationException(String message) {
            super(message);
        }
    }

    class AgentValidationException extends RuntimeException {
        public AgentValidationException(String message) {
            super(message);
        }
    }

    class AgentNotFoundException extends RuntimeException {
        public AgentNotFoundException(String agentId) {
            super("Agent " + agentId + " not found");
        }
    }

    class TaskNotFoundException extends RuntimeException {
        public TaskNotFoundException(String taskId) {
            super("Task " + taskId + " not found");
        }
    }
}
