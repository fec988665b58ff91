package com.z254.butterfly.hermes.delegation;

import com.z254.butterfly.hermes.domain.model.AgentPerformance;
import com.z254.butterfly.hermes.domain.model.AgentStatus;
import com.z254.butterfly.hermes.domain.model.SubAgent;
import com.z254.butterfly.hermes.domain.model.SubAgentTask;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Agent id to agent record index.
 * Selection and reservation happen under one lock, so an agent never exceeds its
 * {@code maxConcurrentTasks}. Readers receive detached copies.
 */
@Component
public class AgentRegistry {

    static final double SPECIALIZATION_BOOST = 1.2;

    private final Map<String, SubAgent> agents = new LinkedHashMap<>();
    private final Set<String> draining = new HashSet<>();

    /**
     * Add an agent, or refresh the registration of a known one while keeping its in-flight tasks.
     *
     * @return Copy of the stored record
     */
    public synchronized SubAgent register(SubAgent agent, Instant now) {
        SubAgent stored = agent.copy();
        if (stored.getPerformance() == null) {
            stored.setPerformance(new AgentPerformance());
        }
        if (stored.getSpecializations() == null) {
            stored.setSpecializations(new LinkedHashSet<>());
        }
        SubAgent existing = agents.get(stored.getAgentId());
        if (existing != null) {
            stored.setCurrentTasks(new ArrayList<>(existing.getCurrentTasks()));
            stored.setRegisteredAt(existing.getRegisteredAt());
        } else {
            stored.setCurrentTasks(new ArrayList<>());
            stored.setRegisteredAt(now);
        }
        if (draining.contains(stored.getAgentId())) {
            stored.setStatus(AgentStatus.OFFLINE);
        } else {
            stored.setStatus(stored.hasSpareCapacity() ? AgentStatus.AVAILABLE : AgentStatus.BUSY);
        }
        stored.setLastHeartbeat(now);
        agents.put(stored.getAgentId(), stored);
        return stored.copy();
    }

    public synchronized boolean contains(String agentId) {
        return agents.containsKey(agentId);
    }

    public synchronized int size() {
        return agents.size();
    }

    public synchronized Optional<SubAgent> get(String agentId) {
        return Optional.ofNullable(agents.get(agentId)).map(SubAgent::copy);
    }

    public synchronized List<SubAgent> snapshot() {
        List<SubAgent> copies = new ArrayList<>(agents.size());
        agents.values().forEach(agent -> copies.add(agent.copy()));
        return copies;
    }

    /**
     * Take an agent offline for good ahead of its removal. Heartbeats and re-registration
     * no longer bring it back.
     *
     * @return The tasks it still holds, or empty when the agent is unknown
     */
    public synchronized Optional<List<String>> startDraining(String agentId) {
        SubAgent agent = agents.get(agentId);
        if (agent == null) {
            return Optional.empty();
        }
        draining.add(agentId);
        agent.setStatus(AgentStatus.OFFLINE);
        return Optional.of(new ArrayList<>(agent.getCurrentTasks()));
    }

    public synchronized boolean isDraining(String agentId) {
        return draining.contains(agentId);
    }

    /**
     * Remove a draining agent once it holds no task.
     *
     * @return The tasks it still holds; empty when the agent was removed
     */
    public synchronized List<String> removeIfDrained(String agentId) {
        SubAgent agent = agents.get(agentId);
        if (agent != null && !agent.getCurrentTasks().isEmpty()) {
            return new ArrayList<>(agent.getCurrentTasks());
        }
        agents.remove(agentId);
        draining.remove(agentId);
        return List.of();
    }

    /**
     * Choose the best agent for a task and reserve a slot on it.
     *
     * @param excludedAgents Agents that must not be chosen
     * @return Copy of the chosen agent after reservation, or empty when no agent qualifies
     */
    public synchronized Optional<SubAgent> reserve(SubAgentTask task, Set<String> excludedAgents) {
        SubAgent best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (SubAgent agent : agents.values()) {
            if (excludedAgents.contains(agent.getAgentId()) || !isEligible(agent, task.getOperation())) {
                continue;
            }
            double score = score(agent, task.getOperation());
            if (score > bestScore) {
                best = agent;
                bestScore = score;
            }
        }
        if (best == null) {
            return Optional.empty();
        }
        best.getCurrentTasks().add(task.getTaskId());
        if (!best.hasSpareCapacity()) {
            best.setStatus(AgentStatus.BUSY);
        }
        return Optional.of(best.copy());
    }

    /**
     * Free the slot a task held on an agent.
     */
    public synchronized boolean release(String agentId, String taskId) {
        SubAgent agent = agents.get(agentId);
        if (agent == null || !agent.getCurrentTasks().remove(taskId)) {
            return false;
        }
        if (agent.getStatus() == AgentStatus.BUSY && agent.hasSpareCapacity()) {
            agent.setStatus(AgentStatus.AVAILABLE);
        }
        return true;
    }

    /**
     * Blend a finished task into the agent's performance figures.
     */
    public synchronized void recordOutcome(String agentId, boolean success, long durationMs, double alpha) {
        SubAgent agent = agents.get(agentId);
        if (agent == null) {
            return;
        }
        AgentPerformance performance = agent.getPerformance();
        if (success) {
            performance.setTasksCompleted(performance.getTasksCompleted() + 1);
            performance.setAverageExecutionTime(performance.getTasksCompleted() == 1
                    ? durationMs
                    : alpha * durationMs + (1 - alpha) * performance.getAverageExecutionTime());
        } else {
            performance.setTasksFailed(performance.getTasksFailed() + 1);
        }
        long total = performance.getTasksCompleted() + performance.getTasksFailed();
        performance.setErrorRate((double) performance.getTasksFailed() / total);
        performance.setSuccessRate(100.0 * performance.getTasksCompleted() / total);
    }

    /**
     * Record a heartbeat. Agents taken offline for missing heartbeats come back, draining agents stay offline.
     *
     * @return false when the agent is unknown
     */
    public synchronized boolean heartbeat(String agentId, Instant now) {
        SubAgent agent = agents.get(agentId);
        if (agent == null) {
            return false;
        }
        agent.setLastHeartbeat(now);
        if (agent.getStatus() == AgentStatus.OFFLINE && !draining.contains(agentId)) {
            agent.setStatus(agent.hasSpareCapacity() ? AgentStatus.AVAILABLE : AgentStatus.BUSY);
        }
        return true;
    }

    /**
     * Take agents offline whose last heartbeat is older than {@code limit}.
     *
     * @return Ids of agents newly taken offline
     */
    public synchronized List<String> markMissedHeartbeats(Instant now, Duration limit) {
        List<String> missed = new ArrayList<>();
        for (SubAgent agent : agents.values()) {
            if (agent.getStatus() == AgentStatus.OFFLINE || agent.getLastHeartbeat() == null) {
                continue;
            }
            if (Duration.between(agent.getLastHeartbeat(), now).compareTo(limit) > 0) {
                agent.setStatus(AgentStatus.OFFLINE);
                missed.add(agent.getAgentId());
            }
        }
        return missed;
    }

    public synchronized int activeTaskCount() {
        return agents.values().stream().mapToInt(agent -> agent.getCurrentTasks().size()).sum();
    }

    public synchronized int totalCapacity() {
        return agents.values().stream().mapToInt(SubAgent::getMaxConcurrentTasks).sum();
    }

    static boolean isEligible(SubAgent agent, String operation) {
        return agent.getStatus().acceptsWork() && agent.hasSpareCapacity() && agent.canHandle(operation);
    }

    /**
     * Selection score: spare capacity times efficiency, boosted for specialized agents.
     */
    static double score(SubAgent agent, String operation) {
        double spare = 1.0 - agent.getLoad();
        double efficiency = agent.getPerformance().getEfficiency() / 100.0;
        boolean specialized = agent.getSpecializations() != null && agent.getSpecializations().contains(operation);
        return spare * efficiency * (specialized ? SPECIALIZATION_BOOST : 1.0);
    }
}
