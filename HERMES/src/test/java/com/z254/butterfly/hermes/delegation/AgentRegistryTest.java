package com.z254.butterfly.hermes.delegation;

import com.z254.butterfly.hermes.domain.model.AgentPerformance;
import com.z254.butterfly.hermes.domain.model.AgentStatus;
import com.z254.butterfly.hermes.domain.model.SubAgent;
import com.z254.butterfly.hermes.domain.model.SubAgentTask;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for AgentRegistry.
 */
class AgentRegistryTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    private AgentRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new AgentRegistry();
    }

    @Test
    void shouldReserveUpToMaxConcurrentTasks() {
        // Given
        registry.register(agent("a1", 2, "analyze"), NOW);

        // When
        assertThat(registry.reserve(task("t1", "analyze"), Set.of())).isPresent();
        assertThat(registry.reserve(task("t2", "analyze"), Set.of())).isPresent();

        // Then
        assertThat(registry.reserve(task("t3", "analyze"), Set.of())).isEmpty();
        SubAgent stored = registry.get("a1").orElseThrow();
        assertThat(stored.getCurrentTasks()).containsExactly("t1", "t2");
        assertThat(stored.getStatus()).isEqualTo(AgentStatus.BUSY);
    }

    @Test
    void shouldFreeSlotOnRelease() {
        // Given
        registry.register(agent("a1", 1, "analyze"), NOW);
        registry.reserve(task("t1", "analyze"), Set.of());

        // When
        boolean released = registry.release("a1", "t1");

        // Then
        assertThat(released).isTrue();
        assertThat(registry.get("a1").orElseThrow().getStatus()).isEqualTo(AgentStatus.AVAILABLE);
        assertThat(registry.release("a1", "t1")).isFalse();
        assertThat(registry.activeTaskCount()).isZero();
    }

    @Test
    void shouldPreferSpecializedAgents() {
        // Given
        registry.register(agent("generalist", 3, "translate"), NOW);
        SubAgent specialist = agent("specialist", 3, "translate");
        specialist.setSpecializations(Set.of("translate"));
        registry.register(specialist, NOW);

        // When
        SubAgent chosen = registry.reserve(task("t1", "translate"), Set.of()).orElseThrow();

        // Then
        assertThat(chosen.getAgentId()).isEqualTo("specialist");
    }

    @Test
    void shouldPreferAgentsWithSpareCapacityAndEfficiency() {
        // Given
        registry.register(agent("a1", 2, "analyze"), NOW);
        SubAgent slow = agent("a2", 2, "analyze");
        slow.setPerformance(AgentPerformance.builder().efficiency(40).build());
        registry.register(slow, NOW);

        // When
        SubAgent first = registry.reserve(task("t1", "analyze"), Set.of()).orElseThrow();
        SubAgent second = registry.reserve(task("t2", "analyze"), Set.of()).orElseThrow();

        // Then
        assertThat(first.getAgentId()).isEqualTo("a1");
        // a1 at half load scores 0.5, a2 idle scores 0.4
        assertThat(second.getAgentId()).isEqualTo("a1");
        assertThat(AgentRegistry.score(registry.get("a2").orElseThrow(), "analyze")).isCloseTo(0.4, within(0.001));
    }

    @Test
    void shouldSkipExcludedOfflineAndIncapableAgents() {
        // Given
        registry.register(agent("excluded", 3, "analyze"), NOW);
        registry.register(agent("offline", 3, "analyze"), NOW);
        registry.register(agent("other", 3, "billing"), NOW);
        registry.register(agent("wildcard", 3, SubAgent.WILDCARD_CAPABILITY), NOW);
        registry.startDraining("offline");

        // When
        SubAgent chosen = registry.reserve(task("t1", "analyze"), Set.of("excluded")).orElseThrow();

        // Then
        assertThat(chosen.getAgentId()).isEqualTo("wildcard");
    }

    @Test
    void shouldKeepInFlightTasksWhenReRegistering() {
        // Given
        registry.register(agent("a1", 3, "analyze"), NOW);
        registry.reserve(task("t1", "analyze"), Set.of());

        // When
        SubAgent refreshed = registry.register(agent("a1", 5, "analyze", "summarize"), NOW.plusSeconds(10));

        // Then
        assertThat(refreshed.getCurrentTasks()).containsExactly("t1");
        assertThat(refreshed.getMaxConcurrentTasks()).isEqualTo(5);
        assertThat(refreshed.getRegisteredAt()).isEqualTo(NOW);
        assertThat(refreshed.getLastHeartbeat()).isEqualTo(NOW.plusSeconds(10));
    }

    @Test
    void shouldTrackOutcomes() {
        // Given
        registry.register(agent("a1", 3, "analyze"), NOW);

        // When
        registry.recordOutcome("a1", true, 100, 0.5);
        registry.recordOutcome("a1", true, 200, 0.5);
        registry.recordOutcome("a1", false, 50, 0.5);

        // Then
        AgentPerformance performance = registry.get("a1").orElseThrow().getPerformance();
        assertThat(performance.getTasksCompleted()).isEqualTo(2);
        assertThat(performance.getTasksFailed()).isEqualTo(1);
        assertThat(performance.getAverageExecutionTime()).isEqualTo(150.0);
        assertThat(performance.getErrorRate()).isCloseTo(1.0 / 3, within(0.0001));
        assertThat(performance.getSuccessRate()).isCloseTo(200.0 / 3, within(0.0001));
    }

    @Test
    void shouldTakeSilentAgentsOfflineAndReviveThemOnHeartbeat() {
        // Given
        registry.register(agent("quiet", 3, "analyze"), NOW);
        registry.register(agent("chatty", 3, "analyze"), NOW);
        registry.heartbeat("chatty", NOW.plusSeconds(50));

        // When
        List<String> missed = registry.markMissedHeartbeats(NOW.plusSeconds(61), Duration.ofSeconds(60));

        // Then
        assertThat(missed).containsExactly("quiet");
        assertThat(registry.get("quiet").orElseThrow().getStatus()).isEqualTo(AgentStatus.OFFLINE);

        // When
        assertThat(registry.heartbeat("quiet", NOW.plusSeconds(62))).isTrue();

        // Then
        assertThat(registry.get("quiet").orElseThrow().getStatus()).isEqualTo(AgentStatus.AVAILABLE);
        assertThat(registry.heartbeat("unknown", NOW)).isFalse();
    }

    @Test
    void shouldKeepDrainingAgentOfflineUntilItHoldsNoTask() {
        // Given
        registry.register(agent("a1", 3, "analyze"), NOW);
        registry.reserve(task("t1", "analyze"), Set.of());

        // When
        assertThat(registry.startDraining("a1")).contains(List.of("t1"));
        registry.heartbeat("a1", NOW.plusSeconds(1));
        registry.register(agent("a1", 3, "analyze"), NOW.plusSeconds(2));

        // Then
        assertThat(registry.get("a1").orElseThrow().getStatus()).isEqualTo(AgentStatus.OFFLINE);
        assertThat(registry.reserve(task("t2", "analyze"), Set.of())).isEmpty();
        assertThat(registry.removeIfDrained("a1")).containsExactly("t1");
        assertThat(registry.contains("a1")).isTrue();

        // When
        registry.release("a1", "t1");

        // Then
        assertThat(registry.removeIfDrained("a1")).isEmpty();
        assertThat(registry.contains("a1")).isFalse();
        assertThat(registry.isDraining("a1")).isFalse();
        assertThat(registry.startDraining("a1")).isEmpty();
    }

    @Test
    void shouldReportCapacity() {
        // Given
        registry.register(agent("a1", 2, "analyze"), NOW);
        registry.register(agent("a2", 3, "analyze"), NOW);
        registry.reserve(task("t1", "analyze"), Set.of());

        // Then
        assertThat(registry.totalCapacity()).isEqualTo(5);
        assertThat(registry.activeTaskCount()).isEqualTo(1);
        assertThat(registry.size()).isEqualTo(2);
    }

    private SubAgent agent(String agentId, int maxConcurrentTasks, String... capabilities) {
        return SubAgent.builder()
                .agentId(agentId)
                .serverId("server-1")
                .capabilities(new java.util.LinkedHashSet<>(List.of(capabilities)))
                .maxConcurrentTasks(maxConcurrentTasks)
                .build();
    }

    private SubAgentTask task(String taskId, String operation) {
        return SubAgentTask.builder().taskId(taskId).operation(operation).build();
    }
}
