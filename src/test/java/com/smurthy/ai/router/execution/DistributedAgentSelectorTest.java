package com.smurthy.ai.router.execution;

import com.smurthy.ai.router.agents.Agent;
import com.smurthy.ai.router.agents.AgentType;
import com.smurthy.ai.router.config.AgentPoolProperties;
import com.smurthy.ai.router.pool.AgentHealth;
import com.smurthy.ai.router.pool.AgentPoolManager;
import com.smurthy.ai.router.test.StubAgent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for DistributedAgentSelector.
 *
 * Tests the selection order: content affinity, caller preference, least loaded.
 */
class DistributedAgentSelectorTest {

    private AgentPoolManager poolManager;
    private DistributedAgentSelector selector;

    @BeforeEach
    void setUp() {
        poolManager = new AgentPoolManager();
        selector = new DistributedAgentSelector(poolManager, AgentPoolProperties.defaults());
    }

    private void register(String id, AgentType type, int activeTasks) {
        poolManager.registerAgent(StubAgent.answering(id, type, "ok"));
        for (int i = 0; i < activeTasks; i++) {
            poolManager.addActiveTask(id, id + "_task_" + i);
        }
    }

    private String selectedId(String request, List<String> preferred) {
        return selector.select(request, preferred).map(Agent::agentId).orElseThrow();
    }

    @Test
    @DisplayName("Should pick the least loaded healthy agent")
    void testLeastLoaded() {
        register("agent-a", AgentType.CHAT, 2);
        register("agent-b", AgentType.CHAT, 0);
        register("agent-c", AgentType.RAG, 1);

        assertThat(selectedId("summarize the meeting notes", null)).isEqualTo("agent-b");
    }

    @Test
    @DisplayName("Least loaded ties go to the lowest agent id")
    void testLeastLoadedTieBreak() {
        register("agent-c", AgentType.CHAT, 1);
        register("agent-b", AgentType.CHAT, 1);
        register("agent-a", AgentType.CHAT, 3);

        assertThat(selectedId("summarize the meeting notes", List.of())).isEqualTo("agent-b");
    }

    @Test
    @DisplayName("Code search affinity beats caller preference and load")
    void testCodeSearchAffinity() {
        register("chat-1", AgentType.CHAT, 0);
        register("npu_code_search", AgentType.CODE_SEARCH, 5);
        register("rag-1", AgentType.RAG, 0);

        String selected = selectedId("find the function that parses dates", List.of("rag-1"));

        assertThat(selected).isEqualTo("npu_code_search");
    }

    @Test
    @DisplayName("Classification keywords pick a classification agent")
    void testClassificationAffinity() {
        register("chat-1", AgentType.CHAT, 0);
        register("classifier-1", AgentType.CLASSIFICATION, 3);

        assertThat(selectedId("Please categorize these support tickets", null)).isEqualTo("classifier-1");
    }

    @Test
    @DisplayName("Affinity without a matching healthy agent falls through to preference")
    void testAffinityFallsThrough() {
        register("chat-1", AgentType.CHAT, 0);
        register("rag-1", AgentType.RAG, 4);
        register("npu_code_search", AgentType.CODE_SEARCH, 0);
        poolManager.updateHealth("npu_code_search", AgentHealth.UNHEALTHY);

        assertThat(selectedId("review this code", List.of("rag"))).isEqualTo("rag-1");
    }

    @Test
    @DisplayName("Should honour preferred agent ids and types in pool order")
    void testPreferredAgents() {
        register("chat-1", AgentType.CHAT, 0);
        register("rag-1", AgentType.RAG, 3);
        register("rag-2", AgentType.RAG, 1);

        assertThat(selectedId("summarize the meeting notes", List.of("rag-2"))).isEqualTo("rag-2");
        assertThat(selectedId("summarize the meeting notes", List.of("missing", "rag"))).isEqualTo("rag-1");
        assertThat(selectedId("summarize the meeting notes", List.of("missing"))).isEqualTo("chat-1");
    }

    @Test
    @DisplayName("Unhealthy agents are never selected")
    void testUnhealthyExcluded() {
        register("agent-a", AgentType.CHAT, 0);
        register("agent-b", AgentType.CHAT, 2);
        poolManager.updateHealth("agent-a", AgentHealth.UNHEALTHY);

        assertThat(selectedId("summarize the meeting notes", List.of("agent-a"))).isEqualTo("agent-b");
    }

    @Test
    @DisplayName("Should return empty when no healthy agent exists")
    void testNoHealthyAgents() {
        assertThat(selector.select("hello", null)).isEmpty();

        register("agent-a", AgentType.CHAT, 0);
        poolManager.updateHealth("agent-a", AgentHealth.UNHEALTHY);

        Optional<Agent> selected = selector.select("hello", List.of("agent-a"));
        assertThat(selected).isEmpty();
    }
}
