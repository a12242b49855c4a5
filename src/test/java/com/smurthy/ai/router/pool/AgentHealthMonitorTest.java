package com.smurthy.ai.router.pool;

import com.smurthy.ai.router.agents.Agent;
import com.smurthy.ai.router.agents.AgentResponse;
import com.smurthy.ai.router.agents.AgentType;
import com.smurthy.ai.router.config.AgentPoolProperties;
import com.smurthy.ai.router.test.StubAgent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AgentHealthMonitorTest {

    @Test
    @DisplayName("Should mark agents by their health check result")
    void testHealthCheckUpdatesPool() {
        AgentPoolManager poolManager = new AgentPoolManager();
        StubAgent healthy = StubAgent.answering("chat-1", AgentType.CHAT, "ok");
        StubAgent sick = StubAgent.answering("chat-2", AgentType.CHAT, "ok");
        sick.setHealthy(false);
        StubAgent crashing = new StubAgent("rag-1", AgentType.RAG,
                request -> AgentResponse.success("rag-1", AgentType.RAG, "ok")) {
            @Override
            public boolean healthCheck() {
                throw new IllegalStateException("health check timed out");
            }
        };
        poolManager.registerAgent(healthy);
        poolManager.registerAgent(sick);
        poolManager.registerAgent(crashing);

        new AgentHealthMonitor(poolManager, AgentPoolProperties.defaults()).checkAgents();

        assertThat(poolManager.getHealthyAgents()).extracting(Agent::agentId).containsExactly("chat-1");

        sick.setHealthy(true);
        new AgentHealthMonitor(poolManager, AgentPoolProperties.defaults()).checkAgents();

        assertThat(poolManager.getHealthyAgents()).extracting(Agent::agentId).containsExactly("chat-1", "chat-2");
    }

    @Test
    @DisplayName("Disabled health checks leave the pool untouched")
    void testDisabledHealthChecks() {
        AgentPoolManager poolManager = new AgentPoolManager();
        StubAgent sick = StubAgent.answering("chat-1", AgentType.CHAT, "ok");
        sick.setHealthy(false);
        poolManager.registerAgent(sick);

        AgentPoolProperties disabled = new AgentPoolProperties(List.of(), List.of("code"), List.of("classify"),
                false, 30000);
        new AgentHealthMonitor(poolManager, disabled).checkAgents();

        assertThat(poolManager.getHealthyAgents()).hasSize(1);
    }
}
