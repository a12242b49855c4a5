package com.smurthy.ai.router.pool;

import com.smurthy.ai.router.agents.Agent;

import java.time.Instant;
import java.util.Set;

/**
 * Point-in-time snapshot of one pooled agent.
 *
 * The agent handle is shared, not owned: its lifecycle is managed by whoever registered it.
 */
public record PoolAgentInfo(
        Agent agent,
        AgentHealth health,
        Instant lastHealthCheck,
        Set<String> activeTasks
) {
    public PoolAgentInfo {
        activeTasks = Set.copyOf(activeTasks);
    }

    public String agentId() {
        return agent.agentId();
    }

    public int activeTaskCount() {
        return activeTasks.size();
    }

    public boolean isHealthy() {
        return health == AgentHealth.HEALTHY;
    }
}
