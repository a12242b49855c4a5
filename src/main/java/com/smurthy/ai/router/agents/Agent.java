package com.smurthy.ai.router.agents;

/**
 * A worker that fulfils one request category.
 *
 * Implementations are constructed once at startup and shared across requests,
 * so {@link #processRequest(AgentRequest)} must be safe to call concurrently.
 */
public interface Agent {

    String agentId();

    AgentType agentType();

    AgentResponse processRequest(AgentRequest request);

    /**
     * Liveness check used by the pool health monitor.
     *
     * @return true if the agent can currently serve requests
     */
    default boolean healthCheck() {
        return true;
    }
}
