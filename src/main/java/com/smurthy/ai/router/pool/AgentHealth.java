package com.smurthy.ai.router.pool;

/**
 * Liveness of a pooled agent. Unhealthy agents are never selected.
 */
public enum AgentHealth {
    HEALTHY,
    UNHEALTHY
}
