package com.smurthy.ai.router.execution;

import com.smurthy.ai.router.agents.AgentType;

/**
 * Outcome of one agent invocation inside an execution strategy.
 */
public record AgentResult(
        AgentType agentType,
        String content,
        boolean success,
        ErrorKind errorKind,
        String error,
        long executionTimeMs
) {
    public static AgentResult success(AgentType agentType, String content, long executionTimeMs) {
        return new AgentResult(agentType, content, true, null, null, executionTimeMs);
    }

    public static AgentResult failure(AgentType agentType, ErrorKind errorKind, String error, long executionTimeMs) {
        return new AgentResult(agentType, null, false, errorKind, error, executionTimeMs);
    }
}
