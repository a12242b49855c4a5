package com.smurthy.ai.router.agents;

import java.util.Map;
import java.util.Objects;

/**
 * Envelope returned by an agent.
 */
public record AgentResponse(
        Status status,
        Map<String, Object> result,
        String error,
        String agentId,
        AgentType agentType
) {
    public static final String RESULT_RESPONSE = "response";
    public static final String RESULT_CONTENT = "content";

    public enum Status {
        SUCCESS, ERROR
    }

    public AgentResponse {
        Objects.requireNonNull(status, "status");
        result = result == null ? null : Map.copyOf(result);
        if (status == Status.ERROR && (error == null || error.isBlank())) {
            error = "Unknown agent error";
        }
    }

    public static AgentResponse success(String agentId, AgentType agentType, String response) {
        return new AgentResponse(Status.SUCCESS, Map.of(RESULT_RESPONSE, response), null, agentId, agentType);
    }

    public static AgentResponse error(String agentId, AgentType agentType, String error) {
        return new AgentResponse(Status.ERROR, null, error, agentId, agentType);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    /**
     * Text of the agent's answer: the "response" entry, else "content", else the whole result map.
     */
    public String content() {
        if (result == null) {
            return "";
        }
        Object text = result.get(RESULT_RESPONSE);
        if (text == null) {
            text = result.get(RESULT_CONTENT);
        }
        return text != null ? text.toString() : result.toString();
    }
}
