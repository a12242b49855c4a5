package com.smurthy.ai.router.agents;

import java.util.Map;
import java.util.Objects;

/**
 * Envelope sent to an agent. Only the envelope is validated; payload contents are
 * the agent's business.
 */
public record AgentRequest(
        String requestId,
        AgentType agentType,
        String action,
        Map<String, Object> payload,
        Priority priority
) {
    public static final String ACTION_PROCESS = "process_request";

    public static final String PAYLOAD_REQUEST = "request";
    public static final String PAYLOAD_CONTEXT = "context";
    public static final String PAYLOAD_CHAT_HISTORY = "chat_history";
    public static final String PAYLOAD_TASK_ID = "task_id";

    public enum Priority {
        LOW, NORMAL, HIGH, URGENT, CRITICAL
    }

    public AgentRequest {
        if (requestId == null || requestId.isBlank()) {
            throw new IllegalArgumentException("requestId must not be blank");
        }
        Objects.requireNonNull(agentType, "agentType");
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("action must not be blank");
        }
        payload = payload == null ? Map.of() : Map.copyOf(payload);
        priority = priority == null ? Priority.NORMAL : priority;
    }

    /**
     * The free-text request carried in the payload, or an empty string.
     */
    public String requestText() {
        Object text = payload.get(PAYLOAD_REQUEST);
        return text == null ? "" : text.toString();
    }
}
