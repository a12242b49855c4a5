package com.smurthy.ai.router.execution;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.smurthy.ai.router.routing.RoutingDecision;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Final answer for one request, whatever path produced it.
 *
 * {@code routingStrategy} names the path taken and is meant for observability only.
 *
 * Execution time is reported under {@link #META_EXECUTION_TIME_MS} as a {@code Long} count of
 * milliseconds, measured around the agent call(s).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionResponse(
        ExecutionStatus status,
        String response,
        String routingStrategy,
        List<String> agentsUsed,
        RoutingDecision routing,
        ErrorKind errorKind,
        String error,
        Map<String, Object> metadata
) {
    public static final String SINGLE_AGENT = "single_agent";
    public static final String SINGLE_AGENT_ERROR = "single_agent_error";
    public static final String MULTI_AGENT = "multi_agent";
    public static final String MULTI_AGENT_ERROR = "multi_agent_error";
    public static final String ORCHESTRATOR_FALLBACK = "orchestrator_fallback";
    public static final String FINAL_FALLBACK = "final_fallback";
    public static final String DISTRIBUTED = "distributed";

    public static final String META_AGENT_ID = "agent_id";
    public static final String META_AGENT_TYPE = "agent_type";
    public static final String META_TASK_ID = "task_id";
    /** Wall-clock duration of the agent call(s), in milliseconds. */
    public static final String META_EXECUTION_TIME_MS = "execution_time_ms";
    public static final String META_SYNTHESIZED = "synthesized";

    public ExecutionResponse {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(routingStrategy, "routingStrategy");
        response = response == null ? "" : response;
        agentsUsed = agentsUsed == null ? List.of() : List.copyOf(agentsUsed);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static ExecutionResponse success(String response, String routingStrategy, List<String> agentsUsed,
                                            RoutingDecision routing, Map<String, Object> metadata) {
        return new ExecutionResponse(ExecutionStatus.SUCCESS, response, routingStrategy, agentsUsed, routing,
                null, null, metadata);
    }

    public static ExecutionResponse failure(String response, String routingStrategy, List<String> agentsUsed,
                                            RoutingDecision routing, ErrorKind errorKind, String error,
                                            Map<String, Object> metadata) {
        return new ExecutionResponse(ExecutionStatus.ERROR, response, routingStrategy, agentsUsed, routing,
                errorKind, error, metadata);
    }

    public boolean isSuccess() {
        return status == ExecutionStatus.SUCCESS;
    }
}
