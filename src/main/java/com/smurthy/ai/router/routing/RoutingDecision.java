package com.smurthy.ai.router.routing;

import com.smurthy.ai.router.agents.AgentType;

import java.util.List;
import java.util.Objects;

/**
 * Classification output: which agent(s) handle a request and how.
 */
public record RoutingDecision(
    RoutingStrategy strategy,
    AgentType primaryAgent,
    List<AgentType> secondaryAgents,
    double confidence,          // 0.0 - 1.0
    String reasoning
) {
    public RoutingDecision {
        Objects.requireNonNull(strategy, "strategy");
        Objects.requireNonNull(primaryAgent, "primaryAgent");
        secondaryAgents = secondaryAgents == null ? List.of() : List.copyOf(secondaryAgents);
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1]: " + confidence);
        }
        reasoning = reasoning == null ? "" : reasoning;
    }

    public static RoutingDecision singleAgent(AgentType agent, double confidence, String reasoning) {
        return new RoutingDecision(RoutingStrategy.SINGLE_AGENT, agent, List.of(), confidence, reasoning);
    }

    public static RoutingDecision multiAgent(AgentType primary, List<AgentType> secondaries,
                                             double confidence, String reasoning) {
        return new RoutingDecision(RoutingStrategy.MULTI_AGENT, primary, secondaries, confidence, reasoning);
    }

    public static RoutingDecision orchestrator(double confidence, String reasoning) {
        return new RoutingDecision(RoutingStrategy.ORCHESTRATOR_ANALYSIS, AgentType.ORCHESTRATOR,
                List.of(), confidence, reasoning);
    }
}
