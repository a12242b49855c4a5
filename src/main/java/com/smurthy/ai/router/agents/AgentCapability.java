package com.smurthy.ai.router.agents;

import java.util.List;

/**
 * Static descriptor of what an agent type is good at, used to build classifier context.
 */
public record AgentCapability(
    AgentType agentType,
    String modelSize,         // "1B", "3B", "7B"
    String specialization,    // One-line description of the agent's job
    List<String> strengths,
    List<String> limitations,
    String resourceUsage      // "low", "medium", "high"
) {
    public AgentCapability {
        strengths = List.copyOf(strengths);
        limitations = List.copyOf(limitations);
    }

    /**
     * Create a concise summary for LLM consumption
     */
    public String toSummary() {
        return String.format("""
            **%s** (model: %s, resources: %s)
            Specialization: %s
            Strengths: %s
            Limitations: %s
            """,
            agentType.id(),
            modelSize,
            resourceUsage,
            specialization,
            String.join(", ", strengths),
            String.join(", ", limitations)
        );
    }
}
