package com.smurthy.ai.router.config;

import com.smurthy.ai.router.agents.AgentType;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

/**
 * Configuration properties for the distributed agent pool
 */
@ConfigurationProperties(prefix = "agent-pool")
public record AgentPoolProperties(
        List<PoolAgent> agents,
        @DefaultValue({"code", "function", "programming", "development"}) List<String> codeSearchKeywords,
        @DefaultValue({"classify", "categorize", "identify", "tag"}) List<String> classificationKeywords,
        @DefaultValue("true") boolean healthCheckEnabled,
        @DefaultValue("30000") long healthCheckIntervalMs
) {
    public AgentPoolProperties {
        agents = agents == null ? List.of() : List.copyOf(agents);
        codeSearchKeywords = List.copyOf(codeSearchKeywords);
        classificationKeywords = List.copyOf(classificationKeywords);
    }

    public static AgentPoolProperties defaults() {
        return new AgentPoolProperties(List.of(),
                List.of("code", "function", "programming", "development"),
                List.of("classify", "categorize", "identify", "tag"),
                true, 30000);
    }

    /**
     * A pool registration: one agent instance of the given type.
     */
    public record PoolAgent(String id, AgentType type) {
    }
}
