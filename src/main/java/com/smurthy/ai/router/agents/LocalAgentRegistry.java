package com.smurthy.ai.router.agents;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed in-process agents used by classified (non-distributed) execution, one per type.
 */
public class LocalAgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(LocalAgentRegistry.class);

    private final Map<AgentType, Agent> agents;

    public LocalAgentRegistry(Collection<? extends Agent> agents) {
        Map<AgentType, Agent> byType = new EnumMap<>(AgentType.class);
        for (Agent agent : agents) {
            Agent previous = byType.put(agent.agentType(), agent);
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate local agent for type " + agent.agentType().id()
                        + ": " + previous.agentId() + ", " + agent.agentId());
            }
        }
        this.agents = Collections.unmodifiableMap(byType);
        log.info("Local agents registered for types: {}", byType.keySet());
    }

    public Optional<Agent> find(AgentType type) {
        return Optional.ofNullable(agents.get(type));
    }

    public Map<AgentType, Agent> asMap() {
        return agents;
    }
}
