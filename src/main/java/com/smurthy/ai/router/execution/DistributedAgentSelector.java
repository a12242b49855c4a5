package com.smurthy.ai.router.execution;

import com.smurthy.ai.router.agents.Agent;
import com.smurthy.ai.router.agents.AgentType;
import com.smurthy.ai.router.config.AgentPoolProperties;
import com.smurthy.ai.router.pool.AgentPoolManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Picks a pooled agent for a distributed request.
 *
 * Policy, in priority order:
 * 1. Content affinity: code-search keywords pick the first healthy CODE_SEARCH agent,
 *    otherwise classification keywords pick the first healthy CLASSIFICATION agent.
 * 2. Caller preference: the first healthy agent whose id or type matches any preferred entry.
 * 3. Least loaded: the healthy agent with the fewest active tasks, ties going to the lowest agent id.
 *
 * Unhealthy agents are never considered.
 */
@Component
public class DistributedAgentSelector {

    private static final Logger log = LoggerFactory.getLogger(DistributedAgentSelector.class);

    private final AgentPoolManager poolManager;
    private final List<String> codeSearchKeywords;
    private final List<String> classificationKeywords;

    public DistributedAgentSelector(AgentPoolManager poolManager, AgentPoolProperties properties) {
        this.poolManager = poolManager;
        this.codeSearchKeywords = lowercase(properties.codeSearchKeywords());
        this.classificationKeywords = lowercase(properties.classificationKeywords());
    }

    /**
     * @return the selected agent, or empty when no healthy agent is available
     */
    public Optional<Agent> select(String request, List<String> preferredAgents) {
        List<Agent> healthy = poolManager.getHealthyAgents();
        if (healthy.isEmpty()) {
            log.warn("No healthy agents in pool");
            return Optional.empty();
        }

        String lower = request == null ? "" : request.toLowerCase(Locale.ROOT);

        if (containsAny(lower, codeSearchKeywords)) {
            Optional<Agent> codeSearch = firstOfType(healthy, AgentType.CODE_SEARCH);
            if (codeSearch.isPresent()) {
                log.debug("Selected [{}] by code-search affinity", codeSearch.get().agentId());
                return codeSearch;
            }
        } else if (containsAny(lower, classificationKeywords)) {
            Optional<Agent> classifier = firstOfType(healthy, AgentType.CLASSIFICATION);
            if (classifier.isPresent()) {
                log.debug("Selected [{}] by classification affinity", classifier.get().agentId());
                return classifier;
            }
        }

        if (preferredAgents != null && !preferredAgents.isEmpty()) {
            for (Agent agent : healthy) {
                if (matchesAny(agent, preferredAgents)) {
                    log.debug("Selected [{}] by caller preference", agent.agentId());
                    return Optional.of(agent);
                }
            }
        }

        return Optional.of(leastLoaded(healthy));
    }

    private Agent leastLoaded(List<Agent> healthy) {
        Agent best = null;
        int bestCount = Integer.MAX_VALUE;
        // Enumeration is sorted by agent id, strict comparison keeps the first on ties
        for (Agent agent : healthy) {
            int count = poolManager.getActiveTaskCount(agent.agentId());
            if (count < bestCount) {
                best = agent;
                bestCount = count;
            }
        }
        log.debug("Selected least loaded agent [{}] with {} active tasks", best.agentId(), bestCount);
        return best;
    }

    private static Optional<Agent> firstOfType(List<Agent> agents, AgentType type) {
        return agents.stream()
                .filter(agent -> agent.agentType() == type)
                .findFirst();
    }

    private static boolean matchesAny(Agent agent, List<String> preferred) {
        for (String entry : preferred) {
            if (entry == null) {
                continue;
            }
            if (entry.equals(agent.agentId())
                    || AgentType.fromId(entry).filter(type -> type == agent.agentType()).isPresent()) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsAny(String text, List<String> keywords) {
        return keywords.stream().anyMatch(text::contains);
    }

    private static List<String> lowercase(List<String> keywords) {
        return keywords.stream()
                .map(k -> k.toLowerCase(Locale.ROOT))
                .toList();
    }
}
