package com.smurthy.ai.router.agents;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only catalog of agent capabilities.
 *
 * Built once at startup and never mutated. Feeds the LLM classification prompt
 * and the monitoring endpoint.
 */
@Service
public class AgentCapabilityCatalog {

    private static final Logger log = LoggerFactory.getLogger(AgentCapabilityCatalog.class);

    private final Map<AgentType, AgentCapability> capabilities;

    public AgentCapabilityCatalog() {
        this(defaultCapabilities());
    }

    public AgentCapabilityCatalog(List<AgentCapability> capabilities) {
        Map<AgentType, AgentCapability> byType = new EnumMap<>(AgentType.class);
        for (AgentCapability capability : capabilities) {
            byType.put(capability.agentType(), capability);
        }
        this.capabilities = Collections.unmodifiableMap(byType);
        log.info("Agent capability catalog initialized with {} agent types", byType.size());
    }

    public Optional<AgentCapability> getCapability(AgentType type) {
        return Optional.ofNullable(capabilities.get(type));
    }

    public List<AgentCapability> getAllCapabilities() {
        return List.copyOf(capabilities.values());
    }

    /**
     * Capabilities of the types request classification may choose from.
     */
    public List<AgentCapability> getRoutableCapabilities() {
        return capabilities.values().stream()
                .filter(c -> !c.agentType().isPoolOnly())
                .toList();
    }

    /**
     * Get routable agents as a formatted catalog for LLM consumption
     */
    public String getCapabilityCatalogForLLM() {
        StringBuilder catalog = new StringBuilder();
        catalog.append("=== AVAILABLE AGENTS ===\n\n");
        for (AgentCapability capability : getRoutableCapabilities()) {
            catalog.append(capability.toSummary()).append("\n");
        }
        return catalog.toString();
    }

    static List<AgentCapability> defaultCapabilities() {
        return List.of(
            new AgentCapability(AgentType.CHAT, "1B",
                "Conversational replies, greetings and short questions",
                List.of("greetings", "small talk", "quick answers", "low latency"),
                List.of("no system access", "no document retrieval", "limited reasoning depth"),
                "low"),
            new AgentCapability(AgentType.SYSTEM_COMMANDS, "1B",
                "Translating requests into shell commands and explaining their output",
                List.of("command generation", "system diagnostics", "file and process operations"),
                List.of("commands need validation before execution", "no long-form answers"),
                "low"),
            new AgentCapability(AgentType.RAG, "3B",
                "Synthesizing answers from retrieved documents",
                List.of("document synthesis", "multi-source summaries", "citations"),
                List.of("depends on retrieved context quality", "slower than chat"),
                "medium"),
            new AgentCapability(AgentType.KNOWLEDGE_RETRIEVAL, "1B",
                "Fast lookup of facts in the knowledge base",
                List.of("fact lookup", "documentation search", "definitions"),
                List.of("no synthesis across sources", "no web access"),
                "low"),
            new AgentCapability(AgentType.RESEARCH, "3B",
                "Web research for current or external information",
                List.of("current events", "comparisons", "external sources"),
                List.of("network dependent", "higher latency"),
                "high"),
            new AgentCapability(AgentType.ORCHESTRATOR, "3B",
                "Complex multi-step requests that need planning",
                List.of("task decomposition", "ambiguous requests", "long instructions"),
                List.of("highest latency", "highest cost"),
                "high"),
            new AgentCapability(AgentType.CODE_SEARCH, "1B",
                "Searching source code for functions, classes and usages",
                List.of("symbol lookup", "code navigation", "accelerated search"),
                List.of("code only", "pool dispatch only"),
                "medium"),
            new AgentCapability(AgentType.CLASSIFICATION, "1B",
                "Classifying and tagging text",
                List.of("categorization", "tagging", "intent detection"),
                List.of("no free-form answers", "pool dispatch only"),
                "low")
        );
    }
}
