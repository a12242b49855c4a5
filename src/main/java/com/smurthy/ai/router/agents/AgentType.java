package com.smurthy.ai.router.agents;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of agent categories known to the router.
 *
 * Pool-only types are never produced by request classification; they are only
 * reachable through distributed dispatch.
 */
public enum AgentType {

    CHAT("chat", false),
    SYSTEM_COMMANDS("system_commands", false),
    RAG("rag", false),
    KNOWLEDGE_RETRIEVAL("knowledge_retrieval", false),
    RESEARCH("research", false),
    ORCHESTRATOR("orchestrator", false),

    CODE_SEARCH("code_search", true),
    CLASSIFICATION("classification", true);

    private final String id;
    private final boolean poolOnly;

    AgentType(String id, boolean poolOnly) {
        this.id = id;
        this.poolOnly = poolOnly;
    }

    @JsonValue
    public String id() {
        return id;
    }

    public boolean isPoolOnly() {
        return poolOnly;
    }

    /**
     * Resolve a type from its wire id ("system_commands") or enum name, ignoring case
     * and treating '-' and ' ' like '_'.
     */
    public static Optional<AgentType> fromId(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim()
                .toLowerCase(Locale.ROOT)
                .replace('-', '_')
                .replace(' ', '_');
        for (AgentType type : values()) {
            if (type.id.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    static AgentType fromJson(String value) {
        return fromId(value).orElseThrow(() -> new IllegalArgumentException("Unknown agent type: " + value));
    }
}
