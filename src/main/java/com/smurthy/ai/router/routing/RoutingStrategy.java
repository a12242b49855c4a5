package com.smurthy.ai.router.routing;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * How a request is executed once classified.
 */
public enum RoutingStrategy {

    /** Exactly one agent handles the request. */
    SINGLE_AGENT("single_agent"),

    /** A primary agent runs first, then secondaries refine its answer. */
    MULTI_AGENT("multi_agent"),

    /** The request goes to the orchestrator fallback. */
    ORCHESTRATOR_ANALYSIS("orchestrator_analysis");

    private final String id;

    RoutingStrategy(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    public static Optional<RoutingStrategy> fromId(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (RoutingStrategy strategy : values()) {
            if (strategy.id.equals(normalized)) {
                return Optional.of(strategy);
            }
        }
        return Optional.empty();
    }
}
