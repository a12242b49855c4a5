package com.smurthy.ai.router.agents;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Answer tiers of the failsafe fallback, best first.
 */
public enum FailsafeTier {

    /** Full LLM call with chat history. */
    PRIMARY("primary"),
    /** LLM call with a shortened prompt and no history. */
    SECONDARY("secondary"),
    /** Rule-based canned replies. */
    BASIC("basic"),
    /** Static text; always available. */
    EMERGENCY("emergency");

    private final String id;

    FailsafeTier(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }
}
