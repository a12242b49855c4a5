package com.smurthy.ai.router.llm;

import java.util.Objects;

/**
 * A single chat message exchanged with an LLM: role is "system", "user" or "assistant".
 */
public record LlmMessage(String role, String content) {

    public static final String SYSTEM = "system";
    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";

    public LlmMessage {
        Objects.requireNonNull(role, "role");
        content = content == null ? "" : content;
    }

    public static LlmMessage system(String content) {
        return new LlmMessage(SYSTEM, content);
    }

    public static LlmMessage user(String content) {
        return new LlmMessage(USER, content);
    }

    public static LlmMessage assistant(String content) {
        return new LlmMessage(ASSISTANT, content);
    }
}
