package com.smurthy.ai.router.agents;

import com.smurthy.ai.router.llm.LlmMessage;

import java.util.List;
import java.util.Map;

/**
 * Last line of defense for requests no specialized agent takes.
 *
 * Implementations should never throw; callers still guard against it.
 */
public interface FallbackHandler {

    String respond(String request, Map<String, Object> context, List<LlmMessage> chatHistory);
}
