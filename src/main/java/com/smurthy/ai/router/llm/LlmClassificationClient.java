package com.smurthy.ai.router.llm;

import java.util.List;

/**
 * Chat-completion collaborator used by the router for request classification.
 *
 * The returned object is provider specific. Callers normalize it with
 * {@link ResponseContentExtractor}.
 */
public interface LlmClassificationClient {

    Object chatCompletion(List<LlmMessage> messages,
                          String llmType,
                          double temperature,
                          int maxTokens,
                          double topP);
}
