package com.smurthy.ai.router.routing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.smurthy.ai.router.agents.AgentCapabilityCatalog;
import com.smurthy.ai.router.agents.AgentType;
import com.smurthy.ai.router.config.RouterProperties;
import com.smurthy.ai.router.llm.LlmClassificationClient;
import com.smurthy.ai.router.llm.LlmMessage;
import com.smurthy.ai.router.llm.ResponseContentExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Request classifier.
 *
 * Runs the keyword fast path first and only asks the LLM when the fast path is not
 * confident enough. Any LLM or parsing failure falls back to the fast-path decision,
 * so {@link #classify(String, Map)} never throws. Stateless and safe to share.
 */
@Component
public class QueryRouter {

    private static final Logger log = LoggerFactory.getLogger(QueryRouter.class);

    static final int SHORT_REQUEST_MAX_TOKENS = 10;

    private static final String CLASSIFICATION_SYSTEM_PROMPT = """
            You are a request routing specialist. Decide which specialized agent(s) should handle a user request.

            %s
            STRATEGIES:
            - single_agent: one agent can fully answer the request
            - multi_agent: a primary agent answers first, secondary agents add or synthesize information
            - orchestrator_analysis: the request is complex and needs multi-step planning

            RULES:
            - Use only the agent names listed above
            - Prefer single_agent unless another agent clearly adds value
            - Confidence is a number between 0.0 and 1.0

            Respond ONLY with valid JSON in this exact format:
            {
              "strategy": "single_agent",
              "primary_agent": "chat",
              "secondary_agents": [],
              "confidence": 0.9,
              "reasoning": "Simple greeting, chat agent is sufficient"
            }
            """;

    private final LlmClassificationClient llmClient;
    private final AgentCapabilityCatalog capabilityCatalog;
    private final ResponseContentExtractor contentExtractor;
    private final ObjectMapper objectMapper;
    private final RouterProperties properties;

    public QueryRouter(LlmClassificationClient llmClient,
                       AgentCapabilityCatalog capabilityCatalog,
                       ResponseContentExtractor contentExtractor,
                       ObjectMapper objectMapper,
                       RouterProperties properties) {
        this.llmClient = llmClient;
        this.capabilityCatalog = capabilityCatalog;
        this.contentExtractor = contentExtractor;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * Classify a request into a routing decision.
     *
     * @param request The user's request
     * @param context Optional caller context, may be null
     * @return the routing decision, never null
     */
    public RoutingDecision classify(String request, Map<String, Object> context) {
        RoutingDecision quick = quickRouteAnalysis(request);

        if (quick.confidence() > properties.fastPathThreshold()) {
            log.info("Fast-path routing: {} -> {} (confidence {})",
                    quick.strategy().id(), quick.primaryAgent().id(), quick.confidence());
            return quick;
        }
        if (!properties.llmClassificationEnabled()) {
            log.debug("LLM classification disabled, using pattern decision");
            return quick;
        }

        try {
            RoutingDecision decision = classifyWithLlm(request, context);
            log.info("LLM routing: {} -> {} + {} (confidence {}) | Reasoning: {}",
                    decision.strategy().id(), decision.primaryAgent().id(), decision.secondaryAgents(),
                    decision.confidence(), decision.reasoning());
            return decision;
        } catch (RuntimeException e) {
            log.warn("LLM classification failed, using pattern decision {}: {}",
                    quick.primaryAgent().id(), e.getMessage());
            return quick;
        }
    }

    /**
     * Deterministic keyword classification. A pure function of the request text.
     */
    public RoutingDecision quickRouteAnalysis(String request) {
        Optional<RoutingPatterns.Category> match = RoutingPatterns.firstMatch(request);
        if (match.isPresent()) {
            return match.get().decision();
        }

        int tokenCount = countTokens(request);
        if (tokenCount <= SHORT_REQUEST_MAX_TOKENS) {
            return RoutingDecision.singleAgent(AgentType.CHAT, 0.6,
                    "No pattern matched, short request defaults to chat");
        }
        return RoutingDecision.orchestrator(0.5, "No pattern matched, long request needs analysis");
    }

    /**
     * Rewrite the original request for a secondary agent, seeded with the primary agent's answer.
     */
    public String adaptRequestForSecondary(String originalRequest, String primaryResult, AgentType secondaryType) {
        return switch (secondaryType) {
            case RAG -> String.format("""
                    Synthesize a comprehensive answer to the following question:
                    "%s"

                    Use this information gathered so far:
                    %s
                    """, originalRequest, primaryResult);
            case RESEARCH -> String.format("""
                    Find additional information that complements the answer below.

                    Original question: %s

                    Current answer:
                    %s
                    """, originalRequest, primaryResult);
            case KNOWLEDGE_RETRIEVAL -> String.format(
                    "Look up knowledge base entries related to: %s", originalRequest);
            default -> originalRequest;
        };
    }

    private RoutingDecision classifyWithLlm(String request, Map<String, Object> context) {
        List<LlmMessage> messages = new ArrayList<>();
        messages.add(LlmMessage.system(String.format(CLASSIFICATION_SYSTEM_PROMPT,
                capabilityCatalog.getCapabilityCatalogForLLM())));
        messages.add(LlmMessage.user(buildUserPrompt(request, context)));

        Object providerResponse = llmClient.chatCompletion(messages, properties.llmType(),
                properties.temperature(), properties.maxTokens(), properties.topP());
        String content = contentExtractor.extractResponseContent(providerResponse);
        log.debug("Router LLM response: {}", content);

        return parseRoutingDecision(content);
    }

    private String buildUserPrompt(String request, Map<String, Object> context) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Classify this request:\n\n\"").append(request).append("\"\n");
        if (context != null && !context.isEmpty()) {
            String contextText = context.entrySet().stream()
                    .map(e -> e.getKey() + ": " + e.getValue())
                    .collect(Collectors.joining("\n"));
            prompt.append("\nContext:\n").append(contextText).append("\n");
        }
        return prompt.toString();
    }

    RoutingDecision parseRoutingDecision(String content) {
        // Clean up response - sometimes LLMs add markdown code blocks
        String cleanJson = content
                .replaceAll("```json\\s*", "")
                .replaceAll("```\\s*", "")
                .trim();

        JsonNode node = readJson(cleanJson);
        if (node == null || !node.isObject()) {
            throw new RoutingValidationException("Classification response is not a JSON object");
        }

        RoutingStrategy strategy = RoutingStrategy.fromId(node.path("strategy").asText(null))
                .orElseThrow(() -> new RoutingValidationException(
                        "Unknown strategy: " + node.path("strategy").asText()));

        AgentType primary = routableAgent(node.path("primary_agent").asText(null));

        JsonNode confidence = node.path("confidence");
        if (!confidence.isNumber()) {
            throw new RoutingValidationException("Missing numeric confidence");
        }
        String reasoning = node.path("reasoning").asText("");

        // The orchestrator has no local agent; either half naming it means the orchestrator path
        if (primary == AgentType.ORCHESTRATOR || strategy == RoutingStrategy.ORCHESTRATOR_ANALYSIS) {
            if (primary != AgentType.ORCHESTRATOR || strategy != RoutingStrategy.ORCHESTRATOR_ANALYSIS) {
                log.debug("Normalizing {} decision with primary [{}] to orchestrator analysis",
                        strategy.id(), primary.id());
            }
            try {
                return RoutingDecision.orchestrator(confidence.asDouble(), reasoning);
            } catch (IllegalArgumentException e) {
                throw new RoutingValidationException("Malformed routing decision: " + e.getMessage(), e);
            }
        }

        List<AgentType> secondaries = new ArrayList<>();
        for (JsonNode secondary : node.path("secondary_agents")) {
            AgentType type = routableAgent(secondary.asText(null));
            if (type == AgentType.ORCHESTRATOR) {
                throw new RoutingValidationException("Orchestrator cannot be a secondary agent");
            }
            secondaries.add(type);
        }

        try {
            return new RoutingDecision(strategy, primary, secondaries, confidence.asDouble(), reasoning);
        } catch (IllegalArgumentException e) {
            throw new RoutingValidationException("Malformed routing decision: " + e.getMessage(), e);
        }
    }

    private JsonNode readJson(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RoutingValidationException("Classification response is not valid JSON", e);
        }
    }

    private AgentType routableAgent(String name) {
        AgentType type = AgentType.fromId(name)
                .orElseThrow(() -> new RoutingValidationException("Unknown agent: " + name));
        if (type.isPoolOnly()) {
            throw new RoutingValidationException("Agent is only available through the pool: " + name);
        }
        return type;
    }

    private static int countTokens(String request) {
        if (request == null || request.isBlank()) {
            return 0;
        }
        return request.trim().split("\\s+").length;
    }
}
