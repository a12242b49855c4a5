package com.smurthy.ai.router.agents;

import com.smurthy.ai.router.llm.LlmMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.UserMessage;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Agent answering through a Spring AI chat client with a type-specific system prompt.
 *
 * Failures are reported as error responses rather than thrown. The health check sends a
 * short prompt to the model, so every scheduled check costs one small LLM call.
 */
public class ChatClientAgent implements Agent {

    private static final Logger log = LoggerFactory.getLogger(ChatClientAgent.class);

    static final String HEALTH_CHECK_PROMPT = "Hello, please respond with 'OK' to confirm you're working.";
    static final String EMPTY_ANSWER_ERROR = "Agent returned an empty answer";

    private final String agentId;
    private final AgentType agentType;
    private final ChatClient chatClient;

    public ChatClientAgent(String agentId, AgentType agentType, ChatClient.Builder chatClientBuilder) {
        this.agentId = agentId;
        this.agentType = agentType;
        this.chatClient = chatClientBuilder
                .defaultSystem(AgentPrompts.systemPromptFor(agentType))
                .build();

        log.info("Agent [{}] initialized as {}", agentId, agentType.id());
    }

    @Override
    public String agentId() {
        return agentId;
    }

    @Override
    public AgentType agentType() {
        return agentType;
    }

    @Override
    public AgentResponse processRequest(AgentRequest request) {
        log.debug("[{}] Processing request {}", agentId, request.requestId());
        long startTime = System.currentTimeMillis();

        try {
            String result = chatClient.prompt()
                    .messages(historyMessages(request.payload().get(AgentRequest.PAYLOAD_CHAT_HISTORY)))
                    .user(userPrompt(request))
                    .call()
                    .content();

            if (result == null || result.isBlank()) {
                log.warn("[{}] Empty answer for {}", agentId, request.requestId());
                return AgentResponse.error(agentId, agentType, EMPTY_ANSWER_ERROR);
            }

            log.info("[{}] Completed {} in {}ms", agentId, request.requestId(),
                    System.currentTimeMillis() - startTime);
            return AgentResponse.success(agentId, agentType, result);

        } catch (Exception e) {
            log.error("[{}] Error processing request {}", agentId, request.requestId(), e);
            return AgentResponse.error(agentId, agentType, "Agent failed: " + e.getMessage());
        }
    }

    @Override
    public boolean healthCheck() {
        try {
            String answer = chatClient.prompt()
                    .user(HEALTH_CHECK_PROMPT)
                    .call()
                    .content();
            return answer != null && !answer.isBlank();
        } catch (Exception e) {
            log.warn("[{}] Health check failed: {}", agentId, e.getMessage());
            return false;
        }
    }

    private static String userPrompt(AgentRequest request) {
        if (!(request.payload().get(AgentRequest.PAYLOAD_CONTEXT) instanceof Map<?, ?> context)
                || context.isEmpty()) {
            return request.requestText();
        }
        StringBuilder prompt = new StringBuilder(request.requestText()).append("\n\nContext:");
        context.forEach((key, value) -> prompt.append("\n- ").append(key).append(": ").append(value));
        return prompt.toString();
    }

    private static List<Message> historyMessages(Object history) {
        List<Message> messages = new ArrayList<>();
        if (history instanceof List<?> turns) {
            for (Object turn : turns) {
                if (turn instanceof LlmMessage message) {
                    messages.add(LlmMessage.ASSISTANT.equals(message.role())
                            ? new AssistantMessage(message.content())
                            : new UserMessage(message.content()));
                }
            }
        }
        return messages;
    }
}
