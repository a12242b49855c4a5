package com.smurthy.ai.router.llm;

import com.smurthy.ai.router.config.RouterProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.ChatOptions;

import java.util.List;

/**
 * {@link LlmClassificationClient} backed by a Spring AI chat model.
 *
 * The llm type selects a provider model from {@code router.models}; when no mapping
 * exists the provider's configured default model is used. Returns the assistant text.
 */
public class SpringAiClassificationClient implements LlmClassificationClient {

    private static final Logger log = LoggerFactory.getLogger(SpringAiClassificationClient.class);

    private final ChatClient chatClient;
    private final RouterProperties properties;

    public SpringAiClassificationClient(ChatModel chatModel, RouterProperties properties) {
        // No default system prompt: the router sends its own
        this.chatClient = ChatClient.builder(chatModel).build();
        this.properties = properties;
    }

    @Override
    public Object chatCompletion(List<LlmMessage> messages,
                                 String llmType,
                                 double temperature,
                                 int maxTokens,
                                 double topP) {
        ChatOptions.Builder options = ChatOptions.builder()
                .temperature(temperature)
                .maxTokens(maxTokens)
                .topP(topP);
        String model = properties.models().get(llmType);
        if (model != null) {
            options.model(model);
        }

        log.debug("Classification call: llmType={}, model={}, messages={}", llmType, model, messages.size());

        return chatClient.prompt()
                .messages(toSpringMessages(messages))
                .options(options.build())
                .call()
                .content();
    }

    static List<Message> toSpringMessages(List<LlmMessage> messages) {
        return messages.stream()
                .map(SpringAiClassificationClient::toSpringMessage)
                .toList();
    }

    private static Message toSpringMessage(LlmMessage message) {
        return switch (message.role()) {
            case LlmMessage.SYSTEM -> new SystemMessage(message.content());
            case LlmMessage.ASSISTANT -> new AssistantMessage(message.content());
            default -> new UserMessage(message.content());
        };
    }
}
