package com.smurthy.ai.router.llm;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Pulls assistant text out of the response shapes chat providers return.
 *
 * Supported shapes:
 * - a plain string
 * - {"message": {"content": "..."}}
 * - {"choices": [{"message": {"content": "..."}}]}
 *
 * Both Java maps/lists and Jackson trees are accepted. Anything else is rendered with toString().
 */
@Component
public class ResponseContentExtractor {

    public String extractResponseContent(Object response) {
        if (response == null) {
            return "";
        }
        if (response instanceof String text) {
            return text;
        }
        if (response instanceof JsonNode node) {
            return fromJsonNode(node);
        }
        if (response instanceof Map<?, ?> map) {
            String content = fromMap(map);
            if (content != null) {
                return content;
            }
        }
        return response.toString();
    }

    private String fromMap(Map<?, ?> map) {
        String content = messageContent(map.get("message"));
        if (content != null) {
            return content;
        }
        if (map.get("choices") instanceof List<?> choices && !choices.isEmpty()
                && choices.get(0) instanceof Map<?, ?> firstChoice) {
            return messageContent(firstChoice.get("message"));
        }
        return null;
    }

    private String messageContent(Object message) {
        if (message instanceof Map<?, ?> messageMap && messageMap.get("content") != null) {
            return messageMap.get("content").toString();
        }
        return null;
    }

    private String fromJsonNode(JsonNode node) {
        if (node.isTextual()) {
            return node.asText();
        }
        JsonNode content = node.path("message").path("content");
        if (content.isTextual()) {
            return content.asText();
        }
        content = node.path("choices").path(0).path("message").path("content");
        if (content.isTextual()) {
            return content.asText();
        }
        return node.toString();
    }
}
