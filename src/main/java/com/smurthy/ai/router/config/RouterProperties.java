package com.smurthy.ai.router.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.Map;

/**
 * Configuration properties for request classification
 */
@ConfigurationProperties(prefix = "router")
public record RouterProperties(
        @DefaultValue("0.8") double fastPathThreshold,
        @DefaultValue("true") boolean llmClassificationEnabled,
        @DefaultValue("classification") String llmType,
        @DefaultValue("0.1") double temperature,
        @DefaultValue("300") int maxTokens,
        @DefaultValue("0.9") double topP,
        Map<String, String> models      // llm type -> provider model name
) {
    public RouterProperties {
        models = models == null ? Map.of() : Map.copyOf(models);
    }

    public static RouterProperties defaults() {
        return new RouterProperties(0.8, true, "classification", 0.1, 300, 0.9, Map.of());
    }
}
