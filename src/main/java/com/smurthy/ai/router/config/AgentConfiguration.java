package com.smurthy.ai.router.config;

import com.smurthy.ai.router.agents.Agent;
import com.smurthy.ai.router.agents.AgentType;
import com.smurthy.ai.router.agents.ChatClientAgent;
import com.smurthy.ai.router.agents.LlmFailsafeHandler;
import com.smurthy.ai.router.agents.LocalAgentRegistry;
import com.smurthy.ai.router.llm.LlmClassificationClient;
import com.smurthy.ai.router.llm.SpringAiClassificationClient;
import com.smurthy.ai.router.pool.AgentPoolManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Wires agents, the pool and the LLM collaborators.
 *
 * Every agent is constructed once here and shared by reference; nothing else creates agents.
 * Each agent gets its own ChatClient so system prompts never leak between agents.
 */
@Configuration
public class AgentConfiguration {

    private static final Logger log = LoggerFactory.getLogger(AgentConfiguration.class);

    /**
     * Types served by in-process agents in classified execution. The orchestrator type is
     * served by the fallback handler.
     */
    static final List<AgentType> LOCAL_AGENT_TYPES = List.of(
            AgentType.CHAT,
            AgentType.SYSTEM_COMMANDS,
            AgentType.RAG,
            AgentType.KNOWLEDGE_RETRIEVAL,
            AgentType.RESEARCH
    );

    @Bean
    public LlmClassificationClient llmClassificationClient(ChatModel chatModel, RouterProperties properties) {
        return new SpringAiClassificationClient(chatModel, properties);
    }

    @Bean
    public LocalAgentRegistry localAgentRegistry(ChatModel chatModel) {
        List<Agent> agents = LOCAL_AGENT_TYPES.stream()
                .<Agent>map(type -> new ChatClientAgent("local_" + type.id(), type, ChatClient.builder(chatModel)))
                .toList();
        return new LocalAgentRegistry(agents);
    }

    @Bean
    public LlmFailsafeHandler fallbackHandler(ChatModel chatModel) {
        return new LlmFailsafeHandler(ChatClient.builder(chatModel));
    }

    @Bean
    public AgentPoolManager agentPoolManager(ChatModel chatModel, AgentPoolProperties properties) {
        AgentPoolManager poolManager = new AgentPoolManager();
        for (AgentPoolProperties.PoolAgent definition : properties.agents()) {
            poolManager.registerAgent(
                    new ChatClientAgent(definition.id(), definition.type(), ChatClient.builder(chatModel)));
        }
        log.info("Agent pool initialized with {} agents", properties.agents().size());
        return poolManager;
    }
}
