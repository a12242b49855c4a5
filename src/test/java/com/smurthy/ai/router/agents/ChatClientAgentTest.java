package com.smurthy.ai.router.agents;

import com.smurthy.ai.router.config.AgentPoolProperties;
import com.smurthy.ai.router.llm.LlmMessage;
import com.smurthy.ai.router.pool.AgentHealth;
import com.smurthy.ai.router.pool.AgentHealthMonitor;
import com.smurthy.ai.router.pool.AgentPoolManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.Message;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChatClientAgentTest {

    @Mock
    private ChatClient.Builder builder;

    @Mock
    private ChatClient chatClient;

    @Mock
    private ChatClient.ChatClientRequestSpec requestSpec;

    @Mock
    private ChatClient.CallResponseSpec callSpec;

    private ChatClientAgent agent;

    @BeforeEach
    void setUp() {
        when(builder.defaultSystem(anyString())).thenReturn(builder);
        when(builder.build()).thenReturn(chatClient);
        agent = new ChatClientAgent("local_rag", AgentType.RAG, builder);
    }

    private static AgentRequest request(Map<String, Object> payload) {
        return new AgentRequest("req-1", AgentType.RAG, AgentRequest.ACTION_PROCESS, payload, null);
    }

    @Test
    @DisplayName("Should send history and context to the chat client")
    void testProcessRequest() {
        // Given
        when(chatClient.prompt()).thenReturn(requestSpec);
        when(requestSpec.messages(anyList())).thenReturn(requestSpec);
        when(requestSpec.user(anyString())).thenReturn(requestSpec);
        when(requestSpec.call()).thenReturn(callSpec);
        when(callSpec.content()).thenReturn("Synthesized answer");

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("project", "apollo");
        Map<String, Object> payload = Map.of(
                AgentRequest.PAYLOAD_REQUEST, "summarize the design notes",
                AgentRequest.PAYLOAD_CONTEXT, context,
                AgentRequest.PAYLOAD_CHAT_HISTORY, List.of(LlmMessage.user("hi"), LlmMessage.assistant("hello")));

        // When
        AgentResponse response = agent.processRequest(request(payload));

        // Then
        assertThat(response.isSuccess()).isTrue();
        assertThat(response.content()).isEqualTo("Synthesized answer");
        assertThat(response.agentId()).isEqualTo("local_rag");

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<Message>> history = ArgumentCaptor.forClass(List.class);
        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(requestSpec).messages(history.capture());
        verify(requestSpec).user(prompt.capture());
        assertThat(history.getValue()).hasSize(2);
        assertThat(prompt.getValue()).startsWith("summarize the design notes").contains("- project: apollo");
    }

    @Test
    @DisplayName("Chat client failures become error responses")
    void testProcessRequestFailure() {
        when(chatClient.prompt()).thenThrow(new IllegalStateException("rate limited"));

        AgentResponse response = agent.processRequest(request(Map.of(AgentRequest.PAYLOAD_REQUEST, "hello")));

        assertThat(response.isSuccess()).isFalse();
        assertThat(response.error()).contains("rate limited");
        assertThat(response.agentType()).isEqualTo(AgentType.RAG);
    }

    @Test
    @DisplayName("A null answer is reported as an explicit error")
    void testNullAnswer() {
        when(chatClient.prompt()).thenReturn(requestSpec);
        when(requestSpec.messages(anyList())).thenReturn(requestSpec);
        when(requestSpec.user(anyString())).thenReturn(requestSpec);
        when(requestSpec.call()).thenReturn(callSpec);
        when(callSpec.content()).thenReturn(null);

        AgentResponse response = agent.processRequest(request(Map.of(AgentRequest.PAYLOAD_REQUEST, "hello")));

        assertThat(response.isSuccess()).isFalse();
        assertThat(response.error()).isEqualTo(ChatClientAgent.EMPTY_ANSWER_ERROR);
    }

    @Test
    @DisplayName("Health check reflects whether the model answers")
    void testHealthCheck() {
        when(chatClient.prompt()).thenReturn(requestSpec);
        when(requestSpec.user(ChatClientAgent.HEALTH_CHECK_PROMPT)).thenReturn(requestSpec);
        when(requestSpec.call()).thenReturn(callSpec);
        when(callSpec.content()).thenReturn("OK", "  ");

        assertThat(agent.healthCheck()).isTrue();
        assertThat(agent.healthCheck()).isFalse();
    }

    @Test
    @DisplayName("An unreachable model marks the pooled agent unhealthy")
    void testHealthCheckDrivesPoolHealth() {
        when(chatClient.prompt()).thenThrow(new IllegalStateException("connection refused"));
        AgentPoolManager poolManager = new AgentPoolManager();
        poolManager.registerAgent(agent);

        new AgentHealthMonitor(poolManager, AgentPoolProperties.defaults()).checkAgents();

        assertThat(agent.healthCheck()).isFalse();
        assertThat(poolManager.getAgentInfo("local_rag").orElseThrow().health()).isEqualTo(AgentHealth.UNHEALTHY);
        assertThat(poolManager.getHealthyAgents()).isEmpty();
    }

    @Test
    @DisplayName("Each type gets its own system prompt")
    void testSystemPrompts() {
        assertThat(AgentPrompts.systemPromptFor(AgentType.ORCHESTRATOR)).isEqualTo(AgentPrompts.GENERAL);
        assertThat(AgentPrompts.systemPromptFor(AgentType.RAG))
                .isNotEqualTo(AgentPrompts.systemPromptFor(AgentType.CHAT));
    }
}
