package com.smurthy.ai.router.controllers;

import com.smurthy.ai.router.agents.AgentCapability;
import com.smurthy.ai.router.agents.AgentCapabilityCatalog;
import com.smurthy.ai.router.agents.AgentType;
import com.smurthy.ai.router.agents.FailsafeTier;
import com.smurthy.ai.router.agents.LlmFailsafeHandler;
import com.smurthy.ai.router.pool.AgentHealth;
import com.smurthy.ai.router.pool.AgentPoolManager;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(MonitoringController.class)
class MonitoringControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AgentPoolManager poolManager;

    @MockBean
    private AgentCapabilityCatalog capabilityCatalog;

    @MockBean
    private LlmFailsafeHandler fallbackHandler;

    @Test
    @DisplayName("Should report pool status")
    void testPoolStatus() throws Exception {
        when(poolManager.getPoolStatus()).thenReturn(new AgentPoolManager.PoolStatus(2, 1,
                Map.of("chat-1", AgentHealth.HEALTHY, "rag-1", AgentHealth.UNHEALTHY),
                Map.of("chat-1", 3, "rag-1", 0)));

        mockMvc.perform(get("/monitoring/pool"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalAgents").value(2))
                .andExpect(jsonPath("$.healthyAgents").value(1))
                .andExpect(jsonPath("$.healthByAgent['rag-1']").value("UNHEALTHY"))
                .andExpect(jsonPath("$.activeTasksByAgent['chat-1']").value(3));
    }

    @Test
    @DisplayName("Should list agent capabilities")
    void testCapabilities() throws Exception {
        when(capabilityCatalog.getAllCapabilities()).thenReturn(List.of(
                new AgentCapability(AgentType.CODE_SEARCH, "1B", "Searching source code",
                        List.of("symbol lookup"), List.of("code only"), "medium")));

        mockMvc.perform(get("/monitoring/capabilities"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].agentType").value("code_search"))
                .andExpect(jsonPath("$[0].strengths[0]").value("symbol lookup"));
    }

    @Test
    @DisplayName("Should report fallback tier health")
    void testFallbackStatus() throws Exception {
        Map<String, LlmFailsafeHandler.TierStatus> tiers = new LinkedHashMap<>();
        tiers.put("primary", new LlmFailsafeHandler.TierStatus(false, 4, 2, 0.5, 120.0));
        tiers.put("secondary", new LlmFailsafeHandler.TierStatus(true, 2, 0, 0.0, 80.0));
        when(fallbackHandler.getSystemStatus()).thenReturn(
                new LlmFailsafeHandler.FailsafeStatus(tiers, FailsafeTier.SECONDARY, 6, 2, 4.0 / 6));

        mockMvc.perform(get("/monitoring/fallback"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.activeTier").value("secondary"))
                .andExpect(jsonPath("$.tiers.primary.healthy").value(false))
                .andExpect(jsonPath("$.tiers.primary.failureRate").value(0.5))
                .andExpect(jsonPath("$.totalFailures").value(2));
    }
}
