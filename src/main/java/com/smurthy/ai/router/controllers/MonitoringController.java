package com.smurthy.ai.router.controllers;

import com.smurthy.ai.router.agents.AgentCapability;
import com.smurthy.ai.router.agents.AgentCapabilityCatalog;
import com.smurthy.ai.router.agents.LlmFailsafeHandler;
import com.smurthy.ai.router.pool.AgentPoolManager;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Monitoring endpoint
 */
@RestController
@RequestMapping("/monitoring")
class MonitoringController {

    private final AgentPoolManager poolManager;
    private final AgentCapabilityCatalog capabilityCatalog;
    private final LlmFailsafeHandler fallbackHandler;

    public MonitoringController(AgentPoolManager poolManager,
                                AgentCapabilityCatalog capabilityCatalog,
                                LlmFailsafeHandler fallbackHandler) {
        this.poolManager = poolManager;
        this.capabilityCatalog = capabilityCatalog;
        this.fallbackHandler = fallbackHandler;
    }

    @GetMapping("/pool")
    public AgentPoolManager.PoolStatus getPoolStatus() {
        return poolManager.getPoolStatus();
    }

    @GetMapping("/capabilities")
    public List<AgentCapability> getCapabilities() {
        return capabilityCatalog.getAllCapabilities();
    }

    @GetMapping("/fallback")
    public LlmFailsafeHandler.FailsafeStatus getFallbackStatus() {
        return fallbackHandler.getSystemStatus();
    }
}
