package com.smurthy.ai.router.pool;

import com.smurthy.ai.router.agents.Agent;
import com.smurthy.ai.router.config.AgentPoolProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically checks every pooled agent and records its health.
 */
@Component
public class AgentHealthMonitor {

    private static final Logger log = LoggerFactory.getLogger(AgentHealthMonitor.class);

    private final AgentPoolManager poolManager;
    private final AgentPoolProperties properties;

    public AgentHealthMonitor(AgentPoolManager poolManager, AgentPoolProperties properties) {
        this.poolManager = poolManager;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${agent-pool.health-check-interval-ms:30000}",
            initialDelayString = "${agent-pool.health-check-interval-ms:30000}")
    public void checkAgents() {
        if (!properties.healthCheckEnabled()) {
            return;
        }
        for (Agent agent : poolManager.getAllAgents()) {
            poolManager.updateHealth(agent.agentId(), checkHealth(agent));
        }
        log.debug("Health check finished: {}", poolManager.getPoolStatus());
    }

    private AgentHealth checkHealth(Agent agent) {
        try {
            return agent.healthCheck() ? AgentHealth.HEALTHY : AgentHealth.UNHEALTHY;
        } catch (RuntimeException e) {
            log.warn("Health check failed for [{}]: {}", agent.agentId(), e.getMessage());
            return AgentHealth.UNHEALTHY;
        }
    }
}
