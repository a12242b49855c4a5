package com.smurthy.ai.router.pool;

import com.smurthy.ai.router.agents.Agent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of pooled agents with their health and in-flight tasks.
 *
 * This is the only state shared across concurrent requests. All operations are safe
 * to call from any thread. A task id is owned by at most one agent at a time.
 *
 * Enumerations ({@link #getHealthyAgents()}, {@link #getAllAgents()}) are sorted by agent id.
 */
public class AgentPoolManager {

    private static final Logger log = LoggerFactory.getLogger(AgentPoolManager.class);

    private static final Comparator<PooledAgent> BY_AGENT_ID =
            Comparator.comparing(entry -> entry.agent.agentId());

    // Agent id -> pool entry
    private final Map<String, PooledAgent> agents = new ConcurrentHashMap<>();

    // Task id -> agent id currently running it
    private final Map<String, String> taskOwners = new ConcurrentHashMap<>();

    private final Clock clock;

    public AgentPoolManager() {
        this(Clock.systemUTC());
    }

    public AgentPoolManager(Clock clock) {
        this.clock = clock;
    }

    /**
     * Register an agent as healthy. Re-registering an id replaces the handle but keeps its in-flight tasks.
     */
    public void registerAgent(Agent agent) {
        PooledAgent entry = agents.compute(agent.agentId(), (id, existing) -> {
            PooledAgent replacement = new PooledAgent(agent, clock.instant());
            if (existing != null) {
                replacement.activeTasks.addAll(existing.activeTasks);
            }
            return replacement;
        });
        log.info("Registered pool agent [{}] type={} activeTasks={}",
                agent.agentId(), agent.agentType().id(), entry.activeTasks.size());
    }

    public boolean unregisterAgent(String agentId) {
        PooledAgent removed = agents.remove(agentId);
        if (removed == null) {
            return false;
        }
        removed.activeTasks.forEach(taskId -> taskOwners.remove(taskId, agentId));
        log.info("Unregistered pool agent [{}] with {} in-flight tasks", agentId, removed.activeTasks.size());
        return true;
    }

    /**
     * Record the result of a health check.
     */
    public void updateHealth(String agentId, AgentHealth health) {
        PooledAgent entry = agents.get(agentId);
        if (entry == null) {
            log.debug("Health update for unknown agent [{}] ignored", agentId);
            return;
        }
        AgentHealth previous = entry.recordHealth(health, clock.instant());
        if (previous != health) {
            log.warn("Pool agent [{}] health changed: {} -> {}", agentId, previous, health);
        }
    }

    /**
     * @return healthy agents sorted by agent id
     */
    public List<Agent> getHealthyAgents() {
        return agents.values().stream()
                .filter(entry -> entry.health == AgentHealth.HEALTHY)
                .sorted(BY_AGENT_ID)
                .map(entry -> entry.agent)
                .toList();
    }

    /**
     * @return all registered agents sorted by agent id
     */
    public List<Agent> getAllAgents() {
        return agents.values().stream()
                .sorted(BY_AGENT_ID)
                .map(entry -> entry.agent)
                .toList();
    }

    public Optional<PoolAgentInfo> getAgentInfo(String agentId) {
        PooledAgent entry = agents.get(agentId);
        return entry == null ? Optional.empty() : Optional.of(entry.snapshot());
    }

    /**
     * Number of in-flight tasks for an agent; 0 for unknown agents.
     */
    public int getActiveTaskCount(String agentId) {
        PooledAgent entry = agents.get(agentId);
        return entry == null ? 0 : entry.activeTasks.size();
    }

    /**
     * Mark a task as in flight on an agent.
     *
     * @throws IllegalArgumentException if the agent is not registered
     * @throws IllegalStateException if the task id is already in flight
     */
    public void addActiveTask(String agentId, String taskId) {
        PooledAgent entry = agents.get(agentId);
        if (entry == null) {
            throw new IllegalArgumentException("Agent not registered in pool: " + agentId);
        }
        String owner = taskOwners.putIfAbsent(taskId, agentId);
        if (owner != null) {
            throw new IllegalStateException("Task " + taskId + " is already active on agent " + owner);
        }
        entry.activeTasks.add(taskId);
        log.debug("Task [{}] started on [{}] ({} active)", taskId, agentId, entry.activeTasks.size());
    }

    /**
     * Release a task. Removing a task that is not active, or from an unknown agent, is a no-op.
     */
    public void removeActiveTask(String agentId, String taskId) {
        PooledAgent entry = agents.get(agentId);
        if (entry != null && entry.activeTasks.remove(taskId)) {
            log.debug("Task [{}] finished on [{}] ({} active)", taskId, agentId, entry.activeTasks.size());
        }
        taskOwners.remove(taskId, agentId);
    }

    public PoolStatus getPoolStatus() {
        Map<String, Integer> activeTasks = new TreeMap<>();
        Map<String, AgentHealth> health = new TreeMap<>();
        agents.forEach((id, entry) -> {
            activeTasks.put(id, entry.activeTasks.size());
            health.put(id, entry.health);
        });
        long healthy = health.values().stream().filter(h -> h == AgentHealth.HEALTHY).count();
        return new PoolStatus(health.size(), (int) healthy, health, activeTasks);
    }

    /**
     * Summary of the pool for monitoring.
     */
    public record PoolStatus(
            int totalAgents,
            int healthyAgents,
            Map<String, AgentHealth> healthByAgent,
            Map<String, Integer> activeTasksByAgent
    ) {
    }

    private static final class PooledAgent {
        private final Agent agent;
        private final Set<String> activeTasks = ConcurrentHashMap.newKeySet();
        private volatile AgentHealth health = AgentHealth.HEALTHY;
        private volatile Instant lastHealthCheck;

        private PooledAgent(Agent agent, Instant registeredAt) {
            this.agent = agent;
            this.lastHealthCheck = registeredAt;
        }

        private synchronized AgentHealth recordHealth(AgentHealth newHealth, Instant checkedAt) {
            AgentHealth previous = health;
            health = newHealth;
            lastHealthCheck = checkedAt;
            return previous;
        }

        private synchronized PoolAgentInfo snapshot() {
            return new PoolAgentInfo(agent, health, lastHealthCheck, Set.copyOf(activeTasks));
        }
    }
}
