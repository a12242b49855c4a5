package com.smurthy.ai.router.execution;

import com.smurthy.ai.router.agents.Agent;
import com.smurthy.ai.router.agents.AgentRequest;
import com.smurthy.ai.router.agents.AgentResponse;
import com.smurthy.ai.router.agents.AgentType;
import com.smurthy.ai.router.agents.FallbackHandler;
import com.smurthy.ai.router.agents.LocalAgentRegistry;
import com.smurthy.ai.router.llm.LlmMessage;
import com.smurthy.ai.router.pool.AgentPoolManager;
import com.smurthy.ai.router.routing.QueryRouter;
import com.smurthy.ai.router.routing.RoutingDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Executes user requests.
 *
 * Classified execution ({@link #executeLegacy}) asks the router for a decision and runs
 * it against the local agents: one agent, a primary followed by secondaries with
 * synthesis, or the orchestrator fallback.
 *
 * Distributed execution ({@link #executeDistributed}) picks a pooled agent and tracks the
 * dispatch as an active task on it for exactly the duration of the call.
 *
 * Neither entry point throws for collaborator failures; every outcome is an
 * {@link ExecutionResponse}. Holds no mutable state of its own.
 */
@Service
public class AgentExecutor {

    private static final Logger log = LoggerFactory.getLogger(AgentExecutor.class);

    static final String FINAL_FALLBACK_MESSAGE =
            "I'm sorry, I wasn't able to process your request right now. Please try again in a moment.";
    static final String NO_SUITABLE_AGENT_MESSAGE = "No suitable agent available to handle this request.";
    static final int MAX_TASK_ID_ATTEMPTS = 5;

    private final QueryRouter router;
    private final LocalAgentRegistry localAgents;
    private final FallbackHandler fallbackHandler;
    private final ResultSynthesizer synthesizer;
    private final AgentPoolManager poolManager;
    private final DistributedAgentSelector agentSelector;
    private final Supplier<String> taskIdGenerator;

    @Autowired
    public AgentExecutor(QueryRouter router,
                         LocalAgentRegistry localAgents,
                         FallbackHandler fallbackHandler,
                         ResultSynthesizer synthesizer,
                         AgentPoolManager poolManager,
                         DistributedAgentSelector agentSelector) {
        this(router, localAgents, fallbackHandler, synthesizer, poolManager, agentSelector,
                AgentExecutor::newTaskId);
    }

    AgentExecutor(QueryRouter router,
                  LocalAgentRegistry localAgents,
                  FallbackHandler fallbackHandler,
                  ResultSynthesizer synthesizer,
                  AgentPoolManager poolManager,
                  DistributedAgentSelector agentSelector,
                  Supplier<String> taskIdGenerator) {
        this.router = router;
        this.localAgents = localAgents;
        this.fallbackHandler = fallbackHandler;
        this.synthesizer = synthesizer;
        this.poolManager = poolManager;
        this.agentSelector = agentSelector;
        this.taskIdGenerator = taskIdGenerator;
    }

    // ==================================================================================
    // CLASSIFIED EXECUTION
    // ==================================================================================

    /**
     * Classify the request and execute the resulting decision against local agents.
     *
     * @param request The user's request
     * @param context Optional caller context, may be null
     * @param chatHistory Optional prior turns, may be null
     */
    public ExecutionResponse executeLegacy(String request, Map<String, Object> context, List<LlmMessage> chatHistory) {
        Map<String, Object> safeContext = context == null ? Map.of() : context;
        List<LlmMessage> safeHistory = chatHistory == null ? List.of() : chatHistory;

        RoutingDecision decision = null;
        try {
            decision = router.classify(request, safeContext);
            log.info("Executing {} strategy with primary agent [{}]",
                    decision.strategy().id(), decision.primaryAgent().id());

            return switch (decision.strategy()) {
                case SINGLE_AGENT -> executeSingleAgent(request, safeContext, safeHistory, decision);
                case MULTI_AGENT -> executeMultiAgent(request, safeContext, safeHistory, decision);
                case ORCHESTRATOR_ANALYSIS -> executeFallback(request, safeContext, safeHistory, decision);
            };
        } catch (RuntimeException e) {
            log.error("Unexpected failure while dispatching request, using fallback", e);
            return executeFallback(request, safeContext, safeHistory, decision);
        }
    }

    private ExecutionResponse executeSingleAgent(String request, Map<String, Object> context,
                                                 List<LlmMessage> chatHistory, RoutingDecision decision) {
        AgentResult result = invokeLocal(decision.primaryAgent(), request, context, chatHistory);
        List<String> agentsUsed = List.of(decision.primaryAgent().id());

        if (!result.success()) {
            log.error("Single agent [{}] failed: {}", decision.primaryAgent().id(), result.error());
            return ExecutionResponse.failure("I encountered an error: " + result.error(),
                    ExecutionResponse.SINGLE_AGENT_ERROR, agentsUsed, decision,
                    result.errorKind(), result.error(), timing(result.executionTimeMs()));
        }
        return ExecutionResponse.success(result.content(), ExecutionResponse.SINGLE_AGENT, agentsUsed,
                decision, timing(result.executionTimeMs()));
    }

    private ExecutionResponse executeMultiAgent(String request, Map<String, Object> context,
                                                List<LlmMessage> chatHistory, RoutingDecision decision) {
        long startTime = System.currentTimeMillis();

        // Primary runs to completion first: its answer seeds every secondary request
        AgentResult primary = invokeLocal(decision.primaryAgent(), request, context, chatHistory);
        if (!primary.success()) {
            log.error("Primary agent [{}] failed, aborting multi-agent execution: {}",
                    decision.primaryAgent().id(), primary.error());
            return ExecutionResponse.failure("I encountered an error: " + primary.error(),
                    ExecutionResponse.MULTI_AGENT_ERROR, List.of(decision.primaryAgent().id()), decision,
                    primary.errorKind(), primary.error(), timing(System.currentTimeMillis() - startTime));
        }

        List<String> agentsUsed = new ArrayList<>();
        agentsUsed.add(decision.primaryAgent().id());

        // Strictly sequential, in declared order
        List<AgentResult> secondaries = new ArrayList<>();
        for (AgentType secondaryType : decision.secondaryAgents()) {
            String adapted = router.adaptRequestForSecondary(request, primary.content(), secondaryType);
            AgentResult secondary = invokeLocal(secondaryType, adapted, context, chatHistory);
            if (secondary.success()) {
                secondaries.add(secondary);
                agentsUsed.add(secondaryType.id());
            } else {
                log.warn("Secondary agent [{}] failed, omitting its contribution: {}",
                        secondaryType.id(), secondary.error());
            }
        }

        Map<String, Object> metadata = timing(System.currentTimeMillis() - startTime);
        String answer;
        try {
            answer = synthesizer.synthesize(primary, secondaries);
            metadata.put(ExecutionResponse.META_SYNTHESIZED, true);
        } catch (RuntimeException e) {
            log.warn("Synthesis failed, returning primary result unmodified", e);
            answer = primary.content();
            metadata.put(ExecutionResponse.META_SYNTHESIZED, false);
        }

        return ExecutionResponse.success(answer, ExecutionResponse.MULTI_AGENT, agentsUsed, decision, metadata);
    }

    /**
     * Terminal path. Never throws: a failing fallback handler becomes a fixed apology.
     */
    private ExecutionResponse executeFallback(String request, Map<String, Object> context,
                                              List<LlmMessage> chatHistory, RoutingDecision decision) {
        long startTime = System.currentTimeMillis();
        List<String> agentsUsed = List.of(AgentType.ORCHESTRATOR.id());
        try {
            String answer = fallbackHandler.respond(request, context, chatHistory);
            return ExecutionResponse.success(answer, ExecutionResponse.ORCHESTRATOR_FALLBACK, agentsUsed,
                    decision, timing(System.currentTimeMillis() - startTime));
        } catch (RuntimeException e) {
            log.error("Fallback handler failed, returning final fallback message", e);
            return ExecutionResponse.failure(FINAL_FALLBACK_MESSAGE, ExecutionResponse.FINAL_FALLBACK, agentsUsed,
                    decision, ErrorKind.TERMINAL_FALLBACK, e.getMessage(),
                    timing(System.currentTimeMillis() - startTime));
        }
    }

    private AgentResult invokeLocal(AgentType type, String request, Map<String, Object> context,
                                    List<LlmMessage> chatHistory) {
        long startTime = System.currentTimeMillis();

        Optional<Agent> agent = localAgents.find(type);
        if (agent.isEmpty()) {
            return AgentResult.failure(type, ErrorKind.VALIDATION,
                    "No local agent registered for type " + type.id(), 0);
        }

        Map<String, Object> payload = new HashMap<>();
        payload.put(AgentRequest.PAYLOAD_REQUEST, request == null ? "" : request);
        payload.put(AgentRequest.PAYLOAD_CONTEXT, context);
        payload.put(AgentRequest.PAYLOAD_CHAT_HISTORY, chatHistory);

        try {
            AgentRequest agentRequest = new AgentRequest(newRequestId(), type, AgentRequest.ACTION_PROCESS,
                    payload, AgentRequest.Priority.NORMAL);
            AgentResponse response = agent.get().processRequest(agentRequest);
            long elapsed = System.currentTimeMillis() - startTime;

            if (response == null || !response.isSuccess()) {
                String error = response == null ? "Agent returned no response" : response.error();
                return AgentResult.failure(type, ErrorKind.COLLABORATOR, error, elapsed);
            }
            return AgentResult.success(type, response.content(), elapsed);

        } catch (RuntimeException e) {
            log.error("Agent [{}] raised an exception", type.id(), e);
            return AgentResult.failure(type, ErrorKind.COLLABORATOR, e.getMessage(),
                    System.currentTimeMillis() - startTime);
        }
    }

    // ==================================================================================
    // DISTRIBUTED EXECUTION
    // ==================================================================================

    /**
     * Dispatch the request to one healthy pooled agent.
     *
     * @param request The user's request
     * @param context Optional caller context, may be null
     * @param preferredAgents Optional agent ids or type ids, in order of preference
     */
    public ExecutionResponse executeDistributed(String request, Map<String, Object> context,
                                                List<String> preferredAgents) {
        Optional<Agent> selected = agentSelector.select(request, preferredAgents);
        if (selected.isEmpty()) {
            log.error("Distributed dispatch failed: no healthy agent in pool");
            return ExecutionResponse.failure(NO_SUITABLE_AGENT_MESSAGE, ExecutionResponse.DISTRIBUTED, List.of(),
                    null, ErrorKind.NO_SUITABLE_AGENT, NO_SUITABLE_AGENT_MESSAGE, Map.of());
        }

        Agent agent = selected.get();
        String agentId = agent.agentId();

        Map<String, Object> metadata = new HashMap<>();
        metadata.put(ExecutionResponse.META_AGENT_ID, agentId);
        metadata.put(ExecutionResponse.META_AGENT_TYPE, agent.agentType().id());

        // Acquired outside the try: the finally below must only release a task this call owns
        String taskId;
        try {
            taskId = acquireTask(agentId);
        } catch (IllegalArgumentException | IllegalStateException e) {
            log.error("Could not register a task on agent [{}]: {}", agentId, e.getMessage());
            return ExecutionResponse.failure("I encountered an error: " + e.getMessage(),
                    ExecutionResponse.DISTRIBUTED, List.of(agentId), null, ErrorKind.COLLABORATOR,
                    e.getMessage(), metadata);
        }
        metadata.put(ExecutionResponse.META_TASK_ID, taskId);

        long startTime = System.currentTimeMillis();
        try {
            log.info("Dispatching task [{}] to agent [{}]", taskId, agentId);

            Map<String, Object> payload = new HashMap<>();
            payload.put(AgentRequest.PAYLOAD_REQUEST, request == null ? "" : request);
            payload.put(AgentRequest.PAYLOAD_CONTEXT, context == null ? Map.of() : context);
            payload.put(AgentRequest.PAYLOAD_TASK_ID, taskId);

            AgentRequest agentRequest = new AgentRequest(taskId, agent.agentType(), AgentRequest.ACTION_PROCESS,
                    payload, AgentRequest.Priority.NORMAL);
            AgentResponse response = agent.processRequest(agentRequest);

            metadata.put(ExecutionResponse.META_EXECUTION_TIME_MS, System.currentTimeMillis() - startTime);
            List<String> agentsUsed = List.of(agentId);

            if (response == null || !response.isSuccess()) {
                String error = response == null ? "Agent returned no response" : response.error();
                log.warn("Task [{}] on agent [{}] returned an error: {}", taskId, agentId, error);
                return ExecutionResponse.failure("I encountered an error: " + error, ExecutionResponse.DISTRIBUTED,
                        agentsUsed, null, ErrorKind.COLLABORATOR, error, metadata);
            }

            log.info("Task [{}] on agent [{}] completed in {}ms", taskId, agentId,
                    metadata.get(ExecutionResponse.META_EXECUTION_TIME_MS));
            return ExecutionResponse.success(response.content(), ExecutionResponse.DISTRIBUTED, agentsUsed, null,
                    metadata);

        } catch (RuntimeException e) {
            metadata.put(ExecutionResponse.META_EXECUTION_TIME_MS, System.currentTimeMillis() - startTime);
            log.error("Task [{}] on agent [{}] failed", taskId, agentId, e);
            return ExecutionResponse.failure("I encountered an error: " + e.getMessage(),
                    ExecutionResponse.DISTRIBUTED, List.of(agentId), null, ErrorKind.COLLABORATOR,
                    e.getMessage(), metadata);
        } finally {
            poolManager.removeActiveTask(agentId, taskId);
        }
    }

    /**
     * Register a fresh task id on the agent, drawing a new id when one is already in flight.
     *
     * @throws IllegalStateException if every attempt collided
     * @throws IllegalArgumentException if the agent left the pool after selection
     */
    private String acquireTask(String agentId) {
        IllegalStateException lastCollision = null;
        for (int attempt = 1; attempt <= MAX_TASK_ID_ATTEMPTS; attempt++) {
            String candidate = taskIdGenerator.get();
            try {
                poolManager.addActiveTask(agentId, candidate);
                return candidate;
            } catch (IllegalStateException e) {
                log.warn("Task id collision on attempt {}: {}", attempt, e.getMessage());
                lastCollision = e;
            }
        }
        throw lastCollision;
    }

    // ==================================================================================
    // HELPERS
    // ==================================================================================

    static String newTaskId() {
        return "task_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }

    private static String newRequestId() {
        return UUID.randomUUID().toString();
    }

    private static Map<String, Object> timing(long elapsedMs) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put(ExecutionResponse.META_EXECUTION_TIME_MS, elapsedMs);
        return metadata;
    }
}
