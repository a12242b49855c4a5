package com.smurthy.ai.router.controllers;

import com.smurthy.ai.router.execution.AgentExecutor;
import com.smurthy.ai.router.execution.ErrorKind;
import com.smurthy.ai.router.execution.ExecutionResponse;
import com.smurthy.ai.router.llm.LlmMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * HTTP entry points for request execution.
 *
 * - POST /agents/execute: classify and execute with local agents
 * - POST /agents/execute/distributed: dispatch to one pooled agent
 */
@RestController
@RequestMapping("/agents")
public class AgentRoutingController {

    private static final Logger log = LoggerFactory.getLogger(AgentRoutingController.class);

    static final String VALIDATION_STRATEGY = "validation";

    private final AgentExecutor executor;

    public AgentRoutingController(AgentExecutor executor) {
        this.executor = executor;
    }

    @PostMapping("/execute")
    public ResponseEntity<ExecutionResponse> execute(@RequestBody ExecuteRequest body) {
        if (!StringUtils.hasText(body.request())) {
            log.warn("Received an empty or null request. Aborting.");
            return ResponseEntity.badRequest().body(invalidRequest());
        }
        return ResponseEntity.ok(executor.executeLegacy(body.request(), body.context(), body.chatHistory()));
    }

    @PostMapping("/execute/distributed")
    public ResponseEntity<ExecutionResponse> executeDistributed(@RequestBody DistributedExecuteRequest body) {
        if (!StringUtils.hasText(body.request())) {
            log.warn("Received an empty or null distributed request. Aborting.");
            return ResponseEntity.badRequest().body(invalidRequest());
        }
        return ResponseEntity.ok(
                executor.executeDistributed(body.request(), body.context(), body.preferredAgents()));
    }

    private static ExecutionResponse invalidRequest() {
        return ExecutionResponse.failure("Please provide a valid request.", VALIDATION_STRATEGY, List.of(),
                null, ErrorKind.VALIDATION, "request must not be blank", Map.of());
    }

    public record ExecuteRequest(
            String request,
            Map<String, Object> context,
            List<LlmMessage> chatHistory
    ) {}

    public record DistributedExecuteRequest(
            String request,
            Map<String, Object> context,
            List<String> preferredAgents
    ) {}
}
