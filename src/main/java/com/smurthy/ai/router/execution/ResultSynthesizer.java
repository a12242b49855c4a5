package com.smurthy.ai.router.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Combines a primary agent's answer with the answers of secondary agents.
 *
 * The primary text comes first; successful secondary texts follow in execution order
 * under an "Additional Information" heading. Failed secondaries are skipped.
 */
@Component
public class ResultSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(ResultSynthesizer.class);

    static final String ADDITIONAL_INFORMATION_HEADER = "## Additional Information";

    /**
     * @param primary Successful result of the primary agent
     * @param secondaries Secondary results in execution order
     * @return synthesized answer
     */
    public String synthesize(AgentResult primary, List<AgentResult> secondaries) {
        List<AgentResult> successful = secondaries.stream()
                .filter(AgentResult::success)
                .filter(r -> r.content() != null && !r.content().isBlank())
                .toList();

        if (successful.isEmpty()) {
            return primary.content();
        }

        log.debug("Synthesizing primary [{}] with {} secondary results",
                primary.agentType().id(), successful.size());

        String additional = successful.stream()
                .map(r -> r.content().trim())
                .collect(Collectors.joining("\n\n"));

        return primary.content() + "\n\n" + ADDITIONAL_INFORMATION_HEADER + "\n\n" + additional;
    }
}
