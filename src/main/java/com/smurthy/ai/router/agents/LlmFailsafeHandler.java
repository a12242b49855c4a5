package com.smurthy.ai.router.agents;

import com.smurthy.ai.router.llm.LlmMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.UserMessage;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Orchestrator fallback that degrades through {@link FailsafeTier} in order.
 *
 * <ol>
 *   <li>PRIMARY: the LLM as a general assistant, with chat history</li>
 *   <li>SECONDARY: the LLM again with a shortened prompt and no history</li>
 *   <li>BASIC: rule-based replies keyed on the request text</li>
 *   <li>EMERGENCY: static text, always answers</li>
 * </ol>
 *
 * A tier that fails or answers blank is skipped for {@link #RECOVERY_INTERVAL} before it is
 * tried again. This handler does not throw.
 */
public class LlmFailsafeHandler implements FallbackHandler {

    private static final Logger log = LoggerFactory.getLogger(LlmFailsafeHandler.class);

    static final Duration RECOVERY_INTERVAL = Duration.ofSeconds(60);
    static final int SIMPLIFIED_PROMPT_MAX_CHARS = 200;

    private final ChatClient chatClient;
    private final Clock clock;
    private final Map<FailsafeTier, TierStats> tierStats = new EnumMap<>(FailsafeTier.class);

    public LlmFailsafeHandler(ChatClient.Builder chatClientBuilder) {
        this(chatClientBuilder, Clock.systemDefaultZone());
    }

    LlmFailsafeHandler(ChatClient.Builder chatClientBuilder, Clock clock) {
        this.chatClient = chatClientBuilder
                .defaultSystem(AgentPrompts.GENERAL)
                .build();
        this.clock = clock;
        for (FailsafeTier tier : FailsafeTier.values()) {
            tierStats.put(tier, new TierStats());
        }
    }

    @Override
    public String respond(String request, Map<String, Object> context, List<LlmMessage> chatHistory) {
        for (FailsafeTier tier : List.of(FailsafeTier.PRIMARY, FailsafeTier.SECONDARY, FailsafeTier.BASIC)) {
            TierStats stats = tierStats.get(tier);
            if (!stats.isHealthy(clock.instant())) {
                log.debug("Skipping unhealthy fallback tier {}", tier.id());
                continue;
            }

            long start = clock.millis();
            try {
                String answer = answerWith(tier, request, chatHistory);
                if (answer != null && !answer.isBlank()) {
                    stats.recordSuccess(clock.millis() - start);
                    if (tier != FailsafeTier.PRIMARY) {
                        log.info("Fallback answered from {} tier", tier.id());
                    }
                    return answer;
                }
                log.warn("Fallback tier {} returned an empty answer", tier.id());
            } catch (Exception e) {
                log.error("Fallback tier {} failed", tier.id(), e);
            }
            stats.recordFailure(clock.millis() - start, clock.instant());
        }

        log.warn("All fallback tiers unavailable, using emergency response");
        tierStats.get(FailsafeTier.EMERGENCY).recordSuccess(0);
        return FailsafeResponses.emergencyResponse(request, ZonedDateTime.now(clock));
    }

    /**
     * Per-tier health and statistics.
     */
    public FailsafeStatus getSystemStatus() {
        Instant now = clock.instant();
        Map<String, TierStatus> tiers = new LinkedHashMap<>();
        FailsafeTier activeTier = FailsafeTier.EMERGENCY;
        int totalRequests = 0;
        int totalFailures = 0;
        for (FailsafeTier tier : FailsafeTier.values()) {
            TierStatus status = tierStats.get(tier).snapshot(now);
            tiers.put(tier.id(), status);
            totalRequests += status.requests();
            totalFailures += status.failures();
            if (status.healthy() && tier.ordinal() < activeTier.ordinal()) {
                activeTier = tier;
            }
        }
        double successRate = totalRequests == 0 ? 1.0 : (double) (totalRequests - totalFailures) / totalRequests;
        return new FailsafeStatus(tiers, activeTier, totalRequests, totalFailures, successRate);
    }

    /**
     * Take a tier out of rotation as if it had just failed.
     */
    void markUnhealthy(FailsafeTier tier) {
        tierStats.get(tier).markUnhealthy(clock.instant());
    }

    private String answerWith(FailsafeTier tier, String request, List<LlmMessage> chatHistory) {
        return switch (tier) {
            case PRIMARY -> chatClient.prompt()
                    .messages(toMessages(chatHistory))
                    .user(request)
                    .call()
                    .content();
            case SECONDARY -> chatClient.prompt()
                    .user(simplifyPrompt(request))
                    .call()
                    .content();
            case BASIC -> FailsafeResponses.basicResponse(request, ZonedDateTime.now(clock));
            case EMERGENCY -> FailsafeResponses.emergencyResponse(request, ZonedDateTime.now(clock));
        };
    }

    /**
     * Long prompts are cut to their first sentence, or to the first
     * {@value #SIMPLIFIED_PROMPT_MAX_CHARS} characters when that sentence is itself too long.
     */
    static String simplifyPrompt(String request) {
        if (request.length() <= SIMPLIFIED_PROMPT_MAX_CHARS) {
            return request;
        }
        int end = request.indexOf('.');
        String firstSentence = end >= 0 ? request.substring(0, end) : request;
        if (firstSentence.length() < SIMPLIFIED_PROMPT_MAX_CHARS) {
            return firstSentence + ".";
        }
        return request.substring(0, SIMPLIFIED_PROMPT_MAX_CHARS) + "...";
    }

    private static List<Message> toMessages(List<LlmMessage> chatHistory) {
        List<Message> messages = new ArrayList<>();
        if (chatHistory != null) {
            for (LlmMessage turn : chatHistory) {
                messages.add(LlmMessage.ASSISTANT.equals(turn.role())
                        ? new AssistantMessage(turn.content())
                        : new UserMessage(turn.content()));
            }
        }
        return messages;
    }

    public record TierStatus(boolean healthy, int requests, int failures, double failureRate, double averageTimeMs) {
    }

    public record FailsafeStatus(Map<String, TierStatus> tiers,
                                 FailsafeTier activeTier,
                                 int totalRequests,
                                 int totalFailures,
                                 double overallSuccessRate) {
    }

    private static class TierStats {
        private final AtomicInteger requests = new AtomicInteger(0);
        private final AtomicInteger failures = new AtomicInteger(0);
        private final AtomicLong totalTimeMs = new AtomicLong(0);
        private volatile Instant unhealthySince;

        synchronized void recordSuccess(long elapsedMs) {
            requests.incrementAndGet();
            totalTimeMs.addAndGet(elapsedMs);
            unhealthySince = null;
        }

        synchronized void recordFailure(long elapsedMs, Instant now) {
            requests.incrementAndGet();
            failures.incrementAndGet();
            totalTimeMs.addAndGet(elapsedMs);
            unhealthySince = now;
        }

        synchronized void markUnhealthy(Instant now) {
            unhealthySince = now;
        }

        boolean isHealthy(Instant now) {
            Instant since = unhealthySince;
            return since == null || Duration.between(since, now).compareTo(RECOVERY_INTERVAL) >= 0;
        }

        synchronized TierStatus snapshot(Instant now) {
            int total = requests.get();
            int failed = failures.get();
            double failureRate = total == 0 ? 0.0 : (double) failed / total;
            double averageTime = total == 0 ? 0.0 : (double) totalTimeMs.get() / total;
            return new TierStatus(isHealthy(now), total, failed, failureRate, averageTime);
        }
    }
}
