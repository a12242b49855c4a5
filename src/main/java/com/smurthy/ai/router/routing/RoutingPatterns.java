package com.smurthy.ai.router.routing;

import com.smurthy.ai.router.agents.AgentType;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Keyword categories for the deterministic fast path.
 *
 * Categories are checked in declaration order and the first match wins:
 * chat, system commands, research, knowledge. Single words match whole tokens,
 * phrases match as substrings of the lowercased request.
 */
public final class RoutingPatterns {

    public static final Category CHAT = new Category("chat",
            Set.of("hello", "hi", "hey", "howdy", "greetings", "thanks", "thank", "bye", "goodbye"),
            List.of("how are you", "good morning", "good afternoon", "good evening", "what's up",
                    "nice to meet you"),
            RoutingDecision.singleAgent(AgentType.CHAT, 0.9, "Greeting or casual conversation"));

    public static final Category SYSTEM_COMMANDS = new Category("system_commands",
            Set.of("run", "execute", "command", "terminal", "shell", "bash", "ls", "cd", "mkdir", "chmod",
                    "sudo", "install", "uninstall", "ps", "kill", "df", "du", "grep", "systemctl", "restart",
                    "reboot"),
            List.of("disk usage", "disk space", "memory usage", "cpu usage", "list files", "running processes"),
            RoutingDecision.singleAgent(AgentType.SYSTEM_COMMANDS, 0.9, "System command request"));

    public static final Category RESEARCH = new Category("research",
            Set.of("research", "investigate", "latest", "news", "online", "web", "internet", "browse", "compare"),
            List.of("search the web", "look up", "find information", "current events", "recent developments"),
            RoutingDecision.multiAgent(AgentType.RESEARCH, List.of(AgentType.RAG), 0.85,
                    "Research request, synthesized with retrieved documents"));

    public static final Category KNOWLEDGE = new Category("knowledge",
            Set.of("explain", "define", "definition", "documentation", "docs", "knowledge", "manual"),
            List.of("what is", "what are", "how does", "how do i", "tell me about", "according to"),
            RoutingDecision.multiAgent(AgentType.KNOWLEDGE_RETRIEVAL, List.of(AgentType.RAG), 0.85,
                    "Knowledge lookup, synthesized with retrieved documents"));

    /** Evaluation order is part of the routing contract. */
    public static final List<Category> CATEGORIES = List.of(CHAT, SYSTEM_COMMANDS, RESEARCH, KNOWLEDGE);

    private RoutingPatterns() {
    }

    /**
     * @return the first category in {@link #CATEGORIES} matching the request
     */
    public static Optional<Category> firstMatch(String request) {
        if (request == null || request.isBlank()) {
            return Optional.empty();
        }
        String lower = request.toLowerCase(Locale.ROOT);
        Set<String> tokens = tokenize(lower);
        return CATEGORIES.stream()
                .filter(category -> category.matches(lower, tokens))
                .findFirst();
    }

    static Set<String> tokenize(String lower) {
        return Arrays.stream(lower.split("[^a-z0-9]+"))
                .filter(token -> !token.isEmpty())
                .collect(Collectors.toSet());
    }

    /**
     * One fast-path category and the decision it produces.
     */
    public record Category(String name, Set<String> words, List<String> phrases, RoutingDecision decision) {

        boolean matches(String lowerRequest, Set<String> tokens) {
            for (String word : words) {
                if (tokens.contains(word)) {
                    return true;
                }
            }
            for (String phrase : phrases) {
                if (lowerRequest.contains(phrase)) {
                    return true;
                }
            }
            return false;
        }
    }
}
