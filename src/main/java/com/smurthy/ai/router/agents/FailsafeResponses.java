package com.smurthy.ai.router.agents;

import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Canned replies for the rule-based and emergency tiers of {@link LlmFailsafeHandler}.
 *
 * Both lookups are pure functions of the request and the supplied time.
 */
final class FailsafeResponses {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final DateTimeFormatter LONG_DATE =
            DateTimeFormatter.ofPattern("EEEE, MMMM dd, yyyy 'at' HH:mm:ss", Locale.ENGLISH);

    // Placeholders filled in from the clock
    private static final String NOW = "{now}";
    private static final String NOW_LONG = "{now_long}";

    record BasicRule(String category, Pattern pattern, List<String> replies) {
    }

    static final List<BasicRule> BASIC_RULES = List.of(
            rule("greeting", "\\b(hello|hi|hey|greetings)\\b",
                    "Hello! How can I help you today?",
                    "Hi there! What would you like me to assist you with?",
                    "Greetings! I'm ready to help with your tasks."),
            rule("help", "\\b(help|assist|support)\\b",
                    "I can help you with various tasks including:\n- System automation\n"
                            + "- Research and information gathering\n- File operations\n- Development tasks\n\n"
                            + "What specifically would you like help with?",
                    "I'm here to assist! You can ask me to help with automation, research, coding, or system tasks."),
            rule("status", "\\b(status|health|working)\\b",
                    "I'm operational and ready to help! My language services may be having issues, "
                            + "but I can still assist you.",
                    "System status: basic operations functional. How can I help you today?"),
            rule("time", "\\b(time|date|today)\\b",
                    "The current time is " + NOW,
                    "Current date and time: " + NOW_LONG),
            rule("math", "\\b(calculate|math|compute)\\b|\\d+\\s*[-+*/]\\s*\\d+",
                    "I can help with calculations. Please provide the specific math problem you'd like me to solve.",
                    "For mathematical calculations, please specify the exact computation you need."),
            rule("files", "\\b(files?|director(y|ies)|folders?)\\b",
                    "I can help with file operations including listing, reading, writing, and organizing files. "
                            + "What specific file task do you need?",
                    "File operations available: list files, read content, create files, organize directories. "
                            + "What would you like to do?"),
            rule("system", "\\b(system|install|configure|setup)\\b",
                    "I can assist with system configuration, software installation, and setup tasks. "
                            + "Please specify what you'd like to install or configure.",
                    "System operations available. What specific system task or installation do you need help with?")
    );

    static final List<String> BASIC_DEFAULT_REPLIES = List.of(
            "I understand you need assistance. I'm operating in basic mode right now. "
                    + "Can you please rephrase your request more specifically?",
            "I'm currently in basic operation mode. Please provide a clear, specific request "
                    + "and I'll do my best to help.",
            "I'm here to help! Could you please be more specific about what you need assistance with?"
    );

    static final String EMERGENCY_GREETING =
            "Hello! I'm running in emergency mode due to system issues, but I can still help with basic questions.";
    static final String EMERGENCY_HELP =
            "Emergency help: my systems are degraded. For immediate assistance, please:\n"
                    + "1. Try rephrasing your request\n2. Check the service logs\n"
                    + "3. Restart the service if needed\n4. Contact technical support";
    static final String EMERGENCY_STATUS =
            "Emergency status - " + NOW + ": basic functions operational, language services unavailable.";
    static final String EMERGENCY_ERROR =
            "An error occurred in my primary systems and I'm operating in emergency mode. "
                    + "Your request has been noted and I'll assist as best I can.";
    static final String EMERGENCY_DEFAULT =
            "I'm experiencing technical difficulties but I'm still here to help. "
                    + "Please try again, or contact support if the issue persists.";

    // Checked in insertion order, first hit wins
    private static final Map<Set<String>, String> EMERGENCY_BY_KEYWORDS = new LinkedHashMap<>();

    static {
        EMERGENCY_BY_KEYWORDS.put(Set.of("hello", "hi", "hey", "greetings"), EMERGENCY_GREETING);
        EMERGENCY_BY_KEYWORDS.put(Set.of("help", "assist", "support"), EMERGENCY_HELP);
        EMERGENCY_BY_KEYWORDS.put(Set.of("status", "health", "working"), EMERGENCY_STATUS);
        EMERGENCY_BY_KEYWORDS.put(Set.of("error", "problem", "issue"), EMERGENCY_ERROR);
    }

    private FailsafeResponses() {
    }

    /**
     * Reply from the first matching rule, or a generic basic-mode reply. The same request
     * always picks the same reply within a category.
     */
    static String basicResponse(String request, ZonedDateTime now) {
        String text = request == null ? "" : request;
        String lower = text.toLowerCase(Locale.ROOT).trim();
        List<String> replies = BASIC_DEFAULT_REPLIES;
        for (BasicRule rule : BASIC_RULES) {
            if (rule.pattern().matcher(lower).find()) {
                replies = rule.replies();
                break;
            }
        }
        String reply = replies.get(Math.floorMod(text.hashCode(), replies.size()));
        return fillTime(reply, now);
    }

    static String emergencyResponse(String request, ZonedDateTime now) {
        String lower = request == null ? "" : request.toLowerCase(Locale.ROOT);
        List<String> words = List.of(lower.split("[^a-z]+"));
        for (Map.Entry<Set<String>, String> entry : EMERGENCY_BY_KEYWORDS.entrySet()) {
            if (words.stream().anyMatch(entry.getKey()::contains)) {
                return fillTime(entry.getValue(), now);
            }
        }
        return EMERGENCY_DEFAULT;
    }

    private static String fillTime(String reply, ZonedDateTime now) {
        return reply
                .replace(NOW_LONG, LONG_DATE.format(now))
                .replace(NOW, TIMESTAMP.format(now));
    }

    private static BasicRule rule(String category, String regex, String... replies) {
        return new BasicRule(category, Pattern.compile(regex), List.of(replies));
    }
}
