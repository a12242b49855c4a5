package com.smurthy.ai.router.routing;

/**
 * Raised when an LLM classification cannot be turned into a valid {@link RoutingDecision}.
 */
public class RoutingValidationException extends RuntimeException {

    public RoutingValidationException(String message) {
        super(message);
    }

    public RoutingValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
