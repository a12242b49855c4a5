package com.smurthy.ai.router.execution;

/**
 * Failure categories surfaced on execution responses.
 */
public enum ErrorKind {
    /** Unknown agent type or malformed routing decision. */
    VALIDATION,
    /** An agent or the LLM failed. */
    COLLABORATOR,
    /** Combining primary and secondary results failed. */
    SYNTHESIS,
    /** Distributed dispatch found no healthy agent. */
    NO_SUITABLE_AGENT,
    /** The terminal fallback itself failed. */
    TERMINAL_FALLBACK
}
