package io.simmy.core.model;

/**
 * Outcome of one user turn. {@code completed} is false when the turn was aborted by a backend failure.
 */
public record AgentResult(boolean completed, String content, int toolCallsDispatched) {

    public static AgentResult reply(String content, int toolCallsDispatched) {
        return new AgentResult(true, content, toolCallsDispatched);
    }

    public static AgentResult aborted(String reason, int toolCallsDispatched) {
        return new AgentResult(false, reason, toolCallsDispatched);
    }
}
