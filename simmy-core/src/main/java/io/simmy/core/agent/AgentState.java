package io.simmy.core.agent;

public enum AgentState {
    /** Waiting for user input. */
    IDLE,
    /** Awaiting a model response. */
    THINKING,
    /** Dispatching requested tool calls. */
    ACTING
}
