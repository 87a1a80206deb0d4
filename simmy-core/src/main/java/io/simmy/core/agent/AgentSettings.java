package io.simmy.core.agent;

public record AgentSettings(
    String systemPrompt,
    int maxToolIterations,
    boolean silenceActions,
    boolean verbose
) {
    public static final String DEFAULT_SYSTEM_PROMPT = "You are Simmy, a helpful assistant. "
        + "Break larger requests into tasks with the task tools, keep their notes up to date, "
        + "and mark them complete once every requirement is met.";

    public AgentSettings {
        maxToolIterations = Math.max(1, maxToolIterations);
        systemPrompt = systemPrompt == null || systemPrompt.isBlank() ? DEFAULT_SYSTEM_PROMPT : systemPrompt;
    }

    public static AgentSettings defaults() {
        return new AgentSettings(DEFAULT_SYSTEM_PROMPT, 20, false, false);
    }
}
