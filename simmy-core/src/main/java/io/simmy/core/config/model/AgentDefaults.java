package io.simmy.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentDefaults(
    String workspace,
    String provider,
    String model,
    @JsonAlias({"max_tool_iterations"}) int maxToolIterations,
    @JsonAlias({"silence_actions"}) boolean silenceActions,
    boolean verbose,
    @JsonAlias({"log_directory"}) String logDirectory
) {

    public static AgentDefaults defaults() {
        return new AgentDefaults(
            "~/.simmy/workspace",
            "openai",
            "gpt-4o",
            20,
            false,
            false,
            "simmy-agent-logs"
        );
    }

    public AgentDefaults withLogDirectory(String newLogDirectory) {
        return new AgentDefaults(workspace, provider, model, maxToolIterations, silenceActions, verbose, newLogDirectory);
    }
}
