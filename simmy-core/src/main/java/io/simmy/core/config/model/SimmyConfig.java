package io.simmy.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SimmyConfig(
    AgentsConfig agents,
    ProvidersConfig providers,
    ToolsConfig tools
) {

    public static SimmyConfig defaults() {
        return new SimmyConfig(
            AgentsConfig.defaultConfig(),
            ProvidersConfig.defaults(),
            ToolsConfig.defaults()
        );
    }

    public SimmyConfig withAgentDefaults(AgentDefaults defaults) {
        return new SimmyConfig(new AgentsConfig(defaults), providers, tools);
    }

    public SimmyConfig withProviders(ProvidersConfig newProviders) {
        return new SimmyConfig(agents, newProviders, tools);
    }
}
