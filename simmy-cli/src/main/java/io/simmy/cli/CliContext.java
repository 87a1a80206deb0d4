package io.simmy.cli;

import io.simmy.core.config.ConfigService;
import io.simmy.core.config.model.SimmyConfig;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

public record CliContext(
    ConfigService configService,
    Path configPath,
    Map<String, String> environment,
    AgentFactory agentFactory
) {
    public CliContext {
        environment = environment == null ? Map.of() : Map.copyOf(environment);
    }

    public CliContext(ConfigService configService, Path configPath, AgentFactory agentFactory) {
        this(configService, configPath, Map.of(), agentFactory);
    }

    /**
     * Loads the config file and applies environment overrides on top.
     */
    public SimmyConfig loadConfig() throws IOException {
        return configService.applyEnvironment(configService.load(configPath), environment);
    }
}
