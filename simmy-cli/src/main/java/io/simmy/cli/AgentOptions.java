package io.simmy.cli;

import io.simmy.core.agent.AgentSettings;
import io.simmy.core.config.model.AgentDefaults;
import picocli.CommandLine.Option;

/**
 * Command-line overrides shared by the commands that run the agent.
 */
public final class AgentOptions {

    @Option(names = {"-p", "--provider"}, description = "Provider override")
    String provider;

    @Option(names = {"-m", "--model"}, description = "Model override")
    String model;

    @Option(names = "--verbose", description = "Log full model replies and tool results")
    boolean verbose;

    @Option(names = "--silence-actions", description = "Hide tool and task notices")
    boolean silenceActions;

    String provider(AgentDefaults defaults) {
        return provider != null ? provider : defaults.provider();
    }

    String model(AgentDefaults defaults) {
        return model != null ? model : defaults.model();
    }

    AgentSettings settings(AgentDefaults defaults) {
        return new AgentSettings(
            AgentSettings.DEFAULT_SYSTEM_PROMPT,
            defaults.maxToolIterations(),
            silenceActions || defaults.silenceActions(),
            verbose || defaults.verbose()
        );
    }
}
