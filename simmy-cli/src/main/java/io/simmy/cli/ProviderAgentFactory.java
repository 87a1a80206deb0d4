package io.simmy.cli;

import io.simmy.core.agency.TaskTracker;
import io.simmy.core.agent.Agent;
import io.simmy.core.agent.AgentSettings;
import io.simmy.core.bus.EventBus;
import io.simmy.core.config.ConfigPaths;
import io.simmy.core.config.model.SimmyConfig;
import io.simmy.core.config.model.WebToolsConfig;
import io.simmy.core.provider.LlmProvider;
import io.simmy.core.provider.ModelClient;
import io.simmy.core.provider.ProviderRouter;
import io.simmy.core.tool.Toolbox;
import io.simmy.core.tool.impl.CoreRoles;
import java.util.List;

/**
 * Builds agents whose model client is resolved through a {@link ProviderRouter} and whose toolbox
 * carries the built-in researcher role.
 */
public final class ProviderAgentFactory implements AgentFactory {
    private final ProviderRouter router;

    public ProviderAgentFactory(ProviderRouter router) {
        this.router = router;
    }

    @Override
    public Agent create(EventBus bus, SimmyConfig config, String provider, String model, AgentSettings settings) {
        LlmProvider llm = router.resolve(provider, model);
        WebToolsConfig web = config.tools().web();
        Toolbox toolbox = new Toolbox(
            List.of(CoreRoles.researcher(web.maxChars(), web.allowPrivateAddresses())),
            List.of()
        );
        return new Agent(
            bus,
            new ModelClient(llm, model),
            toolbox,
            new TaskTracker(bus, settings.silenceActions()),
            settings,
            ConfigPaths.resolveWorkspace(config.agents().defaults().workspace())
        );
    }
}
