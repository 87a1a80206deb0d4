package io.simmy.cli;

import io.simmy.core.agent.Agent;
import io.simmy.core.agent.AgentSettings;
import io.simmy.core.bus.EventBus;
import io.simmy.core.config.model.SimmyConfig;

@FunctionalInterface
public interface AgentFactory {

    /**
     * @param provider preferred provider name, or null to route by model
     */
    Agent create(EventBus bus, SimmyConfig config, String provider, String model, AgentSettings settings);
}
