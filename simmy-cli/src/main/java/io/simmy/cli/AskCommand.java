package io.simmy.cli;

import io.simmy.core.agent.Agent;
import io.simmy.core.bus.InMemoryEventBus;
import io.simmy.core.config.ConfigPaths;
import io.simmy.core.config.model.AgentDefaults;
import io.simmy.core.config.model.SimmyConfig;
import io.simmy.core.log.TranscriptLog;
import io.simmy.core.model.AgentResult;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

@Command(name = "ask", description = "Run a single turn and print the reply")
public final class AskCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Prompt to send")
    String prompt;

    @Mixin
    AgentOptions options = new AgentOptions();

    public AskCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            SimmyConfig config = context.loadConfig();
            AgentDefaults defaults = config.agents().defaults();

            InMemoryEventBus bus = new InMemoryEventBus();
            new TranscriptLog(ConfigPaths.resolveLogDirectory(defaults.logDirectory())).attach(bus);

            Agent agent = context.agentFactory().create(
                bus,
                config,
                options.provider(defaults),
                options.model(defaults),
                options.settings(defaults)
            );
            agent.initialize();
            AgentResult result = agent.respond(prompt);
            if (!result.completed()) {
                System.err.println("Ask failed: " + result.content());
                return 1;
            }
            System.out.println(result.content());
            return 0;
        } catch (Exception e) {
            System.err.println("Ask failed: " + e.getMessage());
            return 1;
        }
    }
}
