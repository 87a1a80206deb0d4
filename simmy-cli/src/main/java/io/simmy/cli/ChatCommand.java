package io.simmy.cli;

import io.simmy.core.agent.Agent;
import io.simmy.core.agent.ShutdownSignal;
import io.simmy.core.bus.InMemoryEventBus;
import io.simmy.core.config.ConfigPaths;
import io.simmy.core.config.model.AgentDefaults;
import io.simmy.core.config.model.SimmyConfig;
import io.simmy.core.log.TranscriptLog;
import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

@Command(name = "chat", description = "Start an interactive conversation with Simmy")
public final class ChatCommand implements Callable<Integer> {
    private static final Duration REPLY_TIMEOUT = Duration.ofMinutes(10);

    private final CliContext context;

    @Mixin
    AgentOptions options = new AgentOptions();

    @Option(names = "--clear-logs", description = "Truncate agent.log before starting")
    boolean clearLogs;

    public ChatCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        Agent agent = null;
        Thread shutdownHook = null;
        try {
            SimmyConfig config = context.loadConfig();
            AgentDefaults defaults = config.agents().defaults();

            InMemoryEventBus bus = new InMemoryEventBus();
            TranscriptLog transcriptLog = new TranscriptLog(ConfigPaths.resolveLogDirectory(defaults.logDirectory()));
            transcriptLog.attach(bus);
            if (clearLogs) {
                transcriptLog.clear(TranscriptLog.AGENT_LOG);
            }
            transcriptLog.clear(TranscriptLog.THREAD_LOG);

            ConsolePresenter presenter = new ConsolePresenter(System.out, Ansi.AUTO);
            presenter.attach(bus);
            ShutdownSignal shutdown = new ShutdownSignal();
            shutdown.bridge(bus);

            agent = context.agentFactory().create(
                bus,
                config,
                options.provider(defaults),
                options.model(defaults),
                options.settings(defaults)
            );
            agent.start();

            shutdownHook = new Thread(() -> shutdown.request("Signal exit"), "simmy-shutdown");
            Runtime.getRuntime().addShutdownHook(shutdownHook);

            BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            new ChatSession(in, bus, shutdown, transcriptLog, presenter, REPLY_TIMEOUT).run();

            System.out.println("Shutting down agent...");
            return 0;
        } catch (Exception e) {
            System.err.println("Chat failed: " + e.getMessage());
            return 1;
        } finally {
            if (agent != null) {
                agent.stop();
            }
            removeHook(shutdownHook);
        }
    }

    private void removeHook(Thread hook) {
        if (hook == null) {
            return;
        }
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM is already shutting down; the hook has run
        }
    }
}
