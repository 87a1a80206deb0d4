package io.simmy.cli;

import io.simmy.core.config.ConfigPaths;
import io.simmy.core.config.model.AgentDefaults;
import io.simmy.core.config.model.ProviderConfig;
import io.simmy.core.config.model.SimmyConfig;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show the effective configuration, environment overrides applied")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        SimmyConfig config;
        try {
            config = context.loadConfig();
        } catch (Exception e) {
            System.err.println("Status failed: " + e.getMessage());
            return 1;
        }

        AgentDefaults defaults = config.agents().defaults();
        row("Config", context.configPath() + (Files.exists(context.configPath()) ? "" : " (not created, using defaults)"));
        row("Workspace", ConfigPaths.resolveWorkspace(defaults.workspace()));
        row("Logs", ConfigPaths.resolveLogDirectory(defaults.logDirectory()));
        row("Provider", defaults.provider());
        row("Model", defaults.model());
        row("Max tool iterations", defaults.maxToolIterations());
        row("Silence actions", defaults.silenceActions());
        row("openai", keyState(config.providers().openai()));
        row("openrouter", keyState(config.providers().openrouter()));
        return 0;
    }

    private static String keyState(ProviderConfig provider) {
        return provider.configured() ? "API key set" : "no API key";
    }

    private static void row(String label, Object value) {
        System.out.printf("%-20s %s%n", label + ":", value);
    }
}
