package io.simmy.cli;

import io.simmy.core.config.OnboardResult;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "onboard", description = "Write the config file and create the workspace and log directory")
public final class OnboardCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--overwrite", description = "Replace an existing config with the defaults")
    boolean overwrite;

    public OnboardCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        OnboardResult result;
        try {
            result = context.configService().onboard(context.configPath(), overwrite);
        } catch (Exception e) {
            System.err.println("Onboard failed: " + e.getMessage());
            return 1;
        }

        String action = switch (result.outcome()) {
            case CREATED -> "Created config";
            case OVERWRITTEN -> "Reset config to defaults";
            case REFRESHED -> "Updated config with missing defaults";
        };
        System.out.println(action + ": " + result.configPath());
        System.out.println("Workspace: " + result.workspacePath());
        System.out.println("Logs: " + result.logDirectory());
        if (!overwrite && result.outcome() == OnboardResult.Outcome.CREATED) {
            System.out.println("Set OPENAI_API_KEY or OPENROUTER_API_KEY, then run 'simmy chat'.");
        }
        return 0;
    }
}
