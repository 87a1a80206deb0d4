package io.simmy.app;

import io.simmy.cli.AskCommand;
import io.simmy.cli.ChatCommand;
import io.simmy.cli.CliContext;
import io.simmy.cli.OnboardCommand;
import io.simmy.cli.ProviderAgentFactory;
import io.simmy.cli.SimmyCliCommand;
import io.simmy.cli.StatusCommand;
import io.simmy.core.config.ConfigPaths;
import io.simmy.core.config.ConfigService;
import io.simmy.core.config.model.ProviderConfig;
import io.simmy.core.config.model.SimmyConfig;
import io.simmy.core.provider.DisabledProvider;
import io.simmy.core.provider.EchoProvider;
import io.simmy.core.provider.FallbackLlmProvider;
import io.simmy.core.provider.LlmProvider;
import io.simmy.core.provider.OpenAiCompatProvider;
import io.simmy.core.provider.ProviderRegistry;
import io.simmy.core.provider.ProviderRouter;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class SimmyApplication {
    private static final Logger LOG = LoggerFactory.getLogger(SimmyApplication.class);

    private SimmyApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();
        Map<String, String> environment = System.getenv();
        SimmyConfig config = loadConfig(configService, configPath, environment);

        ProviderRegistry providerRegistry = buildProviderRegistry(config);
        CliContext context = new CliContext(
            configService,
            configPath,
            environment,
            new ProviderAgentFactory(new ProviderRouter(providerRegistry))
        );

        CommandLine commandLine = new CommandLine(new SimmyCliCommand());
        commandLine.addSubcommand("chat", new ChatCommand(context));
        commandLine.addSubcommand("ask", new AskCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("onboard", new OnboardCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    static ProviderRegistry buildProviderRegistry(SimmyConfig config) {
        LlmProvider openai = buildOpenAiCompatProvider("openai", config.providers().openai(), "https://api.openai.com/v1");
        LlmProvider openrouter = buildOpenAiCompatProvider(
            "openrouter",
            config.providers().openrouter(),
            "https://openrouter.ai/api/v1"
        );

        ProviderRegistry registry = new ProviderRegistry();
        registry.register(new FallbackLlmProvider("openai", List.of(openai, openrouter)));
        registry.register(new FallbackLlmProvider("openrouter", List.of(openrouter, openai)));
        registry.register(new EchoProvider("echo"));
        return registry;
    }

    private static SimmyConfig loadConfig(ConfigService configService, Path configPath, Map<String, String> environment) {
        try {
            return configService.applyEnvironment(configService.load(configPath), environment);
        } catch (Exception e) {
            LOG.warn("Could not read {}, using defaults: {}", configPath, e.getMessage());
            return configService.applyEnvironment(SimmyConfig.defaults(), environment);
        }
    }

    private static LlmProvider buildOpenAiCompatProvider(String name, ProviderConfig providerConfig, String defaultBase) {
        if (providerConfig != null && providerConfig.configured()) {
            String apiBase = providerConfig.apiBase() == null || providerConfig.apiBase().isBlank()
                ? defaultBase
                : providerConfig.apiBase();
            return new OpenAiCompatProvider(name, providerConfig.apiKey(), apiBase, providerConfig.extraHeaders());
        }
        return new DisabledProvider(name, "missing API key");
    }
}
