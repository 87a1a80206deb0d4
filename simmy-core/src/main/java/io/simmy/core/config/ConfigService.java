package io.simmy.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.simmy.core.config.model.AgentDefaults;
import io.simmy.core.config.model.ProvidersConfig;
import io.simmy.core.config.model.SimmyConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Loads the JSON config, filling every field the file omits from {@link SimmyConfig#defaults()}.
 */
public final class ConfigService {
    public static final String ENV_LOG_DIRECTORY = "LOG_DIRECTORY";
    public static final String ENV_OPENAI_API_KEY = "OPENAI_API_KEY";
    public static final String ENV_OPENROUTER_API_KEY = "OPENROUTER_API_KEY";

    private final ObjectMapper mapper = new ObjectMapper();

    public SimmyConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return SimmyConfig.defaults();
        }

        JsonNode defaultsNode = mapper.valueToTree(SimmyConfig.defaults());
        JsonNode existingNode = mapper.readTree(Files.readString(configPath));
        JsonNode merged = deepMerge(defaultsNode, existingNode);
        return mapper.treeToValue(merged, SimmyConfig.class);
    }

    /**
     * Environment values win over the file: {@code LOG_DIRECTORY}, {@code OPENAI_API_KEY},
     * {@code OPENROUTER_API_KEY}. Blank values are ignored.
     */
    public SimmyConfig applyEnvironment(SimmyConfig config, Map<String, String> environment) {
        SimmyConfig result = config;
        String logDirectory = environment.get(ENV_LOG_DIRECTORY);
        if (logDirectory != null && !logDirectory.isBlank()) {
            result = result.withAgentDefaults(result.agents().defaults().withLogDirectory(logDirectory));
        }

        ProvidersConfig providers = result.providers();
        String openAiKey = environment.get(ENV_OPENAI_API_KEY);
        if (openAiKey != null && !openAiKey.isBlank()) {
            providers = new ProvidersConfig(providers.openai().withApiKey(openAiKey), providers.openrouter());
        }
        String openRouterKey = environment.get(ENV_OPENROUTER_API_KEY);
        if (openRouterKey != null && !openRouterKey.isBlank()) {
            providers = new ProvidersConfig(providers.openai(), providers.openrouter().withApiKey(openRouterKey));
        }
        return result.withProviders(providers);
    }

    public void save(Path configPath, SimmyConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        if (configPath.getParent() != null) {
            Files.createDirectories(configPath.getParent());
        }
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json + System.lineSeparator());
    }

    public OnboardResult onboard(Path configPath, boolean overwrite) throws IOException {
        OnboardResult.Outcome outcome;
        if (!Files.exists(configPath)) {
            outcome = OnboardResult.Outcome.CREATED;
        } else if (overwrite) {
            outcome = OnboardResult.Outcome.OVERWRITTEN;
        } else {
            outcome = OnboardResult.Outcome.REFRESHED;
        }

        SimmyConfig config = outcome == OnboardResult.Outcome.REFRESHED ? load(configPath) : SimmyConfig.defaults();
        save(configPath, config);

        AgentDefaults defaults = config.agents().defaults();
        Path workspace = Files.createDirectories(ConfigPaths.resolveWorkspace(defaults.workspace()));
        Path logDirectory = Files.createDirectories(ConfigPaths.resolveLogDirectory(defaults.logDirectory()));
        return new OnboardResult(configPath, workspace, logDirectory, outcome);
    }

    public String toPrettyJson(SimmyConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode existing = merged.get(entry.getKey());
            merged.set(entry.getKey(), deepMerge(existing, entry.getValue()));
        });
        return merged;
    }
}
