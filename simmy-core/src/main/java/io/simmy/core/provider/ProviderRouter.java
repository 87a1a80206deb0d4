package io.simmy.core.provider;

import java.util.List;
import java.util.Locale;

/**
 * Picks the provider for a turn: an explicit {@code --provider} wins, otherwise the model name decides.
 */
public final class ProviderRouter {
    private static final List<String> OPENAI_MODEL_PREFIXES = List.of("gpt", "o1", "o3", "o4");

    private final ProviderRegistry registry;

    public ProviderRouter(ProviderRegistry registry) {
        this.registry = registry;
    }

    public LlmProvider resolve(String preferredProvider, String model) {
        if (preferredProvider != null && !preferredProvider.isBlank()) {
            return registry.require(preferredProvider);
        }
        return registry.require(providerForModel(model));
    }

    static String providerForModel(String model) {
        String normalized = model == null ? "" : model.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("echo")) {
            return "echo";
        }
        for (String prefix : OPENAI_MODEL_PREFIXES) {
            if (normalized.startsWith(prefix)) {
                return "openai";
            }
        }
        return "openrouter";
    }
}
