package io.simmy.core.provider;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Providers keyed by name. Lookups ignore case and treat {@code -} and {@code _} alike, so
 * {@code --provider open-router} finds the provider registered as {@code open_router}.
 */
public final class ProviderRegistry {
    private final Map<String, LlmProvider> providers = new ConcurrentHashMap<>();

    public void register(LlmProvider provider) {
        String key = key(provider.name());
        if (key.isEmpty()) {
            throw new IllegalArgumentException("Provider name must not be blank");
        }
        LlmProvider previous = providers.putIfAbsent(key, provider);
        if (previous != null) {
            throw new IllegalStateException("Provider " + provider.name() + " is already registered");
        }
    }

    public Optional<LlmProvider> find(String name) {
        return Optional.ofNullable(providers.get(key(name)));
    }

    public LlmProvider require(String name) {
        return find(name).orElseThrow(() -> new IllegalArgumentException(
            "Unknown provider: " + name + " (registered: " + String.join(", ", names()) + ")"
        ));
    }

    public List<String> names() {
        List<String> names = new ArrayList<>();
        providers.values().forEach(provider -> names.add(provider.name()));
        Collections.sort(names);
        return names;
    }

    private static String key(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    }
}
