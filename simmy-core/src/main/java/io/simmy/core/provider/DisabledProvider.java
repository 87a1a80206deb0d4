package io.simmy.core.provider;

import io.simmy.core.model.ChatMessage;
import java.util.List;
import java.util.Map;

/**
 * Stands in for a backend with no API key. Both startup and chat fail, which lets a
 * {@link FallbackLlmProvider} move on to the next backend.
 */
public final class DisabledProvider implements LlmProvider {
    private final String name;
    private final String failure;

    public DisabledProvider(String name, String reason) {
        this.name = name;
        String why = reason == null || reason.isBlank() ? "provider is disabled" : reason;
        this.failure = "provider " + name + " is not configured (" + why + ")";
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void startup() throws LlmException {
        throw new LlmException(failure);
    }

    @Override
    public LlmResponse chat(String model, List<ChatMessage> messages, List<Map<String, Object>> tools) throws LlmException {
        throw new LlmException(failure);
    }
}
