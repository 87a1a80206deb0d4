package io.simmy.core.provider;

import io.simmy.core.model.ChatMessage;
import io.simmy.core.model.MessageRole;
import java.util.List;
import java.util.Map;

/**
 * Offline backend for trying the CLI without an API key: answers with the latest user message.
 * Never requests tools.
 */
public final class EchoProvider implements LlmProvider {
    private final String name;

    public EchoProvider(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public LlmResponse chat(String model, List<ChatMessage> messages, List<Map<String, Object>> tools) {
        String reply = "";
        for (int i = messages.size() - 1; i >= 0; i--) {
            if (messages.get(i).role() == MessageRole.USER) {
                reply = messages.get(i).content();
                break;
            }
        }
        return new LlmResponse("[" + name + "] " + reply, List.of(), Map.of("provider", name));
    }
}
