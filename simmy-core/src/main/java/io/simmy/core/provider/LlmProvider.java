package io.simmy.core.provider;

import io.simmy.core.model.ChatMessage;
import java.util.List;
import java.util.Map;

public interface LlmProvider {
    String name();

    /**
     * One-time backend initialization such as capability negotiation.
     */
    default void startup() throws LlmException {
    }

    LlmResponse chat(String model, List<ChatMessage> messages, List<Map<String, Object>> tools) throws LlmException;
}
