package io.simmy.core.provider;

import io.simmy.core.model.ChatMessage;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class FallbackLlmProvider implements LlmProvider {
    private static final Logger LOG = LoggerFactory.getLogger(FallbackLlmProvider.class);
    private final String name;
    private final List<LlmProvider> chain;

    public FallbackLlmProvider(String name, List<LlmProvider> chain) {
        this.name = name;
        this.chain = List.copyOf(chain);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void startup() throws LlmException {
        List<String> failures = new ArrayList<>();
        for (LlmProvider provider : chain) {
            try {
                provider.startup();
            } catch (LlmException e) {
                LOG.warn("Provider {} failed to start in chain {}: {}", provider.name(), name, e.getMessage());
                failures.add(provider.name());
            }
        }
        if (!chain.isEmpty() && failures.size() == chain.size()) {
            throw new LlmException("no provider in chain " + name + " could start: " + failures);
        }
    }

    @Override
    public LlmResponse chat(String model, List<ChatMessage> messages, List<Map<String, Object>> tools) throws LlmException {
        LlmException last = new LlmException("no providers in fallback chain " + name);
        for (LlmProvider provider : chain) {
            try {
                LlmResponse response = provider.chat(model, messages, tools);
                LOG.debug("Provider {} served request for chain {}", provider.name(), name);
                return response;
            } catch (LlmException e) {
                LOG.warn("Provider {} failed in chain {}: {}", provider.name(), name, truncate(e.getMessage(), 300));
                last = e;
            }
        }
        throw last;
    }

    private String truncate(String value, int max) {
        if (value == null) {
            return "";
        }
        if (value.length() <= max) {
            return value;
        }
        return value.substring(0, max) + "...";
    }
}
