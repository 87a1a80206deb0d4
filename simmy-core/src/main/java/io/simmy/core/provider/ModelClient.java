package io.simmy.core.provider;

import io.simmy.core.model.ChatMessage;
import io.simmy.core.model.ToolCall;
import io.simmy.core.tool.Tool;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Backend-independent model client. Owns the system prompt and turns one provider call into exactly
 * one assistant {@link ChatMessage}: either a terminal reply or a request for tool calls.
 *
 * <p>Retries are the provider's concern. A response with neither content nor tool calls, a tool call
 * without a name, or an unchecked failure inside the provider surfaces as {@link LlmException} instead
 * of reaching the transcript.
 */
public final class ModelClient {
    private static final Logger LOG = LoggerFactory.getLogger(ModelClient.class);

    private final LlmProvider provider;
    private final String model;
    private final AtomicLong generatedCallIds = new AtomicLong();
    private volatile String systemPrompt;

    public ModelClient(LlmProvider provider, String model) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.model = model == null ? "" : model;
    }

    public String providerName() {
        return provider.name();
    }

    public String model() {
        return model;
    }

    public void startup(String prompt) throws LlmException {
        this.systemPrompt = prompt == null ? "" : prompt;
        provider.startup();
        LOG.debug("Model client started with provider {} and model {}", provider.name(), model);
    }

    public String systemPrompt() {
        return systemPrompt;
    }

    public synchronized String appendToSystemPrompt(String text) {
        requireStarted();
        systemPrompt = systemPrompt + "\n" + (text == null ? "" : text);
        return systemPrompt;
    }

    public ChatMessage getResponse(List<ChatMessage> transcript, Collection<Tool> tools) throws LlmException {
        return getResponse(transcript, tools, "");
    }

    /**
     * @param contextSupplement text appended to the system prompt for this call only
     */
    public ChatMessage getResponse(
        List<ChatMessage> transcript,
        Collection<Tool> tools,
        String contextSupplement
    ) throws LlmException {
        requireStarted();
        String prompt = contextSupplement == null || contextSupplement.isBlank()
            ? systemPrompt
            : systemPrompt + "\n\n" + contextSupplement;

        List<ChatMessage> request = new ArrayList<>(transcript.size() + 1);
        request.add(ChatMessage.system(prompt));
        request.addAll(transcript);

        LlmResponse response = call(request, toolDefinitions(tools));
        if (response == null) {
            throw new LlmException("provider " + provider.name() + " returned no response");
        }
        return toMessage(response);
    }

    /**
     * Stateless one-shot completion without tools or transcript.
     */
    public String getTextResponse(String prompt, String oneShotSystemPrompt) throws LlmException {
        List<ChatMessage> request = List.of(
            ChatMessage.system(oneShotSystemPrompt == null ? "" : oneShotSystemPrompt),
            ChatMessage.user(prompt == null ? "" : prompt)
        );
        LlmResponse response = call(request, List.of());
        if (response == null || response.content() == null) {
            return "";
        }
        return response.content();
    }

    private LlmResponse call(List<ChatMessage> request, List<Map<String, Object>> toolDefinitions) throws LlmException {
        try {
            return provider.chat(model, request, toolDefinitions);
        } catch (RuntimeException e) {
            throw new LlmException("provider " + provider.name() + " failed: " + e, e);
        }
    }

    private ChatMessage toMessage(LlmResponse response) throws LlmException {
        if (response.toolCalls().isEmpty()) {
            if (response.content() == null || response.content().isBlank()) {
                throw new LlmException("provider " + provider.name() + " returned neither content nor tool calls");
            }
            return ChatMessage.assistant(response.id(), response.content());
        }

        List<ToolCall> calls = new ArrayList<>(response.toolCalls().size());
        for (ToolCall call : response.toolCalls()) {
            if (call.name().isBlank()) {
                throw new LlmException("provider " + provider.name() + " returned a tool call without a name");
            }
            calls.add(call.id() == null || call.id().isBlank()
                ? call.withId("call_" + generatedCallIds.incrementAndGet())
                : call);
        }
        return ChatMessage.assistantWithToolCalls(response.id(), response.content(), calls);
    }

    private List<Map<String, Object>> toolDefinitions(Collection<Tool> tools) {
        if (tools == null) {
            return List.of();
        }
        return tools.stream()
            .map(tool -> Map.<String, Object>of(
                "type", "function",
                "function", Map.of(
                    "name", tool.name(),
                    "description", tool.description(),
                    "parameters", tool.schema().toMap())))
            .toList();
    }

    private void requireStarted() {
        if (systemPrompt == null) {
            throw new IllegalStateException("Model client has not been started");
        }
    }
}
