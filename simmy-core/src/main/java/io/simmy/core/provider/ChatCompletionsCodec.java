package io.simmy.core.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.simmy.core.model.ChatMessage;
import io.simmy.core.model.MessageRole;
import io.simmy.core.model.ToolCall;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import okio.BufferedSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wire format of the chat completions protocol: request bodies, plain JSON replies and
 * {@code text/event-stream} replies whose tool call fragments arrive split across events.
 */
final class ChatCompletionsCodec {
    private static final Logger LOG = LoggerFactory.getLogger(ChatCompletionsCodec.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final String DATA_PREFIX = "data:";
    private static final String DONE_MARKER = "[DONE]";

    private final ObjectMapper mapper;
    private final String providerName;

    ChatCompletionsCodec(ObjectMapper mapper, String providerName) {
        this.mapper = mapper;
        this.providerName = providerName;
    }

    String encodeRequest(String model, List<ChatMessage> messages, List<Map<String, Object>> tools)
        throws JsonProcessingException {
        ObjectNode root = mapper.createObjectNode();
        root.put("model", model);
        ArrayNode wireMessages = root.putArray("messages");
        for (ChatMessage message : messages) {
            wireMessages.add(encodeMessage(message));
        }
        root.put("stream", true);
        if (tools != null && !tools.isEmpty()) {
            root.set("tools", mapper.valueToTree(tools));
            root.put("tool_choice", "auto");
        }
        return mapper.writeValueAsString(root);
    }

    private ObjectNode encodeMessage(ChatMessage message) throws JsonProcessingException {
        ObjectNode node = mapper.createObjectNode();
        node.put("role", message.role().name().toLowerCase(Locale.ROOT));
        if (message.hasContent()) {
            node.put("content", message.content());
        } else {
            node.putNull("content");
        }
        if (message.role() == MessageRole.ASSISTANT && message.hasToolCalls()) {
            ArrayNode calls = node.putArray("tool_calls");
            for (ToolCall call : message.toolCalls()) {
                ObjectNode item = calls.addObject();
                item.put("id", call.id());
                item.put("type", "function");
                ObjectNode function = item.putObject("function");
                function.put("name", call.name());
                // the protocol carries arguments as a JSON document inside a string
                function.put("arguments", mapper.writeValueAsString(call.arguments()));
            }
        }
        if (message.role() == MessageRole.TOOL && message.toolCallId() != null && !message.toolCallId().isBlank()) {
            node.put("tool_call_id", message.toolCallId());
        }
        return node;
    }

    LlmResponse decodeJson(String body) throws IOException, LlmException {
        JsonNode root = mapper.readTree(body);
        JsonNode choice = root.path("choices").path(0);
        if (choice.isMissingNode()) {
            throw new LlmException("response has no choices");
        }
        JsonNode message = choice.path("message");
        List<ToolCall> toolCalls = new ArrayList<>();
        int position = 0;
        for (JsonNode item : message.path("tool_calls")) {
            JsonNode function = item.path("function");
            String id = item.path("id").asText("");
            toolCalls.add(new ToolCall(
                id.isBlank() ? "call_" + position : id,
                function.path("name").asText(""),
                decodeArguments(function.path("arguments"))
            ));
            position++;
        }
        return new LlmResponse(textOrNull(root.path("id")), message.path("content").asText(""), toolCalls, usage(root));
    }

    LlmResponse decodeStream(BufferedSource source) throws IOException, LlmException {
        StringBuilder content = new StringBuilder();
        TreeMap<Integer, PendingCall> pending = new TreeMap<>();
        Map<String, Object> usage = Map.of();
        String responseId = null;

        String line;
        while ((line = source.readUtf8Line()) != null) {
            if (!line.startsWith(DATA_PREFIX)) {
                continue;
            }
            String data = line.substring(DATA_PREFIX.length()).trim();
            if (data.isEmpty()) {
                continue;
            }
            if (DONE_MARKER.equals(data)) {
                break;
            }

            JsonNode event = mapper.readTree(data);
            JsonNode error = event.path("error");
            if (!error.isMissingNode() && !error.isNull()) {
                throw new LlmException("stream error: " + error.path("message").asText(error.toString()));
            }
            if (responseId == null) {
                responseId = textOrNull(event.path("id"));
            }
            if (event.hasNonNull("usage")) {
                usage = usage(event);
            }
            for (JsonNode choice : event.path("choices")) {
                JsonNode delta = choice.path("delta");
                if (delta.hasNonNull("content")) {
                    content.append(delta.path("content").asText(""));
                }
                for (JsonNode fragment : delta.path("tool_calls")) {
                    int index = Math.max(fragment.path("index").asInt(0), 0);
                    pending.computeIfAbsent(index, PendingCall::new).absorb(fragment);
                }
            }
        }

        List<ToolCall> toolCalls = new ArrayList<>(pending.size());
        for (PendingCall call : pending.values()) {
            toolCalls.add(new ToolCall(call.id(), call.name, parseArguments(call.arguments.toString())));
        }
        return new LlmResponse(responseId, content.toString(), toolCalls, usage);
    }

    private Map<String, Object> decodeArguments(JsonNode node) {
        if (node.isTextual()) {
            return parseArguments(node.asText());
        }
        if (node.isObject()) {
            return mapper.convertValue(node, MAP_TYPE);
        }
        return Map.of();
    }

    private Map<String, Object> parseArguments(String raw) {
        if (raw == null || raw.isBlank()) {
            return Map.of();
        }
        try {
            return mapper.readValue(raw, MAP_TYPE);
        } catch (IOException e) {
            // the agent's schema check reports the missing arguments back to the model
            LOG.warn("Provider {} returned unparseable tool arguments: {}", providerName, e.getMessage());
            return Map.of();
        }
    }

    private Map<String, Object> usage(JsonNode root) {
        JsonNode usage = root.path("usage");
        if (!usage.isObject()) {
            return Map.of();
        }
        // gateways report counters they could not compute as null
        Map<String, Object> counters = new LinkedHashMap<>();
        usage.fields().forEachRemaining(field -> {
            if (!field.getValue().isNull()) {
                counters.put(field.getKey(), mapper.convertValue(field.getValue(), Object.class));
            }
        });
        return counters;
    }

    private static String textOrNull(JsonNode node) {
        return node.isMissingNode() || node.isNull() ? null : node.asText();
    }

    private static final class PendingCall {
        private final int index;
        private String id = "";
        private String name = "";
        private final StringBuilder arguments = new StringBuilder();

        private PendingCall(int index) {
            this.index = index;
        }

        void absorb(JsonNode fragment) {
            String fragmentId = fragment.path("id").asText("");
            if (id.isBlank() && !fragmentId.isBlank()) {
                id = fragmentId;
            }
            JsonNode function = fragment.path("function");
            String fragmentName = function.path("name").asText("");
            if (!fragmentName.isBlank()) {
                name = fragmentName;
            }
            arguments.append(function.path("arguments").asText(""));
        }

        String id() {
            return id.isBlank() ? "call_" + index : id;
        }
    }
}
