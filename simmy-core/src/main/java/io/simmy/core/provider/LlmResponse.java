package io.simmy.core.provider;

import io.simmy.core.model.ToolCall;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record LlmResponse(String id, String content, List<ToolCall> toolCalls, Map<String, Object> usage) {
    public LlmResponse {
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
        // usage maps decoded from JSON may hold null values, which Map.copyOf rejects
        usage = usage == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(usage));
    }

    public LlmResponse(String content, List<ToolCall> toolCalls, Map<String, Object> usage) {
        this(null, content, toolCalls, usage);
    }
}
