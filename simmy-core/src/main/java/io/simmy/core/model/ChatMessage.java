package io.simmy.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One transcript entry. {@code content} is null only for an assistant entry that carries nothing
 * but tool calls.
 */
public record ChatMessage(String id, MessageRole role, String content, String toolCallId, List<ToolCall> toolCalls) {

    public ChatMessage {
        Objects.requireNonNull(role, "role must not be null");
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
        if (content == null && toolCalls.isEmpty()) {
            content = "";
        }
    }

    public static ChatMessage system(String content) {
        return new ChatMessage(null, MessageRole.SYSTEM, content, null, List.of());
    }

    public static ChatMessage user(String content) {
        return new ChatMessage(null, MessageRole.USER, content, null, List.of());
    }

    public static ChatMessage assistant(String content) {
        return new ChatMessage(null, MessageRole.ASSISTANT, content, null, List.of());
    }

    public static ChatMessage assistant(String id, String content) {
        return new ChatMessage(id, MessageRole.ASSISTANT, content, null, List.of());
    }

    /**
     * @param content text sent alongside the calls; blank means absent
     */
    public static ChatMessage assistantWithToolCalls(String id, String content, List<ToolCall> toolCalls) {
        String text = content == null || content.isBlank() ? null : content;
        return new ChatMessage(id, MessageRole.ASSISTANT, text, null, toolCalls);
    }

    public static ChatMessage tool(String content, String toolCallId) {
        Objects.requireNonNull(toolCallId, "toolCallId must not be null");
        return new ChatMessage(null, MessageRole.TOOL, content, toolCallId, List.of());
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }

    public boolean hasContent() {
        return content != null;
    }
}
