package io.simmy.core.provider;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.simmy.core.model.ChatMessage;
import io.simmy.core.model.ToolCall;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ChatCompletionsCodecTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ChatCompletionsCodec codec = new ChatCompletionsCodec(mapper, "test");

    @Test
    void shouldSkipNullUsageCounters() throws Exception {
        LlmResponse response = codec.decodeJson("""
            {
              "id": "chatcmpl-7",
              "choices": [ { "message": { "content": "hi" } } ],
              "usage": { "prompt_tokens": 3, "cost": null }
            }
            """);

        assertThat(response.content()).isEqualTo("hi");
        assertThat(response.usage()).containsOnlyKeys("prompt_tokens").containsEntry("prompt_tokens", 3);
    }

    @Test
    void shouldWriteNullContentForPureToolCallEntries() throws Exception {
        ChatMessage toolRequest = ChatMessage.assistantWithToolCalls(
            null, "", List.of(new ToolCall("call_1", "create_task", Map.of("description", "x"))));

        JsonNode body = mapper.readTree(codec.encodeRequest("m", List.of(ChatMessage.user("go"), toolRequest), List.of()));

        JsonNode assistant = body.path("messages").path(1);
        assertThat(toolRequest.hasContent()).isFalse();
        assertThat(assistant.has("content")).isTrue();
        assertThat(assistant.path("content").isNull()).isTrue();
        assertThat(assistant.path("tool_calls").path(0).path("function").path("arguments").asText())
            .isEqualTo("{\"description\":\"x\"}");
        assertThat(body.path("messages").path(0).path("content").asText()).isEqualTo("go");
    }

    @Test
    void shouldKeepTextSentAlongsideToolCalls() throws Exception {
        ChatMessage toolRequest = ChatMessage.assistantWithToolCalls(
            null, "Let me check.", List.of(new ToolCall("call_1", "web_request", Map.of())));

        JsonNode body = mapper.readTree(codec.encodeRequest("m", List.of(toolRequest), List.of()));

        assertThat(body.path("messages").path(0).path("content").asText()).isEqualTo("Let me check.");
    }
}
