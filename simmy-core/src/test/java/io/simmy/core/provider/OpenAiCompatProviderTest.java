package io.simmy.core.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.simmy.core.model.ChatMessage;
import io.simmy.core.model.ToolCall;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenAiCompatProviderTest {

    private MockWebServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldParseJsonCompletionResponse() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("""
                {
                  "id": "chatcmpl-1",
                  "choices": [
                    { "message": { "content": "hello from json" } }
                  ],
                  "usage": { "total_tokens": 42 }
                }
                """));

        OpenAiCompatProvider provider = new OpenAiCompatProvider(
            "openrouter",
            "sk-test",
            server.url("/v1").toString(),
            Map.of("X-Title", "simmy")
        );

        LlmResponse response = provider.chat("gpt-4o", List.of(ChatMessage.user("hi")), List.of());

        assertThat(response.id()).isEqualTo("chatcmpl-1");
        assertThat(response.content()).isEqualTo("hello from json");
        assertThat(response.usage()).containsEntry("total_tokens", 42);

        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/v1/chat/completions");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer sk-test");
        assertThat(request.getHeader("X-Title")).isEqualTo("simmy");
        assertThat(request.getBody().readUtf8()).contains("\"stream\":true");
    }

    @Test
    void shouldParseSseCompletionAndToolCalls() throws Exception {
        String sse = """
            data: {"id":"chatcmpl-2","choices":[{"delta":{"content":"hello "}}]}
            
            data: {"id":"chatcmpl-2","choices":[{"delta":{"content":"world"}}]}
            
            data: {"choices":[{"delta":{"tool_calls":[{"id":"call_a","index":0,"function":{"name":"create_task","arguments":"{\\"description\\":"}}]}}]}
            
            data: {"choices":[{"delta":{"tool_calls":[{"index":0,"function":{"arguments":"\\"plan\\"}"}}]}}]}
            
            data: {"usage":{"total_tokens":13}}
            
            data: [DONE]
            
            """;

        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "text/event-stream")
            .setBody(sse));

        OpenAiCompatProvider provider = new OpenAiCompatProvider(
            "openai",
            "sk-test",
            server.url("/v1/").toString(),
            Map.of()
        );

        LlmResponse response = provider.chat("gpt-4o", List.of(ChatMessage.user("hi")), List.of());

        assertThat(response.id()).isEqualTo("chatcmpl-2");
        assertThat(response.content()).isEqualTo("hello world");
        assertThat(response.toolCalls()).hasSize(1);
        ToolCall call = response.toolCalls().get(0);
        assertThat(call.id()).isEqualTo("call_a");
        assertThat(call.name()).isEqualTo("create_task");
        assertThat(call.arguments()).containsEntry("description", "plan");
        assertThat(response.usage()).containsEntry("total_tokens", 13);
    }

    @Test
    void shouldSendToolCallsAndToolResultsWithTheirIds() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("{\"choices\":[{\"message\":{\"content\":\"done\"}}]}"));

        OpenAiCompatProvider provider = new OpenAiCompatProvider("openai", "sk-test", server.url("/v1").toString(), Map.of());
        List<ChatMessage> messages = List.of(
            ChatMessage.system("be brief"),
            ChatMessage.user("plan it"),
            ChatMessage.assistantWithToolCalls(null, "", List.of(new ToolCall("call_9", "complete_task", Map.of("task_id", "task_1")))),
            ChatMessage.tool("Task with id task_1 marked as complete.", "call_9")
        );

        provider.chat("gpt-4o", messages, List.of(Map.of("type", "function")));

        String body = server.takeRequest().getBody().readUtf8();
        assertThat(body).contains("\"tool_calls\":[{\"id\":\"call_9\"");
        assertThat(body).contains("\"tool_call_id\":\"call_9\"");
        assertThat(body).contains("\"tool_choice\":\"auto\"");
    }

    @Test
    void shouldFailOnClientError() {
        server.enqueue(new MockResponse().setResponseCode(401).setBody("{\"error\":\"bad key\"}"));

        OpenAiCompatProvider provider = new OpenAiCompatProvider("openai", "sk-test", server.url("/v1").toString(), Map.of());

        assertThatThrownBy(() -> provider.chat("gpt-4o", List.of(ChatMessage.user("hi")), List.of()))
            .isInstanceOf(LlmException.class)
            .hasMessageContaining("HTTP 401");
    }

    @Test
    void shouldRetryServerErrorsBeforeSucceeding() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(503));
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("{\"choices\":[{\"message\":{\"content\":\"recovered\"}}]}"));

        OpenAiCompatProvider provider = new OpenAiCompatProvider("openai", "sk-test", server.url("/v1").toString(), Map.of(), 2);

        LlmResponse response = provider.chat("gpt-4o", List.of(ChatMessage.user("hi")), List.of());

        assertThat(response.content()).isEqualTo("recovered");
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void shouldRefuseToStartWithoutApiKey() {
        OpenAiCompatProvider provider = new OpenAiCompatProvider("openai", "", server.url("/v1").toString(), Map.of());

        assertThatThrownBy(provider::startup)
            .isInstanceOf(LlmException.class)
            .hasMessageContaining("missing API key");
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void shouldAcceptNullUsageCounters() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("{\"choices\":[{\"message\":{\"content\":\"fine\"}}],\"usage\":{\"prompt_tokens\":3,\"cost\":null}}"));

        OpenAiCompatProvider provider = new OpenAiCompatProvider("openrouter", "sk-test", server.url("/v1").toString(), Map.of());

        LlmResponse response = provider.chat("gpt-4o", List.of(ChatMessage.user("hi")), List.of());

        assertThat(response.content()).isEqualTo("fine");
        assertThat(response.usage()).containsEntry("prompt_tokens", 3).doesNotContainKey("cost");
    }
}
