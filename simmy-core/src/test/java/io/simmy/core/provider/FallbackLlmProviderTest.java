package io.simmy.core.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.assertThatCode;

import io.simmy.core.model.ChatMessage;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FallbackLlmProviderTest {

    @Test
    void shouldUseNextProviderWhenFirstFails() throws Exception {
        LlmProvider primary = new DisabledProvider("primary", "no key");
        LlmProvider secondary = new StubProvider("secondary", "ok");

        FallbackLlmProvider provider = new FallbackLlmProvider("openrouter", List.of(primary, secondary));

        LlmResponse response = provider.chat("model", List.of(ChatMessage.user("hi")), List.of());

        assertThat(response.content()).isEqualTo("ok");
    }

    @Test
    void shouldRethrowLastFailureWhenEveryProviderFails() {
        FallbackLlmProvider provider = new FallbackLlmProvider("chain", List.of(
            new DisabledProvider("first", "no key"),
            new DisabledProvider("second", "offline")
        ));

        assertThatThrownBy(() -> provider.chat("model", List.of(ChatMessage.user("hi")), List.of()))
            .isInstanceOf(LlmException.class)
            .hasMessageContaining("second")
            .hasMessageContaining("offline");
    }

    @Test
    void shouldStartWhenAnyProviderStarts() {
        FallbackLlmProvider partial = new FallbackLlmProvider("chain", List.of(
            new FailingStartupProvider("broken"),
            new StubProvider("healthy", "ok")
        ));
        FallbackLlmProvider dead = new FallbackLlmProvider("chain", List.of(
            new FailingStartupProvider("broken")
        ));

        assertThatCode(partial::startup).doesNotThrowAnyException();
        assertThatThrownBy(dead::startup)
            .isInstanceOf(LlmException.class)
            .hasMessageContaining("broken");
    }

    private record StubProvider(String name, String content) implements LlmProvider {
        @Override
        public LlmResponse chat(String model, List<ChatMessage> messages, List<Map<String, Object>> tools) {
            return new LlmResponse(content, List.of(), Map.of());
        }
    }

    private record FailingStartupProvider(String name) implements LlmProvider {
        @Override
        public void startup() throws LlmException {
            throw new LlmException("cannot start " + name);
        }

        @Override
        public LlmResponse chat(String model, List<ChatMessage> messages, List<Map<String, Object>> tools) {
            return new LlmResponse("unused", List.of(), Map.of());
        }
    }
}
