package io.simmy.core.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.simmy.core.model.ChatMessage;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adapter for any backend speaking the OpenAI chat completions protocol (OpenAI, OpenRouter, local gateways).
 * Rate limits, server errors and I/O failures are retried with exponential backoff.
 */
public final class OpenAiCompatProvider implements LlmProvider {
    private static final Logger LOG = LoggerFactory.getLogger(OpenAiCompatProvider.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final long INITIAL_BACKOFF_MS = 250;
    private static final long MAX_BACKOFF_MS = 2000;

    private final String name;
    private final String apiKey;
    private final HttpUrl completionsUrl;
    private final Map<String, String> extraHeaders;
    private final int maxAttempts;
    private final OkHttpClient client;
    private final ChatCompletionsCodec codec;

    public OpenAiCompatProvider(String name, String apiKey, String apiBase, Map<String, String> extraHeaders) {
        this(name, apiKey, apiBase, extraHeaders, 3);
    }

    public OpenAiCompatProvider(
        String name,
        String apiKey,
        String apiBase,
        Map<String, String> extraHeaders,
        int maxAttempts
    ) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        this.completionsUrl = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"))
            .newBuilder()
            .addPathSegment("chat")
            .addPathSegment("completions")
            .build();
        this.extraHeaders = extraHeaders == null ? Map.of() : Map.copyOf(extraHeaders);
        this.maxAttempts = Math.max(1, maxAttempts);
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(20))
            .readTimeout(Duration.ofSeconds(90))
            .writeTimeout(Duration.ofSeconds(20))
            .build();
        this.codec = new ChatCompletionsCodec(new ObjectMapper(), name);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void startup() throws LlmException {
        requireApiKey();
    }

    @Override
    public LlmResponse chat(String model, List<ChatMessage> messages, List<Map<String, Object>> tools) throws LlmException {
        requireApiKey();
        Request request;
        try {
            request = buildRequest(codec.encodeRequest(model, messages, tools));
        } catch (IOException e) {
            throw new LlmException("could not encode request for provider " + name, e);
        }

        long backoffMs = INITIAL_BACKOFF_MS;
        LlmException lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (attempt > 1) {
                pause(backoffMs);
                backoffMs = Math.min(backoffMs * 2, MAX_BACKOFF_MS);
            }
            try (Response response = client.newCall(request).execute()) {
                if (response.isSuccessful()) {
                    return decode(response);
                }
                String errorBody = response.body() == null ? "" : response.body().string();
                lastFailure = new LlmException("HTTP " + response.code() + " " + errorBody);
                if (!isTransient(response.code())) {
                    throw lastFailure;
                }
                LOG.debug("Provider {} answered HTTP {} on attempt {}/{}", name, response.code(), attempt, maxAttempts);
            } catch (IOException ioe) {
                lastFailure = new LlmException(ioe.getMessage() == null ? "I/O failure" : ioe.getMessage(), ioe);
                LOG.debug("Provider {} I/O failure on attempt {}/{}: {}", name, attempt, maxAttempts, ioe.getMessage());
            }
        }
        throw lastFailure;
    }

    private LlmResponse decode(Response response) throws IOException, LlmException {
        ResponseBody body = response.body();
        if (body == null) {
            throw new LlmException("empty response body from provider " + name);
        }
        MediaType type = body.contentType();
        try {
            if (type != null && "event-stream".equalsIgnoreCase(type.subtype())) {
                return codec.decodeStream(body.source());
            }
            return codec.decodeJson(body.string());
        } catch (RuntimeException e) {
            throw new LlmException("malformed response from provider " + name + ": " + e, e);
        }
    }

    private Request buildRequest(String json) {
        Request.Builder builder = new Request.Builder()
            .url(completionsUrl)
            .post(RequestBody.create(json, JSON))
            .header("Authorization", "Bearer " + apiKey)
            .header("Accept", "application/json, text/event-stream");
        extraHeaders.forEach(builder::header);
        return builder.build();
    }

    private void requireApiKey() throws LlmException {
        if (apiKey.isEmpty()) {
            throw new LlmException("missing API key for provider " + name);
        }
    }

    private static boolean isTransient(int status) {
        return status == 429 || status >= 500;
    }

    private static void pause(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
