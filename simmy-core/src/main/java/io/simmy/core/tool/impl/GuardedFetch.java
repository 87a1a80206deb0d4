package io.simmy.core.tool.impl;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * GET with redirects followed by hand, so that every hop passes the {@link UrlGuard} before it is requested.
 */
final class GuardedFetch {
    static final int MAX_REDIRECTS = 5;
    private static final Set<Integer> REDIRECT_CODES = Set.of(301, 302, 303, 307, 308);

    private final HttpClient client;
    private final UrlGuard urlGuard;

    GuardedFetch(UrlGuard urlGuard) {
        // HttpClient's default redirect policy is NEVER
        this.client = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build();
        this.urlGuard = urlGuard;
    }

    Page get(String rawUrl) throws IOException, InterruptedException {
        URI uri = urlGuard.validate(rawUrl);
        for (int hop = 0; ; hop++) {
            HttpRequest request = HttpRequest.newBuilder(uri)
                .GET()
                .timeout(Duration.ofSeconds(20))
                .header("User-Agent", "simmy/0.1")
                .build();
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
            Optional<String> location = response.headers().firstValue("Location");
            if (!REDIRECT_CODES.contains(response.statusCode()) || location.isEmpty()) {
                return new Page(uri, response.statusCode(), response.body() == null ? "" : response.body());
            }
            if (hop >= MAX_REDIRECTS) {
                throw new IOException("Too many redirects, last location: " + location.get());
            }
            uri = urlGuard.validate(uri.resolve(location.get().trim()));
        }
    }

    record Page(URI uri, int status, String body) {
    }
}
