package io.simmy.core.tool.impl;

import static org.assertj.core.api.Assertions.assertThat;

import io.simmy.core.bus.InMemoryEventBus;
import io.simmy.core.tool.ToolArguments;
import io.simmy.core.tool.ToolContext;
import java.io.IOException;
import java.util.Map;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ScraperToolTest {

    private static final String PAGE = """
        <html>
          <head><title>Field Guide</title></head>
          <body>
            <h1>Birds</h1>
            <p class="entry">Robin</p>
            <p class="entry">Wren</p>
          </body>
        </html>
        """;

    private MockWebServer server;
    private final ToolContext context = new ToolContext(new InMemoryEventBus());

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
    void shouldReturnPageTextWithTitle() {
        server.enqueue(new MockResponse().setHeader("Content-Type", "text/html").setBody(PAGE));
        ScraperTool tool = new ScraperTool(10_000, true);

        String result = tool.execute(ToolArguments.of(Map.of("url", server.url("/guide").toString())), context);

        assertThat(result).startsWith("Title: Field Guide\n\n").contains("Birds").contains("Robin").contains("Wren");
    }

    @Test
    void shouldNarrowBySelector() {
        server.enqueue(new MockResponse().setHeader("Content-Type", "text/html").setBody(PAGE));
        ScraperTool tool = new ScraperTool(10_000, true);

        String result = tool.execute(
            ToolArguments.of(Map.of("url", server.url("/guide").toString(), "selector", "p.entry")),
            context
        );

        assertThat(result).isEqualTo("Title: Field Guide\n\nRobin\nWren");
    }

    @Test
    void shouldReportUnmatchedSelector() {
        server.enqueue(new MockResponse().setHeader("Content-Type", "text/html").setBody(PAGE));
        ScraperTool tool = new ScraperTool(10_000, true);

        String result = tool.execute(
            ToolArguments.of(Map.of("url", server.url("/guide").toString(), "selector", "table")),
            context
        );

        assertThat(result).isEqualTo("No elements matched selector: table");
    }

    @Test
    void shouldReportHttpErrors() {
        server.enqueue(new MockResponse().setResponseCode(404));
        ScraperTool tool = new ScraperTool(10_000, true);

        String result = tool.execute(ToolArguments.of(Map.of("url", server.url("/missing").toString())), context);

        assertThat(result).isEqualTo("Error running scraper: HTTP 404");
    }
}
