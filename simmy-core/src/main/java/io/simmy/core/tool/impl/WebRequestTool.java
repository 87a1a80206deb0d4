package io.simmy.core.tool.impl;

import io.simmy.core.tool.Tool;
import io.simmy.core.tool.ToolArguments;
import io.simmy.core.tool.ToolContext;
import io.simmy.core.tool.ToolSchema;

public final class WebRequestTool implements Tool {
    private static final ToolSchema SCHEMA = ToolSchema.builder()
        .string("url", "The URL to request.", true)
        .build();

    private final GuardedFetch fetch;
    private final int maxChars;

    public WebRequestTool(int maxChars, boolean allowPrivateAddresses) {
        this(maxChars, new UrlGuard(allowPrivateAddresses));
    }

    WebRequestTool(int maxChars, UrlGuard urlGuard) {
        this.fetch = new GuardedFetch(urlGuard);
        this.maxChars = Math.max(1, maxChars);
    }

    @Override
    public String name() {
        return "web_request";
    }

    @Override
    public String description() {
        return "Make a GET request to a URL and return the raw response body.";
    }

    @Override
    public ToolSchema schema() {
        return SCHEMA;
    }

    @Override
    public String execute(ToolArguments arguments, ToolContext context) {
        String url = arguments.string("url").orElse("").trim();
        if (url.isBlank()) {
            return "Error running web_request: No URL provided.";
        }

        try {
            GuardedFetch.Page page = fetch.get(url);
            String body = page.body();
            if (body.length() > maxChars) {
                body = body.substring(0, maxChars) + "\n[truncated]";
            }
            return "URL: " + page.uri() + "\nStatus: " + page.status() + "\n\n" + body;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "Error running web_request: interrupted";
        } catch (Exception e) {
            return "Error running web_request: " + e.getMessage();
        }
    }
}
