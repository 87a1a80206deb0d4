package io.simmy.core.tool.impl;

import io.simmy.core.tool.Tool;
import io.simmy.core.tool.ToolArguments;
import io.simmy.core.tool.ToolContext;
import io.simmy.core.tool.ToolSchema;
import java.util.stream.Collectors;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

public final class ScraperTool implements Tool {
    private static final ToolSchema SCHEMA = ToolSchema.builder()
        .string("url", "The URL of the webpage to scrape.", true)
        .string("selector", "Optional CSS selector limiting which elements are returned.", false)
        .build();

    private final GuardedFetch fetch;
    private final int maxChars;

    public ScraperTool(int maxChars, boolean allowPrivateAddresses) {
        this(maxChars, new UrlGuard(allowPrivateAddresses));
    }

    ScraperTool(int maxChars, UrlGuard urlGuard) {
        this.fetch = new GuardedFetch(urlGuard);
        this.maxChars = Math.max(1, maxChars);
    }

    @Override
    public String name() {
        return "scraper";
    }

    @Override
    public String description() {
        return "Scrape the visible text of a webpage, optionally narrowed by a CSS selector.";
    }

    @Override
    public ToolSchema schema() {
        return SCHEMA;
    }

    @Override
    public String execute(ToolArguments arguments, ToolContext context) {
        String url = arguments.string("url").orElse("").trim();
        if (url.isBlank()) {
            return "Error running scraper: No URL provided.";
        }
        String selector = arguments.string("selector").orElse("").trim();

        try {
            GuardedFetch.Page page = fetch.get(url);
            if (page.status() >= 400) {
                return "Error running scraper: HTTP " + page.status();
            }

            Document document = Jsoup.parse(page.body(), page.uri().toString());
            String text;
            if (selector.isBlank()) {
                text = document.text();
            } else {
                Elements elements = document.select(selector);
                if (elements.isEmpty()) {
                    return "No elements matched selector: " + selector;
                }
                text = elements.stream().map(Element::text).collect(Collectors.joining("\n"));
            }
            if (text.length() > maxChars) {
                text = text.substring(0, maxChars) + "\n[truncated]";
            }
            String title = document.title();
            return title.isBlank() ? text : "Title: " + title + "\n\n" + text;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "Error running scraper: interrupted";
        } catch (Exception e) {
            return "Error running scraper: " + e.getMessage();
        }
    }
}
