package com.newswatch.backend;

import com.newswatch.backend.config.NewsSourceConfig;
import com.newswatch.backend.scraping.NewsSourceConfigService;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.springframework.core.io.ClassPathResource;

/**
 * Source configs and HTML fixtures shared by the tests.
 */
public final class TestSources {

    private TestSources() {
    }

    /**
     * The detik source exactly as shipped in news-sources.yml
     */
    public static NewsSourceConfig detik() {
        NewsSourceConfigService service = new NewsSourceConfigService(new ClassPathResource("news-sources.yml"));
        service.loadConfigurations();
        return service.getConfig("detik").orElseThrow();
    }

    /**
     * A minimal source on example.com with plain selectors and no URL suffix
     */
    public static NewsSourceConfig example() {
        NewsSourceConfig config = new NewsSourceConfig();
        config.setCode("example");
        config.setName("Example");
        config.setBaseUrl("https://www.example.com");
        config.setSearchPath("/search");
        config.setArticleCardSelector(".card");
        config.setArticleLinkSelector("a");
        config.setSkipUrlsContaining(List.of("-video"));
        config.setTitleSelectors(List.of("h1"));
        config.setPublishedTimeSelectors(List.of("time"));
        config.setContentSelectors(List.of(".body"));
        return config;
    }

    public static String fixture(String name) {
        try (InputStream in = new ClassPathResource("fixtures/" + name).getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static String resultsPage(String... links) {
        StringBuilder html = new StringBuilder("<html><body>");
        for (String link : links) {
            html.append("<div class=\"card\"><a href=\"").append(link).append("\">").append(link).append("</a></div>");
        }
        return html.append("</body></html>").toString();
    }

    public static String emptyResultsPage() {
        return "<html><body><p>Tidak ada hasil</p></body></html>";
    }

    public static String articlePage(String title, String date, String body) {
        return "<html><body><h1>" + title + "</h1><time>" + date + "</time>"
                + "<div class=\"body\"><p>" + body + "</p></div></body></html>";
    }
}
