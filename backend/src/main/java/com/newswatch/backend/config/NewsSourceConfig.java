package com.newswatch.backend.config;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;

/**
 * Selector and endpoint configuration for one news source, loaded from news-sources.yml.
 * <p>
 * Selector lists are ordered by priority: the first one producing non-empty data wins.
 * A plain CSS selector yields element text, {@code css@attr} yields an attribute and
 * {@code script[type='application/ld+json']} reads the matching JSON-LD field.
 */
@Data
public class NewsSourceConfig {
    private String code;
    private String name;
    private String baseUrl;

    // Search endpoint
    private String searchPath;
    private String keywordParam = "query";
    private String pageParam = "page";
    private Map<String, String> searchParams = new LinkedHashMap<>();

    // Results page
    private String articleCardSelector;
    private String articleLinkSelector;
    private List<String> skipUrlsContaining = List.of();

    // Appended to article links before fetching, e.g. a simplified rendering hint
    private String articleUrlSuffix;

    // Article page, in priority order (high to low)
    private List<String> titleSelectors = List.of();
    private List<String> authorSelectors = List.of();
    private List<String> categorySelectors = List.of();
    private List<String> publishedTimeSelectors = List.of();
    private List<String> contentSelectors = List.of();

    // Content sanitization
    private List<String> contentIgnoreSelectors = List.of();
    private List<String> contentNoiseClasses = List.of();
    private List<String> paragraphTags = List.of("p");
    private List<String> boilerplateTexts = List.of();

    // Overrides scraping.concurrency for this source when set
    private Integer concurrency;

    /**
     * Get the domain name from the base URL
     */
    public String getDomain() {
        if (baseUrl == null) return null;
        return baseUrl.replaceAll("https?://", "").replaceAll("/.*", "");
    }

    /**
     * Stable identifier written into every record, e.g. "detik.com"
     */
    public String getSourceId() {
        String domain = getDomain();
        if (domain == null) return code;
        return domain.startsWith("www.") ? domain.substring(4) : domain;
    }

    public int effectiveConcurrency(int defaultConcurrency) {
        return concurrency != null && concurrency > 0 ? concurrency : defaultConcurrency;
    }
}
