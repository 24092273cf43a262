package com.newswatch.backend.scraper;

import com.newswatch.backend.config.NewsSourceConfig;
import com.newswatch.backend.scraper.extract.ExtractedArticle;
import java.util.Optional;
import java.util.Set;

/**
 * What a crawl needs to know about one news source: how to build its search URL, how to read
 * its results page and how to read its article pages.
 */
public interface NewsSourceScraper {

    NewsSourceConfig getConfig();

    /**
     * Identifier stamped on every record from this source, derived from its domain
     */
    String getSourceId();

    String buildSearchUrl(String keyword, int page);

    Optional<Set<String>> extractLinks(String resultsPageHtml);

    /**
     * URL actually requested for an article link
     */
    String articleUrl(String link);

    Optional<ExtractedArticle> extractArticle(String articleHtml, String link);
}
