package com.newswatch.backend.scraper;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.newswatch.backend.config.NewsSourceConfig;
import com.newswatch.backend.scraper.extract.ArticleExtractor;
import com.newswatch.backend.scraper.extract.ArticleLinkExtractor;
import com.newswatch.backend.scraper.extract.ExtractedArticle;
import com.newswatch.backend.scraper.extract.PublishDateParser;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

public abstract class BaseNewsSourceScraper implements NewsSourceScraper {

    protected final NewsSourceConfig config;
    private final ArticleLinkExtractor linkExtractor;
    private final ArticleExtractor articleExtractor;

    protected BaseNewsSourceScraper(NewsSourceConfig config, ObjectMapper objectMapper) {
        this.config = config;
        this.linkExtractor = new ArticleLinkExtractor(config.getBaseUrl(), config.getArticleCardSelector(),
                config.getArticleLinkSelector(), config.getSkipUrlsContaining());
        this.articleExtractor = new ArticleExtractor(config, createDateParser(), objectMapper);
    }

    protected abstract PublishDateParser createDateParser();

    @Override
    public NewsSourceConfig getConfig() {
        return config;
    }

    @Override
    public String getSourceId() {
        return config.getSourceId();
    }

    @Override
    public String buildSearchUrl(String keyword, int page) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put(config.getKeywordParam(), keyword);
        params.put(config.getPageParam(), String.valueOf(page));
        if (config.getSearchParams() != null) {
            params.putAll(config.getSearchParams());
        }

        String query = params.entrySet().stream()
                .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
                .collect(Collectors.joining("&"));
        return config.getBaseUrl().replaceAll("/$", "") + config.getSearchPath() + "?" + query;
    }

    @Override
    public Optional<Set<String>> extractLinks(String resultsPageHtml) {
        return linkExtractor.extractLinks(resultsPageHtml);
    }

    @Override
    public String articleUrl(String link) {
        String suffix = config.getArticleUrlSuffix();
        if (suffix == null || suffix.isEmpty()) {
            return link;
        }
        // "?single=1" becomes "&single=1" when the link already carries a query
        if (suffix.startsWith("?") && link.contains("?")) {
            return link + "&" + suffix.substring(1);
        }
        return link + suffix;
    }

    @Override
    public Optional<ExtractedArticle> extractArticle(String articleHtml, String link) {
        return articleExtractor.extract(articleHtml, link);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
