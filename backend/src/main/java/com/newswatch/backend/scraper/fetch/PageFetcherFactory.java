package com.newswatch.backend.scraper.fetch;

import com.newswatch.backend.config.NewsSourceConfig;
import com.newswatch.backend.config.ScrapingConfig;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Hands out one gated fetcher per source, so every crawl of that source shares the same cap.
 */
@Component
@Slf4j
public class PageFetcherFactory {

    private final ScrapingConfig scrapingConfig;
    private final PageFetcher transport;
    private final Map<String, GatedPageFetcher> fetchersBySource = new ConcurrentHashMap<>();

    @Autowired
    public PageFetcherFactory(ScrapingConfig scrapingConfig) {
        this(scrapingConfig, new JsoupPageFetcher(scrapingConfig));
    }

    PageFetcherFactory(ScrapingConfig scrapingConfig, PageFetcher transport) {
        this.scrapingConfig = scrapingConfig;
        this.transport = transport;
    }

    public GatedPageFetcher fetcherFor(NewsSourceConfig source) {
        return fetchersBySource.computeIfAbsent(source.getCode(), code -> {
            int limit = source.effectiveConcurrency(scrapingConfig.getConcurrency());
            log.info("Admission gate for {}: {} concurrent requests", code, limit);
            return new GatedPageFetcher(transport, limit);
        });
    }
}
