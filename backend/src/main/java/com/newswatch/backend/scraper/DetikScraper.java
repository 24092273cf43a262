package com.newswatch.backend.scraper;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.newswatch.backend.config.NewsSourceConfig;
import com.newswatch.backend.scraper.extract.PublishDateParser;

/**
 * detik.com: search results sorted by the "relevansi" mode, dates written in Indonesian
 * ("Senin, 06 Okt 2025 14:30 WIB").
 */
public class DetikScraper extends BaseNewsSourceScraper {

    public static final String CODE = "detik";

    public DetikScraper(NewsSourceConfig config, ObjectMapper objectMapper) {
        super(config, objectMapper);
    }

    @Override
    protected PublishDateParser createDateParser() {
        return PublishDateParser.indonesian();
    }
}
