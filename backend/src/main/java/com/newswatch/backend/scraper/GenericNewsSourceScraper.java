package com.newswatch.backend.scraper;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.newswatch.backend.config.NewsSourceConfig;
import com.newswatch.backend.scraper.extract.PublishDateParser;

/**
 * Any source described purely in news-sources.yml, with ISO or English date text.
 */
public class GenericNewsSourceScraper extends BaseNewsSourceScraper {

    public GenericNewsSourceScraper(NewsSourceConfig config, ObjectMapper objectMapper) {
        super(config, objectMapper);
    }

    @Override
    protected PublishDateParser createDateParser() {
        return PublishDateParser.english();
    }
}
