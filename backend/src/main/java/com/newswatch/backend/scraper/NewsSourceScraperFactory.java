package com.newswatch.backend.scraper;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.newswatch.backend.config.NewsSourceConfig;
import lombok.AllArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@AllArgsConstructor
public class NewsSourceScraperFactory {

    private final ObjectMapper objectMapper;

    public NewsSourceScraper createScraper(NewsSourceConfig config) {
        if (DetikScraper.CODE.equalsIgnoreCase(config.getCode())) {
            return new DetikScraper(config, objectMapper);
        }
        return new GenericNewsSourceScraper(config, objectMapper);
    }
}
