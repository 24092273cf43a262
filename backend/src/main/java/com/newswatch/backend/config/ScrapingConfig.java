package com.newswatch.backend.config;

import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "scraping")
@Data
public class ScrapingConfig {

    // Max in-flight requests per source, unless the source overrides it
    private int concurrency = 12;
    private int timeout = 30;

    // Records buffered between the crawlers and the collecting consumer
    private int sinkCapacity = 1000;

    // 0 disables the cap
    private int maxPages = 0;

    // Default headers for HTTP requests
    private Map<String, String> defaultHeaders = Map.of(
            "User-Agent", "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/140.0.0.0 Safari/537.36",
            "Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8",
            "Accept-Language", "id-ID,id;q=0.9,en-US;q=0.8,en;q=0.7"
    );

    public String getUserAgent() {
        return defaultHeaders.getOrDefault("User-Agent", "Mozilla/5.0");
    }
}
