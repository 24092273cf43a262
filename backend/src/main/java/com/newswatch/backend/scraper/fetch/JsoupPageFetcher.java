package com.newswatch.backend.scraper.fetch;

import com.newswatch.backend.config.ScrapingConfig;
import java.io.IOException;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Connection;
import org.jsoup.HttpStatusException;
import org.jsoup.Jsoup;

@Slf4j
@RequiredArgsConstructor
public class JsoupPageFetcher implements PageFetcher {

    private final ScrapingConfig scrapingConfig;

    @Override
    public Optional<String> fetch(String url) {
        try {
            Connection.Response response = Jsoup.connect(url)
                    .userAgent(scrapingConfig.getUserAgent())
                    .headers(scrapingConfig.getDefaultHeaders())
                    .timeout(scrapingConfig.getTimeout() * 1000)
                    .followRedirects(true)
                    .execute();
            return Optional.of(response.body());
        } catch (HttpStatusException e) {
            log.warn("HTTP {} fetching {}", e.getStatusCode(), url);
        } catch (IOException e) {
            log.warn("Failed to fetch {}: {}", url, e.getMessage());
        } catch (IllegalArgumentException e) {
            log.warn("Malformed URL {}: {}", url, e.getMessage());
        }
        return Optional.empty();
    }
}
