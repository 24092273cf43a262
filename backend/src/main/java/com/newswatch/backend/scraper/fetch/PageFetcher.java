package com.newswatch.backend.scraper.fetch;

import java.util.Optional;

/**
 * Performs a GET and returns the response body, or empty when there was no usable response.
 * Implementations never retry and never throw for transport failures.
 */
@FunctionalInterface
public interface PageFetcher {

    Optional<String> fetch(String url);
}
