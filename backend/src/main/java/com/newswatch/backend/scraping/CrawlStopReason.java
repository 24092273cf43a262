package com.newswatch.backend.scraping;

public enum CrawlStopReason {
    NO_RESULTS,
    NO_ARTICLE_LINKS,
    DATE_BOUND_REACHED,
    RESULTS_PAGE_UNAVAILABLE,
    MAX_PAGES_REACHED,
    INTERRUPTED,
    CANCELLED,
    FAILED
}
