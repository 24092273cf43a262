package com.newswatch.backend.scraping;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CrawlSummary {
    String keyword;
    String source;
    int pagesFetched;
    int linksDispatched;
    int recordsEmitted;
    CrawlStopReason stopReason;
}
