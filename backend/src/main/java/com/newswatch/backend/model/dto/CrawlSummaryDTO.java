package com.newswatch.backend.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CrawlSummaryDTO {
    private String keyword;
    private String source;
    private int pagesFetched;
    private int linksDispatched;
    private int recordsEmitted;
    private String stopReason;
}
