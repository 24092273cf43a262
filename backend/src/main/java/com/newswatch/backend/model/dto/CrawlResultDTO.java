package com.newswatch.backend.model.dto;

import com.newswatch.backend.model.ArticleRecord;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CrawlResultDTO {
    private List<ArticleRecord> articles;
    private List<CrawlSummaryDTO> crawls;
    private List<String> keywords;
    private List<String> sources;
    private int totalEmitted;
    private int totalCollected;
    private String scrapedAt;
    private Double durationSeconds;
}
