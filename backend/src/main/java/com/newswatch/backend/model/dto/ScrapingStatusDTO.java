package com.newswatch.backend.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for crawl task status responses
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScrapingStatusDTO {
    private String taskId;
    private volatile String status; // RUNNING, COMPLETED, FAILED
    private String keywords;
    private String sources;
    private Integer articlesCollected;
    private Integer crawlsCompleted;
    private String startedAt;
    private String completedAt;
    private String error;
    private Double durationSeconds;
}
