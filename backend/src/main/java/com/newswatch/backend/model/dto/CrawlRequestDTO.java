package com.newswatch.backend.model.dto;

import jakarta.validation.constraints.NotEmpty;
import java.time.LocalDate;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for crawl requests
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CrawlRequestDTO {
    @NotEmpty(message = "At least one keyword is required")
    private List<String> keywords;
    private List<String> sources; // source codes, empty means all configured sources
    private LocalDate startDate; // lower bound that stops pagination
    private LocalDate endDate; // upper bound applied when collecting results
}
