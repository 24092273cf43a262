package com.newswatch.backend.scraper.extract;

import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * Fields read from one article page, before keyword and source are attached.
 */
@Value
@Builder
public class ExtractedArticle {
    String title;
    String author;
    String category;
    LocalDate publishDate;
    String content;
}
