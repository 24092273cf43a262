package com.newswatch.backend.model;

import java.time.LocalDate;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One extracted article. Immutable; {@code link} identifies the article for downstream dedup.
 */
@Value
@Builder
public class ArticleRecord {

    public static final String UNKNOWN = "Unknown";

    @NonNull
    String title;
    @NonNull
    LocalDate publishDate;
    @Builder.Default
    String author = UNKNOWN;
    @NonNull
    String content;
    String keyword;
    @Builder.Default
    String category = UNKNOWN;
    String source;
    @NonNull
    String link;
}
