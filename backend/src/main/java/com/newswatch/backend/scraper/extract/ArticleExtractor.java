package com.newswatch.backend.scraper.extract;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.newswatch.backend.config.NewsSourceConfig;
import com.newswatch.backend.model.ArticleRecord;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/**
 * Extracts article fields from an article page using the source's fallback selector chains.
 * Title, publish date and content are required; author and category fall back to "Unknown".
 */
@Slf4j
public class ArticleExtractor {

    private final SelectorChain categoryChain;
    private final SelectorChain titleChain;
    private final SelectorChain authorChain;
    private final SelectorChain dateChain;
    private final List<String> contentSelectors;
    private final ContentSanitizer sanitizer;
    private final PublishDateParser dateParser;

    public ArticleExtractor(NewsSourceConfig config, PublishDateParser dateParser, ObjectMapper objectMapper) {
        this.categoryChain = SelectorRules.chain("category", config.getCategorySelectors(), objectMapper, "articleSection");
        this.titleChain = SelectorRules.chain("title", config.getTitleSelectors(), objectMapper, "headline", "name");
        this.authorChain = SelectorRules.chain("author", config.getAuthorSelectors(), objectMapper, "author.name", "author");
        this.dateChain = SelectorRules.chain("publishedTime", config.getPublishedTimeSelectors(), objectMapper, "datePublished");
        this.contentSelectors = config.getContentSelectors() == null ? List.of() : List.copyOf(config.getContentSelectors());
        this.sanitizer = new ContentSanitizer(config.getContentIgnoreSelectors(), config.getContentNoiseClasses(),
                config.getParagraphTags(), config.getBoilerplateTexts());
        this.dateParser = dateParser;
    }

    public Optional<ExtractedArticle> extract(String html, String link) {
        Document doc = Jsoup.parse(html, link);

        String category = categoryChain.firstMatch(doc).orElse(ArticleRecord.UNKNOWN);

        Optional<String> title = titleChain.firstMatch(doc);
        if (title.isEmpty()) {
            log.error("No title found for {}", link);
            return Optional.empty();
        }

        String author = authorChain.firstMatch(doc).orElse(ArticleRecord.UNKNOWN);

        Optional<String> dateText = dateChain.firstMatch(doc);
        if (dateText.isEmpty()) {
            log.warn("No date found for {}", link);
            return Optional.empty();
        }

        Optional<String> content = extractContent(doc);
        if (content.isEmpty()) {
            log.warn("No content found for {}", link);
            return Optional.empty();
        }

        LocalDate publishDate;
        try {
            publishDate = dateParser.parse(dateText.get());
        } catch (DateParseException e) {
            log.error("Error parsing date '{}' for article {}", dateText.get(), link);
            return Optional.empty();
        }

        return Optional.of(ExtractedArticle.builder()
                .title(title.get())
                .author(author)
                .category(category)
                .publishDate(publishDate)
                .content(content.get())
                .build());
    }

    /**
     * Only the first matching container is used; if it sanitizes to nothing the article has no content
     */
    private Optional<String> extractContent(Document doc) {
        for (String selector : contentSelectors) {
            Element container = doc.selectFirst(selector);
            if (container != null) {
                return sanitizer.sanitize(container);
            }
        }
        return Optional.empty();
    }
}
