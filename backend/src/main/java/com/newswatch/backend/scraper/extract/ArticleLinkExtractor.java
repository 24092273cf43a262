package com.newswatch.backend.scraper.extract;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

/**
 * Reads article links off a search results page.
 */
@Slf4j
public class ArticleLinkExtractor {

    private final String baseUrl;
    private final String cardSelector;
    private final String linkSelector;
    private final List<String> skipUrlsContaining;

    public ArticleLinkExtractor(String baseUrl, String cardSelector, String linkSelector,
                                List<String> skipUrlsContaining) {
        this.baseUrl = baseUrl;
        this.cardSelector = cardSelector;
        this.linkSelector = linkSelector;
        this.skipUrlsContaining = skipUrlsContaining == null ? List.of() : List.copyOf(skipUrlsContaining);
    }

    /**
     * Returns empty when the page has no article cards at all (end of results). A present but
     * empty set means cards were found and every link was filtered out.
     */
    public Optional<Set<String>> extractLinks(String html) {
        Document doc = Jsoup.parse(html, baseUrl);

        Elements cards = doc.select(cardSelector);
        if (cards.isEmpty()) {
            log.warn("No article cards found");
            return Optional.empty();
        }

        Set<String> links = new LinkedHashSet<>();
        for (Element card : cards) {
            Element titleLink = card.selectFirst(linkSelector);
            if (titleLink == null || !titleLink.hasAttr("href")) continue;

            String href = titleLink.absUrl("href");
            if (href.isEmpty()) {
                href = titleLink.attr("href");
            }
            if (isArticleUrl(href)) {
                links.add(href);
            } else {
                log.debug("Skipping non-article URL: {}", href);
            }
        }

        log.info("Found {} valid article links in {} cards", links.size(), cards.size());
        return Optional.of(links);
    }

    boolean isArticleUrl(String url) {
        if (url == null || url.isBlank()) return false;
        for (String pattern : skipUrlsContaining) {
            if (url.contains(pattern)) return false;
        }
        return true;
    }
}
