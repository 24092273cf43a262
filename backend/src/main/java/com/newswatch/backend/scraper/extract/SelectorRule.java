package com.newswatch.backend.scraper.extract;

import java.util.Optional;
import org.jsoup.nodes.Element;

/**
 * One extraction attempt against a parsed page. Pure: the page is never modified.
 */
@FunctionalInterface
public interface SelectorRule {

    Optional<String> apply(Element root);
}
