package com.newswatch.backend.scraper.extract;

import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;

/**
 * Ordered fallback rules for one field; the first rule yielding non-blank text wins.
 */
@Slf4j
public class SelectorChain {

    private final String field;
    private final List<SelectorRule> rules;

    public SelectorChain(String field, List<SelectorRule> rules) {
        this.field = field;
        this.rules = List.copyOf(rules);
    }

    public Optional<String> firstMatch(Element root) {
        for (SelectorRule rule : rules) {
            Optional<String> value = rule.apply(root)
                    .map(String::trim)
                    .filter(text -> !text.isEmpty());
            if (value.isPresent()) {
                return value;
            }
        }
        log.debug("No {} found by {} rule(s)", field, rules.size());
        return Optional.empty();
    }
}
