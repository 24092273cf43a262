package com.newswatch.backend.scraper.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;

/**
 * Builds {@link SelectorRule}s from the selector strings in news-sources.yml.
 */
@Slf4j
public final class SelectorRules {

    public static final String JSON_LD_SELECTOR = "script[type='application/ld+json']";

    private static final Set<String> ARTICLE_TYPES = Set.of(
            "article", "newsarticle", "reportagenewsarticle", "blogposting", "webpage");

    private SelectorRules() {
    }

    public static SelectorChain chain(String field, List<String> selectors, ObjectMapper objectMapper,
                                      String... jsonLdFields) {
        List<SelectorRule> rules = new ArrayList<>();
        if (selectors != null) {
            for (String selector : selectors) {
                rules.add(fromSelector(selector, objectMapper, jsonLdFields));
            }
        }
        return new SelectorChain(field, rules);
    }

    public static SelectorRule fromSelector(String selector, ObjectMapper objectMapper, String... jsonLdFields) {
        if (selector.contains(JSON_LD_SELECTOR)) {
            return jsonLd(objectMapper, jsonLdFields);
        }
        int at = selector.lastIndexOf('@');
        if (at > 0 && at < selector.length() - 1) {
            return attribute(selector.substring(0, at), selector.substring(at + 1));
        }
        return text(selector);
    }

    public static SelectorRule text(String cssSelector) {
        return root -> Optional.ofNullable(root.selectFirst(cssSelector)).map(Element::text);
    }

    public static SelectorRule attribute(String cssSelector, String attribute) {
        return root -> Optional.ofNullable(root.selectFirst(cssSelector))
                .filter(el -> el.hasAttr(attribute))
                .map(el -> el.attr(attribute));
    }

    /**
     * Reads the first of {@code fields} from an article-typed JSON-LD block. A dotted field
     * such as {@code author.name} descends into objects and the first element of arrays.
     */
    public static SelectorRule jsonLd(ObjectMapper objectMapper, String... fields) {
        return root -> {
            for (Element script : root.select(JSON_LD_SELECTOR)) {
                String json = script.data();
                if (json == null || json.isBlank()) continue;
                try {
                    JsonNode node = objectMapper.readTree(json);
                    Optional<String> value = node.isArray() ? firstInArray(node, fields) : fromArticleNode(node, fields);
                    if (value.isPresent()) return value;
                } catch (Exception e) {
                    log.debug("Error parsing JSON-LD: {}", e.getMessage());
                }
            }
            return Optional.empty();
        };
    }

    private static Optional<String> firstInArray(JsonNode array, String[] fields) {
        for (JsonNode node : array) {
            Optional<String> value = fromArticleNode(node, fields);
            if (value.isPresent()) return value;
        }
        return Optional.empty();
    }

    private static Optional<String> fromArticleNode(JsonNode node, String[] fields) {
        JsonNode typeNode = node.get("@type");
        if (typeNode == null || !ARTICLE_TYPES.contains(typeNode.asText().toLowerCase(Locale.ROOT))) {
            return Optional.empty();
        }
        for (String field : fields) {
            JsonNode value = node;
            for (String part : field.split("\\.")) {
                if (value != null && value.isArray()) {
                    value = value.isEmpty() ? null : value.get(0);
                }
                value = value == null ? null : value.get(part);
            }
            if (value != null && value.isArray() && !value.isEmpty()) {
                value = value.get(0);
            }
            if (value != null && value.isValueNode() && !value.asText().isBlank()) {
                return Optional.of(value.asText());
            }
        }
        return Optional.empty();
    }
}
