package com.newswatch.backend.scraper.extract;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.jsoup.nodes.Comment;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;

/**
 * Turns an article body container into clean text: paragraphs separated by a blank line.
 * Works on a copy, the source document is left untouched.
 */
public class ContentSanitizer {

    static final String PARAGRAPH_SEPARATOR = "\n\n";

    private final List<String> ignoreSelectors;
    private final List<String> noiseClasses;
    private final String paragraphQuery;
    private final Set<String> boilerplateTexts;

    public ContentSanitizer(List<String> ignoreSelectors, List<String> noiseClasses,
                            List<String> paragraphTags, List<String> boilerplateTexts) {
        this.ignoreSelectors = ignoreSelectors == null ? List.of() : List.copyOf(ignoreSelectors);
        this.noiseClasses = noiseClasses == null ? List.of() : List.copyOf(noiseClasses);
        this.paragraphQuery = paragraphTags == null || paragraphTags.isEmpty() ? "p" : String.join(", ", paragraphTags);
        this.boilerplateTexts = boilerplateTexts == null ? Set.of() : Set.copyOf(boilerplateTexts);
    }

    public Optional<String> sanitize(Element container) {
        Element body = container.clone();

        for (String selector : ignoreSelectors) {
            for (Element el : body.select(selector)) {
                if (el != body && el.parent() != null) el.remove();
            }
        }
        removeNoisyElements(body);
        removeComments(body);

        List<String> paragraphs = collectParagraphs(body);
        if (paragraphs.isEmpty()) {
            paragraphs = collectTextLines(body);
        }

        String content = String.join(PARAGRAPH_SEPARATOR, paragraphs);
        return content.isEmpty() ? Optional.empty() : Optional.of(content);
    }

    private void removeNoisyElements(Element body) {
        if (noiseClasses.isEmpty()) return;
        for (Element el : body.getAllElements()) {
            if (el != body && el.parent() != null && hasNoiseClass(el)) {
                el.remove();
            }
        }
    }

    // Markers ending in '-' or '_' are class prefixes, the rest must match a whole class
    boolean hasNoiseClass(Element el) {
        for (String cls : el.classNames()) {
            for (String marker : noiseClasses) {
                boolean prefix = marker.endsWith("-") || marker.endsWith("_");
                if (prefix ? cls.startsWith(marker) : cls.equals(marker)) {
                    return true;
                }
            }
        }
        return false;
    }

    private void removeComments(Element body) {
        List<Node> comments = new ArrayList<>();
        NodeTraversor.traverse((node, depth) -> {
            if (node instanceof Comment) comments.add(node);
        }, body);
        comments.forEach(Node::remove);
    }

    private List<String> collectParagraphs(Element body) {
        List<String> paragraphs = new ArrayList<>();
        Set<Element> collected = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Element el : body.select(paragraphQuery)) {
            if (hasCollectedAncestor(el, collected)) continue;
            String text = el.text().trim();
            if (!text.isEmpty() && !boilerplateTexts.contains(text)) {
                paragraphs.add(text);
                collected.add(el);
            }
        }
        return paragraphs;
    }

    private boolean hasCollectedAncestor(Element el, Set<Element> collected) {
        for (Element parent = el.parent(); parent != null; parent = parent.parent()) {
            if (collected.contains(parent)) return true;
        }
        return false;
    }

    private List<String> collectTextLines(Element body) {
        List<String> lines = new ArrayList<>();
        NodeTraversor.traverse((node, depth) -> {
            if (node instanceof TextNode) {
                for (String line : ((TextNode) node).getWholeText().split("\n")) {
                    String trimmed = line.trim();
                    if (!trimmed.isEmpty()) lines.add(trimmed);
                }
            }
        }, body);
        return lines;
    }
}
