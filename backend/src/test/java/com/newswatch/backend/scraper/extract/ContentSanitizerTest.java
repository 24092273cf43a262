package com.newswatch.backend.scraper.extract;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Optional;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ContentSanitizerTest {

    private final ContentSanitizer sanitizer = new ContentSanitizer(
            List.of("script", "style", ".linksisip", "div[id^=\"div-gpt-ad\"]"),
            List.of("clearfix", "ads-", "mg_", "mc", "para_caption"),
            List.of("p", "strong"),
            List.of("ADVERTISEMENT", "SCROLL TO CONTINUE WITH CONTENT"));

    private static Element body(String inner) {
        return Jsoup.parse("<div class=\"body\">" + inner + "</div>").selectFirst("div.body");
    }

    @Test
    @DisplayName("Paragraphs are joined with a blank line, ignored regions dropped")
    void joinsParagraphs() {
        Element body = body("<p>Satu.</p><script>x()</script><div class=\"linksisip\"><p>Baca juga</p></div>"
                + "<div id=\"div-gpt-ad-1\"><p>Iklan</p></div><p>Dua.</p>");

        assertThat(sanitizer.sanitize(body)).contains("Satu.\n\nDua.");
    }

    @Test
    @DisplayName("Boilerplate paragraphs are skipped")
    void skipsBoilerplate() {
        Element body = body("<p>ADVERTISEMENT</p><p>Isi berita.</p><p>SCROLL TO CONTINUE WITH CONTENT</p>");

        assertThat(sanitizer.sanitize(body)).contains("Isi berita.");
    }

    @Test
    @DisplayName("Noise classes match whole class names, markers ending in a dash or underscore match prefixes")
    void removesNoiseClasses() {
        Element body = body("<div class=\"ads-banner\"><p>Promo</p></div>"
                + "<div class=\"mg_widget\"><p>Widget</p></div>"
                + "<p class=\"para_caption\">Foto: dok</p>"
                + "<p class=\"mce-text\">Tetap ada.</p>"
                + "<div class=\"mc\"><p>Hilang</p></div>");

        assertThat(sanitizer.sanitize(body)).contains("Tetap ada.");
    }

    @Test
    @DisplayName("Emphasis nested inside a collected paragraph is not repeated")
    void nestedEmphasisNotDuplicated() {
        Element body = body("<p>Kata <strong>penting</strong> di sini.</p><strong>Berdiri sendiri</strong>");

        assertThat(sanitizer.sanitize(body)).contains("Kata penting di sini.\n\nBerdiri sendiri");
    }

    @Test
    @DisplayName("HTML comments never reach the output")
    void dropsComments() {
        Element body = body("<!-- sisipan --><div>Baris satu<br>\n  Baris dua  \n\n</div>");

        Optional<String> content = sanitizer.sanitize(body);

        assertThat(content).contains("Baris satu\n\nBaris dua");
        assertThat(content.get()).doesNotContain("sisipan");
    }

    @Test
    @DisplayName("Without paragraphs the non-blank text lines are used")
    void fallsBackToTextLines() {
        Element body = body("<div>Baris pertama\n\n   Baris kedua</div><span>Baris ketiga</span>");

        assertThat(sanitizer.sanitize(body)).contains("Baris pertama\n\nBaris kedua\n\nBaris ketiga");
    }

    @Test
    @DisplayName("A container with only noise sanitizes to nothing")
    void emptyAfterSanitizing() {
        Element body = body("<script>x()</script><div class=\"clearfix\"><p>Bersih</p></div><!-- kosong -->");

        assertThat(sanitizer.sanitize(body)).isEmpty();
    }

    @Test
    @DisplayName("The source document is left untouched")
    void doesNotMutateSource() {
        Document doc = Jsoup.parse("<div class=\"body\"><p>Isi.</p><script>x()</script></div>");
        String before = doc.outerHtml();

        sanitizer.sanitize(doc.selectFirst("div.body"));

        assertThat(doc.outerHtml()).isEqualTo(before);
    }

    @Test
    void exactMarkersDoNotMatchLongerClassNames() {
        Element el = Jsoup.parse("<div class=\"mcard clearfixed\"></div>").selectFirst("div");

        assertThat(sanitizer.hasNoiseClass(el)).isFalse();
    }
}
