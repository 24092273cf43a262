package com.newswatch.backend.scraper.extract;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.newswatch.backend.TestSources;
import com.newswatch.backend.config.NewsSourceConfig;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

@ExtendWith(OutputCaptureExtension.class)
class ArticleExtractorTest {

    private static final String LINK = "https://news.detik.com/berita/d-7000001/banjir-rendam-jakarta-utara";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ArticleExtractor detikExtractor =
            new ArticleExtractor(TestSources.detik(), PublishDateParser.indonesian(), objectMapper);

    @Test
    @DisplayName("Extracts every field of a detik article page")
    void extractsDetikArticle() {
        // when
        Optional<ExtractedArticle> article = detikExtractor.extract(TestSources.fixture("detik-article.html"), LINK);

        // then
        assertThat(article).isPresent();
        assertThat(article.get().getTitle()).isEqualTo("Banjir Rendam Jakarta Utara");
        assertThat(article.get().getAuthor()).isEqualTo("Andi Wijaya - detikNews");
        assertThat(article.get().getCategory()).isEqualTo("Berita");
        assertThat(article.get().getPublishDate()).isEqualTo(LocalDate.of(2025, 10, 6));
        assertThat(article.get().getContent()).isEqualTo(
                "Hujan deras sejak pagi membuat sejumlah wilayah di Jakarta Utara terendam."
                        + "\n\nPetugas BPBD mendirikan posko pengungsian.");
    }

    @Test
    @DisplayName("Extracting the same page twice gives the same article")
    void extractionIsRepeatable() {
        String html = TestSources.fixture("detik-article.html");

        assertThat(detikExtractor.extract(html, LINK)).isEqualTo(detikExtractor.extract(html, LINK));
    }

    @Test
    @DisplayName("Missing optional fields default to Unknown")
    void defaultsOptionalFields() {
        String html = "<h1 class=\"detail__title\">Judul</h1><div class=\"detail__date\">06 Okt 2025</div>"
                + "<div class=\"detail__body-text\"><p>Isi.</p></div>";

        Optional<ExtractedArticle> article = detikExtractor.extract(html, LINK);

        assertThat(article).hasValueSatisfying(a -> {
            assertThat(a.getAuthor()).isEqualTo("Unknown");
            assertThat(a.getCategory()).isEqualTo("Unknown");
        });
    }

    @Test
    @DisplayName("No title: nothing is produced and an error is logged")
    void missingTitle(CapturedOutput output) {
        String html = "<div class=\"detail__date\">06 Okt 2025</div><div class=\"detail__body-text\"><p>Isi.</p></div>";

        assertThat(detikExtractor.extract(html, LINK)).isEmpty();
        assertThat(output).contains("No title found for " + LINK);
    }

    @Test
    @DisplayName("No content container: nothing is produced")
    void missingContent(CapturedOutput output) {
        String html = "<h1>Judul</h1><div class=\"detail__date\">06 Okt 2025</div><div class=\"other\"><p>Isi.</p></div>";

        assertThat(detikExtractor.extract(html, LINK)).isEmpty();
        assertThat(output).contains("No content found for " + LINK);
    }

    @Test
    @DisplayName("Only the first matching content container is used")
    void firstContainerOnly() {
        String html = "<h1>Judul</h1><div class=\"detail__date\">06 Okt 2025</div>"
                + "<div class=\"detail__body-text\"><script>x()</script></div>"
                + "<div class=\"itp_bodycontent\"><p>Cadangan.</p></div>";

        assertThat(detikExtractor.extract(html, LINK)).isEmpty();
    }

    @Test
    @DisplayName("Unparseable date text: nothing is produced and the text is logged")
    void unparseableDate(CapturedOutput output) {
        String html = "<h1>Judul</h1><div class=\"detail__date\">baru saja</div>"
                + "<div class=\"detail__body-text\"><p>Isi.</p></div>";

        assertThat(detikExtractor.extract(html, LINK)).isEmpty();
        assertThat(output).contains("Error parsing date 'baru saja' for article " + LINK);
    }

    @Test
    @DisplayName("JSON-LD datePublished is used when no date element exists")
    void jsonLdDateFallback() {
        String html = "<script type=\"application/ld+json\">"
                + "[{\"@type\":\"BreadcrumbList\"},{\"@type\":\"NewsArticle\",\"datePublished\":\"2025-09-30T07:00:00+07:00\"}]"
                + "</script><h1>Judul</h1><div class=\"detail__body-text\"><p>Isi.</p></div>";

        assertThat(detikExtractor.extract(html, LINK))
                .hasValueSatisfying(a -> assertThat(a.getPublishDate()).isEqualTo(LocalDate.of(2025, 9, 30)));
    }

    @Test
    @DisplayName("Attribute selectors read the attribute value")
    void attributeSelector() {
        NewsSourceConfig config = TestSources.example();
        config.setPublishedTimeSelectors(List.of("meta[property='article:published_time']@content", "time"));
        ArticleExtractor extractor = new ArticleExtractor(config, PublishDateParser.english(), objectMapper);
        String html = "<html><head><meta property=\"article:published_time\" content=\"2025-10-01T10:00:00Z\"></head>"
                + "<body><h1>Title</h1><time>October 5, 2025</time><div class=\"body\"><p>Text.</p></div></body></html>";

        assertThat(extractor.extract(html, "https://www.example.com/a"))
                .hasValueSatisfying(a -> assertThat(a.getPublishDate()).isEqualTo(LocalDate.of(2025, 10, 1)));
    }
}
