package com.newswatch.backend.scraper.extract;

import static org.assertj.core.api.Assertions.assertThat;

import com.newswatch.backend.TestSources;
import com.newswatch.backend.config.NewsSourceConfig;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ArticleLinkExtractorTest {

    private final NewsSourceConfig detik = TestSources.detik();
    private final ArticleLinkExtractor extractor = new ArticleLinkExtractor(detik.getBaseUrl(),
            detik.getArticleCardSelector(), detik.getArticleLinkSelector(), detik.getSkipUrlsContaining());

    @Test
    @DisplayName("Video cards are filtered, article links kept in page order")
    void extractsArticleLinks() {
        // when
        Optional<Set<String>> links = extractor.extractLinks(TestSources.fixture("detik-results.html"));

        // then
        assertThat(links).isPresent();
        assertThat(links.get()).containsExactly(
                "https://news.detik.com/berita/d-7000001/banjir-rendam-jakarta-utara",
                "https://news.detik.com/berita/d-7000002/warga-mengungsi");
    }

    @Test
    @DisplayName("A page without cards means the end of results")
    void noCards() {
        assertThat(extractor.extractLinks(TestSources.emptyResultsPage())).isEmpty();
    }

    @Test
    @DisplayName("Cards whose links are all denied give an empty set, not the end of results")
    void allLinksFiltered() {
        String html = "<div class=\"list-content__item\"><h3 class=\"media__title\">"
                + "<a href=\"https://wolipop.detik.com/x\">x</a></h3></div>"
                + "<div class=\"list-content__item\"><h3 class=\"media__title\">"
                + "<a href=\"https://www.detik.com/pop/y\">y</a></h3></div>";

        assertThat(extractor.extractLinks(html)).hasValueSatisfying(links -> assertThat(links).isEmpty());
    }

    @Test
    @DisplayName("Relative hrefs resolve against the source base URL and duplicates collapse")
    void resolvesRelativeLinks() {
        String html = "<div class=\"list-content__item\"><h3 class=\"media__title\"><a href=\"/berita/d-1/a\">a</a></h3></div>"
                + "<div class=\"list-content__item\"><h3 class=\"media__title\"><a href=\"/berita/d-1/a\">a</a></h3></div>"
                + "<div class=\"list-content__item\"><span>no link</span></div>";

        assertThat(extractor.extractLinks(html)).hasValueSatisfying(links ->
                assertThat(links).containsExactly("https://www.detik.com/berita/d-1/a"));
    }

    @Test
    void denylistMatchesSubstrings() {
        assertThat(extractor.isArticleUrl("https://news.detik.com/foto-news/d-1/galeri")).isFalse();
        assertThat(extractor.isArticleUrl("https://www.detik.com/detiktv/d-2")).isFalse();
        assertThat(extractor.isArticleUrl("https://news.detik.com/berita/d-3/banjir")).isTrue();
        assertThat(extractor.isArticleUrl("")).isFalse();
    }
}
