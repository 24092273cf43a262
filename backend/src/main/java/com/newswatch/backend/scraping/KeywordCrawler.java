package com.newswatch.backend.scraping;

import com.newswatch.backend.model.ArticleRecord;
import com.newswatch.backend.scraper.NewsSourceScraper;
import com.newswatch.backend.scraper.extract.ExtractedArticle;
import com.newswatch.backend.scraper.fetch.PageFetcher;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Paginates the search results of one source for one keyword and feeds the extracted
 * articles into a {@link ResultSink}.
 * <p>
 * Pages are fetched one after another; the articles of a page are fetched concurrently on
 * {@code articleExecutor}, bounded by the fetcher's admission gate. When an article older
 * than {@code startDate} shows up, no further page is requested and articles of the current
 * page that have not started yet are skipped. Articles already in progress still complete and
 * are emitted, including the old one. This assumes the endpoint returns newest results first.
 * <p>
 * If the sink is closed while the crawl runs (its consumer gave up), the crawl ends as
 * {@link CrawlStopReason#CANCELLED}.
 * <p>
 * An instance runs a single crawl and is then discarded.
 */
@Slf4j
public class KeywordCrawler {

    private final NewsSourceScraper scraper;
    private final PageFetcher fetcher;
    private final ResultSink sink;
    private final Executor articleExecutor;
    private final String keyword;
    private final LocalDate startDate;
    private final int maxPages;

    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean continueScraping = new AtomicBoolean(true);
    private final AtomicInteger linksDispatched = new AtomicInteger();
    private final AtomicInteger recordsEmitted = new AtomicInteger();
    private int pageNumber = 1;

    public KeywordCrawler(NewsSourceScraper scraper, PageFetcher fetcher, ResultSink sink, Executor articleExecutor,
                          String keyword, LocalDate startDate, int maxPages) {
        this.scraper = scraper;
        this.fetcher = fetcher;
        this.sink = sink;
        this.articleExecutor = articleExecutor;
        this.keyword = keyword;
        this.startDate = startDate;
        this.maxPages = maxPages;
    }

    public CrawlSummary crawl() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Crawl for '" + keyword + "' on " + scraper.getSourceId() + " already ran");
        }
        log.info("Starting crawl for '{}' on {} (start date: {})", keyword, scraper.getSourceId(), startDate);

        int pagesFetched = 0;
        CrawlStopReason stopReason;
        while (true) {
            if (sink.isClosed()) {
                log.info("Result sink closed, ending crawl for '{}' on {}", keyword, scraper.getSourceId());
                stopReason = CrawlStopReason.CANCELLED;
                break;
            }
            if (maxPages > 0 && pageNumber > maxPages) {
                log.info("Reached page cap {} for '{}' on {}", maxPages, keyword, scraper.getSourceId());
                stopReason = CrawlStopReason.MAX_PAGES_REACHED;
                break;
            }

            String searchUrl = scraper.buildSearchUrl(keyword, pageNumber);
            Optional<String> resultsPage = fetcher.fetch(searchUrl);
            if (resultsPage.isEmpty()) {
                log.warn("No response for results page {} ({}), ending crawl", pageNumber, searchUrl);
                stopReason = CrawlStopReason.RESULTS_PAGE_UNAVAILABLE;
                break;
            }
            pagesFetched++;

            Optional<Set<String>> links = scraper.extractLinks(resultsPage.get());
            if (links.isEmpty()) {
                log.info("No more results for '{}' on {} at page {}", keyword, scraper.getSourceId(), pageNumber);
                stopReason = CrawlStopReason.NO_RESULTS;
                break;
            }
            if (links.get().isEmpty()) {
                log.info("All links on page {} filtered out for '{}' on {}", pageNumber, keyword, scraper.getSourceId());
                stopReason = CrawlStopReason.NO_ARTICLE_LINKS;
                break;
            }

            dispatchArticles(links.get());

            if (Thread.currentThread().isInterrupted()) {
                stopReason = CrawlStopReason.INTERRUPTED;
                break;
            }
            if (sink.isClosed()) {
                stopReason = CrawlStopReason.CANCELLED;
                break;
            }
            if (!continueScraping.get()) {
                stopReason = CrawlStopReason.DATE_BOUND_REACHED;
                break;
            }
            pageNumber++;
        }

        CrawlSummary summary = CrawlSummary.builder()
                .keyword(keyword)
                .source(scraper.getSourceId())
                .pagesFetched(pagesFetched)
                .linksDispatched(linksDispatched.get())
                .recordsEmitted(recordsEmitted.get())
                .stopReason(stopReason)
                .build();
        log.info("Finished crawl for '{}' on {}: {} pages, {} articles emitted ({})",
                keyword, scraper.getSourceId(), pagesFetched, summary.getRecordsEmitted(), stopReason);
        return summary;
    }

    /**
     * Fetches and extracts every link of one page, returning once all of them are done
     */
    private void dispatchArticles(Set<String> links) {
        List<CompletableFuture<Void>> dispatches = links.stream()
                .map(link -> CompletableFuture.runAsync(() -> processArticle(link), articleExecutor))
                .collect(Collectors.toList());
        CompletableFuture.allOf(dispatches.toArray(new CompletableFuture[0])).join();
    }

    private void processArticle(String link) {
        if (!continueScraping.get() || sink.isClosed()) {
            log.debug("Skipping {}: crawl for '{}' is stopping", link, keyword);
            return;
        }
        linksDispatched.incrementAndGet();

        try {
            Optional<String> html = fetcher.fetch(scraper.articleUrl(link));
            if (html.isEmpty()) {
                log.warn("No response for {}", link);
                return;
            }

            Optional<ExtractedArticle> extracted = scraper.extractArticle(html.get(), link);
            if (extracted.isEmpty()) {
                return;
            }
            ExtractedArticle article = extracted.get();

            if (startDate != null && article.getPublishDate().isBefore(startDate)
                    && continueScraping.compareAndSet(true, false)) {
                log.info("Article date {} is before start date {}, stopping crawl for '{}' on {}",
                        article.getPublishDate(), startDate, keyword, scraper.getSourceId());
            }

            sink.put(ArticleRecord.builder()
                    .title(article.getTitle())
                    .publishDate(article.getPublishDate())
                    .author(article.getAuthor())
                    .content(article.getContent())
                    .keyword(keyword)
                    .category(article.getCategory())
                    .source(scraper.getSourceId())
                    .link(link)
                    .build());
            recordsEmitted.incrementAndGet();
            log.info("Successfully scraped: {}", article.getTitle());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while handing off {}", link);
        } catch (RuntimeException e) {
            if (sink.isClosed()) {
                log.debug("Result sink closed, dropping {}", link);
            } else {
                log.error("Error processing article {}: {}", link, e.getMessage(), e);
            }
        }
    }

    public boolean isContinueScraping() {
        return continueScraping.get();
    }

    public int getPageNumber() {
        return pageNumber;
    }
}
