package com.newswatch.backend.scraping;

import com.newswatch.backend.config.NewsSourceConfig;
import com.newswatch.backend.config.ScrapingConfig;
import com.newswatch.backend.model.ArticleRecord;
import com.newswatch.backend.model.dto.CrawlRequestDTO;
import com.newswatch.backend.model.dto.CrawlResultDTO;
import com.newswatch.backend.model.dto.CrawlSummaryDTO;
import com.newswatch.backend.model.dto.ScrapingStatusDTO;
import com.newswatch.backend.scraper.NewsSourceScraper;
import com.newswatch.backend.scraper.NewsSourceScraperFactory;
import com.newswatch.backend.scraper.fetch.PageFetcherFactory;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs one {@link KeywordCrawler} per keyword and source, all concurrently, and funnels their
 * records through a single {@link ResultSink} to one consumer.
 */
@Service
@Slf4j
public class CrawlService {

    private final NewsSourceConfigService configService;
    private final NewsSourceScraperFactory scraperFactory;
    private final PageFetcherFactory fetcherFactory;
    private final ScrapingConfig scrapingConfig;
    private final Executor crawlTaskExecutor;
    private final Executor articleTaskExecutor;
    private final Executor jobTaskExecutor;

    // Store crawl task statuses
    private final Map<String, ScrapingStatusDTO> taskStatuses = new ConcurrentHashMap<>();

    public CrawlService(NewsSourceConfigService configService,
                        NewsSourceScraperFactory scraperFactory,
                        PageFetcherFactory fetcherFactory,
                        ScrapingConfig scrapingConfig,
                        @Qualifier("crawlTaskExecutor") Executor crawlTaskExecutor,
                        @Qualifier("articleTaskExecutor") Executor articleTaskExecutor,
                        @Qualifier("jobTaskExecutor") Executor jobTaskExecutor) {
        this.configService = configService;
        this.scraperFactory = scraperFactory;
        this.fetcherFactory = fetcherFactory;
        this.scrapingConfig = scrapingConfig;
        this.crawlTaskExecutor = crawlTaskExecutor;
        this.articleTaskExecutor = articleTaskExecutor;
        this.jobTaskExecutor = jobTaskExecutor;
    }

    /**
     * Crawl every requested keyword on every requested source and collect the records
     */
    public CrawlResultDTO crawl(CrawlRequestDTO request) {
        List<String> keywords = resolveKeywords(request);
        List<NewsSourceConfig> sources = resolveSources(request);
        validateDates(request);

        long startTime = System.currentTimeMillis();
        LocalDate endDate = request.getEndDate();
        List<ArticleRecord> collected = new ArrayList<>();

        List<CrawlSummary> summaries = crawl(keywords, sources, request.getStartDate(), record -> {
            if (endDate == null || !record.getPublishDate().isAfter(endDate)) {
                collected.add(record);
            }
        });

        double durationSeconds = (System.currentTimeMillis() - startTime) / 1000.0;
        int totalEmitted = summaries.stream().mapToInt(CrawlSummary::getRecordsEmitted).sum();

        CrawlResultDTO result = new CrawlResultDTO();
        result.setArticles(collected);
        result.setCrawls(summaries.stream().map(this::toDto).collect(Collectors.toList()));
        result.setKeywords(keywords);
        result.setSources(sources.stream().map(NewsSourceConfig::getCode).collect(Collectors.toList()));
        result.setTotalEmitted(totalEmitted);
        result.setTotalCollected(collected.size());
        result.setScrapedAt(LocalDateTime.now().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME));
        result.setDurationSeconds(durationSeconds);

        log.info("Completed crawl of {} keyword(s) on {} source(s): {} collected of {} emitted in {}s",
                keywords.size(), sources.size(), collected.size(), totalEmitted, durationSeconds);
        return result;
    }

    /**
     * Starts the crawls and hands each record to {@code consumer} on the calling thread, in
     * arrival order. Returns once every crawl has stopped and the sink is drained.
     * <p>
     * If the consumer throws or the calling thread is interrupted, the sink is abandoned so the
     * crawls end instead of blocking on a sink nobody reads.
     */
    public List<CrawlSummary> crawl(List<String> keywords, List<NewsSourceConfig> sources, LocalDate startDate,
                                    Consumer<ArticleRecord> consumer) {
        ResultSink sink = new ResultSink(scrapingConfig.getSinkCapacity());

        List<CompletableFuture<CrawlSummary>> crawls = new ArrayList<>();
        for (NewsSourceConfig source : sources) {
            NewsSourceScraper scraper = scraperFactory.createScraper(source);
            for (String keyword : keywords) {
                KeywordCrawler crawler = new KeywordCrawler(scraper, fetcherFactory.fetcherFor(source), sink,
                        articleTaskExecutor, keyword, startDate, scrapingConfig.getMaxPages());
                crawls.add(submitCrawl(crawler, keyword, scraper));
            }
        }

        CompletableFuture.allOf(crawls.toArray(new CompletableFuture[0]))
                .whenComplete((ignored, ex) -> sink.close());

        boolean drained = false;
        try {
            sink.drain(consumer);
            drained = true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while collecting results, {} records received so far", sink.getReceivedCount());
            return crawls.stream()
                    .filter(CompletableFuture::isDone)
                    .map(CompletableFuture::join)
                    .collect(Collectors.toList());
        } finally {
            if (!drained) {
                sink.abandon();
            }
        }

        return crawls.stream().map(CompletableFuture::join).collect(Collectors.toList());
    }

    private CompletableFuture<CrawlSummary> submitCrawl(KeywordCrawler crawler, String keyword, NewsSourceScraper scraper) {
        try {
            return CompletableFuture.supplyAsync(crawler::crawl, crawlTaskExecutor)
                    .exceptionally(ex -> failedSummary(keyword, scraper, ex));
        } catch (RejectedExecutionException e) {
            return CompletableFuture.completedFuture(failedSummary(keyword, scraper, e));
        }
    }

    /**
     * Start a crawl in the background and return its task status
     */
    public ScrapingStatusDTO submit(CrawlRequestDTO request) {
        List<String> keywords = resolveKeywords(request);
        List<NewsSourceConfig> sources = resolveSources(request);
        validateDates(request);

        String taskId = UUID.randomUUID().toString();
        ScrapingStatusDTO status = new ScrapingStatusDTO();
        status.setTaskId(taskId);
        status.setStatus("RUNNING");
        status.setKeywords(String.join(",", keywords));
        status.setSources(sources.stream().map(NewsSourceConfig::getCode).collect(Collectors.joining(",")));
        status.setStartedAt(LocalDateTime.now().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME));
        taskStatuses.put(taskId, status);

        try {
            CompletableFuture.runAsync(() -> runTask(status, request), jobTaskExecutor);
            log.info("Submitted crawl task {} for keywords {}", taskId, keywords);
        } catch (RejectedExecutionException e) {
            log.warn("Rejected crawl task {}: {}", taskId, e.getMessage());
            status.setStatus("FAILED");
            status.setError("Too many crawl tasks running, try again later");
            status.setCompletedAt(LocalDateTime.now().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME));
        }
        return status;
    }

    private void runTask(ScrapingStatusDTO status, CrawlRequestDTO request) {
        try {
            CrawlResultDTO result = crawl(request);
            status.setArticlesCollected(result.getTotalCollected());
            status.setCrawlsCompleted(result.getCrawls().size());
            status.setDurationSeconds(result.getDurationSeconds());
            status.setCompletedAt(LocalDateTime.now().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME));
            // set last, pollers treat status as the completion flag
            status.setStatus("COMPLETED");
            log.info("Completed crawl task {}: {} articles", status.getTaskId(), result.getTotalCollected());
        } catch (Exception e) {
            log.error("Error in crawl task {}: {}", status.getTaskId(), e.getMessage(), e);
            status.setError(e.getMessage());
            status.setCompletedAt(LocalDateTime.now().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME));
            status.setStatus("FAILED");
        }
    }

    /**
     * Get status of a crawl task
     */
    public ScrapingStatusDTO getTaskStatus(String taskId) {
        return taskStatuses.get(taskId);
    }

    /**
     * Get all task statuses
     */
    public Map<String, ScrapingStatusDTO> getAllTaskStatuses() {
        return new ConcurrentHashMap<>(taskStatuses);
    }

    List<String> resolveKeywords(CrawlRequestDTO request) {
        List<String> keywords = request.getKeywords() == null ? List.of() : request.getKeywords().stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(keyword -> !keyword.isEmpty())
                .distinct()
                .collect(Collectors.toList());
        if (keywords.isEmpty()) {
            throw new IllegalArgumentException("At least one keyword is required");
        }
        return keywords;
    }

    List<NewsSourceConfig> resolveSources(CrawlRequestDTO request) {
        if (request.getSources() == null || request.getSources().isEmpty()) {
            return configService.getAllConfigs();
        }
        List<NewsSourceConfig> sources = new ArrayList<>();
        for (String code : request.getSources()) {
            NewsSourceConfig config = configService.getConfig(code)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown news source: " + code));
            if (!sources.contains(config)) sources.add(config);
        }
        return sources;
    }

    private void validateDates(CrawlRequestDTO request) {
        if (request.getStartDate() != null && request.getEndDate() != null
                && request.getStartDate().isAfter(request.getEndDate())) {
            throw new IllegalArgumentException("Start date " + request.getStartDate()
                    + " is after end date " + request.getEndDate());
        }
    }

    private CrawlSummary failedSummary(String keyword, NewsSourceScraper scraper, Throwable ex) {
        log.error("Crawl for '{}' on {} failed: {}", keyword, scraper.getSourceId(), ex.getMessage(), ex);
        return CrawlSummary.builder()
                .keyword(keyword)
                .source(scraper.getSourceId())
                .stopReason(CrawlStopReason.FAILED)
                .build();
    }

    private CrawlSummaryDTO toDto(CrawlSummary summary) {
        return new CrawlSummaryDTO(summary.getKeyword(), summary.getSource(), summary.getPagesFetched(),
                summary.getLinksDispatched(), summary.getRecordsEmitted(), summary.getStopReason().name());
    }
}
