package com.newswatch.backend.controller;

import com.newswatch.backend.config.NewsSourceConfig;
import com.newswatch.backend.model.dto.CrawlRequestDTO;
import com.newswatch.backend.model.dto.CrawlResultDTO;
import com.newswatch.backend.model.dto.ScrapingStatusDTO;
import com.newswatch.backend.scraping.CrawlService;
import com.newswatch.backend.scraping.NewsSourceConfigService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for keyword crawls
 */
@RestController
@RequestMapping("/api/scraping")
@RequiredArgsConstructor
@Slf4j
public class ScrapingController {

    private final CrawlService crawlService;
    private final NewsSourceConfigService configService;

    /**
     * Crawl the requested keywords synchronously and return the collected articles
     */
    @PostMapping("/search")
    public ResponseEntity<?> search(@Valid @RequestBody CrawlRequestDTO request) {
        try {
            log.info("Starting synchronous crawl for keywords {} on sources {}", request.getKeywords(), request.getSources());

            CrawlResultDTO result = crawlService.crawl(request);

            return ResponseEntity.ok(Map.of(
                    "success", true,
                    "message", "Crawl completed successfully",
                    "result", result
            ));

        } catch (IllegalArgumentException e) {
            log.warn("Rejected crawl request: {}", e.getMessage());
            return ResponseEntity.badRequest().body(Map.of("success", false, "error", e.getMessage()));
        } catch (Exception e) {
            log.error("Error during synchronous crawl", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("success", false, "error", "Crawl failed: " + e.getMessage()));
        }
    }

    /**
     * Start a crawl in the background
     */
    @PostMapping("/search/async")
    public ResponseEntity<?> searchAsync(@Valid @RequestBody CrawlRequestDTO request) {
        try {
            ScrapingStatusDTO status = crawlService.submit(request);

            return ResponseEntity.accepted().body(Map.of(
                    "success", true,
                    "taskId", status.getTaskId(),
                    "status", status.getStatus(),
                    "checkStatusAt", "/api/scraping/status/" + status.getTaskId()
            ));

        } catch (IllegalArgumentException e) {
            log.warn("Rejected async crawl request: {}", e.getMessage());
            return ResponseEntity.badRequest().body(Map.of("success", false, "error", e.getMessage()));
        } catch (Exception e) {
            log.error("Error starting async crawl", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("success", false, "error", "Failed to start crawl: " + e.getMessage()));
        }
    }

    /**
     * Get crawl task status
     */
    @GetMapping("/status/{taskId}")
    public ResponseEntity<?> getTaskStatus(@PathVariable String taskId) {
        ScrapingStatusDTO status = crawlService.getTaskStatus(taskId);

        if (status == null) {
            return ResponseEntity.notFound().build();
        }

        return ResponseEntity.ok(status);
    }

    /**
     * Get all crawl task statuses
     */
    @GetMapping("/status")
    public ResponseEntity<Map<String, ScrapingStatusDTO>> getAllTaskStatuses() {
        return ResponseEntity.ok(crawlService.getAllTaskStatuses());
    }

    /**
     * List configured news sources
     */
    @GetMapping("/sources")
    public ResponseEntity<List<Map<String, String>>> sources() {
        List<Map<String, String>> sources = configService.getAllConfigs().stream()
                .map(this::describe)
                .collect(Collectors.toList());
        return ResponseEntity.ok(sources);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidRequest(MethodArgumentNotValidException e) {
        String error = e.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        log.warn("Rejected crawl request: {}", error);
        return ResponseEntity.badRequest().body(Map.of("success", false, "error", error));
    }

    private Map<String, String> describe(NewsSourceConfig config) {
        return Map.of(
                "code", config.getCode(),
                "name", config.getName() == null ? config.getCode() : config.getName(),
                "baseUrl", config.getBaseUrl(),
                "source", config.getSourceId()
        );
    }
}
