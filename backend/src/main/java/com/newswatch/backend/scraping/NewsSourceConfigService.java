package com.newswatch.backend.scraping;

import com.newswatch.backend.config.NewsSourceConfig;
import jakarta.annotation.PostConstruct;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;
import org.yaml.snakeyaml.Yaml;

/**
 * Service to load and manage news source configurations from YAML
 */
@Service
@Slf4j
public class NewsSourceConfigService {

    private final Map<String, NewsSourceConfig> sourceConfigs = new LinkedHashMap<>();
    private final Resource configResource;

    public NewsSourceConfigService(@Value("classpath:news-sources.yml") Resource configResource) {
        this.configResource = configResource;
    }

    @PostConstruct
    public void loadConfigurations() {
        try (InputStream inputStream = configResource.getInputStream()) {
            Yaml yaml = new Yaml();
            Map<String, Object> data = yaml.load(inputStream);

            @SuppressWarnings("unchecked")
            Map<String, Object> sources = (Map<String, Object>) data.get("sources");
            if (sources == null) {
                throw new IllegalStateException("No 'sources' section in " + configResource.getDescription());
            }

            for (Map.Entry<String, Object> entry : sources.entrySet()) {
                String code = entry.getKey().toLowerCase(Locale.ROOT);
                @SuppressWarnings("unchecked")
                Map<String, Object> sourceData = (Map<String, Object>) entry.getValue();

                NewsSourceConfig config = createConfigFromMap(code, sourceData);
                validate(config);
                sourceConfigs.put(code, config);
                log.info("Loaded configuration for news source: {} ({})", code, config.getBaseUrl());
            }

            log.info("Successfully loaded {} news source configurations", sourceConfigs.size());

        } catch (Exception e) {
            log.error("Error loading news source configurations", e);
            throw new IllegalStateException("Failed to load news source configurations", e);
        }
    }

    public Optional<NewsSourceConfig> getConfig(String code) {
        if (code == null) return Optional.empty();
        return Optional.ofNullable(sourceConfigs.get(code.trim().toLowerCase(Locale.ROOT)));
    }

    public List<NewsSourceConfig> getAllConfigs() {
        return new ArrayList<>(sourceConfigs.values());
    }

    public boolean hasConfig(String code) {
        return getConfig(code).isPresent();
    }

    private void validate(NewsSourceConfig config) {
        if (config.getBaseUrl() == null || config.getSearchPath() == null) {
            throw new IllegalStateException("Source " + config.getCode() + " needs baseUrl and searchPath");
        }
        if (config.getArticleCardSelector() == null || config.getArticleLinkSelector() == null) {
            throw new IllegalStateException("Source " + config.getCode() + " needs articleCardSelector and articleLinkSelector");
        }
    }

    /**
     * Create NewsSourceConfig from YAML map data
     */
    @SuppressWarnings("unchecked")
    private NewsSourceConfig createConfigFromMap(String code, Map<String, Object> sourceData) {
        NewsSourceConfig config = new NewsSourceConfig();

        config.setCode(code);
        config.setName((String) sourceData.get("name"));
        config.setBaseUrl((String) sourceData.get("baseUrl"));

        config.setSearchPath((String) sourceData.get("searchPath"));
        if (sourceData.containsKey("keywordParam")) config.setKeywordParam((String) sourceData.get("keywordParam"));
        if (sourceData.containsKey("pageParam")) config.setPageParam((String) sourceData.get("pageParam"));
        Map<String, Object> searchParams = (Map<String, Object>) sourceData.get("searchParams");
        if (searchParams != null) {
            Map<String, String> params = new LinkedHashMap<>();
            searchParams.forEach((key, value) -> params.put(key, String.valueOf(value)));
            config.setSearchParams(params);
        }

        config.setArticleCardSelector((String) sourceData.get("articleCardSelector"));
        config.setArticleLinkSelector((String) sourceData.get("articleLinkSelector"));
        config.setSkipUrlsContaining(listOrEmpty(sourceData, "skipUrlsContaining"));
        config.setArticleUrlSuffix((String) sourceData.get("articleUrlSuffix"));

        config.setTitleSelectors(listOrEmpty(sourceData, "titleSelectors"));
        config.setAuthorSelectors(listOrEmpty(sourceData, "authorSelectors"));
        config.setCategorySelectors(listOrEmpty(sourceData, "categorySelectors"));
        config.setPublishedTimeSelectors(listOrEmpty(sourceData, "publishedTimeSelectors"));
        config.setContentSelectors(listOrEmpty(sourceData, "contentSelectors"));

        config.setContentIgnoreSelectors(listOrEmpty(sourceData, "contentIgnoreSelectors"));
        config.setContentNoiseClasses(listOrEmpty(sourceData, "contentNoiseClasses"));
        if (sourceData.containsKey("paragraphTags")) config.setParagraphTags(listOrEmpty(sourceData, "paragraphTags"));
        config.setBoilerplateTexts(listOrEmpty(sourceData, "boilerplateTexts"));

        Object concurrency = sourceData.get("concurrency");
        if (concurrency instanceof Number) config.setConcurrency(((Number) concurrency).intValue());

        return config;
    }

    @SuppressWarnings("unchecked")
    private List<String> listOrEmpty(Map<String, Object> sourceData, String key) {
        List<String> values = (List<String>) sourceData.get(key);
        return values == null ? List.of() : values;
    }
}
