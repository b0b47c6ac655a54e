package com.newsagent.ingestion;

import com.newsagent.model.BatchPipelineResult;
import com.newsagent.model.NewsApiArticle;
import com.newsagent.model.NewsApiStatus;
import com.newsagent.model.PipelineResult;
import com.newsagent.model.PipelineStatus;
import com.newsagent.model.UpsertResult;
import com.newsagent.model.VectorRecord;
import com.newsagent.service.NewsApiService;
import com.newsagent.service.PineconeService;
import com.newsagent.util.ArticleIds;
import com.newsagent.util.ArticleText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fetches articles from NewsAPI and stores them as text records in the vector index.
 */
@Service
public class NewsPipelineService {

    private static final Logger log = LoggerFactory.getLogger(NewsPipelineService.class);

    static final int MAX_CONTENT_CHARS = 1000;

    private final NewsApiService newsApiService;
    private final PineconeService pineconeService;
    private final Clock clock;

    public NewsPipelineService(NewsApiService newsApiService, PineconeService pineconeService, Clock clock) {
        this.newsApiService = newsApiService;
        this.pineconeService = pineconeService;
        this.clock = clock;
    }

    public PipelineResult processTopic(String topic, String fromDate, String language, String sortBy) {
        log.info("Starting pipeline for topic: {}", topic);
        String target = "topic:" + topic;
        try {
            List<NewsApiArticle> articles = newsApiService.fetchNews(topic, fromDate, language, sortBy);
            return ingest(target, articles, "news", topic, "No articles found");
        } catch (RuntimeException e) {
            log.error("Error in news pipeline for topic '{}': {}", topic, e.getMessage(), e);
            return PipelineResult.failure(target, e.getMessage(), now());
        }
    }

    public PipelineResult processTopHeadlines(String country, String category) {
        log.info("Starting pipeline for top headlines (country: {}, category: {})", country, category);
        String target = "headlines:" + country + (category != null && !category.isBlank() ? "/" + category : "");
        try {
            List<NewsApiArticle> articles = newsApiService.fetchTopHeadlines(country, category);
            return ingest(target, articles, "headlines", "headlines_" + country, "No headlines found");
        } catch (RuntimeException e) {
            log.error("Error in headlines pipeline: {}", e.getMessage(), e);
            return PipelineResult.failure(target, e.getMessage(), now());
        }
    }

    public PipelineResult processDomain(String domain, String fromDate) {
        log.info("Starting pipeline for domain: {}", domain);
        String target = "domain:" + domain;
        try {
            List<NewsApiArticle> articles = newsApiService.fetchNewsByDomain(domain, fromDate);
            return ingest(target, articles, "domain_" + domain, "domain_" + domain, "No articles found");
        } catch (RuntimeException e) {
            log.error("Error in domain pipeline for '{}': {}", domain, e.getMessage(), e);
            return PipelineResult.failure(target, e.getMessage(), now());
        }
    }

    /**
     * Runs {@link #processTopic} for each topic. A topic that fails outright counts as one
     * failed article in the totals.
     */
    public BatchPipelineResult batchProcessTopics(List<String> topics, String fromDate) {
        log.info("Starting batch pipeline for {} topics", topics.size());
        List<PipelineResult> results = new ArrayList<>();
        int totalProcessed = 0;
        int totalFailed = 0;
        for (String topic : topics) {
            PipelineResult result = processTopic(topic, fromDate, null, null);
            results.add(result);
            if (result.success()) {
                totalProcessed += result.articlesProcessed();
                totalFailed += result.articlesFailed();
            } else {
                totalFailed += 1;
            }
        }
        log.info("Batch pipeline completed: {} total processed, {} total failed", totalProcessed, totalFailed);
        return new BatchPipelineResult(true, topics.size(), totalProcessed, totalFailed, List.copyOf(results), now());
    }

    /**
     * Checks both upstreams. The pipeline is usable only when NewsAPI answers and the
     * index statistics can be read.
     */
    public PipelineStatus pipelineStatus() {
        NewsApiStatus newsApiStatus = newsApiService.getApiStatus();
        try {
            Map<String, Object> stats = pineconeService.describeIndexStats();
            boolean ok = newsApiStatus.isOk();
            return new PipelineStatus(ok, newsApiStatus, stats, ok ? null : newsApiStatus.message(), now());
        } catch (RuntimeException e) {
            log.error("Error getting pipeline status: {}", e.getMessage());
            return new PipelineStatus(false, newsApiStatus, Map.of(), e.getMessage(), now());
        }
    }

    private PipelineResult ingest(String target, List<NewsApiArticle> articles, String idPrefix,
                                  String sourceType, String emptyError) {
        if (articles.isEmpty()) {
            log.warn("{} for {}", emptyError, target);
            return PipelineResult.failure(target, emptyError, now());
        }
        String processedAt = now();
        List<VectorRecord> records = new ArrayList<>(articles.size());
        for (NewsApiArticle article : articles) {
            records.add(new VectorRecord(
                    ArticleIds.recordId(idPrefix, article.url(), article.publishedAt()),
                    prepareArticleText(article),
                    prepareArticleMetadata(article, sourceType, processedAt)));
        }
        UpsertResult upsert = pineconeService.upsertRecords(records);
        log.info("Pipeline completed for {}: {} processed, {} failed", target, upsert.successful(), upsert.failed());
        return PipelineResult.completed(target, articles.size(), upsert.successful(), upsert.failed(), now());
    }

    /**
     * Title, description and the first {@value #MAX_CONTENT_CHARS} characters of content,
     * with markup removed.
     */
    static String prepareArticleText(NewsApiArticle article) {
        List<String> parts = new ArrayList<>(3);
        String title = ArticleText.clean(article.title());
        String description = ArticleText.clean(article.description());
        String content = ArticleText.truncate(ArticleText.clean(article.content()), MAX_CONTENT_CHARS);
        if (!title.isEmpty()) parts.add(title);
        if (!description.isEmpty()) parts.add(description);
        if (!content.isEmpty()) parts.add(content);
        return String.join(" ", parts).trim();
    }

    static Map<String, Object> prepareArticleMetadata(NewsApiArticle article, String sourceType, String processedAt) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("source_type", sourceType);
        metadata.put("title", nvl(article.title()));
        metadata.put("description", nvl(article.description()));
        metadata.put("url", nvl(article.url()));
        metadata.put("published_at", nvl(article.publishedAt()));
        metadata.put("source_name", nvl(article.sourceName()));
        metadata.put("author", nvl(article.author()));
        metadata.put("content_type", "news_article");
        metadata.put("processed_at", processedAt);
        if (article.urlToImage() != null && !article.urlToImage().isBlank()) {
            metadata.put("image_url", article.urlToImage());
        }
        return metadata;
    }

    private String now() {
        return LocalDateTime.now(clock).toString();
    }

    private static String nvl(String value) {
        return value == null ? "" : value;
    }
}
