package com.newsagent.service;

import com.newsagent.cache.HeadlineCache;
import com.newsagent.model.Article;
import com.newsagent.model.HeadlinesResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Top headlines, served from the daily cache when possible so NewsAPI is hit at most once
 * per country, category and day.
 */
@Service
public class HeadlineService {

    private static final Logger log = LoggerFactory.getLogger(HeadlineService.class);

    private final HeadlineCache headlineCache;
    private final NewsApiService newsApiService;

    public HeadlineService(HeadlineCache headlineCache, NewsApiService newsApiService) {
        this.headlineCache = headlineCache;
        this.newsApiService = newsApiService;
    }

    public HeadlinesResponse getHeadlines(String country, String category) {
        Optional<List<Article>> cached = headlineCache.get(country, category);
        if (cached.isPresent()) {
            return new HeadlinesResponse(country, category, true, cached.get());
        }

        List<Article> headlines = newsApiService.fetchTopHeadlines(country, category).stream()
                .map(Article::fromNewsApi)
                .toList();
        // an empty result is usually an upstream error; don't pin it for the day
        if (!headlines.isEmpty()) {
            headlineCache.put(country, category, headlines);
        }
        return new HeadlinesResponse(country, category, false, headlines);
    }

    @Scheduled(cron = "${news.cache.evict-cron:0 5 0 * * *}")
    public void evictStaleHeadlines() {
        int removed = headlineCache.evictStale();
        if (removed > 0) {
            log.info("Evicted {} stale headline cache entries", removed);
        }
    }
}
