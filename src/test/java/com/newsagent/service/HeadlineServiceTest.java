package com.newsagent.service;

import com.newsagent.cache.HeadlineCache;
import com.newsagent.model.Article;
import com.newsagent.model.HeadlinesResponse;
import com.newsagent.model.NewsApiArticle;
import com.newsagent.util.ArticleIds;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HeadlineServiceTest {

    @Mock
    private HeadlineCache headlineCache;

    @Mock
    private NewsApiService newsApiService;

    @InjectMocks
    private HeadlineService headlineService;

    @Test
    void getHeadlines_shouldServeCacheHitWithoutCallingNewsApi() {
        List<Article> cached = List.of(new Article("id", "Cached", "https://example.com/c", "s",
                "2026-10-19T07:00:00Z", "Src", null, null));
        when(headlineCache.get("us", "business")).thenReturn(Optional.of(cached));

        HeadlinesResponse response = headlineService.getHeadlines("us", "business");

        assertTrue(response.cached());
        assertEquals(cached, response.headlines());
        verifyNoInteractions(newsApiService);
    }

    @SuppressWarnings("unchecked")
    @Test
    void getHeadlines_shouldFetchMapAndCacheOnMiss() {
        NewsApiArticle fetched = new NewsApiArticle(new NewsApiArticle.Source("bbc", "BBC"), "Reporter",
                "Storm warning", "Heavy rain expected", "https://example.com/storm", null,
                "2026-10-19T05:00:00Z", "content");
        when(headlineCache.get("gb", null)).thenReturn(Optional.empty());
        when(newsApiService.fetchTopHeadlines("gb", null)).thenReturn(List.of(fetched));

        HeadlinesResponse response = headlineService.getHeadlines("gb", null);

        assertFalse(response.cached());
        Article article = response.headlines().get(0);
        assertEquals(ArticleIds.digest("https://example.com/storm", "2026-10-19T05:00:00Z"), article.id());
        assertEquals("Heavy rain expected", article.summary());
        assertEquals("BBC", article.sourceName());

        ArgumentCaptor<List<Article>> stored = ArgumentCaptor.forClass(List.class);
        verify(headlineCache).put(eq("gb"), eq(null), stored.capture());
        assertEquals(response.headlines(), stored.getValue());
    }

    @Test
    void getHeadlines_shouldNotCacheEmptyResult() {
        when(headlineCache.get("us", null)).thenReturn(Optional.empty());
        when(newsApiService.fetchTopHeadlines("us", null)).thenReturn(List.of());

        HeadlinesResponse response = headlineService.getHeadlines("us", null);

        assertTrue(response.headlines().isEmpty());
        verify(headlineCache, never()).put(anyString(), any(), any());
    }

    @Test
    void evictStaleHeadlines_shouldDelegateToCache() {
        when(headlineCache.evictStale()).thenReturn(3);

        headlineService.evictStaleHeadlines();

        verify(headlineCache).evictStale();
    }
}
