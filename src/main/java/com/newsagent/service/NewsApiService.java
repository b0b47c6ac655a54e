package com.newsagent.service;

import com.newsagent.model.NewsApiArticle;
import com.newsagent.model.NewsApiResponse;
import com.newsagent.model.NewsApiStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * NewsAPI client. Fetch methods never throw: an API error or transport failure is logged
 * and yields an empty list.
 */
@Service
public class NewsApiService {

    private static final Logger log = LoggerFactory.getLogger(NewsApiService.class);

    public static final String DEFAULT_LANGUAGE = "en";
    public static final String DEFAULT_SORT_BY = "publishedAt";

    private final RestTemplate restTemplate;
    private final String apiKey;
    private final String baseUrl;

    public NewsApiService(RestTemplate restTemplate,
                          @Value("${newsapi.api.key:}") String apiKey,
                          @Value("${newsapi.base-url:https://newsapi.org/v2}") String baseUrl) {
        this.restTemplate = restTemplate;
        this.apiKey = apiKey;
        this.baseUrl = baseUrl;
    }

    public List<NewsApiArticle> fetchNews(String topic, String fromDate, String language, String sortBy) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("q", topic);
        params.put("from", fromDate);
        params.put("language", orDefault(language, DEFAULT_LANGUAGE));
        params.put("sortBy", orDefault(sortBy, DEFAULT_SORT_BY));
        List<NewsApiArticle> articles = fetch("/everything", params);
        log.info("Fetched {} articles for topic: {}", articles.size(), topic);
        return articles;
    }

    public List<NewsApiArticle> fetchNewsByDomain(String domain, String fromDate) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("domains", domain);
        params.put("from", fromDate);
        params.put("language", DEFAULT_LANGUAGE);
        params.put("sortBy", DEFAULT_SORT_BY);
        List<NewsApiArticle> articles = fetch("/everything", params);
        log.info("Fetched {} articles from domain: {}", articles.size(), domain);
        return articles;
    }

    public List<NewsApiArticle> fetchTopHeadlines(String country, String category) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("country", country);
        params.put("category", category);
        List<NewsApiArticle> articles = fetch("/top-headlines", params);
        log.info("Fetched {} top headlines for country: {}", articles.size(), country);
        return articles;
    }

    public List<NewsApiArticle> searchArticles(String query, String toDate, String language) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("q", query);
        params.put("to", toDate);
        params.put("language", orDefault(language, DEFAULT_LANGUAGE));
        params.put("sortBy", DEFAULT_SORT_BY);
        List<NewsApiArticle> articles = fetch("/everything", params);
        log.info("Found {} articles for query: {}", articles.size(), query);
        return articles;
    }

    /**
     * Issues a small probe query and reports the outcome instead of throwing.
     */
    public NewsApiStatus getApiStatus() {
        try {
            NewsApiResponse response = request("/everything", Map.of("q", "test"));
            if (response != null && response.isOk()) {
                int found = response.articles() != null ? response.articles().size() : 0;
                return NewsApiStatus.ok(response.totalResults() != null ? response.totalResults() : 0, found);
            }
            return NewsApiStatus.error(response != null && response.message() != null ? response.message() : "Unknown error");
        } catch (RestClientException e) {
            return NewsApiStatus.error(describe(e));
        }
    }

    private List<NewsApiArticle> fetch(String path, Map<String, String> params) {
        try {
            NewsApiResponse response = request(path, params);
            if (response == null || !response.isOk()) {
                log.error("NewsAPI error: {}", response != null && response.message() != null ? response.message() : "Unknown error");
                return List.of();
            }
            return response.articles() != null ? response.articles() : List.of();
        } catch (RestClientException e) {
            log.error("Error fetching {} from NewsAPI: {}", path, describe(e));
            return List.of();
        }
    }

    private NewsApiResponse request(String path, Map<String, String> params) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(baseUrl).path(path);
        Map<String, String> values = new LinkedHashMap<>();
        params.forEach((name, value) -> {
            if (value != null && !value.isBlank()) {
                // expanded as variables so reserved characters such as '+' are percent-encoded
                builder.queryParam(name, "{" + name + "}");
                values.put(name, value);
            }
        });
        URI uri = builder.encode().buildAndExpand(values).toUri();

        HttpHeaders headers = new HttpHeaders();
        headers.set("X-Api-Key", apiKey);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        return restTemplate.exchange(uri, HttpMethod.GET, new HttpEntity<>(headers), NewsApiResponse.class).getBody();
    }

    private static String describe(RestClientException e) {
        if (e instanceof RestClientResponseException) {
            RestClientResponseException responseException = (RestClientResponseException) e;
            String body = responseException.getResponseBodyAsString();
            return responseException.getStatusCode() + (body.isBlank() ? "" : " " + body);
        }
        return e.getMessage();
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
