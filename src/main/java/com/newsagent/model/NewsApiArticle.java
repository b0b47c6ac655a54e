package com.newsagent.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One entry of the "articles" array returned by NewsAPI.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NewsApiArticle(
    Source source,
    String author,
    String title,
    String description,
    String url,
    String urlToImage,
    String publishedAt,
    String content
) {

    public String sourceName() {
        return source != null ? source.name() : null;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Source(String id, String name) {}
}
