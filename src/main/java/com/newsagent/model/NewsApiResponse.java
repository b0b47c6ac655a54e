package com.newsagent.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record NewsApiResponse(
    String status,
    Integer totalResults,
    List<NewsApiArticle> articles,
    String code,
    String message
) {

    public boolean isOk() {
        return "ok".equals(status);
    }
}
