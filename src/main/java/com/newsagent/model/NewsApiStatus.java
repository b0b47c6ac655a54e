package com.newsagent.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record NewsApiStatus(
    String status,
    Integer totalResults,
    Integer articlesFound,
    String message
) {

    public static NewsApiStatus ok(int totalResults, int articlesFound) {
        return new NewsApiStatus("ok", totalResults, articlesFound, null);
    }

    public static NewsApiStatus error(String message) {
        return new NewsApiStatus("error", null, null, message);
    }

    public boolean isOk() {
        return "ok".equals(status);
    }
}
