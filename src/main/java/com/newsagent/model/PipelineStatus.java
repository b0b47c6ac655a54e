package com.newsagent.model;

import java.util.Map;

public record PipelineStatus(
    boolean success,
    NewsApiStatus newsApi,
    Map<String, Object> indexStats,
    String error,
    String timestamp
) {}
