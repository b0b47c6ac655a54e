package com.newsagent.model;

import java.util.Map;

public record VectorMatch(
    String id,
    double score,
    Map<String, Object> fields
) {}
