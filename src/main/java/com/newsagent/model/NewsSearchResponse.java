package com.newsagent.model;

import java.util.List;

public record NewsSearchResponse(
    List<Article> results
) {}
