package com.newsagent.model;

import java.util.List;

public record BatchPipelineResult(
    boolean success,
    int topicsProcessed,
    int totalArticlesProcessed,
    int totalArticlesFailed,
    List<PipelineResult> results,
    String timestamp
) {}
